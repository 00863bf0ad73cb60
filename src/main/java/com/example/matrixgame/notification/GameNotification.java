package com.example.matrixgame.notification;

import java.util.Map;

/**
 * Outbound message published inside a transaction and delivered after it commits.
 *
 * @param targetUserId null for a game-wide broadcast
 */
public record GameNotification(
        NotificationKind kind,
        Long gameId,
        String targetUserId,
        Map<String, Object> payload) {

    public boolean isDirect() {
        return targetUserId != null;
    }
}
