package com.example.matrixgame.notification;

import java.util.Map;

import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Fire-and-forget entry point used by the services. Nothing here is awaited
 * and nothing here can fail the calling operation.
 */
@Component
@RequiredArgsConstructor
public class GameNotifier {

    private final ApplicationEventPublisher eventPublisher;

    public void notify(NotificationKind kind, Long gameId, Map<String, Object> payload) {
        eventPublisher.publishEvent(new GameNotification(kind, gameId, null, payload));
    }

    public void notifyUser(NotificationKind kind, Long gameId, String userId, Map<String, Object> payload) {
        eventPublisher.publishEvent(new GameNotification(kind, gameId, userId, payload));
    }
}
