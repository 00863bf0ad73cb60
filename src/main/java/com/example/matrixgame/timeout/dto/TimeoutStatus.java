package com.example.matrixgame.timeout.dto;

import java.time.LocalDateTime;

import com.example.matrixgame.game.domain.state.GamePhase;

/**
 * Deadline view of the current phase. {@code deadline} and {@code remainingMillis} are null when the phase never expires.
 */
public record TimeoutStatus(
        Long gameId,
        GamePhase phase,
        LocalDateTime phaseStartedAt,
        int timeoutHours,
        boolean isInfinite,
        LocalDateTime deadline,
        Long remainingMillis,
        boolean isExpired) {
}
