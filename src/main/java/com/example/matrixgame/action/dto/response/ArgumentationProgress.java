package com.example.matrixgame.action.dto.response;

import com.example.matrixgame.game.domain.state.GamePhase;

/**
 * Completion state after a "done arguing" signal.
 *
 * @param advanced true when this signal closed argumentation
 */
public record ArgumentationProgress(
        Long actionId,
        long completedUnits,
        int requiredUnits,
        long remainingUnits,
        boolean advanced,
        GamePhase phase) {
}
