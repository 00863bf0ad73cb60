package com.example.matrixgame.game.dto.response;

import java.time.LocalDateTime;

import com.example.matrixgame.game.domain.entity.Round;
import com.example.matrixgame.game.domain.state.RoundStatus;

public record RoundResponse(
        Long id,
        int roundNumber,
        RoundStatus status,
        int actionsCompleted,
        int totalActionsRequired,
        LocalDateTime startedAt,
        LocalDateTime completedAt) {

    public static RoundResponse from(Round round) {
        return new RoundResponse(round.getId(), round.getRoundNumber(), round.getStatus(),
                round.getActionsCompleted(), round.getTotalActionsRequired(),
                round.getStartedAt(), round.getCompletedAt());
    }
}
