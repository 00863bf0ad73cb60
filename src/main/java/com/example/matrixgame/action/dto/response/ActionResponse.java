package com.example.matrixgame.action.dto.response;

import java.time.LocalDateTime;
import java.util.Map;

import com.example.matrixgame.action.domain.entity.Action;
import com.example.matrixgame.action.domain.state.ActionStatus;

public record ActionResponse(
        Long id,
        Long gameId,
        Long roundId,
        Long initiatorId,
        int sequenceNumber,
        String actionDescription,
        String desiredOutcome,
        ActionStatus status,
        LocalDateTime argumentationStartedAt,
        LocalDateTime votingStartedAt,
        LocalDateTime resolvedAt,
        LocalDateTime completedAt,
        String resolutionMethod,
        Map<String, Object> resolutionData,
        boolean argumentationWasSkipped,
        boolean votingWasSkipped) {

    public static ActionResponse from(Action action) {
        return new ActionResponse(action.getId(), action.getGameId(), action.getRoundId(), action.getInitiatorId(),
                action.getSequenceNumber(), action.getActionDescription(), action.getDesiredOutcome(),
                action.getStatus(), action.getArgumentationStartedAt(), action.getVotingStartedAt(),
                action.getResolvedAt(), action.getCompletedAt(), action.getResolutionMethod(),
                action.getResolutionData(), action.isArgumentationWasSkipped(), action.isVotingWasSkipped());
    }
}
