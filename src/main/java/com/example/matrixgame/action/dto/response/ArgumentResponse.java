package com.example.matrixgame.action.dto.response;

import java.time.LocalDateTime;

import com.example.matrixgame.action.domain.entity.Argument;
import com.example.matrixgame.action.domain.state.ArgumentType;

public record ArgumentResponse(
        Long id,
        Long actionId,
        Long playerId,
        ArgumentType argumentType,
        String content,
        int sequence,
        boolean isStrong,
        LocalDateTime createdAt) {

    public static ArgumentResponse from(Argument argument) {
        return new ArgumentResponse(argument.getId(), argument.getActionId(), argument.getPlayerId(),
                argument.getArgumentType(), argument.getContent(), argument.getSequence(),
                argument.isStrong(), argument.getCreatedAt());
    }
}
