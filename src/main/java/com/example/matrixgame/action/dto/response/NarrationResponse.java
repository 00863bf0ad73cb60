package com.example.matrixgame.action.dto.response;

import java.time.LocalDateTime;

import com.example.matrixgame.action.domain.entity.Narration;

public record NarrationResponse(
        Long id,
        Long actionId,
        Long authorId,
        String content,
        LocalDateTime createdAt) {

    public static NarrationResponse from(Narration narration) {
        return new NarrationResponse(narration.getId(), narration.getActionId(), narration.getAuthorId(),
                narration.getContent(), narration.getCreatedAt());
    }
}
