package com.example.matrixgame.game.dto.response;

import java.time.LocalDateTime;
import java.util.Map;

import com.example.matrixgame.game.domain.entity.RoundSummary;

public record RoundSummaryResponse(
        Long id,
        Long roundId,
        Long authorId,
        String content,
        Map<String, Object> outcomes,
        LocalDateTime createdAt) {

    public static RoundSummaryResponse from(RoundSummary summary) {
        return new RoundSummaryResponse(summary.getId(), summary.getRoundId(), summary.getAuthorId(),
                summary.getContent(), summary.getOutcomes(), summary.getCreatedAt());
    }
}
