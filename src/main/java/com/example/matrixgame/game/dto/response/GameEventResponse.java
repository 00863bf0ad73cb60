package com.example.matrixgame.game.dto.response;

import java.time.LocalDateTime;
import java.util.Map;

import com.example.matrixgame.game.domain.entity.GameEvent;

public record GameEventResponse(
        Long id,
        String eventType,
        String userId,
        Map<String, Object> eventData,
        LocalDateTime createdAt) {

    public static GameEventResponse from(GameEvent event) {
        return new GameEventResponse(event.getId(), event.getEventType(), event.getUserId(),
                event.getEventData(), event.getCreatedAt());
    }
}
