package com.example.matrixgame.game.service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.matrixgame.game.domain.entity.GameEvent;
import com.example.matrixgame.game.domain.state.GameEventType;
import com.example.matrixgame.game.repository.GameEventRepository;

/**
 * Audit log. Joins the caller's transaction so an event exists exactly when its mutation does.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GameEventService {

    private final GameEventRepository gameEventRepository;

    @Transactional
    public GameEvent log(Long gameId, String userId, GameEventType type, Map<String, Object> data) {
        GameEvent event = GameEvent.builder()
                .gameId(gameId)
                .userId(userId)
                .eventType(type.name())
                .eventData(data)
                .createdAt(LocalDateTime.now())
                .build();
        log.debug("[event] gameId={}, type={}, data={}", gameId, type, data);
        return gameEventRepository.save(event);
    }

    @Transactional(readOnly = true)
    public boolean existsSince(Long gameId, GameEventType type, LocalDateTime since) {
        return gameEventRepository.existsByGameIdAndEventTypeAndCreatedAtGreaterThanEqual(gameId, type.name(), since);
    }

    @Transactional(readOnly = true)
    public List<GameEvent> getEvents(Long gameId) {
        return gameEventRepository.findAllByGameIdOrderByCreatedAtDescIdDesc(gameId);
    }

    @Transactional(readOnly = true)
    public List<GameEvent> getEvents(Long gameId, GameEventType type) {
        return gameEventRepository.findAllByGameIdAndEventTypeOrderByCreatedAtAsc(gameId, type.name());
    }
}
