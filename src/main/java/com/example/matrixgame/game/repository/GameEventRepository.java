package com.example.matrixgame.game.repository;

import java.time.LocalDateTime;
import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.example.matrixgame.game.domain.entity.GameEvent;

@Repository
public interface GameEventRepository extends JpaRepository<GameEvent, Long> {

    List<GameEvent> findAllByGameIdOrderByCreatedAtDescIdDesc(Long gameId);

    List<GameEvent> findAllByGameIdAndEventTypeOrderByCreatedAtAsc(Long gameId, String eventType);

    boolean existsByGameIdAndEventTypeAndCreatedAtGreaterThanEqual(Long gameId, String eventType, LocalDateTime since);
}
