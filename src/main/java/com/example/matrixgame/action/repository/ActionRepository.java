package com.example.matrixgame.action.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.example.matrixgame.action.domain.entity.Action;
import jakarta.persistence.LockModeType;

@Repository
public interface ActionRepository extends JpaRepository<Action, Long> {

    /**
     * SELECT ... FOR UPDATE on the action row. Every lifecycle step on an action
     * goes through this so completion and vote counts are taken serially.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Action a WHERE a.id = :id")
    Optional<Action> findByIdForUpdate(@Param("id") Long id);

    List<Action> findAllByRoundIdOrderBySequenceNumberAsc(Long roundId);

    List<Action> findAllByGameIdOrderBySequenceNumberAsc(Long gameId);

    long countByRoundId(Long roundId);

    boolean existsByRoundIdAndActingUnitKey(Long roundId, String actingUnitKey);

    boolean existsByRoundIdAndInitiatorId(Long roundId, Long initiatorId);

    @Query("SELECT COALESCE(MAX(a.sequenceNumber), 0) FROM Action a WHERE a.gameId = :gameId")
    int findMaxSequenceNumber(@Param("gameId") Long gameId);
}
