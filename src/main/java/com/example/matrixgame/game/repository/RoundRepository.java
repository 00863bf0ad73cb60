package com.example.matrixgame.game.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.example.matrixgame.game.domain.entity.Round;

@Repository
public interface RoundRepository extends JpaRepository<Round, Long> {

    List<Round> findAllByGameIdOrderByRoundNumberAsc(Long gameId);

    Optional<Round> findByGameIdAndRoundNumber(Long gameId, int roundNumber);

    /**
     * Guarded increment: never lets actionsCompleted pass totalActionsRequired.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Round r SET r.actionsCompleted = r.actionsCompleted + 1 " +
            "WHERE r.id = :roundId AND r.actionsCompleted < r.totalActionsRequired")
    int incrementActionsCompleted(@Param("roundId") Long roundId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Round r SET r.actionsCompleted = :count, r.totalActionsRequired = :count WHERE r.id = :roundId")
    int forceComplete(@Param("roundId") Long roundId, @Param("count") int count);
}
