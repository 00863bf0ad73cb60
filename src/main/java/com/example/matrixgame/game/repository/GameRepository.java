package com.example.matrixgame.game.repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.example.matrixgame.game.domain.entity.Game;
import com.example.matrixgame.game.domain.state.GamePhase;
import com.example.matrixgame.game.domain.state.GameStatus;
import jakarta.persistence.LockModeType;

@Repository
public interface GameRepository extends JpaRepository<Game, Long> {

    Optional<Game> findByIdAndDeletedAtIsNull(Long id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT g FROM Game g WHERE g.id = :id AND g.deletedAt IS NULL")
    Optional<Game> findByIdForUpdate(@Param("id") Long id);

    List<Game> findAllByIdInAndDeletedAtIsNullOrderByCreatedAtDesc(Collection<Long> ids);

    /**
     * Games the timeout sweep has to look at.
     */
    List<Game> findAllByStatusAndDeletedAtIsNullAndCurrentPhaseInAndPhaseStartedAtIsNotNull(
            GameStatus status, Collection<GamePhase> phases);

    /**
     * Conditional phase transition. Returns 0 when the stored phase is no longer {@code from}.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Game g SET g.currentPhase = :to, g.phaseStartedAt = :now " +
            "WHERE g.id = :gameId AND g.currentPhase = :from AND g.deletedAt IS NULL")
    int transitionPhase(@Param("gameId") Long gameId,
                        @Param("from") GamePhase from,
                        @Param("to") GamePhase to,
                        @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Game g SET g.currentActionId = :actionId WHERE g.id = :gameId")
    int updateCurrentAction(@Param("gameId") Long gameId, @Param("actionId") Long actionId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Game g SET g.currentRoundId = :roundId WHERE g.id = :gameId")
    int updateCurrentRound(@Param("gameId") Long gameId, @Param("roundId") Long roundId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Game g SET g.phaseStartedAt = :now WHERE g.id = :gameId AND g.currentPhase = :phase")
    int resetPhaseStartedAt(@Param("gameId") Long gameId,
                            @Param("phase") GamePhase phase,
                            @Param("now") LocalDateTime now);

    /**
     * Atomic momentum update, no read-modify-write.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Game g SET g.npcMomentum = g.npcMomentum + :delta WHERE g.id = :gameId")
    int addNpcMomentum(@Param("gameId") Long gameId, @Param("delta") int delta);
}
