package com.example.matrixgame.game.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.example.matrixgame.game.domain.entity.Player;
import com.example.matrixgame.game.domain.state.GameRole;

@Repository
public interface PlayerRepository extends JpaRepository<Player, Long> {

    Optional<Player> findByGameIdAndUserId(Long gameId, String userId);

    Optional<Player> findByGameIdAndUserIdAndIsActiveTrue(Long gameId, String userId);

    List<Player> findAllByGameIdAndIsActiveTrueOrderByJoinedAtAscIdAsc(Long gameId);

    List<Player> findAllByGameIdOrderByJoinedAtAscIdAsc(Long gameId);

    List<Player> findAllByGameIdAndPersonaIdAndIsActiveTrueOrderByJoinedAtAscIdAsc(Long gameId, Long personaId);

    Optional<Player> findFirstByGameIdAndIsNpcTrueAndIsActiveTrue(Long gameId);

    Optional<Player> findFirstByGameIdAndGameRoleAndIsActiveTrue(Long gameId, GameRole gameRole);

    List<Player> findAllByUserIdAndIsActiveTrue(String userId);
}
