package com.example.matrixgame.action.repository;

import java.util.Collection;
import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.example.matrixgame.action.domain.entity.Vote;

@Repository
public interface VoteRepository extends JpaRepository<Vote, Long> {

    List<Vote> findAllByActionIdOrderByIdAsc(Long actionId);

    boolean existsByActionIdAndPlayerId(Long actionId, Long playerId);

    boolean existsByActionIdAndPlayerIdIn(Long actionId, Collection<Long> playerIds);

    long countByActionId(Long actionId);
}
