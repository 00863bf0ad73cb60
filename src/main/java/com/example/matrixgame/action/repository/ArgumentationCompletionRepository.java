package com.example.matrixgame.action.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.example.matrixgame.action.domain.entity.ArgumentationCompletion;

@Repository
public interface ArgumentationCompletionRepository extends JpaRepository<ArgumentationCompletion, Long> {

    List<ArgumentationCompletion> findAllByActionId(Long actionId);

    boolean existsByActionIdAndPlayerId(Long actionId, Long playerId);

    long countByActionIdAndPlayerId(Long actionId, Long playerId);
}
