package com.example.matrixgame.game.repository;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.example.matrixgame.game.domain.entity.RoundSummary;

@Repository
public interface RoundSummaryRepository extends JpaRepository<RoundSummary, Long> {

    Optional<RoundSummary> findByRoundId(Long roundId);

    boolean existsByRoundId(Long roundId);
}
