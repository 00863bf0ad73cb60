package com.example.matrixgame.action.repository;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.example.matrixgame.action.domain.entity.Narration;

@Repository
public interface NarrationRepository extends JpaRepository<Narration, Long> {

    Optional<Narration> findByActionId(Long actionId);

    boolean existsByActionId(Long actionId);
}
