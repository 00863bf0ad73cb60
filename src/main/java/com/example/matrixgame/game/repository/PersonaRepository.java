package com.example.matrixgame.game.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.example.matrixgame.game.domain.entity.Persona;

@Repository
public interface PersonaRepository extends JpaRepository<Persona, Long> {

    List<Persona> findAllByGameIdOrderByIdAsc(Long gameId);

    Optional<Persona> findByIdAndGameId(Long id, Long gameId);

    Optional<Persona> findFirstByGameIdAndIsNpcTrue(Long gameId);
}
