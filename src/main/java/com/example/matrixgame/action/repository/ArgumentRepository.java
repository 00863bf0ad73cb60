package com.example.matrixgame.action.repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.example.matrixgame.action.domain.entity.Argument;
import com.example.matrixgame.action.domain.state.ArgumentType;

@Repository
public interface ArgumentRepository extends JpaRepository<Argument, Long> {

    List<Argument> findAllByActionIdOrderBySequenceAsc(Long actionId);

    Optional<Argument> findByIdAndActionId(Long id, Long actionId);

    long countByActionIdAndPlayerIdIn(Long actionId, Collection<Long> playerIds);

    long countByActionIdAndPlayerIdInAndArgumentTypeIn(Long actionId, Collection<Long> playerIds,
                                                      Collection<ArgumentType> types);

    long countByActionIdAndArgumentTypeIn(Long actionId, Collection<ArgumentType> types);

    @Query("SELECT COALESCE(MAX(a.sequence), 0) FROM Argument a WHERE a.actionId = :actionId")
    int findMaxSequence(@Param("actionId") Long actionId);
}
