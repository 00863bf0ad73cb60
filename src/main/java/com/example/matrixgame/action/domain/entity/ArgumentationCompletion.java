package com.example.matrixgame.action.domain.entity;

import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A player's "done arguing" signal for one action.
 */
@Entity
@Table(name = "argumentation_complete",
        uniqueConstraints = @UniqueConstraint(name = "uk_arg_complete_action_player", columnNames = {"action_id", "player_id"}))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArgumentationCompletion {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "action_id", nullable = false)
    private Long actionId;

    @Column(name = "player_id", nullable = false)
    private Long playerId;

    @Column(name = "completed_at", nullable = false)
    private LocalDateTime completedAt;
}
