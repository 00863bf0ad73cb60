package com.example.matrixgame.game.domain.entity;

import java.time.LocalDateTime;

import com.example.matrixgame.game.domain.state.RoundStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
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

@Entity
@Table(name = "rounds",
        uniqueConstraints = @UniqueConstraint(name = "uk_round_game_number", columnNames = {"game_id", "round_number"}))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Round {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "game_id", nullable = false)
    private Long gameId;

    @Column(name = "round_number", nullable = false)
    private int roundNumber;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private RoundStatus status = RoundStatus.IN_PROGRESS;

    @Builder.Default
    @Column(name = "actions_completed", nullable = false)
    private int actionsCompleted = 0;

    @Column(name = "total_actions_required", nullable = false)
    private int totalActionsRequired;

    @Column(name = "started_at", nullable = false)
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    public boolean isComplete() {
        return actionsCompleted >= totalActionsRequired;
    }
}
