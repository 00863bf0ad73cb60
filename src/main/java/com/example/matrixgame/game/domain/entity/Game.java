package com.example.matrixgame.game.domain.entity;

import java.time.LocalDateTime;

import com.example.matrixgame.game.domain.state.GamePhase;
import com.example.matrixgame.game.domain.state.GameStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.DynamicUpdate;

// only dirty columns are written, so a settings save never rewrites the phase columns
@Entity
@DynamicUpdate
@Table(name = "games")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Game {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "description", length = 2000)
    private String description;

    @Column(name = "host_user_id", nullable = false)
    private String hostUserId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private GameStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "current_phase", nullable = false, length = 20)
    private GamePhase currentPhase;

    // anchor for the timeout sweep, reset on every phase transition
    @Column(name = "phase_started_at")
    private LocalDateTime phaseStartedAt;

    @Column(name = "current_round_id")
    private Long currentRoundId;

    @Column(name = "current_action_id")
    private Long currentActionId;

    @Builder.Default
    @Embedded
    private GameSettings settings = new GameSettings();

    @Builder.Default
    @Column(name = "npc_momentum", nullable = false)
    private int npcMomentum = 0;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "deleted_at")
    private LocalDateTime deletedAt;

    public static Game createNew(String name, String description, String hostUserId, GameSettings settings) {
        return Game.builder()
                .name(name)
                .description(description)
                .hostUserId(hostUserId)
                .status(GameStatus.LOBBY)
                .currentPhase(GamePhase.WAITING)
                .settings(settings != null ? settings : new GameSettings())
                .createdAt(LocalDateTime.now())
                .build();
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }

    public boolean isInLobby() {
        return status == GameStatus.LOBBY;
    }
}
