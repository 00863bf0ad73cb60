package com.example.matrixgame.game.domain.entity;

import java.time.LocalDateTime;

import com.example.matrixgame.game.domain.state.GameRole;
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
@Table(name = "game_players",
        uniqueConstraints = @UniqueConstraint(name = "uk_game_player_user", columnNames = {"game_id", "user_id"}))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Player {

    public static final String NPC_USER_ID = "npc-system";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "game_id", nullable = false)
    private Long gameId;

    @Column(name = "user_id", nullable = false, length = 100)
    private String userId;

    @Column(name = "player_name", nullable = false, length = 50)
    private String playerName;

    @Column(name = "persona_id")
    private Long personaId;

    @Builder.Default
    @Column(name = "is_persona_lead", nullable = false)
    private boolean isPersonaLead = false;

    @Builder.Default
    @Column(name = "is_host", nullable = false)
    private boolean isHost = false;

    @Builder.Default
    @Column(name = "is_npc", nullable = false)
    private boolean isNpc = false;

    @Builder.Default
    @Column(name = "is_active", nullable = false)
    private boolean isActive = true;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "game_role", nullable = false, length = 20)
    private GameRole gameRole = GameRole.PLAYER;

    @Column(name = "joined_at", nullable = false)
    private LocalDateTime joinedAt;

    public boolean isHuman() {
        return !isNpc;
    }

    public boolean isArbiter() {
        return gameRole == GameRole.ARBITER;
    }

    public static Player npc(Long gameId, Persona persona) {
        return Player.builder()
                .gameId(gameId)
                .userId(NPC_USER_ID)
                .playerName(persona.getName())
                .personaId(persona.getId())
                .isPersonaLead(true)
                .isNpc(true)
                .joinedAt(LocalDateTime.now())
                .build();
    }
}
