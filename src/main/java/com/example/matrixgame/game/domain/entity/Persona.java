package com.example.matrixgame.game.domain.entity;

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

@Entity
@Table(name = "personas",
        uniqueConstraints = @UniqueConstraint(name = "uk_persona_game_name", columnNames = {"game_id", "name"}))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Persona {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "game_id", nullable = false)
    private Long gameId;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "description", length = 2000)
    private String description;

    @Builder.Default
    @Column(name = "is_npc", nullable = false)
    private boolean isNpc = false;

    // scripted text, only read for the NPC persona
    @Column(name = "npc_action_description", length = 2000)
    private String npcActionDescription;

    @Column(name = "npc_desired_outcome", length = 2000)
    private String npcDesiredOutcome;

    public String scriptedActionDescription() {
        return npcActionDescription != null && !npcActionDescription.isBlank()
                ? npcActionDescription
                : name + " takes action";
    }

    public String scriptedDesiredOutcome() {
        return npcDesiredOutcome != null && !npcDesiredOutcome.isBlank()
                ? npcDesiredOutcome
                : name + " achieves their goal";
    }
}
