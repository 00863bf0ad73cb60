package com.example.matrixgame.action.domain.entity;

import java.time.LocalDateTime;

import com.example.matrixgame.action.domain.state.ArgumentType;
import jakarta.persistence.Column;
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

@Entity
@Table(name = "arguments")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Argument {

    public static final String TIMEOUT_PLACEHOLDER = "[No argument submitted - timed out]";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "action_id", nullable = false)
    private Long actionId;

    @Column(name = "player_id", nullable = false)
    private Long playerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "argument_type", nullable = false, length = 20)
    private ArgumentType argumentType;

    @Column(name = "content", nullable = false, length = 4000)
    private String content;

    @Column(name = "sequence_no", nullable = false)
    private int sequence;

    // set by the arbiter during review
    @Builder.Default
    @Column(name = "is_strong", nullable = false)
    private boolean isStrong = false;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
