package com.example.matrixgame.action.domain.entity;

import java.time.LocalDateTime;

import com.example.matrixgame.action.domain.state.VoteType;
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
@Table(name = "votes",
        uniqueConstraints = @UniqueConstraint(name = "uk_vote_action_player", columnNames = {"action_id", "player_id"}))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Vote {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "action_id", nullable = false)
    private Long actionId;

    @Column(name = "player_id", nullable = false)
    private Long playerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "vote_type", nullable = false, length = 20)
    private VoteType voteType;

    @Column(name = "success_tokens", nullable = false)
    private int successTokens;

    @Column(name = "failure_tokens", nullable = false)
    private int failureTokens;

    // synthesized by a timeout or a host skip
    @Builder.Default
    @Column(name = "was_skipped", nullable = false)
    private boolean wasSkipped = false;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
