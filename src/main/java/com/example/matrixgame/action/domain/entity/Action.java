package com.example.matrixgame.action.domain.entity;

import java.time.LocalDateTime;
import java.util.Map;

import com.example.matrixgame.action.domain.state.ActionStatus;
import com.example.matrixgame.global.util.JsonMapConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One proposed action. Rows are never deleted; the acting unit key makes
 * "one proposal per acting unit per round" a storage-level guarantee.
 */
@Entity
@Table(name = "actions", uniqueConstraints = {
        @UniqueConstraint(name = "uk_action_game_sequence", columnNames = {"game_id", "sequence_number"}),
        @UniqueConstraint(name = "uk_action_round_unit", columnNames = {"round_id", "acting_unit_key"})
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Action {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "game_id", nullable = false)
    private Long gameId;

    @Column(name = "round_id", nullable = false)
    private Long roundId;

    @Column(name = "initiator_id", nullable = false)
    private Long initiatorId;

    @Column(name = "acting_unit_key", nullable = false, length = 40)
    private String actingUnitKey;

    @Column(name = "sequence_number", nullable = false)
    private int sequenceNumber;

    @Column(name = "action_description", nullable = false, length = 4000)
    private String actionDescription;

    @Column(name = "desired_outcome", nullable = false, length = 4000)
    private String desiredOutcome;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ActionStatus status;

    @Column(name = "argumentation_started_at")
    private LocalDateTime argumentationStartedAt;

    @Column(name = "voting_started_at")
    private LocalDateTime votingStartedAt;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "resolution_method", length = 40)
    private String resolutionMethod;

    // strategy payload plus resultType / resultValue
    @Lob
    @Convert(converter = JsonMapConverter.class)
    @Column(name = "resolution_data")
    private Map<String, Object> resolutionData;

    @Builder.Default
    @Column(name = "argumentation_was_skipped", nullable = false)
    private boolean argumentationWasSkipped = false;

    @Builder.Default
    @Column(name = "voting_was_skipped", nullable = false)
    private boolean votingWasSkipped = false;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    public boolean isResolutionRecorded() {
        return resolvedAt != null && resolutionData != null;
    }
}
