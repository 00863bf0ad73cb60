package com.example.matrixgame.game.domain.entity;

import java.time.LocalDateTime;
import java.util.Map;

import com.example.matrixgame.global.util.JsonMapConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Append-only audit record of everything that happened in a game.
 */
@Entity
@Table(name = "game_events",
        indexes = @Index(name = "idx_game_event_type_time", columnList = "game_id, event_type, created_at"))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GameEvent {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "game_id", nullable = false)
    private Long gameId;

    // null for system events (phase changes, timeouts)
    @Column(name = "user_id", length = 100)
    private String userId;

    @Column(name = "event_type", nullable = false, length = 50)
    private String eventType;

    @Lob
    @Convert(converter = JsonMapConverter.class)
    @Column(name = "event_data")
    private Map<String, Object> eventData;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
