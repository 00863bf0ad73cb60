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
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "round_summaries")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoundSummary {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "round_id", nullable = false, unique = true)
    private Long roundId;

    @Column(name = "author_id", nullable = false)
    private Long authorId;

    @Lob
    @Column(name = "content", nullable = false)
    private String content;

    // netMomentum, triumphs, disasters, actionCount
    @Lob
    @Convert(converter = JsonMapConverter.class)
    @Column(name = "outcomes")
    private Map<String, Object> outcomes;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
