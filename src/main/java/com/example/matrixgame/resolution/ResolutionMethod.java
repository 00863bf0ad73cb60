package com.example.matrixgame.resolution;

import java.util.Arrays;

import lombok.Getter;

import com.example.matrixgame.game.domain.state.GamePhase;
import com.example.matrixgame.global.error.ErrorCode;

/**
 * The closed set of resolution strategies, keyed by the id stored in game settings.
 */
@Getter
public enum ResolutionMethod {
    TOKEN_DRAW("token_draw",
            "Token Draw",
            "Votes add success and failure tokens to a pool; three tokens are drawn to decide the outcome.",
            GamePhase.VOTING,
            0),
    ARBITER("arbiter",
            "Arbiter",
            "A designated arbiter marks strong arguments; the side with more strong arguments prevails.",
            GamePhase.ARBITER_REVIEW,
            3);

    private final String id;
    private final String displayName;
    private final String description;
    private final GamePhase phaseAfterArgumentation;
    // 0 = no cap per side
    private final int maxArgumentsPerSide;

    ResolutionMethod(String id, String displayName, String description,
                     GamePhase phaseAfterArgumentation, int maxArgumentsPerSide) {
        this.id = id;
        this.displayName = displayName;
        this.description = description;
        this.phaseAfterArgumentation = phaseAfterArgumentation;
        this.maxArgumentsPerSide = maxArgumentsPerSide;
    }

    public boolean usesVoting() {
        return phaseAfterArgumentation == GamePhase.VOTING;
    }

    public boolean hasSideCap() {
        return maxArgumentsPerSide > 0;
    }

    public static ResolutionMethod fromId(String id) {
        return Arrays.stream(values())
                .filter(method -> method.id.equals(id))
                .findFirst()
                .orElseThrow(() -> ErrorCode.UNKNOWN_RESOLUTION_STRATEGY.commonException(
                        "Unknown resolution strategy: \"" + id + "\""));
    }
}
