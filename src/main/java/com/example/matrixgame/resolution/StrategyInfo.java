package com.example.matrixgame.resolution;

import com.example.matrixgame.game.domain.state.GamePhase;

public record StrategyInfo(
        String id,
        String displayName,
        String description,
        GamePhase phaseAfterArgumentation,
        int maxArgumentsPerSide) {

    public static StrategyInfo from(ResolutionMethod method) {
        return new StrategyInfo(method.getId(), method.getDisplayName(), method.getDescription(),
                method.getPhaseAfterArgumentation(), method.getMaxArgumentsPerSide());
    }
}
