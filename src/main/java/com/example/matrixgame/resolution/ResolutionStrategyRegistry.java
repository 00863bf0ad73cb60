package com.example.matrixgame.resolution;

import java.util.Arrays;
import java.util.List;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import com.example.matrixgame.resolution.strategy.ArbiterStrategy;
import com.example.matrixgame.resolution.strategy.TokenDrawStrategy;

/**
 * Provides the strategy for a stored method id.
 */
@Component
@RequiredArgsConstructor
public class ResolutionStrategyRegistry {

    private final TokenDrawStrategy tokenDrawStrategy;
    private final ArbiterStrategy arbiterStrategy;

    /**
     * @throws com.example.matrixgame.global.error.CommonException UNKNOWN_RESOLUTION_STRATEGY for an unknown id
     */
    public ResolutionStrategy getStrategy(String id) {
        return getStrategy(ResolutionMethod.fromId(id));
    }

    public ResolutionStrategy getStrategy(ResolutionMethod method) {
        return switch (method) {
            case TOKEN_DRAW -> tokenDrawStrategy;
            case ARBITER -> arbiterStrategy;
        };
    }

    public List<StrategyInfo> getAllStrategies() {
        return Arrays.stream(ResolutionMethod.values())
                .map(StrategyInfo::from)
                .toList();
    }
}
