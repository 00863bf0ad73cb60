package com.example.matrixgame.resolution.strategy;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import com.example.matrixgame.action.domain.state.VoteType;
import com.example.matrixgame.resolution.ResolutionContext;
import com.example.matrixgame.resolution.ResolutionResult;
import com.example.matrixgame.resolution.ResolutionStrategy;
import com.example.matrixgame.resolution.ResultType;
import com.example.matrixgame.resolution.TokenWeight;

/**
 * Pool-and-draw resolution.
 * <p>
 * Every vote adds tokens to a pool that always starts with one success and one
 * failure token. The pool is shuffled with a recorded seed and the first
 * {@value #DRAW_COUNT} tokens are drawn; the number of success tokens drawn
 * picks the tier. Replaying {@link #draw(int, int, String)} with the stored
 * seed reproduces the exact sequence.
 */
@Slf4j
@Component
public class TokenDrawStrategy implements ResolutionStrategy {

    public static final int DRAW_COUNT = 3;
    public static final int BASE_SUCCESS_TOKENS = 1;
    public static final int BASE_FAILURE_TOKENS = 1;

    public static final String SUCCESS = "SUCCESS";
    public static final String FAILURE = "FAILURE";

    private final SecureRandom seedSource = new SecureRandom();

    @Override
    public TokenWeight mapVoteToTokens(VoteType voteType) {
        return switch (voteType) {
            case LIKELY_SUCCESS -> new TokenWeight(2, 0);
            case LIKELY_FAILURE -> new TokenWeight(0, 2);
            case UNCERTAIN -> new TokenWeight(1, 1);
        };
    }

    @Override
    public ResolutionResult resolve(ResolutionContext context) {
        int totalSuccess = BASE_SUCCESS_TOKENS;
        int totalFailure = BASE_FAILURE_TOKENS;
        for (ResolutionContext.VoteTokens vote : context.votes()) {
            totalSuccess += vote.successTokens();
            totalFailure += vote.failureTokens();
        }

        String seed = String.format("%016x", seedSource.nextLong());
        List<String> drawn = draw(totalSuccess, totalFailure, seed);

        int drawnSuccess = (int) drawn.stream().filter(SUCCESS::equals).count();
        int drawnFailure = drawn.size() - drawnSuccess;
        ResultType resultType = classify(drawnSuccess);

        List<Map<String, Object>> drawnTokens = new ArrayList<>();
        for (int i = 0; i < drawn.size(); i++) {
            Map<String, Object> token = new LinkedHashMap<>();
            token.put("drawSequence", i + 1);
            token.put("tokenType", drawn.get(i));
            drawnTokens.add(token);
        }

        Map<String, Object> strategyData = new LinkedHashMap<>();
        strategyData.put("seed", seed);
        strategyData.put("totalSuccessTokens", totalSuccess);
        strategyData.put("totalFailureTokens", totalFailure);
        strategyData.put("drawnSuccess", drawnSuccess);
        strategyData.put("drawnFailure", drawnFailure);
        strategyData.put("drawnTokens", drawnTokens);

        log.debug("[token_draw] pool={}/{}, seed={}, drawnSuccess={}, result={}",
                totalSuccess, totalFailure, seed, drawnSuccess, resultType);
        return ResolutionResult.of(resultType, strategyData);
    }

    /**
     * Deterministic draw for a pool and a hex seed: Fisher-Yates shuffle, then the first
     * {@value #DRAW_COUNT} tokens (fewer if the pool is smaller).
     */
    public List<String> draw(int successTokens, int failureTokens, String seed) {
        List<String> pool = new ArrayList<>(successTokens + failureTokens);
        for (int i = 0; i < successTokens; i++) {
            pool.add(SUCCESS);
        }
        for (int i = 0; i < failureTokens; i++) {
            pool.add(FAILURE);
        }

        Random random = new Random(Long.parseUnsignedLong(seed, 16));
        for (int i = pool.size() - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            String swap = pool.get(i);
            pool.set(i, pool.get(j));
            pool.set(j, swap);
        }

        return new ArrayList<>(pool.subList(0, Math.min(DRAW_COUNT, pool.size())));
    }

    public ResultType classify(int drawnSuccess) {
        if (drawnSuccess >= 3) {
            return ResultType.TRIUMPH;
        }
        if (drawnSuccess == 2) {
            return ResultType.SUCCESS_BUT;
        }
        if (drawnSuccess == 1) {
            return ResultType.FAILURE_BUT;
        }
        return ResultType.DISASTER;
    }
}
