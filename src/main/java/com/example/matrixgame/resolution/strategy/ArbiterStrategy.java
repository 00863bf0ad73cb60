package com.example.matrixgame.resolution.strategy;

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.example.matrixgame.action.domain.state.VoteType;
import com.example.matrixgame.global.error.ErrorCode;
import com.example.matrixgame.resolution.ResolutionContext;
import com.example.matrixgame.resolution.ResolutionResult;
import com.example.matrixgame.resolution.ResolutionStrategy;
import com.example.matrixgame.resolution.ResultType;
import com.example.matrixgame.resolution.TokenWeight;

/**
 * Arbiter-judged resolution. Votes are never cast; the arbiter's strong marks decide.
 * Ties go to FAILURE_BUT.
 */
@Component
public class ArbiterStrategy implements ResolutionStrategy {

    @Override
    public TokenWeight mapVoteToTokens(VoteType voteType) {
        throw ErrorCode.VOTING_NOT_USED.commonException();
    }

    @Override
    public ResolutionResult resolve(ResolutionContext context) {
        long strongPro = context.arguments().stream()
                .filter(ResolutionContext.ArgumentStrength::strong)
                .filter(argument -> argument.argumentType().isPro())
                .count();
        long strongAnti = context.arguments().stream()
                .filter(ResolutionContext.ArgumentStrength::strong)
                .filter(argument -> argument.argumentType().isAnti())
                .count();

        Map<String, Object> strategyData = new LinkedHashMap<>();
        strategyData.put("strongProCount", strongPro);
        strategyData.put("strongAntiCount", strongAnti);

        ResultType resultType = strongPro > strongAnti ? ResultType.SUCCESS_BUT : ResultType.FAILURE_BUT;
        return ResolutionResult.of(resultType, strategyData);
    }
}
