package com.example.matrixgame.resolution.strategy;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.example.matrixgame.action.domain.state.ArgumentType;
import com.example.matrixgame.action.domain.state.VoteType;
import com.example.matrixgame.global.error.CommonException;
import com.example.matrixgame.global.error.ErrorCode;
import com.example.matrixgame.resolution.ResolutionContext;
import com.example.matrixgame.resolution.ResolutionContext.ArgumentStrength;
import com.example.matrixgame.resolution.ResolutionResult;
import com.example.matrixgame.resolution.ResultType;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArbiterStrategyTest {

    private final ArbiterStrategy strategy = new ArbiterStrategy();

    @Test
    @DisplayName("more strong pro arguments than anti: SUCCESS_BUT")
    void proWins() {
        ResolutionResult result = strategy.resolve(new ResolutionContext(List.of(), List.of(
                new ArgumentStrength(ArgumentType.INITIATOR_FOR, true),
                new ArgumentStrength(ArgumentType.FOR, true),
                new ArgumentStrength(ArgumentType.AGAINST, true),
                new ArgumentStrength(ArgumentType.AGAINST, false))));

        assertThat(result.resultType()).isEqualTo(ResultType.SUCCESS_BUT);
        assertThat(result.resultValue()).isEqualTo(1);
        assertThat(result.strategyData()).containsEntry("strongProCount", 2L).containsEntry("strongAntiCount", 1L);
    }

    @Test
    @DisplayName("a tie goes against the initiator")
    void tieFails() {
        ResolutionResult result = strategy.resolve(new ResolutionContext(List.of(), List.of(
                new ArgumentStrength(ArgumentType.FOR, true),
                new ArgumentStrength(ArgumentType.AGAINST, true),
                new ArgumentStrength(ArgumentType.CLARIFICATION, true))));

        assertThat(result.resultType()).isEqualTo(ResultType.FAILURE_BUT);
        assertThat(result.resultValue()).isEqualTo(-1);
    }

    @Test
    void votesAreNotUsed() {
        assertThatThrownBy(() -> strategy.mapVoteToTokens(VoteType.LIKELY_SUCCESS))
                .isInstanceOf(CommonException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.VOTING_NOT_USED);
    }
}
