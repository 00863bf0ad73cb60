package com.example.matrixgame.resolution;

import java.util.List;

import com.example.matrixgame.action.domain.entity.Argument;
import com.example.matrixgame.action.domain.entity.Vote;
import com.example.matrixgame.action.domain.state.ArgumentType;

/**
 * Everything a strategy may look at. Strategies never touch persistence.
 */
public record ResolutionContext(List<VoteTokens> votes, List<ArgumentStrength> arguments) {

    public record VoteTokens(int successTokens, int failureTokens) {
    }

    public record ArgumentStrength(ArgumentType argumentType, boolean strong) {
    }

    public ResolutionContext {
        votes = List.copyOf(votes);
        arguments = List.copyOf(arguments);
    }

    public static ResolutionContext of(List<Vote> votes, List<Argument> arguments) {
        return new ResolutionContext(
                votes.stream().map(vote -> new VoteTokens(vote.getSuccessTokens(), vote.getFailureTokens())).toList(),
                arguments.stream().map(argument -> new ArgumentStrength(argument.getArgumentType(), argument.isStrong())).toList());
    }
}
