package com.example.matrixgame.resolution;

import com.example.matrixgame.action.domain.state.VoteType;

/**
 * Converts a completed vote set into a narrative outcome (Strategy Pattern).
 */
public interface ResolutionStrategy {

    /**
     * Token weights a single vote contributes.
     */
    TokenWeight mapVoteToTokens(VoteType voteType);

    /**
     * Decide the outcome of an action.
     *
     * @param context votes and arguments recorded for the action
     * @return outcome tier, momentum delta and the strategy's audit payload
     */
    ResolutionResult resolve(ResolutionContext context);
}
