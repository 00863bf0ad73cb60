package com.example.matrixgame.action.dto.response;

import com.example.matrixgame.action.domain.entity.Vote;
import com.example.matrixgame.action.domain.state.VoteType;

public record VoteResponse(
        Long id,
        Long actionId,
        Long playerId,
        VoteType voteType,
        int successTokens,
        int failureTokens,
        boolean wasSkipped) {

    public static VoteResponse from(Vote vote) {
        return new VoteResponse(vote.getId(), vote.getActionId(), vote.getPlayerId(), vote.getVoteType(),
                vote.getSuccessTokens(), vote.getFailureTokens(), vote.isWasSkipped());
    }
}
