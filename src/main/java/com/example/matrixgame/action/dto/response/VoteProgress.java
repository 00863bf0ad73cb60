package com.example.matrixgame.action.dto.response;

/**
 * @param resolved true when this vote reached the threshold and the action was resolved
 */
public record VoteProgress(
        VoteResponse vote,
        long votesReceived,
        int votesRequired,
        boolean resolved) {
}
