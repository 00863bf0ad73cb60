package com.example.matrixgame.action.dto.request;

import com.example.matrixgame.action.domain.state.VoteType;
import jakarta.validation.constraints.NotNull;

public record SubmitVoteRequest(@NotNull VoteType voteType) {
}
