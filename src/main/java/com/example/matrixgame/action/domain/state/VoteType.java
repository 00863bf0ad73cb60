package com.example.matrixgame.action.domain.state;

public enum VoteType {
    LIKELY_SUCCESS,
    LIKELY_FAILURE,
    UNCERTAIN
}
