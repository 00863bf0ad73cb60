package com.example.matrixgame.action.domain.state;

public enum ArgumentType {
    INITIATOR_FOR,
    FOR,
    AGAINST,
    CLARIFICATION;

    public boolean isPro() {
        return this == FOR || this == INITIATOR_FOR;
    }

    public boolean isAnti() {
        return this == AGAINST;
    }
}
