package com.example.matrixgame.resolution;

import lombok.Getter;

@Getter
public enum ResultType {
    TRIUMPH(3),
    SUCCESS_BUT(1),
    FAILURE_BUT(-1),
    DISASTER(-3);

    private final int value;

    ResultType(int value) {
        this.value = value;
    }
}
