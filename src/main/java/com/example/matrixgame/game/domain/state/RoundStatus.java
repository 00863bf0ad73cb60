package com.example.matrixgame.game.domain.state;

public enum RoundStatus {
    IN_PROGRESS,
    COMPLETED
}
