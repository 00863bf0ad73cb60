package com.example.matrixgame.game.domain.state;

public enum GameStatus {
    LOBBY,
    ACTIVE,
    COMPLETED
}
