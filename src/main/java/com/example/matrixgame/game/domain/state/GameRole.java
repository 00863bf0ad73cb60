package com.example.matrixgame.game.domain.state;

public enum GameRole {
    PLAYER,
    ARBITER
}
