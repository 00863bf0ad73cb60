package com.example.matrixgame.timeout.dto;

import java.util.List;

public record SweepResult(
        int gamesChecked,
        List<TimeoutResult> processed,
        List<SweepFailure> failures) {

    public record SweepFailure(Long gameId, String message) {
    }
}
