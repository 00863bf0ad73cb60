package com.example.matrixgame.game.dto.request;

import com.example.matrixgame.game.domain.state.GamePhase;
import jakarta.validation.constraints.NotNull;

public record TransitionPhaseRequest(@NotNull GamePhase phase) {
}
