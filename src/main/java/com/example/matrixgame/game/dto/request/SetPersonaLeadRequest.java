package com.example.matrixgame.game.dto.request;

import jakarta.validation.constraints.NotNull;

public record SetPersonaLeadRequest(@NotNull Long playerId) {
}
