package com.example.matrixgame.game.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RoundSummaryRequest(@NotBlank @Size(max = 8000) String content) {
}
