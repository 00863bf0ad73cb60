package com.example.matrixgame.action.dto.request;

import com.example.matrixgame.action.domain.state.ArgumentType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record AddArgumentRequest(
        @NotNull ArgumentType argumentType,
        @NotBlank @Size(max = 4000) String content) {
}
