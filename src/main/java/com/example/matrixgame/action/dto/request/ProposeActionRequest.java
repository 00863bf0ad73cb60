package com.example.matrixgame.action.dto.request;

import java.util.List;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

public record ProposeActionRequest(
        @NotBlank @Size(max = 4000) String actionDescription,
        @NotBlank @Size(max = 4000) String desiredOutcome,
        @NotEmpty List<@NotBlank @Size(max = 4000) String> initialArguments) {
}
