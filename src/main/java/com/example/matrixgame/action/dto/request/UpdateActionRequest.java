package com.example.matrixgame.action.dto.request;

import jakarta.validation.constraints.Size;

public record UpdateActionRequest(
        @Size(max = 4000) String actionDescription,
        @Size(max = 4000) String desiredOutcome) {
}
