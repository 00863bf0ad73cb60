package com.example.matrixgame.action.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Narration text, or a host correction to an argument or narration.
 */
public record ContentRequest(@NotBlank @Size(max = 8000) String content) {
}
