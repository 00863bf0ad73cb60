package com.example.matrixgame.game.dto.request;

/**
 * A null persona clears the selection.
 */
public record SelectPersonaRequest(Long personaId) {
}
