package com.example.matrixgame.game.dto.response;

import com.example.matrixgame.game.domain.entity.Persona;

public record PersonaResponse(
        Long id,
        String name,
        String description,
        boolean isNpc) {

    public static PersonaResponse from(Persona persona) {
        return new PersonaResponse(persona.getId(), persona.getName(), persona.getDescription(), persona.isNpc());
    }
}
