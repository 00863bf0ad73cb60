package com.example.matrixgame.game.dto.request;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateGameRequest(
        @NotBlank @Size(max = 100) String name,
        @Size(max = 2000) String description,
        @NotBlank @Size(max = 50) String hostName,
        @Valid GameSettingsRequest settings,
        @Valid List<PersonaRequest> personas) {

    public record PersonaRequest(
            @NotBlank @Size(max = 100) String name,
            @Size(max = 2000) String description,
            boolean isNpc,
            @Size(max = 2000) String npcActionDescription,
            @Size(max = 2000) String npcDesiredOutcome) {
    }
}
