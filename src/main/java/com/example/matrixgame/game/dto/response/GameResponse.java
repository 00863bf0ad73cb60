package com.example.matrixgame.game.dto.response;

import java.time.LocalDateTime;
import java.util.List;

import com.example.matrixgame.game.domain.entity.Game;
import com.example.matrixgame.game.domain.entity.Persona;
import com.example.matrixgame.game.domain.entity.Player;
import com.example.matrixgame.game.domain.state.GamePhase;
import com.example.matrixgame.game.domain.state.GameStatus;

public record GameResponse(
        Long id,
        String name,
        String description,
        GameStatus status,
        GamePhase currentPhase,
        LocalDateTime phaseStartedAt,
        Long currentRoundId,
        Long currentActionId,
        int npcMomentum,
        GameSettingsResponse settings,
        List<PlayerResponse> players,
        List<PersonaResponse> personas) {

    public static GameResponse from(Game game, List<Player> players, List<Persona> personas) {
        return new GameResponse(game.getId(), game.getName(), game.getDescription(), game.getStatus(),
                game.getCurrentPhase(), game.getPhaseStartedAt(), game.getCurrentRoundId(),
                game.getCurrentActionId(), game.getNpcMomentum(), GameSettingsResponse.from(game.getSettings()),
                players.stream().map(PlayerResponse::from).toList(),
                personas.stream().map(PersonaResponse::from).toList());
    }

    public static GameResponse summary(Game game) {
        return from(game, List.of(), List.of());
    }
}
