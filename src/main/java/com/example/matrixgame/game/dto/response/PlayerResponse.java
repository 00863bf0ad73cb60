package com.example.matrixgame.game.dto.response;

import com.example.matrixgame.game.domain.entity.Player;
import com.example.matrixgame.game.domain.state.GameRole;

public record PlayerResponse(
        Long id,
        String userId,
        String playerName,
        Long personaId,
        boolean isPersonaLead,
        boolean isHost,
        boolean isNpc,
        boolean isActive,
        GameRole gameRole) {

    public static PlayerResponse from(Player player) {
        return new PlayerResponse(player.getId(), player.getUserId(), player.getPlayerName(),
                player.getPersonaId(), player.isPersonaLead(), player.isHost(), player.isNpc(),
                player.isActive(), player.getGameRole());
    }
}
