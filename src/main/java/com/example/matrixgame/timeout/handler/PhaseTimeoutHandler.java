package com.example.matrixgame.timeout.handler;

import java.util.Optional;

import com.example.matrixgame.game.domain.entity.Game;
import com.example.matrixgame.game.domain.state.GamePhase;
import com.example.matrixgame.timeout.dto.TimeoutResult;

/**
 * What the sweep does with a game whose phase ran out of time.
 */
public interface PhaseTimeoutHandler {

    /**
     * Handles the expired phase in its own transaction.
     *
     * @param game the game as read by the sweep
     * @return empty when the game moved on before the handler got to it
     */
    Optional<TimeoutResult> handle(Game game);

    GamePhase getGamePhase();
}
