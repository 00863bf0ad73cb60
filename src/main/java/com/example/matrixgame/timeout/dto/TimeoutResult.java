package com.example.matrixgame.timeout.dto;

import java.util.List;

import com.example.matrixgame.game.domain.state.GamePhase;

/**
 * One expired phase handled by the sweep.
 *
 * @param playersAffected players that received a synthesized argument or vote
 * @param newPhase        the game's phase after handling; unchanged for notice-only phases
 */
public record TimeoutResult(
        Long gameId,
        Long actionId,
        GamePhase phase,
        List<Long> playersAffected,
        GamePhase newPhase,
        boolean hostNotified) {
}
