package com.example.matrixgame.game.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import com.example.matrixgame.game.domain.entity.Game;
import com.example.matrixgame.game.domain.entity.GameSettings;
import com.example.matrixgame.game.domain.entity.Player;
import com.example.matrixgame.game.domain.state.GamePhase;
import com.example.matrixgame.game.domain.state.GameStatus;
import com.example.matrixgame.game.repository.GameRepository;
import com.example.matrixgame.game.repository.PlayerRepository;
import com.example.matrixgame.global.error.ErrorCode;
import com.example.matrixgame.resolution.ResolutionMethod;

/**
 * Lookups and guards shared by every game-scoped operation.
 */
@Component
@RequiredArgsConstructor
public class GameValidator {

    public static final int MIN_PLAYERS = 2;
    private static final int MAX_ARGUMENT_LIMIT = 10;

    private final GameRepository gameRepository;
    private final PlayerRepository playerRepository;

    public Game getGame(Long gameId) {
        return gameRepository.findByIdAndDeletedAtIsNull(gameId)
                .orElseThrow(ErrorCode.GAME_NOT_FOUND::commonException);
    }

    /**
     * Loads the game with its row locked until the surrounding transaction ends.
     */
    public Game lockGame(Long gameId) {
        return gameRepository.findByIdForUpdate(gameId)
                .orElseThrow(ErrorCode.GAME_NOT_FOUND::commonException);
    }

    public Player requireMember(Long gameId, String userId) {
        return playerRepository.findByGameIdAndUserIdAndIsActiveTrue(gameId, userId)
                .filter(Player::isHuman)
                .orElseThrow(ErrorCode.NOT_A_MEMBER::commonException);
    }

    public Player requireHost(Long gameId, String userId) {
        Player player = playerRepository.findByGameIdAndUserIdAndIsActiveTrue(gameId, userId)
                .orElseThrow(ErrorCode.HOST_ONLY::commonException);
        if (!player.isHost()) {
            throw ErrorCode.HOST_ONLY.commonException();
        }
        return player;
    }

    public void requireLobby(Game game) {
        if (game.getStatus() != GameStatus.LOBBY) {
            throw ErrorCode.GAME_NOT_IN_LOBBY.commonException();
        }
    }

    public void requireActive(Game game) {
        if (game.getStatus() != GameStatus.ACTIVE) {
            throw ErrorCode.GAME_NOT_ACTIVE.commonException();
        }
    }

    public void requirePhase(Game game, GamePhase phase) {
        if (game.getCurrentPhase() != phase) {
            throw ErrorCode.WRONG_PHASE.commonException(
                    "Operation requires phase " + phase + " but game is in " + game.getCurrentPhase());
        }
    }

    public void validateSettings(GameSettings settings) {
        if (settings.getArgumentLimit() < 1 || settings.getArgumentLimit() > MAX_ARGUMENT_LIMIT) {
            throw ErrorCode.INVALID_SETTINGS.commonException("argumentLimit must be between 1 and " + MAX_ARGUMENT_LIMIT);
        }
        for (GamePhase phase : GamePhase.timedPhases()) {
            int hours = settings.timeoutHoursFor(phase);
            if (hours != GameSettings.INFINITE_TIMEOUT && (hours < 0 || hours > GameSettings.MAX_TIMEOUT_HOURS)) {
                throw ErrorCode.INVALID_SETTINGS.commonException(
                        phase + " timeout must be -1 or between 0 and " + GameSettings.MAX_TIMEOUT_HOURS + " hours");
            }
        }
        // fails with UNKNOWN_RESOLUTION_STRATEGY
        ResolutionMethod.fromId(settings.getResolutionMethod());
    }
}
