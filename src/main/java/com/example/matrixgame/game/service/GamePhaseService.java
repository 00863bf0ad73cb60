package com.example.matrixgame.game.service;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.matrixgame.game.domain.entity.Game;
import com.example.matrixgame.game.domain.entity.Round;
import com.example.matrixgame.game.domain.state.GameEventType;
import com.example.matrixgame.game.domain.state.GamePhase;
import com.example.matrixgame.game.repository.GameRepository;
import com.example.matrixgame.game.repository.RoundRepository;
import com.example.matrixgame.global.error.ErrorCode;
import com.example.matrixgame.notification.GameNotifier;
import com.example.matrixgame.notification.NotificationKind;

/**
 * Top-level phase machine. The only writer of {@code currentPhase} and {@code phaseStartedAt}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GamePhaseService {

    private final GameRepository gameRepository;
    private final RoundRepository roundRepository;
    private final GameValidator gameValidator;
    private final GameEventService gameEventService;
    private final GameNotifier gameNotifier;

    /**
     * Moves the game to {@code newPhase} if the table allows it from the phase currently stored.
     * The write is conditional on that phase, so a transition computed from a stale read fails
     * instead of overwriting a concurrent one.
     *
     * @return the game as stored after the transition
     */
    @Transactional
    public Game transitionPhase(Long gameId, GamePhase newPhase) {
        Game game = gameValidator.getGame(gameId);
        GamePhase from = game.getCurrentPhase();

        if (!from.canTransitionTo(newPhase)) {
            throw ErrorCode.INVALID_PHASE_TRANSITION.commonException(
                    "Cannot transition from " + from + " to " + newPhase);
        }
        if (newPhase == GamePhase.ROUND_SUMMARY) {
            requireRoundComplete(game);
        }

        int updated = gameRepository.transitionPhase(gameId, from, newPhase, LocalDateTime.now());
        if (updated == 0) {
            throw ErrorCode.INVALID_PHASE_TRANSITION.commonException(
                    "Cannot transition from " + from + " to " + newPhase + ": phase changed concurrently");
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("from", from.name());
        data.put("to", newPhase.name());
        gameEventService.log(gameId, null, GameEventType.PHASE_CHANGED, data);
        gameNotifier.notify(NotificationKind.PHASE_CHANGED, gameId, data);

        log.info("[phase] gameId={}, {} -> {}", gameId, from, newPhase);
        return gameValidator.getGame(gameId);
    }

    /**
     * Manual transition by the host.
     */
    @Transactional
    public Game transitionPhase(Long gameId, GamePhase newPhase, String userId) {
        Game game = gameValidator.getGame(gameId);
        gameValidator.requireHost(gameId, userId);
        gameValidator.requireActive(game);
        return transitionPhase(gameId, newPhase);
    }

    // a round is summarized only once every required action is narrated
    private void requireRoundComplete(Game game) {
        boolean complete = game.getCurrentRoundId() != null && roundRepository.findById(game.getCurrentRoundId())
                .map(Round::isComplete)
                .orElse(false);
        if (!complete) {
            throw ErrorCode.ROUND_NOT_COMPLETE.commonException();
        }
    }
}
