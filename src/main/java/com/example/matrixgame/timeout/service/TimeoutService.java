package com.example.matrixgame.timeout.service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.matrixgame.game.domain.entity.Game;
import com.example.matrixgame.game.domain.entity.GameSettings;
import com.example.matrixgame.game.domain.state.GameEventType;
import com.example.matrixgame.game.domain.state.GamePhase;
import com.example.matrixgame.game.domain.state.GameStatus;
import com.example.matrixgame.game.repository.GameRepository;
import com.example.matrixgame.game.service.GameEventService;
import com.example.matrixgame.game.service.GameValidator;
import com.example.matrixgame.global.error.CommonException;
import com.example.matrixgame.global.error.ErrorCode;
import com.example.matrixgame.global.error.ErrorKind;
import com.example.matrixgame.notification.GameNotifier;
import com.example.matrixgame.notification.NotificationKind;
import com.example.matrixgame.timeout.dto.SweepResult;
import com.example.matrixgame.timeout.dto.TimeoutResult;
import com.example.matrixgame.timeout.dto.TimeoutStatus;
import com.example.matrixgame.timeout.handler.PhaseTimeoutHandler;
import com.example.matrixgame.timeout.handler.PhaseTimeoutHandlerFactory;

/**
 * Finds games whose timed phase has run out and hands each to its phase handler.
 * Every game is handled in its own transaction so one failure never affects the rest of the sweep.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TimeoutService {

    private final GameRepository gameRepository;
    private final GameValidator gameValidator;
    private final GameEventService gameEventService;
    private final PhaseTimeoutHandlerFactory handlerFactory;
    private final GameNotifier gameNotifier;

    public SweepResult processAllTimeouts() {
        List<Game> games = gameRepository.findAllByStatusAndDeletedAtIsNullAndCurrentPhaseInAndPhaseStartedAtIsNotNull(
                GameStatus.ACTIVE, GamePhase.timedPhases());

        List<TimeoutResult> processed = new ArrayList<>();
        List<SweepResult.SweepFailure> failures = new ArrayList<>();
        LocalDateTime now = LocalDateTime.now();
        for (Game game : games) {
            try {
                processGameTimeout(game, now).ifPresent(processed::add);
            } catch (CommonException e) {
                if (e.getKind() == ErrorKind.CONFLICT) {
                    log.debug("[timeout] lost race, skipping: gameId={}, reason={}", game.getId(), e.getMessage());
                    continue;
                }
                log.error("[timeout] failed: gameId={}, reason={}", game.getId(), e.getMessage());
                failures.add(new SweepResult.SweepFailure(game.getId(), e.getMessage()));
            } catch (DataIntegrityViolationException e) {
                // a player's row won the unique key first
                log.debug("[timeout] lost race, skipping: gameId={}, reason={}",
                        game.getId(), e.getMostSpecificCause().getMessage());
            } catch (RuntimeException e) {
                log.error("[timeout] failed: gameId={}", game.getId(), e);
                failures.add(new SweepResult.SweepFailure(game.getId(), e.getMessage()));
            }
        }

        if (!processed.isEmpty() || !failures.isEmpty()) {
            log.info("[timeout] sweep finished: checked={}, processed={}, failed={}",
                    games.size(), processed.size(), failures.size());
        }
        return new SweepResult(games.size(), processed, failures);
    }

    /**
     * Handles one game if its current phase has expired.
     */
    public Optional<TimeoutResult> processGameTimeout(Game game, LocalDateTime now) {
        GamePhase phase = game.getCurrentPhase();
        int hours = game.getSettings().timeoutHoursFor(phase);
        if (hours == GameSettings.INFINITE_TIMEOUT || game.getPhaseStartedAt() == null) {
            return Optional.empty();
        }
        if (!now.isAfter(game.getPhaseStartedAt().plusHours(hours))) {
            return Optional.empty();
        }

        Optional<PhaseTimeoutHandler> handler = handlerFactory.getHandler(phase);
        if (handler.isEmpty()) {
            return Optional.empty();
        }
        log.info("[timeout] expired: gameId={}, phase={}, timeoutHours={}", game.getId(), phase, hours);
        return handler.get().handle(game);
    }

    @Transactional(readOnly = true)
    public TimeoutStatus getTimeoutStatus(Long gameId) {
        return toStatus(gameValidator.getGame(gameId), LocalDateTime.now());
    }

    /**
     * Restarts the clock of the current timed phase.
     */
    @Transactional
    public TimeoutStatus extendTimeout(Long gameId, String userId) {
        Game game = gameValidator.getGame(gameId);
        gameValidator.requireHost(gameId, userId);
        gameValidator.requireActive(game);
        if (!game.getCurrentPhase().isTimed()) {
            throw ErrorCode.TIMEOUT_NOT_APPLICABLE.commonException();
        }

        LocalDateTime now = LocalDateTime.now();
        if (gameRepository.resetPhaseStartedAt(gameId, game.getCurrentPhase(), now) == 0) {
            throw ErrorCode.CONCURRENT_UPDATE.commonException();
        }
        Map<String, Object> data = Map.of("phase", game.getCurrentPhase().name(), "phaseStartedAt", now.toString());
        gameEventService.log(gameId, userId, GameEventType.TIMEOUT_EXTENDED, data);
        gameNotifier.notify(NotificationKind.GAME_UPDATED, gameId, data);

        log.info("[timeout] extended: gameId={}, phase={}", gameId, game.getCurrentPhase());
        return toStatus(gameValidator.getGame(gameId), now);
    }

    private TimeoutStatus toStatus(Game game, LocalDateTime now) {
        GamePhase phase = game.getCurrentPhase();
        int hours = phase.isTimed() ? game.getSettings().timeoutHoursFor(phase) : GameSettings.INFINITE_TIMEOUT;
        boolean infinite = hours == GameSettings.INFINITE_TIMEOUT || game.getPhaseStartedAt() == null;
        if (infinite) {
            return new TimeoutStatus(game.getId(), phase, game.getPhaseStartedAt(), hours, true, null, null, false);
        }
        LocalDateTime deadline = game.getPhaseStartedAt().plusHours(hours);
        long remaining = Math.max(0, Duration.between(now, deadline).toMillis());
        return new TimeoutStatus(game.getId(), phase, game.getPhaseStartedAt(), hours, false,
                deadline, remaining, now.isAfter(deadline));
    }
}
