package com.example.matrixgame.timeout.handler;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.annotation.Transactional;

import com.example.matrixgame.game.domain.entity.Game;
import com.example.matrixgame.game.domain.state.GameEventType;
import com.example.matrixgame.game.service.GameEventService;
import com.example.matrixgame.game.service.GameValidator;
import com.example.matrixgame.notification.GameNotifier;
import com.example.matrixgame.notification.NotificationKind;
import com.example.matrixgame.timeout.dto.TimeoutResult;

/**
 * Phases that wait for a human decision. Nothing is automated; the host is told once per phase entry.
 */
@Slf4j
@RequiredArgsConstructor
public abstract class HostNoticeTimeoutHandler implements PhaseTimeoutHandler {

    private final GameValidator gameValidator;
    private final GameEventService gameEventService;
    private final GameNotifier gameNotifier;

    protected abstract GameEventType getEventType();

    @Override
    @Transactional
    public Optional<TimeoutResult> handle(Game snapshot) {
        Game game = gameValidator.getGame(snapshot.getId());
        if (game.getCurrentPhase() != getGamePhase() || game.getPhaseStartedAt() == null) {
            return Optional.empty();
        }
        if (gameEventService.existsSince(game.getId(), getEventType(), game.getPhaseStartedAt())) {
            return Optional.empty();
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("phase", getGamePhase().name());
        data.put("phaseStartedAt", game.getPhaseStartedAt().toString());
        data.put("timeoutHours", game.getSettings().timeoutHoursFor(getGamePhase()));
        if (game.getCurrentActionId() != null) {
            data.put("actionId", game.getCurrentActionId());
        }
        gameEventService.log(game.getId(), null, getEventType(), data);
        gameNotifier.notifyUser(NotificationKind.TIMEOUT_WARNING, game.getId(), game.getHostUserId(), data);

        log.info("[timeout] host notified: gameId={}, phase={}", game.getId(), getGamePhase());
        return Optional.of(new TimeoutResult(game.getId(), game.getCurrentActionId(), getGamePhase(),
                List.of(), getGamePhase(), true));
    }
}
