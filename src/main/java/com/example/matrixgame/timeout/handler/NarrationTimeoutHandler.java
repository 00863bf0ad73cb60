package com.example.matrixgame.timeout.handler;

import org.springframework.stereotype.Component;

import com.example.matrixgame.game.domain.state.GameEventType;
import com.example.matrixgame.game.domain.state.GamePhase;
import com.example.matrixgame.game.service.GameEventService;
import com.example.matrixgame.game.service.GameValidator;
import com.example.matrixgame.notification.GameNotifier;

@Component
public class NarrationTimeoutHandler extends HostNoticeTimeoutHandler {

    public NarrationTimeoutHandler(GameValidator gameValidator, GameEventService gameEventService, GameNotifier gameNotifier) {
        super(gameValidator, gameEventService, gameNotifier);
    }

    @Override
    public GamePhase getGamePhase() {
        return GamePhase.NARRATION;
    }

    @Override
    protected GameEventType getEventType() {
        return GameEventType.NARRATION_TIMEOUT;
    }
}
