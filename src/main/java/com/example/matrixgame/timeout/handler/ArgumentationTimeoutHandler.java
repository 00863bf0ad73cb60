package com.example.matrixgame.timeout.handler;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.example.matrixgame.action.domain.entity.Action;
import com.example.matrixgame.action.domain.entity.Argument;
import com.example.matrixgame.action.domain.state.ActionStatus;
import com.example.matrixgame.action.domain.state.ArgumentType;
import com.example.matrixgame.action.repository.ArgumentRepository;
import com.example.matrixgame.action.service.ActionFlowService;
import com.example.matrixgame.action.service.ActionValidator;
import com.example.matrixgame.game.domain.entity.Game;
import com.example.matrixgame.game.domain.entity.Player;
import com.example.matrixgame.game.domain.state.GameEventType;
import com.example.matrixgame.game.domain.state.GamePhase;
import com.example.matrixgame.game.service.ActingUnit;
import com.example.matrixgame.game.service.ActingUnitCalculator;
import com.example.matrixgame.game.service.GameEventService;
import com.example.matrixgame.game.service.GameValidator;
import com.example.matrixgame.timeout.dto.TimeoutResult;

/**
 * Fills in a placeholder argument for every silent acting unit, then closes argumentation.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ArgumentationTimeoutHandler implements PhaseTimeoutHandler {

    private final ArgumentRepository argumentRepository;
    private final ActingUnitCalculator actingUnitCalculator;
    private final ActionValidator actionValidator;
    private final GameValidator gameValidator;
    private final ActionFlowService actionFlowService;
    private final GameEventService gameEventService;

    @Override
    @Transactional
    public Optional<TimeoutResult> handle(Game snapshot) {
        if (snapshot.getCurrentActionId() == null) {
            return Optional.empty();
        }
        Action action = actionValidator.lockAction(snapshot.getCurrentActionId());
        Game game = gameValidator.getGame(snapshot.getId());
        if (game.getCurrentPhase() != GamePhase.ARGUMENTATION || action.getStatus() != ActionStatus.ARGUING) {
            return Optional.empty();
        }

        List<Player> players = actionValidator.activePlayers(game.getId());
        List<Long> autoArgumented = new ArrayList<>();
        int sequence = argumentRepository.findMaxSequence(action.getId());
        for (ActingUnit unit : actingUnitCalculator.groupActingUnits(players)) {
            if (argumentRepository.countByActionIdAndPlayerIdIn(action.getId(), unit.memberIds()) > 0) {
                continue;
            }
            Player representative = unit.representative();
            argumentRepository.save(Argument.builder()
                    .actionId(action.getId())
                    .playerId(representative.getId())
                    .argumentType(ArgumentType.FOR)
                    .content(Argument.TIMEOUT_PLACEHOLDER)
                    .sequence(++sequence)
                    .createdAt(LocalDateTime.now())
                    .build());
            autoArgumented.add(representative.getId());
        }

        GamePhase next = actionFlowService.finishArgumentation(action, game, false);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("actionId", action.getId());
        data.put("autoArgumentedPlayerIds", autoArgumented);
        gameEventService.log(game.getId(), null, GameEventType.ARGUMENTATION_TIMEOUT, data);

        log.info("[timeout] argumentation closed: gameId={}, actionId={}, placeholders={}",
                game.getId(), action.getId(), autoArgumented.size());
        return Optional.of(new TimeoutResult(game.getId(), action.getId(), GamePhase.ARGUMENTATION,
                autoArgumented, next, false));
    }

    @Override
    public GamePhase getGamePhase() {
        return GamePhase.ARGUMENTATION;
    }
}
