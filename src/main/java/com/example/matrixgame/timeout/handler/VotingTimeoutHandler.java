package com.example.matrixgame.timeout.handler;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.example.matrixgame.action.domain.entity.Action;
import com.example.matrixgame.action.domain.state.ActionStatus;
import com.example.matrixgame.action.service.ActionFlowService;
import com.example.matrixgame.action.service.ActionValidator;
import com.example.matrixgame.game.domain.entity.Game;
import com.example.matrixgame.game.domain.entity.Player;
import com.example.matrixgame.game.domain.state.GameEventType;
import com.example.matrixgame.game.domain.state.GamePhase;
import com.example.matrixgame.game.service.GameEventService;
import com.example.matrixgame.game.service.GameValidator;
import com.example.matrixgame.timeout.dto.TimeoutResult;

/**
 * Casts an uncertain vote for everyone who stayed silent and resolves the action.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VotingTimeoutHandler implements PhaseTimeoutHandler {

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
        if (game.getCurrentPhase() != GamePhase.VOTING || action.getStatus() != ActionStatus.VOTING) {
            return Optional.empty();
        }

        List<Long> autoVoted = actionFlowService.synthesizeMissingVotes(action, game).stream()
                .map(Player::getId)
                .toList();
        actionFlowService.closeVoting(action, game);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("actionId", action.getId());
        data.put("autoVotedPlayerIds", autoVoted);
        gameEventService.log(game.getId(), null, GameEventType.VOTING_TIMEOUT, data);

        log.info("[timeout] voting closed: gameId={}, actionId={}, synthesized={}",
                game.getId(), action.getId(), autoVoted.size());
        return Optional.of(new TimeoutResult(game.getId(), action.getId(), GamePhase.VOTING,
                autoVoted, GamePhase.RESOLUTION, false));
    }

    @Override
    public GamePhase getGamePhase() {
        return GamePhase.VOTING;
    }
}
