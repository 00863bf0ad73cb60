package com.example.matrixgame.action.service;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.matrixgame.action.domain.entity.Action;
import com.example.matrixgame.action.domain.state.ActionStatus;
import com.example.matrixgame.action.repository.ActionRepository;
import com.example.matrixgame.action.repository.ArgumentRepository;
import com.example.matrixgame.action.repository.VoteRepository;
import com.example.matrixgame.game.domain.entity.Game;
import com.example.matrixgame.game.domain.entity.Player;
import com.example.matrixgame.game.domain.state.GameEventType;
import com.example.matrixgame.game.domain.state.GamePhase;
import com.example.matrixgame.game.repository.GameRepository;
import com.example.matrixgame.game.service.GameEventService;
import com.example.matrixgame.game.service.GamePhaseService;
import com.example.matrixgame.game.service.GameValidator;
import com.example.matrixgame.global.error.ErrorCode;
import com.example.matrixgame.notification.GameNotifier;
import com.example.matrixgame.notification.NotificationKind;
import com.example.matrixgame.resolution.ResolutionContext;
import com.example.matrixgame.resolution.ResolutionMethod;
import com.example.matrixgame.resolution.ResolutionResult;
import com.example.matrixgame.resolution.ResolutionStrategyRegistry;

@Slf4j
@Service
@RequiredArgsConstructor
public class ResolutionService {

    private final ActionRepository actionRepository;
    private final VoteRepository voteRepository;
    private final ArgumentRepository argumentRepository;
    private final GameRepository gameRepository;
    private final ResolutionStrategyRegistry resolutionStrategyRegistry;
    private final ActionValidator actionValidator;
    private final GameValidator gameValidator;
    private final GamePhaseService gamePhaseService;
    private final GameEventService gameEventService;
    private final GameNotifier gameNotifier;

    /**
     * Runs the game's strategy for a RESOLVED action and persists the outcome.
     * The caller must hold the action's row lock; a second call fails with
     * ALREADY_RESOLVED and leaves the stored outcome untouched.
     */
    @Transactional
    public ResolutionResult resolveOnce(Action action, Game game) {
        if (action.getResolvedAt() != null) {
            throw ErrorCode.ALREADY_RESOLVED.commonException();
        }
        actionValidator.requireStatus(action, ActionStatus.RESOLVED);

        ResolutionMethod method = actionValidator.resolutionMethod(game);
        ResolutionContext context = ResolutionContext.of(
                voteRepository.findAllByActionIdOrderByIdAsc(action.getId()),
                argumentRepository.findAllByActionIdOrderBySequenceAsc(action.getId()));
        ResolutionResult result = resolutionStrategyRegistry.getStrategy(method).resolve(context);

        action.setResolvedAt(LocalDateTime.now());
        action.setResolutionMethod(method.getId());
        action.setResolutionData(result.toResolutionData());
        actionRepository.save(action);

        Player initiator = actionValidator.getInitiator(action);
        if (initiator.isNpc()) {
            gameRepository.addNpcMomentum(game.getId(), result.resultValue());
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("actionId", action.getId());
        data.put("strategy", method.getId());
        data.put("resultType", result.resultType().name());
        data.put("resultValue", result.resultValue());
        gameEventService.log(game.getId(), null, GameEventType.ACTION_RESOLVED, data);

        log.info("[resolve] gameId={}, actionId={}, strategy={}, result={}",
                game.getId(), action.getId(), method.getId(), result.resultType());
        return result;
    }

    /**
     * Reveals the outcome and opens narration. Available to the initiator's unit,
     * or to any member for an NPC action.
     */
    @Transactional
    public Action resolve(Long actionId, String userId) {
        Action action = actionValidator.lockAction(actionId);
        Game game = gameValidator.getGame(action.getGameId());
        Player caller = gameValidator.requireMember(game.getId(), userId);
        requireInitiatorUnit(action, caller);

        if (action.getStatus() == ActionStatus.NARRATED
                || (action.isResolutionRecorded() && game.getCurrentPhase() == GamePhase.NARRATION)) {
            throw ErrorCode.ALREADY_RESOLVED.commonException();
        }
        actionValidator.requireStatus(action, ActionStatus.RESOLVED);
        actionValidator.requireCurrentAction(game, action);
        gameValidator.requirePhase(game, GamePhase.RESOLUTION);

        if (!action.isResolutionRecorded()) {
            // a crash between closing the vote and resolving leaves this step to the caller
            resolveOnce(action, game);
        }
        openNarration(action, game, userId);
        return actionValidator.getAction(actionId);
    }

    /**
     * RESOLUTION -> NARRATION once the outcome is on record.
     */
    @Transactional
    public void openNarration(Action action, Game game, String userId) {
        gamePhaseService.transitionPhase(game.getId(), GamePhase.NARRATION);

        Map<String, Object> resolution = action.getResolutionData();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("actionId", action.getId());
        data.put("resultType", resolution.get("resultType"));
        data.put("resultValue", resolution.get("resultValue"));
        gameEventService.log(game.getId(), userId, GameEventType.TOKENS_DRAWN, data);
        gameNotifier.notify(NotificationKind.TOKENS_DRAWN, game.getId(), data);
    }

    private void requireInitiatorUnit(Action action, Player caller) {
        Player initiator = actionValidator.getInitiator(action);
        if (initiator.isNpc() || initiator.getId().equals(caller.getId())) {
            return;
        }
        boolean samePersona = initiator.getPersonaId() != null
                && initiator.getPersonaId().equals(caller.getPersonaId());
        if (!samePersona) {
            throw ErrorCode.INITIATOR_ONLY.commonException();
        }
    }
}
