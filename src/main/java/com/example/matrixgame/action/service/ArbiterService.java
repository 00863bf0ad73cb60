package com.example.matrixgame.action.service;

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.matrixgame.action.domain.entity.Action;
import com.example.matrixgame.action.domain.entity.Argument;
import com.example.matrixgame.action.domain.state.ActionStatus;
import com.example.matrixgame.action.repository.ActionRepository;
import com.example.matrixgame.action.repository.ArgumentRepository;
import com.example.matrixgame.game.domain.entity.Game;
import com.example.matrixgame.game.domain.entity.Player;
import com.example.matrixgame.game.domain.state.GameEventType;
import com.example.matrixgame.game.domain.state.GamePhase;
import com.example.matrixgame.game.service.GameEventService;
import com.example.matrixgame.game.service.GamePhaseService;
import com.example.matrixgame.game.service.GameValidator;
import com.example.matrixgame.global.error.ErrorCode;
import com.example.matrixgame.notification.GameNotifier;
import com.example.matrixgame.notification.NotificationKind;
import com.example.matrixgame.resolution.ResolutionMethod;
import com.example.matrixgame.resolution.ResolutionResult;

/**
 * Review step of the arbiter strategy: the arbiter marks strong arguments, then closes the review.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ArbiterService {

    private final ActionRepository actionRepository;
    private final ArgumentRepository argumentRepository;
    private final ActionValidator actionValidator;
    private final GameValidator gameValidator;
    private final GamePhaseService gamePhaseService;
    private final ResolutionService resolutionService;
    private final GameEventService gameEventService;
    private final GameNotifier gameNotifier;

    @Transactional
    public Argument markArgumentStrong(Long actionId, Long argumentId, String userId) {
        Action action = actionValidator.lockAction(actionId);
        Game game = gameValidator.getGame(action.getGameId());
        requireReview(action, game, userId);

        Argument argument = argumentRepository.findByIdAndActionId(argumentId, actionId)
                .orElseThrow(ErrorCode.ARGUMENT_NOT_FOUND::commonException);
        argument.setStrong(!argument.isStrong());
        Argument saved = argumentRepository.save(argument);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("actionId", actionId);
        data.put("argumentId", argumentId);
        data.put("isStrong", saved.isStrong());
        gameEventService.log(game.getId(), userId, GameEventType.ARGUMENT_STRENGTH_TOGGLED, data);
        gameNotifier.notify(NotificationKind.GAME_UPDATED, game.getId(), data);
        return saved;
    }

    @Transactional
    public ResolutionResult completeArbiterReview(Long actionId, String userId) {
        Action action = actionValidator.lockAction(actionId);
        Game game = gameValidator.getGame(action.getGameId());
        requireReview(action, game, userId);

        action.setStatus(ActionStatus.RESOLVED);
        actionRepository.save(action);
        gamePhaseService.transitionPhase(game.getId(), GamePhase.RESOLUTION);
        ResolutionResult result = resolutionService.resolveOnce(action, game);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("actionId", actionId);
        data.put("resultType", result.resultType().name());
        data.put("resultValue", result.resultValue());
        gameEventService.log(game.getId(), userId, GameEventType.ARBITER_REVIEW_COMPLETED, data);
        gameNotifier.notify(NotificationKind.RESOLUTION_READY, game.getId(), data);

        log.info("[arbiter] review completed: gameId={}, actionId={}, result={}",
                game.getId(), actionId, result.resultType());
        return result;
    }

    private void requireReview(Action action, Game game, String userId) {
        Player player = gameValidator.requireMember(game.getId(), userId);
        if (actionValidator.resolutionMethod(game) != ResolutionMethod.ARBITER) {
            throw ErrorCode.STRATEGY_MISMATCH.commonException();
        }
        if (!player.isArbiter()) {
            throw ErrorCode.ARBITER_ONLY.commonException();
        }
        if (action.getStatus() != ActionStatus.ARGUING) {
            throw ErrorCode.ALREADY_RESOLVED.commonException();
        }
        actionValidator.requireCurrentAction(game, action);
        gameValidator.requirePhase(game, GamePhase.ARBITER_REVIEW);
    }
}
