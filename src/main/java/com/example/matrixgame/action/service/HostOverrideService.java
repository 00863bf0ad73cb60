package com.example.matrixgame.action.service;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.matrixgame.action.domain.entity.Action;
import com.example.matrixgame.action.domain.entity.Argument;
import com.example.matrixgame.action.domain.entity.Narration;
import com.example.matrixgame.action.domain.state.ActionStatus;
import com.example.matrixgame.action.dto.request.UpdateActionRequest;
import com.example.matrixgame.action.repository.ActionRepository;
import com.example.matrixgame.action.repository.ArgumentRepository;
import com.example.matrixgame.action.repository.NarrationRepository;
import com.example.matrixgame.game.domain.entity.Game;
import com.example.matrixgame.game.domain.entity.Player;
import com.example.matrixgame.game.domain.state.GameEventType;
import com.example.matrixgame.game.domain.state.GamePhase;
import com.example.matrixgame.game.repository.RoundRepository;
import com.example.matrixgame.game.service.GameEventService;
import com.example.matrixgame.game.service.GamePhaseService;
import com.example.matrixgame.game.service.GameValidator;
import com.example.matrixgame.global.error.ErrorCode;
import com.example.matrixgame.notification.GameNotifier;
import com.example.matrixgame.notification.NotificationKind;

/**
 * Host-only shortcuts through the lifecycle and content corrections.
 * Skips reuse the same exits as the natural path; edits never touch lifecycle state.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HostOverrideService {

    private final ActionRepository actionRepository;
    private final ArgumentRepository argumentRepository;
    private final NarrationRepository narrationRepository;
    private final RoundRepository roundRepository;
    private final ActionValidator actionValidator;
    private final GameValidator gameValidator;
    private final GamePhaseService gamePhaseService;
    private final ActionFlowService actionFlowService;
    private final GameEventService gameEventService;
    private final GameNotifier gameNotifier;

    @Transactional
    public Action skipArgumentation(Long actionId, String userId) {
        Action action = actionValidator.lockAction(actionId);
        Game game = gameValidator.getGame(action.getGameId());
        gameValidator.requireHost(game.getId(), userId);
        actionValidator.requireStatus(action, ActionStatus.ARGUING);
        gameValidator.requirePhase(game, GamePhase.ARGUMENTATION);

        GamePhase next = actionFlowService.finishArgumentation(action, game, true);
        gameEventService.log(game.getId(), userId, GameEventType.ARGUMENTATION_SKIPPED,
                Map.of("actionId", actionId, "nextPhase", next.name()));

        log.info("[host] argumentation skipped: gameId={}, actionId={}", game.getId(), actionId);
        return actionValidator.getAction(actionId);
    }

    @Transactional
    public Action skipVoting(Long actionId, String userId) {
        Action action = actionValidator.lockAction(actionId);
        Game game = gameValidator.getGame(action.getGameId());
        gameValidator.requireHost(game.getId(), userId);
        actionValidator.requireStatus(action, ActionStatus.VOTING);
        gameValidator.requirePhase(game, GamePhase.VOTING);

        List<Player> synthesized = actionFlowService.synthesizeMissingVotes(action, game);
        action.setVotingWasSkipped(true);
        actionFlowService.closeVoting(action, game);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("actionId", actionId);
        data.put("autoVotedPlayerIds", synthesized.stream().map(Player::getId).toList());
        gameEventService.log(game.getId(), userId, GameEventType.VOTING_SKIPPED, data);

        log.info("[host] voting skipped: gameId={}, actionId={}, synthesized={}",
                game.getId(), actionId, synthesized.size());
        return actionValidator.getAction(actionId);
    }

    /**
     * Ends the round's proposals early. The round is sized down to the actions already taken.
     */
    @Transactional
    public Game skipToNextAction(Long gameId, String userId) {
        Game game = gameValidator.getGame(gameId);
        gameValidator.requireHost(gameId, userId);
        gameValidator.requireActive(game);
        gameValidator.requirePhase(game, GamePhase.PROPOSAL);
        if (game.getCurrentActionId() != null) {
            throw ErrorCode.WRONG_PHASE.commonException("An action is still in progress");
        }

        Long roundId = game.getCurrentRoundId();
        int actionCount = (int) actionRepository.countByRoundId(roundId);
        if (actionCount == 0) {
            throw ErrorCode.NO_ACTIONS_THIS_ROUND.commonException();
        }
        roundRepository.forceComplete(roundId, actionCount);
        Game updated = gamePhaseService.transitionPhase(gameId, GamePhase.ROUND_SUMMARY);

        gameEventService.log(gameId, userId, GameEventType.PROPOSALS_SKIPPED,
                Map.of("roundId", roundId, "actionCount", actionCount));
        gameNotifier.notify(NotificationKind.ROUND_SUMMARY_NEEDED, gameId, Map.of("roundId", roundId));

        log.info("[host] proposals skipped: gameId={}, roundId={}, actions={}", gameId, roundId, actionCount);
        return updated;
    }

    @Transactional
    public Action updateAction(Long actionId, String userId, UpdateActionRequest request) {
        Action action = actionValidator.lockAction(actionId);
        gameValidator.getGame(action.getGameId());
        gameValidator.requireHost(action.getGameId(), userId);

        if (request.actionDescription() != null && !request.actionDescription().isBlank()) {
            action.setActionDescription(request.actionDescription());
        }
        if (request.desiredOutcome() != null && !request.desiredOutcome().isBlank()) {
            action.setDesiredOutcome(request.desiredOutcome());
        }
        Action saved = actionRepository.save(action);

        gameEventService.log(action.getGameId(), userId, GameEventType.ACTION_EDITED, Map.of("actionId", actionId));
        gameNotifier.notify(NotificationKind.GAME_UPDATED, action.getGameId(), Map.of("actionId", actionId));
        return saved;
    }

    @Transactional
    public Argument updateArgument(Long actionId, Long argumentId, String userId, String content) {
        Action action = actionValidator.getAction(actionId);
        gameValidator.getGame(action.getGameId());
        gameValidator.requireHost(action.getGameId(), userId);

        Argument argument = argumentRepository.findByIdAndActionId(argumentId, actionId)
                .orElseThrow(ErrorCode.ARGUMENT_NOT_FOUND::commonException);
        argument.setContent(content);
        Argument saved = argumentRepository.save(argument);

        gameEventService.log(action.getGameId(), userId, GameEventType.ARGUMENT_EDITED,
                Map.of("actionId", actionId, "argumentId", argumentId));
        gameNotifier.notify(NotificationKind.GAME_UPDATED, action.getGameId(),
                Map.of("actionId", actionId, "argumentId", argumentId));
        return saved;
    }

    @Transactional
    public Narration updateNarration(Long actionId, String userId, String content) {
        Action action = actionValidator.getAction(actionId);
        gameValidator.getGame(action.getGameId());
        gameValidator.requireHost(action.getGameId(), userId);

        Narration narration = narrationRepository.findByActionId(actionId)
                .orElseThrow(ErrorCode.NARRATION_NOT_FOUND::commonException);
        narration.setContent(content);
        Narration saved = narrationRepository.save(narration);

        gameEventService.log(action.getGameId(), userId, GameEventType.NARRATION_EDITED,
                Map.of("actionId", actionId, "narrationId", narration.getId()));
        gameNotifier.notify(NotificationKind.GAME_UPDATED, action.getGameId(), Map.of("actionId", actionId));
        return saved;
    }
}
