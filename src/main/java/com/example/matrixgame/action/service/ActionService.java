package com.example.matrixgame.action.service;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.matrixgame.action.domain.entity.Action;
import com.example.matrixgame.action.domain.entity.Argument;
import com.example.matrixgame.action.domain.entity.ArgumentationCompletion;
import com.example.matrixgame.action.domain.state.ActionStatus;
import com.example.matrixgame.action.domain.state.ArgumentType;
import com.example.matrixgame.action.dto.request.ProposeActionRequest;
import com.example.matrixgame.action.dto.response.ArgumentationProgress;
import com.example.matrixgame.action.repository.ActionRepository;
import com.example.matrixgame.action.repository.ArgumentRepository;
import com.example.matrixgame.action.repository.ArgumentationCompletionRepository;
import com.example.matrixgame.game.domain.entity.Game;
import com.example.matrixgame.game.domain.entity.GameSettings;
import com.example.matrixgame.game.domain.entity.Player;
import com.example.matrixgame.game.domain.state.GameEventType;
import com.example.matrixgame.game.domain.state.GamePhase;
import com.example.matrixgame.game.repository.GameRepository;
import com.example.matrixgame.game.service.ActingUnit;
import com.example.matrixgame.game.service.ActingUnitCalculator;
import com.example.matrixgame.game.service.GameEventService;
import com.example.matrixgame.game.service.GamePhaseService;
import com.example.matrixgame.game.service.GameValidator;
import com.example.matrixgame.global.error.ErrorCode;
import com.example.matrixgame.notification.GameNotifier;
import com.example.matrixgame.notification.NotificationKind;
import com.example.matrixgame.resolution.ResolutionMethod;

/**
 * Proposal and argumentation. Voting lives in {@link VoteService}, narration in {@link NarrationService}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ActionService {

    private static final EnumSet<ArgumentType> OPPOSING_TYPES = EnumSet.of(ArgumentType.FOR, ArgumentType.AGAINST);

    private final ActionRepository actionRepository;
    private final ArgumentRepository argumentRepository;
    private final ArgumentationCompletionRepository completionRepository;
    private final GameRepository gameRepository;
    private final ActingUnitCalculator actingUnitCalculator;
    private final ActionValidator actionValidator;
    private final GameValidator gameValidator;
    private final GamePhaseService gamePhaseService;
    private final GameEventService gameEventService;
    private final ActionFlowService actionFlowService;
    private final GameNotifier gameNotifier;

    @Transactional
    public Action propose(Long gameId, String userId, ProposeActionRequest request) {
        Game game = gameValidator.getGame(gameId);
        Player player = gameValidator.requireMember(gameId, userId);
        gameValidator.requireActive(game);
        gameValidator.requirePhase(game, GamePhase.PROPOSAL);

        GameSettings settings = game.getSettings();
        List<Player> players = actionValidator.activePlayers(gameId);
        ActingUnit unit = actingUnitCalculator.unitOf(player, players);
        if (settings.isAllowSharedPersonas() && unit.isShared() && !player.isPersonaLead()) {
            throw ErrorCode.PERSONA_LEAD_ONLY.commonException();
        }

        List<String> initialArguments = request.initialArguments();
        if (initialArguments == null || initialArguments.isEmpty()) {
            throw ErrorCode.INITIAL_ARGUMENTS_REQUIRED.commonException();
        }
        if (initialArguments.size() > settings.getArgumentLimit()) {
            throw ErrorCode.ARGUMENT_LIMIT_REACHED.commonException(
                    "At most " + settings.getArgumentLimit() + " initial arguments are allowed");
        }

        Long roundId = game.getCurrentRoundId();
        if (actionRepository.existsByRoundIdAndActingUnitKey(roundId, unit.key())) {
            throw ErrorCode.ACTION_ALREADY_PROPOSED.commonException();
        }

        Action action = createAction(game, player, unit.key(), request.actionDescription(), request.desiredOutcome());
        int sequence = 0;
        for (String content : initialArguments) {
            argumentRepository.save(Argument.builder()
                    .actionId(action.getId())
                    .playerId(player.getId())
                    .argumentType(ArgumentType.INITIATOR_FOR)
                    .content(content)
                    .sequence(++sequence)
                    .createdAt(LocalDateTime.now())
                    .build());
        }

        openArgumentation(game, action);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("actionId", action.getId());
        data.put("sequenceNumber", action.getSequenceNumber());
        data.put("initiatorId", player.getId());
        data.put("initialArgumentCount", initialArguments.size());
        gameEventService.log(gameId, userId, GameEventType.ACTION_PROPOSED, data);
        gameNotifier.notify(NotificationKind.ACTION_PROPOSED, gameId, data);

        log.info("[propose] gameId={}, actionId={}, playerId={}", gameId, action.getId(), player.getId());
        return action;
    }

    /**
     * Stores a new ARGUING action for the current round. Shared with the NPC auto-proposal.
     */
    public Action createAction(Game game, Player initiator, String actingUnitKey,
                               String actionDescription, String desiredOutcome) {
        int sequenceNumber = actionRepository.findMaxSequenceNumber(game.getId()) + 1;
        LocalDateTime now = LocalDateTime.now();
        return actionRepository.saveAndFlush(Action.builder()
                .gameId(game.getId())
                .roundId(game.getCurrentRoundId())
                .initiatorId(initiator.getId())
                .actingUnitKey(actingUnitKey)
                .sequenceNumber(sequenceNumber)
                .actionDescription(actionDescription)
                .desiredOutcome(desiredOutcome)
                .status(ActionStatus.ARGUING)
                .argumentationStartedAt(now)
                .createdAt(now)
                .build());
    }

    /**
     * Points the game at the new action and moves it to ARGUMENTATION.
     */
    public void openArgumentation(Game game, Action action) {
        gameRepository.updateCurrentAction(game.getId(), action.getId());
        gamePhaseService.transitionPhase(game.getId(), GamePhase.ARGUMENTATION);
    }

    @Transactional
    public Argument addArgument(Long actionId, String userId, ArgumentType argumentType, String content) {
        Action action = actionValidator.lockAction(actionId);
        Game game = gameValidator.getGame(action.getGameId());
        Player player = gameValidator.requireMember(game.getId(), userId);
        actionValidator.requireStatus(action, ActionStatus.ARGUING);
        gameValidator.requirePhase(game, GamePhase.ARGUMENTATION);

        List<Player> players = actionValidator.activePlayers(game.getId());
        Player initiator = actionValidator.getInitiator(action);
        boolean initiatorSide = initiator.getId().equals(player.getId())
                || (initiator.getPersonaId() != null && initiator.getPersonaId().equals(player.getPersonaId()));

        if (initiatorSide && argumentType != ArgumentType.CLARIFICATION) {
            throw ErrorCode.CLARIFICATION_ONLY.commonException();
        }
        if (!initiatorSide && !OPPOSING_TYPES.contains(argumentType)) {
            throw ErrorCode.CLARIFICATION_NOT_ALLOWED.commonException();
        }

        GameSettings settings = game.getSettings();
        List<Long> countedIds = settings.isSharedArgumentPool()
                ? actingUnitCalculator.unitOf(player, players).memberIds()
                : List.of(player.getId());
        // opening arguments do not count against the initiator's limit
        long alreadyAdded = argumentRepository.countByActionIdAndPlayerIdInAndArgumentTypeIn(
                actionId, countedIds, EnumSet.of(ArgumentType.FOR, ArgumentType.AGAINST, ArgumentType.CLARIFICATION));
        if (alreadyAdded >= settings.getArgumentLimit()) {
            throw ErrorCode.ARGUMENT_LIMIT_REACHED.commonException();
        }

        ResolutionMethod method = actionValidator.resolutionMethod(game);
        if (method.hasSideCap() && argumentType != ArgumentType.CLARIFICATION) {
            EnumSet<ArgumentType> side = argumentType.isPro()
                    ? EnumSet.of(ArgumentType.FOR, ArgumentType.INITIATOR_FOR)
                    : EnumSet.of(ArgumentType.AGAINST);
            if (argumentRepository.countByActionIdAndArgumentTypeIn(actionId, side) >= method.getMaxArgumentsPerSide()) {
                throw ErrorCode.SIDE_LIMIT_REACHED.commonException();
            }
        }

        Argument argument = argumentRepository.save(Argument.builder()
                .actionId(actionId)
                .playerId(player.getId())
                .argumentType(argumentType)
                .content(content)
                .sequence(argumentRepository.findMaxSequence(actionId) + 1)
                .createdAt(LocalDateTime.now())
                .build());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("actionId", actionId);
        data.put("argumentId", argument.getId());
        data.put("argumentType", argumentType.name());
        data.put("playerId", player.getId());
        gameEventService.log(game.getId(), userId, GameEventType.ARGUMENT_ADDED, data);
        gameNotifier.notify(NotificationKind.ARGUMENT_ADDED, game.getId(), data);

        log.info("[argument] gameId={}, actionId={}, type={}", game.getId(), actionId, argumentType);
        return argument;
    }

    /**
     * Records the caller as done arguing. Repeating the signal changes nothing.
     */
    @Transactional
    public ArgumentationProgress completeArgumentation(Long actionId, String userId) {
        Action action = actionValidator.lockAction(actionId);
        Game game = gameValidator.getGame(action.getGameId());
        Player player = gameValidator.requireMember(game.getId(), userId);
        actionValidator.requireStatus(action, ActionStatus.ARGUING);
        gameValidator.requirePhase(game, GamePhase.ARGUMENTATION);

        if (!completionRepository.existsByActionIdAndPlayerId(actionId, player.getId())) {
            completionRepository.saveAndFlush(ArgumentationCompletion.builder()
                    .actionId(actionId)
                    .playerId(player.getId())
                    .completedAt(LocalDateTime.now())
                    .build());
            gameEventService.log(game.getId(), userId, GameEventType.ARGUMENTATION_COMPLETED,
                    Map.of("actionId", actionId, "playerId", player.getId()));
        }

        List<Player> players = actionValidator.activePlayers(game.getId());
        long completed = actionFlowService.countCompletedUnits(action, players);
        int required = actingUnitCalculator.countActingUnits(players);
        GamePhase phase = game.getCurrentPhase();
        boolean advanced = false;
        if (completed >= required) {
            phase = actionFlowService.finishArgumentation(action, game, false);
            advanced = true;
        } else {
            gameNotifier.notify(NotificationKind.ARGUMENTATION_COMPLETED, game.getId(),
                    Map.of("actionId", actionId, "completedUnits", completed, "requiredUnits", required));
        }

        log.info("[argumentation] done: gameId={}, actionId={}, completed={}/{}",
                game.getId(), actionId, completed, required);
        return new ArgumentationProgress(actionId, completed, required,
                Math.max(0, required - completed), advanced, phase);
    }

    @Transactional(readOnly = true)
    public Action getAction(Long actionId) {
        return actionValidator.getAction(actionId);
    }

    @Transactional(readOnly = true)
    public List<Action> getActions(Long gameId) {
        gameValidator.getGame(gameId);
        return actionRepository.findAllByGameIdOrderBySequenceNumberAsc(gameId);
    }

    @Transactional(readOnly = true)
    public List<Action> getRoundActions(Long roundId) {
        return actionRepository.findAllByRoundIdOrderBySequenceNumberAsc(roundId);
    }

    @Transactional(readOnly = true)
    public List<Argument> getArguments(Long actionId) {
        actionValidator.getAction(actionId);
        return argumentRepository.findAllByActionIdOrderBySequenceAsc(actionId);
    }
}
