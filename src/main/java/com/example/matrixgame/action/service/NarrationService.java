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
import com.example.matrixgame.action.domain.entity.Narration;
import com.example.matrixgame.action.domain.state.ActionStatus;
import com.example.matrixgame.action.repository.ActionRepository;
import com.example.matrixgame.action.repository.NarrationRepository;
import com.example.matrixgame.game.domain.entity.Game;
import com.example.matrixgame.game.domain.entity.Player;
import com.example.matrixgame.game.domain.entity.Round;
import com.example.matrixgame.game.domain.state.GameEventType;
import com.example.matrixgame.game.domain.state.GamePhase;
import com.example.matrixgame.game.domain.state.NarrationMode;
import com.example.matrixgame.game.repository.GameRepository;
import com.example.matrixgame.game.service.ActingUnitCalculator;
import com.example.matrixgame.game.service.GameEventService;
import com.example.matrixgame.game.service.GamePhaseService;
import com.example.matrixgame.game.service.GameValidator;
import com.example.matrixgame.game.service.RoundService;
import com.example.matrixgame.global.error.ErrorCode;
import com.example.matrixgame.notification.GameNotifier;
import com.example.matrixgame.notification.NotificationKind;

@Slf4j
@Service
@RequiredArgsConstructor
public class NarrationService {

    private final ActionRepository actionRepository;
    private final NarrationRepository narrationRepository;
    private final GameRepository gameRepository;
    private final ActingUnitCalculator actingUnitCalculator;
    private final ActionValidator actionValidator;
    private final GameValidator gameValidator;
    private final GamePhaseService gamePhaseService;
    private final ResolutionService resolutionService;
    private final RoundService roundService;
    private final NpcActionService npcActionService;
    private final GameEventService gameEventService;
    private final GameNotifier gameNotifier;

    /**
     * Closes the action. The round either moves to its summary or back to PROPOSAL for the next action.
     */
    @Transactional
    public Narration submitNarration(Long actionId, String userId, String content) {
        Action action = actionValidator.lockAction(actionId);
        Game game = gameValidator.getGame(action.getGameId());
        Player player = gameValidator.requireMember(game.getId(), userId);

        if (action.getStatus() == ActionStatus.NARRATED || narrationRepository.existsByActionId(actionId)) {
            throw ErrorCode.ALREADY_NARRATED.commonException();
        }
        actionValidator.requireStatus(action, ActionStatus.RESOLVED);
        actionValidator.requireCurrentAction(game, action);
        requireNarrator(action, game, player);

        if (game.getCurrentPhase() == GamePhase.RESOLUTION) {
            if (!action.isResolutionRecorded()) {
                resolutionService.resolveOnce(action, game);
            }
            resolutionService.openNarration(action, game, userId);
            game = gameValidator.getGame(game.getId());
        }
        gameValidator.requirePhase(game, GamePhase.NARRATION);

        Narration narration = narrationRepository.saveAndFlush(Narration.builder()
                .actionId(actionId)
                .authorId(player.getId())
                .content(content)
                .createdAt(LocalDateTime.now())
                .build());

        action.setStatus(ActionStatus.NARRATED);
        action.setCompletedAt(LocalDateTime.now());
        actionRepository.saveAndFlush(action);

        Round round = roundService.recordActionCompleted(action.getRoundId());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("actionId", actionId);
        data.put("narrationId", narration.getId());
        data.put("authorId", player.getId());
        data.put("actionsCompleted", round.getActionsCompleted());
        data.put("totalActionsRequired", round.getTotalActionsRequired());
        gameEventService.log(game.getId(), userId, GameEventType.NARRATION_SUBMITTED, data);
        gameNotifier.notify(NotificationKind.NARRATION_SUBMITTED, game.getId(), data);

        gameRepository.updateCurrentAction(game.getId(), null);
        if (roundService.isRoundComplete(round)) {
            gamePhaseService.transitionPhase(game.getId(), GamePhase.ROUND_SUMMARY);
            gameNotifier.notify(NotificationKind.ROUND_SUMMARY_NEEDED, game.getId(),
                    Map.of("roundId", round.getId(), "roundNumber", round.getRoundNumber()));
        } else {
            gamePhaseService.transitionPhase(game.getId(), GamePhase.PROPOSAL);
            npcActionService.checkAndProposeNpcAction(game.getId());
        }

        log.info("[narration] gameId={}, actionId={}, round {}/{}", game.getId(), actionId,
                round.getActionsCompleted(), round.getTotalActionsRequired());
        return narration;
    }

    @Transactional(readOnly = true)
    public Narration getNarration(Long actionId) {
        return narrationRepository.findByActionId(actionId)
                .orElseThrow(ErrorCode.NARRATION_NOT_FOUND::commonException);
    }

    private void requireNarrator(Action action, Game game, Player player) {
        Player initiator = actionValidator.getInitiator(action);
        if (initiator.isNpc() || game.getSettings().getNarrationMode() == NarrationMode.OPEN) {
            return;
        }
        if (initiator.getId().equals(player.getId())) {
            return;
        }
        // the lead may narrate for a shared persona
        if (initiator.getPersonaId() != null && initiator.getPersonaId().equals(player.getPersonaId())
                && player.isPersonaLead()) {
            List<Player> players = actionValidator.activePlayers(game.getId());
            if (actingUnitCalculator.unitOf(player, players).isShared()) {
                return;
            }
        }
        throw ErrorCode.NARRATION_NOT_PERMITTED.commonException();
    }
}
