package com.example.matrixgame.action.service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.matrixgame.action.domain.entity.Action;
import com.example.matrixgame.action.domain.entity.ArgumentationCompletion;
import com.example.matrixgame.action.domain.entity.Vote;
import com.example.matrixgame.action.domain.state.ActionStatus;
import com.example.matrixgame.action.domain.state.VoteType;
import com.example.matrixgame.action.repository.ActionRepository;
import com.example.matrixgame.action.repository.ArgumentationCompletionRepository;
import com.example.matrixgame.action.repository.VoteRepository;
import com.example.matrixgame.game.domain.entity.Game;
import com.example.matrixgame.game.domain.entity.GameSettings;
import com.example.matrixgame.game.domain.entity.Player;
import com.example.matrixgame.game.domain.state.GamePhase;
import com.example.matrixgame.game.domain.state.GameRole;
import com.example.matrixgame.game.domain.state.GameStatus;
import com.example.matrixgame.game.repository.PlayerRepository;
import com.example.matrixgame.game.service.ActingUnit;
import com.example.matrixgame.game.service.ActingUnitCalculator;
import com.example.matrixgame.game.service.GamePhaseService;
import com.example.matrixgame.game.service.GameValidator;
import com.example.matrixgame.global.error.ErrorCode;
import com.example.matrixgame.notification.GameNotifier;
import com.example.matrixgame.notification.NotificationKind;
import com.example.matrixgame.resolution.ResolutionMethod;
import com.example.matrixgame.resolution.ResolutionStrategyRegistry;
import com.example.matrixgame.resolution.TokenWeight;

/**
 * Sub-phase exits shared by human requests, host overrides and the timeout sweep.
 * Every method expects the caller to hold the action's row lock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ActionFlowService {

    private final ActionRepository actionRepository;
    private final VoteRepository voteRepository;
    private final ArgumentationCompletionRepository completionRepository;
    private final PlayerRepository playerRepository;
    private final ActingUnitCalculator actingUnitCalculator;
    private final ResolutionStrategyRegistry resolutionStrategyRegistry;
    private final ActionValidator actionValidator;
    private final GameValidator gameValidator;
    private final GamePhaseService gamePhaseService;
    private final ResolutionService resolutionService;
    private final GameNotifier gameNotifier;

    /**
     * Human acting units that signalled "done" against how many must.
     */
    public long countCompletedUnits(Action action, List<Player> players) {
        Set<Long> doneIds = completionRepository.findAllByActionId(action.getId()).stream()
                .map(ArgumentationCompletion::getPlayerId)
                .collect(Collectors.toSet());
        return actingUnitCalculator.countCompletedUnits(players, doneIds);
    }

    /**
     * Closes argumentation if every human acting unit is done.
     *
     * @return true when the action left argumentation
     */
    @Transactional
    public boolean checkArgumentationThreshold(Action action, Game game) {
        List<Player> players = actionValidator.activePlayers(game.getId());
        long completed = countCompletedUnits(action, players);
        int required = actingUnitCalculator.countActingUnits(players);
        if (completed < required) {
            return false;
        }
        finishArgumentation(action, game, false);
        return true;
    }

    /**
     * Leaves ARGUMENTATION for the phase the game's strategy asks for.
     * Arbiter games go to review and the action stays ARGUING until the arbiter resolves it.
     */
    @Transactional
    public GamePhase finishArgumentation(Action action, Game game, boolean skipped) {
        actionValidator.requireStatus(action, ActionStatus.ARGUING);
        ResolutionMethod method = actionValidator.resolutionMethod(game);

        if (skipped) {
            action.setArgumentationWasSkipped(true);
        }

        if (!method.usesVoting()) {
            playerRepository.findFirstByGameIdAndGameRoleAndIsActiveTrue(game.getId(), GameRole.ARBITER)
                    .orElseThrow(ErrorCode.NO_ARBITER::commonException);
            actionRepository.save(action);
            gamePhaseService.transitionPhase(game.getId(), GamePhase.ARBITER_REVIEW);
            gameNotifier.notify(NotificationKind.ARBITER_REVIEW_READY, game.getId(), Map.of("actionId", action.getId()));
            log.info("[argumentation] closed for review: gameId={}, actionId={}", game.getId(), action.getId());
            return GamePhase.ARBITER_REVIEW;
        }

        action.setStatus(ActionStatus.VOTING);
        action.setVotingStartedAt(LocalDateTime.now());
        actionRepository.save(action);
        gamePhaseService.transitionPhase(game.getId(), GamePhase.VOTING);
        gameNotifier.notify(NotificationKind.VOTING_STARTED, game.getId(), Map.of("actionId", action.getId()));
        log.info("[argumentation] closed: gameId={}, actionId={}, skipped={}", game.getId(), action.getId(), skipped);
        return GamePhase.VOTING;
    }

    /**
     * Votes that count toward the threshold: one per unit under one-per-persona,
     * otherwise one per active human.
     */
    public long countAcceptedVotes(Action action, List<Player> players, GameSettings settings) {
        Set<Long> voterIds = voteRepository.findAllByActionIdOrderByIdAsc(action.getId()).stream()
                .map(Vote::getPlayerId)
                .collect(Collectors.toSet());
        if (settings.isOnePerPersonaVoting()) {
            return actingUnitCalculator.countCompletedUnits(players, voterIds);
        }
        return players.stream()
                .filter(Player::isHuman)
                .filter(player -> voterIds.contains(player.getId()))
                .count();
    }

    /**
     * Resolves the action once enough votes are in.
     *
     * @return true when this call closed voting
     */
    @Transactional
    public boolean checkVotingThreshold(Action action, Game game) {
        List<Player> players = actionValidator.activePlayers(game.getId());
        long accepted = countAcceptedVotes(action, players, game.getSettings());
        int required = actingUnitCalculator.votingThreshold(players, game.getSettings());
        if (accepted < required) {
            return false;
        }
        closeVoting(action, game);
        return true;
    }

    /**
     * VOTING -> RESOLVED on the action and VOTING -> RESOLUTION on the game, then the
     * outcome is computed exactly once.
     */
    @Transactional
    public void closeVoting(Action action, Game game) {
        if (action.getStatus() != ActionStatus.VOTING) {
            // someone else closed it first
            throw ErrorCode.ALREADY_RESOLVED.commonException();
        }
        action.setStatus(ActionStatus.RESOLVED);
        actionRepository.save(action);
        gamePhaseService.transitionPhase(game.getId(), GamePhase.RESOLUTION);
        resolutionService.resolveOnce(action, game);

        Player initiator = actionValidator.getInitiator(action);
        gameNotifier.notify(NotificationKind.RESOLUTION_READY, game.getId(),
                Map.of("actionId", action.getId(), "initiatorId", initiator.getId()));
        log.info("[voting] closed: gameId={}, actionId={}", game.getId(), action.getId());
    }

    /**
     * Adds an UNCERTAIN, skipped vote for every voter still missing. Under one-per-persona
     * only the representative of a silent persona gets one.
     *
     * @return the players that received a synthesized vote
     */
    @Transactional
    public List<Player> synthesizeMissingVotes(Action action, Game game) {
        List<Player> players = actionValidator.activePlayers(game.getId());
        Set<Long> voterIds = voteRepository.findAllByActionIdOrderByIdAsc(action.getId()).stream()
                .map(Vote::getPlayerId)
                .collect(Collectors.toSet());

        List<Player> missing = new ArrayList<>();
        if (game.getSettings().isOnePerPersonaVoting()) {
            for (ActingUnit unit : actingUnitCalculator.pendingUnits(players, voterIds)) {
                missing.add(unit.representative());
            }
        } else {
            players.stream()
                    .filter(Player::isHuman)
                    .filter(player -> !voterIds.contains(player.getId()))
                    .forEach(missing::add);
        }

        TokenWeight weight = resolutionStrategyRegistry.getStrategy(actionValidator.resolutionMethod(game))
                .mapVoteToTokens(VoteType.UNCERTAIN);
        for (Player player : missing) {
            voteRepository.save(Vote.builder()
                    .actionId(action.getId())
                    .playerId(player.getId())
                    .voteType(VoteType.UNCERTAIN)
                    .successTokens(weight.successTokens())
                    .failureTokens(weight.failureTokens())
                    .wasSkipped(true)
                    .createdAt(LocalDateTime.now())
                    .build());
        }
        return missing;
    }

    /**
     * Re-checks the current action after the roster shrank so a departure never stalls a phase.
     */
    @Transactional
    public void reevaluatePending(Long gameId) {
        Game game = gameValidator.getGame(gameId);
        if (game.getStatus() != GameStatus.ACTIVE || game.getCurrentActionId() == null) {
            return;
        }
        Action action = actionValidator.lockAction(game.getCurrentActionId());
        if (game.getCurrentPhase() == GamePhase.ARGUMENTATION && action.getStatus() == ActionStatus.ARGUING) {
            checkArgumentationThreshold(action, game);
        } else if (game.getCurrentPhase() == GamePhase.VOTING && action.getStatus() == ActionStatus.VOTING) {
            checkVotingThreshold(action, game);
        }
    }
}
