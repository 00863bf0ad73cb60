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
import com.example.matrixgame.action.domain.entity.Vote;
import com.example.matrixgame.action.domain.state.ActionStatus;
import com.example.matrixgame.action.domain.state.VoteType;
import com.example.matrixgame.action.dto.response.VoteProgress;
import com.example.matrixgame.action.dto.response.VoteResponse;
import com.example.matrixgame.action.repository.VoteRepository;
import com.example.matrixgame.game.domain.entity.Game;
import com.example.matrixgame.game.domain.entity.Player;
import com.example.matrixgame.game.domain.state.GameEventType;
import com.example.matrixgame.game.domain.state.GamePhase;
import com.example.matrixgame.game.service.ActingUnitCalculator;
import com.example.matrixgame.game.service.GameEventService;
import com.example.matrixgame.game.service.GameValidator;
import com.example.matrixgame.global.error.ErrorCode;
import com.example.matrixgame.notification.GameNotifier;
import com.example.matrixgame.notification.NotificationKind;
import com.example.matrixgame.resolution.ResolutionStrategyRegistry;
import com.example.matrixgame.resolution.TokenWeight;

@Slf4j
@Service
@RequiredArgsConstructor
public class VoteService {

    private final VoteRepository voteRepository;
    private final ActingUnitCalculator actingUnitCalculator;
    private final ResolutionStrategyRegistry resolutionStrategyRegistry;
    private final ActionValidator actionValidator;
    private final GameValidator gameValidator;
    private final ActionFlowService actionFlowService;
    private final GameEventService gameEventService;
    private final GameNotifier gameNotifier;

    /**
     * Records a vote and resolves the action when it is the one that reaches the threshold.
     */
    @Transactional
    public VoteProgress submitVote(Long actionId, String userId, VoteType voteType) {
        Action action = actionValidator.lockAction(actionId);
        Game game = gameValidator.getGame(action.getGameId());
        Player player = gameValidator.requireMember(game.getId(), userId);
        if (action.getStatus() == ActionStatus.RESOLVED || action.getStatus() == ActionStatus.NARRATED) {
            throw ErrorCode.ALREADY_RESOLVED.commonException();
        }
        actionValidator.requireStatus(action, ActionStatus.VOTING);
        gameValidator.requirePhase(game, GamePhase.VOTING);

        if (voteRepository.existsByActionIdAndPlayerId(actionId, player.getId())) {
            throw ErrorCode.ALREADY_VOTED.commonException();
        }
        List<Player> players = actionValidator.activePlayers(game.getId());
        if (game.getSettings().isOnePerPersonaVoting()) {
            List<Long> unitMemberIds = actingUnitCalculator.unitOf(player, players).memberIds();
            if (voteRepository.existsByActionIdAndPlayerIdIn(actionId, unitMemberIds)) {
                throw ErrorCode.PERSONA_ALREADY_VOTED.commonException();
            }
        }

        TokenWeight weight = resolutionStrategyRegistry.getStrategy(actionValidator.resolutionMethod(game))
                .mapVoteToTokens(voteType);
        Vote vote = voteRepository.saveAndFlush(Vote.builder()
                .actionId(actionId)
                .playerId(player.getId())
                .voteType(voteType)
                .successTokens(weight.successTokens())
                .failureTokens(weight.failureTokens())
                .createdAt(LocalDateTime.now())
                .build());

        long received = actionFlowService.countAcceptedVotes(action, players, game.getSettings());
        int required = actingUnitCalculator.votingThreshold(players, game.getSettings());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("actionId", actionId);
        data.put("playerId", player.getId());
        data.put("votesReceived", received);
        data.put("votesRequired", required);
        gameEventService.log(game.getId(), userId, GameEventType.VOTE_CAST, data);
        gameNotifier.notify(NotificationKind.VOTE_CAST, game.getId(), data);

        boolean resolved = false;
        if (received >= required) {
            actionFlowService.closeVoting(action, game);
            resolved = true;
        }

        log.info("[vote] gameId={}, actionId={}, votes={}/{}", game.getId(), actionId, received, required);
        return new VoteProgress(VoteResponse.from(vote), received, required, resolved);
    }

    @Transactional(readOnly = true)
    public List<Vote> getVotes(Long actionId) {
        actionValidator.getAction(actionId);
        return voteRepository.findAllByActionIdOrderByIdAsc(actionId);
    }
}
