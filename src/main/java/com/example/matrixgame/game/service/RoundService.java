package com.example.matrixgame.game.service;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.matrixgame.action.domain.entity.Action;
import com.example.matrixgame.action.repository.ActionRepository;
import com.example.matrixgame.game.domain.entity.Game;
import com.example.matrixgame.game.domain.entity.Player;
import com.example.matrixgame.game.domain.entity.Round;
import com.example.matrixgame.game.domain.entity.RoundSummary;
import com.example.matrixgame.game.domain.state.GameEventType;
import com.example.matrixgame.game.domain.state.GamePhase;
import com.example.matrixgame.game.domain.state.RoundStatus;
import com.example.matrixgame.game.repository.GameRepository;
import com.example.matrixgame.game.repository.PlayerRepository;
import com.example.matrixgame.game.repository.RoundRepository;
import com.example.matrixgame.game.repository.RoundSummaryRepository;
import com.example.matrixgame.global.error.ErrorCode;
import com.example.matrixgame.notification.GameNotifier;
import com.example.matrixgame.notification.NotificationKind;
import com.example.matrixgame.resolution.ResultType;

/**
 * Round tracker: counts completed actions against the round total and closes rounds.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoundService {

    private final RoundRepository roundRepository;
    private final RoundSummaryRepository roundSummaryRepository;
    private final GameRepository gameRepository;
    private final PlayerRepository playerRepository;
    private final ActionRepository actionRepository;
    private final ActingUnitCalculator actingUnitCalculator;
    private final GamePhaseService gamePhaseService;
    private final GameValidator gameValidator;
    private final GameEventService gameEventService;
    private final GameNotifier gameNotifier;

    /**
     * Opens a round sized to the acting units present now, and makes it the game's current round.
     */
    @Transactional
    public Round createRound(Long gameId, int roundNumber) {
        List<Player> players = playerRepository.findAllByGameIdAndIsActiveTrueOrderByJoinedAtAscIdAsc(gameId);
        int totalActionsRequired = actingUnitCalculator.totalActionsRequired(players);

        Round round = roundRepository.save(Round.builder()
                .gameId(gameId)
                .roundNumber(roundNumber)
                .totalActionsRequired(totalActionsRequired)
                .startedAt(LocalDateTime.now())
                .build());
        gameRepository.updateCurrentRound(gameId, round.getId());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("roundId", round.getId());
        data.put("roundNumber", roundNumber);
        data.put("totalActionsRequired", totalActionsRequired);
        gameEventService.log(gameId, null, GameEventType.ROUND_STARTED, data);
        gameNotifier.notify(NotificationKind.ROUND_STARTED, gameId, data);

        log.info("[round] gameId={}, roundNumber={}, totalActionsRequired={}", gameId, roundNumber, totalActionsRequired);
        return round;
    }

    public Round getRound(Long roundId) {
        return roundRepository.findById(roundId)
                .orElseThrow(ErrorCode.ROUND_NOT_FOUND::commonException);
    }

    @Transactional(readOnly = true)
    public List<Round> getRounds(Long gameId) {
        gameValidator.getGame(gameId);
        return roundRepository.findAllByGameIdOrderByRoundNumberAsc(gameId);
    }

    /**
     * Counts one narrated action. The update is refused once the round is full.
     *
     * @return the round after the increment
     */
    @Transactional
    public Round recordActionCompleted(Long roundId) {
        int updated = roundRepository.incrementActionsCompleted(roundId);
        if (updated == 0) {
            throw ErrorCode.ROUND_ALREADY_FULL.commonException();
        }
        return getRound(roundId);
    }

    public boolean isRoundComplete(Round round) {
        return round.isComplete();
    }

    @Transactional
    public RoundSummary submitRoundSummary(Long roundId, String userId, String content) {
        Round round = getRound(roundId);
        Game game = gameValidator.getGame(round.getGameId());
        Player host = gameValidator.requireHost(game.getId(), userId);

        if (roundSummaryRepository.existsByRoundId(roundId)) {
            throw ErrorCode.ROUND_SUMMARY_EXISTS.commonException();
        }
        gameValidator.requirePhase(game, GamePhase.ROUND_SUMMARY);
        if (!round.getId().equals(game.getCurrentRoundId()) || !round.isComplete()) {
            throw ErrorCode.ROUND_NOT_COMPLETE.commonException();
        }

        Map<String, Object> outcomes = computeOutcomes(actionRepository.findAllByRoundIdOrderBySequenceNumberAsc(roundId));
        RoundSummary summary = roundSummaryRepository.save(RoundSummary.builder()
                .roundId(roundId)
                .authorId(host.getId())
                .content(content)
                .outcomes(outcomes)
                .createdAt(LocalDateTime.now())
                .build());

        round.setStatus(RoundStatus.COMPLETED);
        round.setCompletedAt(LocalDateTime.now());
        roundRepository.save(round);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("roundId", roundId);
        data.put("roundNumber", round.getRoundNumber());
        data.put("outcomes", outcomes);
        gameEventService.log(game.getId(), userId, GameEventType.ROUND_SUMMARY_SUBMITTED, data);

        createRound(game.getId(), round.getRoundNumber() + 1);
        gameRepository.updateCurrentAction(game.getId(), null);
        gamePhaseService.transitionPhase(game.getId(), GamePhase.PROPOSAL);

        log.info("[round] summary submitted: gameId={}, roundNumber={}, outcomes={}",
                game.getId(), round.getRoundNumber(), outcomes);
        return summary;
    }

    @Transactional
    public RoundSummary updateRoundSummary(Long roundId, String userId, String content) {
        Round round = getRound(roundId);
        gameValidator.getGame(round.getGameId());
        gameValidator.requireHost(round.getGameId(), userId);

        RoundSummary summary = roundSummaryRepository.findByRoundId(roundId)
                .orElseThrow(ErrorCode.ROUND_SUMMARY_NOT_FOUND::commonException);
        summary.setContent(content);
        summary.setUpdatedAt(LocalDateTime.now());
        roundSummaryRepository.save(summary);

        gameEventService.log(round.getGameId(), userId, GameEventType.ROUND_SUMMARY_EDITED,
                Map.of("roundId", roundId, "summaryId", summary.getId()));
        return summary;
    }

    @Transactional(readOnly = true)
    public RoundSummary getRoundSummary(Long roundId) {
        return roundSummaryRepository.findByRoundId(roundId)
                .orElseThrow(ErrorCode.ROUND_SUMMARY_NOT_FOUND::commonException);
    }

    private Map<String, Object> computeOutcomes(List<Action> actions) {
        int netMomentum = 0;
        int triumphs = 0;
        int disasters = 0;
        for (Action action : actions) {
            Map<String, Object> resolution = action.getResolutionData();
            if (resolution == null || resolution.get("resultType") == null) {
                continue;
            }
            if (resolution.get("resultValue") instanceof Number value) {
                netMomentum += value.intValue();
            }
            String resultType = String.valueOf(resolution.get("resultType"));
            if (ResultType.TRIUMPH.name().equals(resultType)) {
                triumphs++;
            } else if (ResultType.DISASTER.name().equals(resultType)) {
                disasters++;
            }
        }

        Map<String, Object> outcomes = new LinkedHashMap<>();
        outcomes.put("netMomentum", netMomentum);
        outcomes.put("triumphs", triumphs);
        outcomes.put("disasters", disasters);
        outcomes.put("actionCount", actions.size());
        return outcomes;
    }
}
