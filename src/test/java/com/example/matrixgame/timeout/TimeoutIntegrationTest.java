package com.example.matrixgame.timeout;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import com.example.matrixgame.action.domain.entity.Action;
import com.example.matrixgame.action.domain.entity.Argument;
import com.example.matrixgame.action.domain.state.ActionStatus;
import com.example.matrixgame.action.domain.state.ArgumentType;
import com.example.matrixgame.action.domain.state.VoteType;
import com.example.matrixgame.game.domain.entity.GameEvent;
import com.example.matrixgame.game.domain.entity.GameSettings;
import com.example.matrixgame.game.domain.state.GameEventType;
import com.example.matrixgame.game.domain.state.GamePhase;
import com.example.matrixgame.global.error.ErrorCode;
import com.example.matrixgame.support.IntegrationTestSupport;
import com.example.matrixgame.timeout.dto.SweepResult;
import com.example.matrixgame.timeout.dto.TimeoutResult;
import com.example.matrixgame.timeout.dto.TimeoutStatus;
import com.example.matrixgame.timeout.service.TimeoutService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimeoutIntegrationTest extends IntegrationTestSupport {

    @Autowired
    private TimeoutService timeoutService;

    private String alice;
    private String bob;
    private Long gameId;

    @BeforeEach
    void setUp() {
        alice = newUserId("alice");
        bob = newUserId("bob");
        gameId = createGame(alice).getId();
        join(gameId, bob);
        changeSettings(gameId, settings -> {
            settings.setProposalTimeoutHours(24);
            settings.setArgumentationTimeoutHours(1);
            settings.setVotingTimeoutHours(1);
        });
        gameService.startGame(gameId, alice);
    }

    @Test
    @DisplayName("stale argumentation gets a placeholder for the silent unit and moves to voting")
    void argumentationTimeout() {
        // given: only alice has argued, through her opening argument
        Action action = propose(gameId, alice);
        ageCurrentPhase(gameId, 2);

        // when
        SweepResult sweep = timeoutService.processAllTimeouts();

        // then
        List<TimeoutResult> mine = sweep.processed().stream()
                .filter(result -> result.gameId().equals(gameId))
                .toList();
        Long bobId = playerId(gameId, bob);
        assertThat(mine).hasSize(1);
        assertThat(mine.get(0).playersAffected()).containsExactly(bobId);
        assertThat(mine.get(0).newPhase()).isEqualTo(GamePhase.VOTING);

        assertThat(action(action.getId()).getStatus()).isEqualTo(ActionStatus.VOTING);
        assertThat(phase(gameId)).isEqualTo(GamePhase.VOTING);

        List<Argument> placeholders = argumentRepository.findAllByActionIdOrderBySequenceAsc(action.getId()).stream()
                .filter(argument -> argument.getPlayerId().equals(bobId))
                .toList();
        assertThat(placeholders).hasSize(1);
        assertThat(placeholders.get(0).getArgumentType()).isEqualTo(ArgumentType.FOR);
        assertThat(placeholders.get(0).getContent()).isEqualTo(Argument.TIMEOUT_PLACEHOLDER);

        List<GameEvent> timeouts = events(gameId, GameEventType.ARGUMENTATION_TIMEOUT);
        assertThat(timeouts).hasSize(1);
        assertThat(ids(timeouts.get(0).getEventData().get("autoArgumentedPlayerIds"))).containsExactly(bobId);
    }

    @Test
    @DisplayName("stale voting synthesizes the missing votes and resolves")
    void votingTimeout() {
        // given
        Action action = propose(gameId, alice);
        hostOverrideService.skipArgumentation(action.getId(), alice);
        voteService.submitVote(action.getId(), alice, VoteType.LIKELY_SUCCESS);
        ageCurrentPhase(gameId, 3);

        // when
        var result = timeoutService.processGameTimeout(game(gameId), LocalDateTime.now());

        // then
        assertThat(result).isPresent();
        assertThat(result.get().newPhase()).isEqualTo(GamePhase.RESOLUTION);
        Action resolved = action(action.getId());
        assertThat(resolved.getStatus()).isEqualTo(ActionStatus.RESOLVED);
        assertThat(resolved.getResolutionData()).containsKey("resultType");
        assertThat(voteRepository.findAllByActionIdOrderByIdAsc(action.getId()))
                .filteredOn(vote -> vote.isWasSkipped())
                .extracting("playerId")
                .containsExactly(playerId(gameId, bob));
        Map<String, Object> data = events(gameId, GameEventType.VOTING_TIMEOUT).get(0).getEventData();
        assertThat(ids(data.get("autoVotedPlayerIds"))).containsExactly(playerId(gameId, bob));
    }

    @Test
    @DisplayName("nothing happens before the deadline or without one")
    void notExpiredIsNoOp() {
        // given
        Action action = propose(gameId, alice);

        // when & then: half an hour into a one hour window
        ageCurrentPhase(gameId, 0);
        assertThat(timeoutService.processGameTimeout(game(gameId), LocalDateTime.now().plusMinutes(30))).isEmpty();

        changeSettings(gameId, settings -> settings.setArgumentationTimeoutHours(GameSettings.INFINITE_TIMEOUT));
        assertThat(timeoutService.processGameTimeout(game(gameId), LocalDateTime.now().plusDays(30))).isEmpty();
        assertThat(action(action.getId()).getStatus()).isEqualTo(ActionStatus.ARGUING);
        assertThat(timeoutService.getTimeoutStatus(gameId).isInfinite()).isTrue();
    }

    @Test
    @DisplayName("a stale proposal phase notifies the host once per phase entry")
    void proposalNoticeIsDeduplicated() {
        // given
        ageCurrentPhase(gameId, 25);

        // when
        var first = timeoutService.processGameTimeout(game(gameId), LocalDateTime.now());
        var second = timeoutService.processGameTimeout(game(gameId), LocalDateTime.now());

        // then
        assertThat(first).isPresent();
        assertThat(first.get().hostNotified()).isTrue();
        assertThat(second).isEmpty();
        assertThat(events(gameId, GameEventType.PROPOSAL_TIMEOUT)).hasSize(1);
        assertThat(phase(gameId)).isEqualTo(GamePhase.PROPOSAL);
    }

    @Test
    @DisplayName("the host restarts the clock of the current phase")
    void extendTimeout() {
        // given
        ageCurrentPhase(gameId, 23);
        assertThat(timeoutService.getTimeoutStatus(gameId).remainingMillis()).isLessThan(3_600_000L);

        // when
        TimeoutStatus status = timeoutService.extendTimeout(gameId, alice);

        // then
        assertThat(status.isExpired()).isFalse();
        assertThat(status.remainingMillis()).isGreaterThan(23 * 3_600_000L);
        assertThat(events(gameId, GameEventType.TIMEOUT_EXTENDED)).hasSize(1);
        assertThatThrownBy(() -> timeoutService.extendTimeout(gameId, bob))
                .extracting("errorCode")
                .isEqualTo(ErrorCode.HOST_ONLY);
    }

    @Test
    @DisplayName("phases without a clock cannot be extended")
    void extendUntimedPhase() {
        Action action = propose(gameId, alice);
        actionService.completeArgumentation(action.getId(), alice);
        actionService.completeArgumentation(action.getId(), bob);
        voteService.submitVote(action.getId(), alice, VoteType.LIKELY_SUCCESS);
        voteService.submitVote(action.getId(), bob, VoteType.LIKELY_SUCCESS);

        assertThat(phase(gameId)).isEqualTo(GamePhase.RESOLUTION);
        assertThatThrownBy(() -> timeoutService.extendTimeout(gameId, alice))
                .extracting("errorCode")
                .isEqualTo(ErrorCode.TIMEOUT_NOT_APPLICABLE);
    }
}
