package com.example.matrixgame.action;

import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import com.example.matrixgame.action.domain.entity.Action;
import com.example.matrixgame.action.domain.state.ActionStatus;
import com.example.matrixgame.action.domain.state.ArgumentType;
import com.example.matrixgame.action.domain.state.VoteType;
import com.example.matrixgame.action.dto.response.ArgumentationProgress;
import com.example.matrixgame.action.dto.response.VoteProgress;
import com.example.matrixgame.game.domain.entity.Game;
import com.example.matrixgame.game.domain.entity.Round;
import com.example.matrixgame.game.domain.state.GameEventType;
import com.example.matrixgame.game.domain.state.GamePhase;
import com.example.matrixgame.game.domain.state.NarrationMode;
import com.example.matrixgame.game.dto.request.GameSettingsRequest;
import com.example.matrixgame.game.service.GamePhaseService;
import com.example.matrixgame.global.error.CommonException;
import com.example.matrixgame.global.error.ErrorCode;
import com.example.matrixgame.support.IntegrationTestSupport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Two solo players, token draw, argument limit 3.
 */
class ActionLifecycleIntegrationTest extends IntegrationTestSupport {

    @Autowired
    private GamePhaseService gamePhaseService;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private String alice;
    private String bob;
    private Long gameId;

    @BeforeEach
    void setUp() {
        alice = newUserId("alice");
        bob = newUserId("bob");
        Game game = createGame(alice);
        gameId = game.getId();
        join(gameId, bob);
        gameService.startGame(gameId, alice);
    }

    @Test
    @DisplayName("an action goes from proposal to narration and the round moves on")
    void fullActionLifecycle() {
        // given
        assertThat(phase(gameId)).isEqualTo(GamePhase.PROPOSAL);
        assertThat(currentRound(gameId).getTotalActionsRequired()).isEqualTo(2);

        // when: proposal
        Action action = propose(gameId, alice);

        // then
        assertThat(phase(gameId)).isEqualTo(GamePhase.ARGUMENTATION);
        assertThat(action(action.getId()).getStatus()).isEqualTo(ActionStatus.ARGUING);
        assertThat(game(gameId).getCurrentActionId()).isEqualTo(action.getId());

        // when: argumentation
        actionService.addArgument(action.getId(), bob, ArgumentType.AGAINST, "Their submarines will break it");
        actionService.addArgument(action.getId(), alice, ArgumentType.CLARIFICATION, "Only the northern lane");
        ArgumentationProgress first = actionService.completeArgumentation(action.getId(), alice);
        ArgumentationProgress last = actionService.completeArgumentation(action.getId(), bob);

        // then
        assertThat(first.advanced()).isFalse();
        assertThat(first.remainingUnits()).isEqualTo(1);
        assertThat(last.advanced()).isTrue();
        assertThat(last.phase()).isEqualTo(GamePhase.VOTING);
        assertThat(phase(gameId)).isEqualTo(GamePhase.VOTING);
        assertThat(action(action.getId()).getStatus()).isEqualTo(ActionStatus.VOTING);

        // when: voting
        VoteProgress firstVote = voteService.submitVote(action.getId(), alice, VoteType.LIKELY_SUCCESS);
        VoteProgress secondVote = voteService.submitVote(action.getId(), bob, VoteType.LIKELY_SUCCESS);

        // then
        assertThat(firstVote.resolved()).isFalse();
        assertThat(firstVote.votesReceived()).isEqualTo(1);
        assertThat(firstVote.votesRequired()).isEqualTo(2);
        assertThat(secondVote.resolved()).isTrue();
        Action resolved = action(action.getId());
        assertThat(resolved.getStatus()).isEqualTo(ActionStatus.RESOLVED);
        assertThat(resolved.getResolutionMethod()).isEqualTo("token_draw");
        assertThat(resolved.getResolutionData()).containsKeys("resultType", "resultValue", "seed");
        assertThat(phase(gameId)).isEqualTo(GamePhase.RESOLUTION);

        // when: reveal and narrate
        resolutionService.resolve(action.getId(), alice);
        assertThat(phase(gameId)).isEqualTo(GamePhase.NARRATION);
        narrationService.submitNarration(action.getId(), alice, "The blockade holds for a week.");

        // then
        Action narrated = action(action.getId());
        assertThat(narrated.getStatus()).isEqualTo(ActionStatus.NARRATED);
        assertThat(narrated.getCompletedAt()).isNotNull();
        Round round = currentRound(gameId);
        assertThat(round.getActionsCompleted()).isEqualTo(1);
        assertThat(round.getTotalActionsRequired()).isEqualTo(2);
        assertThat(phase(gameId)).isEqualTo(GamePhase.PROPOSAL);
        assertThat(game(gameId).getCurrentActionId()).isNull();
        assertThat(events(gameId, GameEventType.ACTION_RESOLVED)).hasSize(1);
    }

    @Test
    @DisplayName("a second resolve is rejected and the stored outcome does not change")
    void resolveIsOnce() {
        // given
        Long actionId = reachResolution();
        resolutionService.resolve(actionId, alice);
        Map<String, Object> outcome = action(actionId).getResolutionData();

        // when & then
        assertThatThrownBy(() -> resolutionService.resolve(actionId, alice))
                .isInstanceOf(CommonException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.ALREADY_RESOLVED);
        assertThat(action(actionId).getResolutionData()).isEqualTo(outcome);
        assertThat(events(gameId, GameEventType.ACTION_RESOLVED)).hasSize(1);
    }

    @Test
    @DisplayName("repeating the done signal records nothing new")
    void completeArgumentationIsIdempotent() {
        // given
        Action action = propose(gameId, alice);

        // when
        actionService.completeArgumentation(action.getId(), alice);
        ArgumentationProgress again = actionService.completeArgumentation(action.getId(), alice);

        // then
        assertThat(again.completedUnits()).isEqualTo(1);
        assertThat(again.advanced()).isFalse();
        assertThat(phase(gameId)).isEqualTo(GamePhase.ARGUMENTATION);
        assertThat(events(gameId, GameEventType.ARGUMENTATION_COMPLETED)).hasSize(1);
    }

    @Test
    @DisplayName("a player votes once per action")
    void duplicateVoteIsRejected() {
        // given
        Action action = propose(gameId, alice);
        hostOverrideService.skipArgumentation(action.getId(), alice);
        voteService.submitVote(action.getId(), bob, VoteType.LIKELY_FAILURE);

        // when & then
        assertThatThrownBy(() -> voteService.submitVote(action.getId(), bob, VoteType.LIKELY_SUCCESS))
                .isInstanceOf(CommonException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.ALREADY_VOTED);
        assertThat(voteRepository.countByActionId(action.getId())).isEqualTo(1);
    }

    @Test
    @DisplayName("arguments follow the side of the caller and the per-player limit")
    void argumentRules() {
        // given
        Action action = propose(gameId, alice);

        // when & then
        assertThatThrownBy(() -> actionService.addArgument(action.getId(), alice, ArgumentType.FOR, "More ships"))
                .extracting("errorCode")
                .isEqualTo(ErrorCode.CLARIFICATION_ONLY);
        assertThatThrownBy(() -> actionService.addArgument(action.getId(), bob, ArgumentType.CLARIFICATION, "Hm"))
                .extracting("errorCode")
                .isEqualTo(ErrorCode.CLARIFICATION_NOT_ALLOWED);

        actionService.addArgument(action.getId(), bob, ArgumentType.AGAINST, "one");
        actionService.addArgument(action.getId(), bob, ArgumentType.FOR, "two");
        actionService.addArgument(action.getId(), bob, ArgumentType.AGAINST, "three");
        assertThatThrownBy(() -> actionService.addArgument(action.getId(), bob, ArgumentType.AGAINST, "four"))
                .extracting("errorCode")
                .isEqualTo(ErrorCode.ARGUMENT_LIMIT_REACHED);

        // the opening argument does not use up the initiator's allowance
        actionService.addArgument(action.getId(), alice, ArgumentType.CLARIFICATION, "c1");
        actionService.addArgument(action.getId(), alice, ArgumentType.CLARIFICATION, "c2");
        actionService.addArgument(action.getId(), alice, ArgumentType.CLARIFICATION, "c3");
        assertThat(argumentRepository.findAllByActionIdOrderBySequenceAsc(action.getId()))
                .extracting("sequence")
                .containsExactly(1, 2, 3, 4, 5, 6, 7);
    }

    @Test
    @DisplayName("only the initiator narrates by default")
    void narrationPermission() {
        // given
        Long actionId = reachResolution();

        // when & then
        assertThatThrownBy(() -> narrationService.submitNarration(actionId, bob, "Not my story"))
                .extracting("errorCode")
                .isEqualTo(ErrorCode.NARRATION_NOT_PERMITTED);
        assertThat(action(actionId).getStatus()).isEqualTo(ActionStatus.RESOLVED);
    }

    @Test
    @DisplayName("narrating straight from RESOLUTION opens narration first; a second narration conflicts")
    void narrationFromResolution() {
        // given
        Long actionId = reachResolution();

        // when
        narrationService.submitNarration(actionId, alice, "The strait is closed.");

        // then
        assertThat(events(gameId, GameEventType.TOKENS_DRAWN)).hasSize(1);
        assertThat(action(actionId).getStatus()).isEqualTo(ActionStatus.NARRATED);
        assertThatThrownBy(() -> narrationService.submitNarration(actionId, alice, "Again"))
                .extracting("errorCode")
                .isEqualTo(ErrorCode.ALREADY_NARRATED);
    }

    @Test
    @DisplayName("one proposal per acting unit per round")
    void duplicateProposalIsRejected() {
        // given
        Long actionId = reachResolution();
        narrationService.submitNarration(actionId, alice, "Done.");

        // when & then
        assertThatThrownBy(() -> propose(gameId, alice))
                .isInstanceOf(CommonException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.ACTION_ALREADY_PROPOSED);
        assertThat(actionRepository.countByRoundId(game(gameId).getCurrentRoundId())).isEqualTo(1);
    }

    @Test
    @DisplayName("a transition outside the table leaves the phase unchanged")
    void invalidTransition() {
        assertThatThrownBy(() -> gamePhaseService.transitionPhase(gameId, GamePhase.VOTING, alice))
                .isInstanceOf(CommonException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.INVALID_PHASE_TRANSITION);
        assertThat(phase(gameId)).isEqualTo(GamePhase.PROPOSAL);
    }

    @Test
    @DisplayName("the host cannot open the round summary before the round is complete")
    void roundSummaryNeedsCompleteRound() {
        // when & then
        assertThatThrownBy(() -> gamePhaseService.transitionPhase(gameId, GamePhase.ROUND_SUMMARY, alice))
                .isInstanceOf(CommonException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.ROUND_NOT_COMPLETE);
        assertThat(phase(gameId)).isEqualTo(GamePhase.PROPOSAL);
        assertThat(currentRound(gameId).getActionsCompleted()).isZero();
        assertThat(events(gameId, GameEventType.PHASE_CHANGED))
                .noneMatch(event -> "ROUND_SUMMARY".equals(event.getEventData().get("to")));
    }

    @Test
    @DisplayName("a settings change keeps a proposal committed after the host's transaction read the game")
    void settingsUpdateKeepsConcurrentProposal() {
        // given
        TransactionTemplate separate = new TransactionTemplate(transactionManager);
        separate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        GameSettingsRequest longerProposals = new GameSettingsRequest(
                null, 5, null, null, null, null, null, null, null, null, null);

        // when
        Long proposedId = transactionTemplate.execute(status -> {
            assertThat(gameRepository.findById(gameId).orElseThrow().getCurrentPhase()).isEqualTo(GamePhase.PROPOSAL);
            Long actionId = separate.execute(inner -> propose(gameId, bob).getId());
            gameService.updateSettings(gameId, alice, longerProposals);
            return actionId;
        });

        // then
        Game game = game(gameId);
        assertThat(game.getSettings().getProposalTimeoutHours()).isEqualTo(5);
        assertThat(game.getCurrentPhase()).isEqualTo(GamePhase.ARGUMENTATION);
        assertThat(game.getCurrentActionId()).isEqualTo(proposedId);
        assertThat(action(proposedId).getStatus()).isEqualTo(ActionStatus.ARGUING);
    }

    @Test
    @DisplayName("the host skips voting and the missing votes are synthesized")
    void hostSkipsVoting() {
        // given
        Action action = propose(gameId, alice);
        hostOverrideService.skipArgumentation(action.getId(), alice);
        voteService.submitVote(action.getId(), alice, VoteType.LIKELY_SUCCESS);

        // when
        hostOverrideService.skipVoting(action.getId(), alice);

        // then
        Action resolved = action(action.getId());
        assertThat(resolved.getStatus()).isEqualTo(ActionStatus.RESOLVED);
        assertThat(resolved.isArgumentationWasSkipped()).isTrue();
        assertThat(resolved.isVotingWasSkipped()).isTrue();
        assertThat(voteService.getVotes(action.getId()))
                .extracting("voteType", "wasSkipped")
                .containsExactly(
                        tuple(VoteType.LIKELY_SUCCESS, false),
                        tuple(VoteType.UNCERTAIN, true));
        assertThat(ids(events(gameId, GameEventType.VOTING_SKIPPED).get(0).getEventData().get("autoVotedPlayerIds")))
                .containsExactly(playerId(gameId, bob));
    }

    @Test
    @DisplayName("a player leaving mid-vote does not stall the phase")
    void departureRechecksVoting() {
        // given
        Action action = propose(gameId, alice);
        hostOverrideService.skipArgumentation(action.getId(), alice);
        voteService.submitVote(action.getId(), alice, VoteType.LIKELY_SUCCESS);

        // when
        gameService.leaveGame(gameId, bob);

        // then
        assertThat(action(action.getId()).getStatus()).isEqualTo(ActionStatus.RESOLVED);
        assertThat(phase(gameId)).isEqualTo(GamePhase.RESOLUTION);
    }

    @Test
    @DisplayName("in open narration mode anyone may narrate")
    void openNarration() {
        // given
        changeSettings(gameId, settings -> settings.setNarrationMode(NarrationMode.OPEN));
        Long actionId = reachResolution();

        // when
        narrationService.submitNarration(actionId, bob, "Told by the other side.");

        // then
        assertThat(narrationService.getNarration(actionId).getAuthorId()).isEqualTo(playerId(gameId, bob));
    }

    @Test
    @DisplayName("only the host may skip")
    void skipIsHostOnly() {
        Action action = propose(gameId, alice);

        assertThatThrownBy(() -> hostOverrideService.skipArgumentation(action.getId(), bob))
                .extracting("errorCode")
                .isEqualTo(ErrorCode.HOST_ONLY);
    }

    private Long reachResolution() {
        Action action = propose(gameId, alice);
        actionService.completeArgumentation(action.getId(), alice);
        actionService.completeArgumentation(action.getId(), bob);
        voteService.submitVote(action.getId(), alice, VoteType.LIKELY_SUCCESS);
        voteService.submitVote(action.getId(), bob, VoteType.UNCERTAIN);
        assertThat(phase(gameId)).isEqualTo(GamePhase.RESOLUTION);
        return action.getId();
    }
}
