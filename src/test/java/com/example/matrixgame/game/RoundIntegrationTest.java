package com.example.matrixgame.game;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.example.matrixgame.action.domain.entity.Action;
import com.example.matrixgame.action.domain.state.ActionStatus;
import com.example.matrixgame.game.domain.entity.Player;
import com.example.matrixgame.game.domain.entity.Round;
import com.example.matrixgame.game.domain.entity.RoundSummary;
import com.example.matrixgame.game.domain.state.GameEventType;
import com.example.matrixgame.game.domain.state.GamePhase;
import com.example.matrixgame.game.domain.state.RoundStatus;
import com.example.matrixgame.global.error.ErrorCode;
import com.example.matrixgame.support.IntegrationTestSupport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoundIntegrationTest extends IntegrationTestSupport {

    @Test
    @DisplayName("the last narration of a round opens the summary, which starts the next round")
    void roundCompletesAndNextRoundStarts() {
        // given
        String alice = newUserId("alice");
        String bob = newUserId("bob");
        Long gameId = startedGame(alice, bob);
        Long firstRoundId = game(gameId).getCurrentRoundId();

        // when
        playAction(gameId, alice, propose(gameId, alice));
        assertThat(phase(gameId)).isEqualTo(GamePhase.PROPOSAL);
        playAction(gameId, alice, propose(gameId, bob));

        // then
        assertThat(phase(gameId)).isEqualTo(GamePhase.ROUND_SUMMARY);
        Round finished = roundService.getRound(firstRoundId);
        assertThat(finished.getActionsCompleted()).isEqualTo(finished.getTotalActionsRequired());

        // when
        RoundSummary summary = roundService.submitRoundSummary(firstRoundId, alice, "The strait is contested.");

        // then
        assertThat(summary.getOutcomes()).containsEntry("actionCount", 2);
        assertThat(roundService.getRound(firstRoundId).getStatus()).isEqualTo(RoundStatus.COMPLETED);
        assertThat(phase(gameId)).isEqualTo(GamePhase.PROPOSAL);
        Round next = currentRound(gameId);
        assertThat(next.getId()).isNotEqualTo(firstRoundId);
        assertThat(next.getRoundNumber()).isEqualTo(2);
        assertThat(next.getActionsCompleted()).isZero();

        // and the same unit may propose again in the new round
        assertThat(propose(gameId, alice).getRoundId()).isEqualTo(next.getId());
    }

    @Test
    @DisplayName("a round is summarized once, by the host")
    void summaryRules() {
        // given
        String alice = newUserId("alice");
        String bob = newUserId("bob");
        Long gameId = startedGame(alice, bob);
        Long roundId = game(gameId).getCurrentRoundId();
        playAction(gameId, alice, propose(gameId, alice));

        // when & then: the round is not over yet
        assertThatThrownBy(() -> roundService.submitRoundSummary(roundId, alice, "early"))
                .extracting("errorCode")
                .isEqualTo(ErrorCode.WRONG_PHASE);

        playAction(gameId, alice, propose(gameId, bob));
        assertThatThrownBy(() -> roundService.submitRoundSummary(roundId, bob, "not the host"))
                .extracting("errorCode")
                .isEqualTo(ErrorCode.HOST_ONLY);

        roundService.submitRoundSummary(roundId, alice, "first");
        assertThatThrownBy(() -> roundService.submitRoundSummary(roundId, alice, "second"))
                .extracting("errorCode")
                .isEqualTo(ErrorCode.ROUND_SUMMARY_EXISTS);

        RoundSummary edited = roundService.updateRoundSummary(roundId, alice, "first, corrected");
        assertThat(edited.getContent()).isEqualTo("first, corrected");
        assertThat(edited.getUpdatedAt()).isNotNull();
    }

    @Test
    @DisplayName("the host ends proposals early and the round shrinks to what was played")
    void skipToNextAction() {
        // given
        String alice = newUserId("alice");
        String bob = newUserId("bob");
        Long gameId = startedGame(alice, bob);
        Long roundId = game(gameId).getCurrentRoundId();

        // when & then: nothing played yet
        assertThatThrownBy(() -> hostOverrideService.skipToNextAction(gameId, alice))
                .extracting("errorCode")
                .isEqualTo(ErrorCode.NO_ACTIONS_THIS_ROUND);

        playAction(gameId, alice, propose(gameId, alice));
        hostOverrideService.skipToNextAction(gameId, alice);

        assertThat(phase(gameId)).isEqualTo(GamePhase.ROUND_SUMMARY);
        Round round = roundService.getRound(roundId);
        assertThat(round.getTotalActionsRequired()).isEqualTo(1);
        assertThat(round.getActionsCompleted()).isEqualTo(1);
        assertThat(events(gameId, GameEventType.PROPOSALS_SKIPPED)).hasSize(1);
    }

    @Test
    @DisplayName("the NPC proposes once every human unit has, and anyone may narrate its action")
    void npcAutoProposal() {
        // given
        String alice = newUserId("alice");
        String bob = newUserId("bob");
        Long gameId = createGame(alice, npcPersona("Pirates", "Raid the convoy", "The cargo is lost")).getId();
        join(gameId, bob);
        gameService.startGame(gameId, alice);
        assertThat(currentRound(gameId).getTotalActionsRequired()).isEqualTo(3);

        // when
        playAction(gameId, alice, propose(gameId, alice));
        assertThat(phase(gameId)).isEqualTo(GamePhase.PROPOSAL);
        playAction(gameId, alice, propose(gameId, bob));

        // then
        assertThat(phase(gameId)).isEqualTo(GamePhase.ARGUMENTATION);
        Action npcAction = action(game(gameId).getCurrentActionId());
        Player npc = playerRepository.findById(npcAction.getInitiatorId()).orElseThrow();
        assertThat(npc.isNpc()).isTrue();
        assertThat(npcAction.getActionDescription()).isEqualTo("Raid the convoy");
        assertThat(events(gameId, GameEventType.NPC_ACTION_PROPOSED)).hasSize(1);

        // when: the NPC action runs its course and bob narrates it
        actionService.completeArgumentation(npcAction.getId(), alice);
        actionService.completeArgumentation(npcAction.getId(), bob);
        hostOverrideService.skipVoting(npcAction.getId(), alice);
        resolutionService.resolve(npcAction.getId(), bob);
        narrationService.submitNarration(npcAction.getId(), bob, "The pirates strike at dawn.");

        // then
        assertThat(action(npcAction.getId()).getStatus()).isEqualTo(ActionStatus.NARRATED);
        assertThat(phase(gameId)).isEqualTo(GamePhase.ROUND_SUMMARY);
        Number resultValue = (Number) action(npcAction.getId()).getResolutionData().get("resultValue");
        assertThat(game(gameId).getNpcMomentum()).isEqualTo(resultValue.intValue());
    }

    @Test
    @DisplayName("starting needs two players")
    void startNeedsTwoPlayers() {
        String alice = newUserId("alice");
        Long gameId = createGame(alice).getId();

        assertThatThrownBy(() -> gameService.startGame(gameId, alice))
                .extracting("errorCode")
                .isEqualTo(ErrorCode.NOT_ENOUGH_PLAYERS);
        assertThat(phase(gameId)).isEqualTo(GamePhase.WAITING);
    }

    @Test
    @DisplayName("rounds are listed in order")
    void listRounds() {
        String alice = newUserId("alice");
        String bob = newUserId("bob");
        Long gameId = startedGame(alice, bob);

        List<Round> rounds = roundService.getRounds(gameId);

        assertThat(rounds).extracting("roundNumber").containsExactly(1);
    }

    private Long startedGame(String host, String other) {
        Long gameId = createGame(host).getId();
        join(gameId, other);
        gameService.startGame(gameId, host);
        return gameId;
    }

    /**
     * Drives a freshly proposed action to narration through the host overrides.
     */
    private void playAction(Long gameId, String host, Action action) {
        hostOverrideService.skipArgumentation(action.getId(), host);
        hostOverrideService.skipVoting(action.getId(), host);
        Player initiator = playerRepository.findById(action.getInitiatorId()).orElseThrow();
        resolutionService.resolve(action.getId(), initiator.getUserId());
        narrationService.submitNarration(action.getId(), initiator.getUserId(), "It happened.");
    }
}
