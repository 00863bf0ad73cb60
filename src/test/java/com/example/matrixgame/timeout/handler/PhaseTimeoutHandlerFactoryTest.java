package com.example.matrixgame.timeout.handler;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.example.matrixgame.game.domain.state.GamePhase;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(MockitoExtension.class)
class PhaseTimeoutHandlerFactoryTest {

    @Mock
    private ProposalTimeoutHandler proposalTimeoutHandler;

    @Mock
    private ArgumentationTimeoutHandler argumentationTimeoutHandler;

    @Mock
    private VotingTimeoutHandler votingTimeoutHandler;

    @Mock
    private NarrationTimeoutHandler narrationTimeoutHandler;

    @InjectMocks
    private PhaseTimeoutHandlerFactory factory;

    @Test
    void timedPhasesHaveHandlers() {
        assertThat(factory.getHandler(GamePhase.PROPOSAL)).containsSame(proposalTimeoutHandler);
        assertThat(factory.getHandler(GamePhase.ARGUMENTATION)).containsSame(argumentationTimeoutHandler);
        assertThat(factory.getHandler(GamePhase.VOTING)).containsSame(votingTimeoutHandler);
        assertThat(factory.getHandler(GamePhase.NARRATION)).containsSame(narrationTimeoutHandler);
    }

    @Test
    void untimedPhasesHaveNone() {
        assertThat(factory.getHandler(GamePhase.WAITING)).isEmpty();
        assertThat(factory.getHandler(GamePhase.ARBITER_REVIEW)).isEmpty();
        assertThat(factory.getHandler(GamePhase.RESOLUTION)).isEmpty();
        assertThat(factory.getHandler(GamePhase.ROUND_SUMMARY)).isEmpty();
    }
}
