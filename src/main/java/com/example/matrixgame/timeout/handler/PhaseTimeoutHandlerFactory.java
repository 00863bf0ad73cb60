package com.example.matrixgame.timeout.handler;

import java.util.Optional;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import com.example.matrixgame.game.domain.state.GamePhase;

/**
 * Picks the timeout handler for a phase.
 */
@Component
@RequiredArgsConstructor
public class PhaseTimeoutHandlerFactory {

    private final ProposalTimeoutHandler proposalTimeoutHandler;
    private final ArgumentationTimeoutHandler argumentationTimeoutHandler;
    private final VotingTimeoutHandler votingTimeoutHandler;
    private final NarrationTimeoutHandler narrationTimeoutHandler;

    public Optional<PhaseTimeoutHandler> getHandler(GamePhase phase) {
        return switch (phase) {
            case PROPOSAL -> Optional.of(proposalTimeoutHandler);
            case ARGUMENTATION -> Optional.of(argumentationTimeoutHandler);
            case VOTING -> Optional.of(votingTimeoutHandler);
            case NARRATION -> Optional.of(narrationTimeoutHandler);
            // no deadline outside the timed phases
            case WAITING, ARBITER_REVIEW, RESOLUTION, ROUND_SUMMARY -> Optional.empty();
        };
    }
}
