package com.example.matrixgame.game.domain.state;

import java.util.EnumSet;
import java.util.Set;

/**
 * Game-wide pipeline stage with its fixed transition table.
 * No phase may be skipped or reverted outside of this table.
 */
public enum GamePhase {
    WAITING,
    PROPOSAL,
    ARGUMENTATION,
    ARBITER_REVIEW,
    VOTING,
    RESOLUTION,
    NARRATION,
    ROUND_SUMMARY;

    private static final Set<GamePhase> TIMED = EnumSet.of(PROPOSAL, ARGUMENTATION, VOTING, NARRATION);

    public Set<GamePhase> nextPhases() {
        return switch (this) {
            case WAITING -> EnumSet.of(PROPOSAL);
            // ROUND_SUMMARY only through the host's round-level override
            case PROPOSAL -> EnumSet.of(ARGUMENTATION, ROUND_SUMMARY);
            case ARGUMENTATION -> EnumSet.of(VOTING, ARBITER_REVIEW);
            case ARBITER_REVIEW -> EnumSet.of(RESOLUTION);
            case VOTING -> EnumSet.of(RESOLUTION);
            case RESOLUTION -> EnumSet.of(NARRATION);
            case NARRATION -> EnumSet.of(PROPOSAL, ROUND_SUMMARY);
            case ROUND_SUMMARY -> EnumSet.of(PROPOSAL);
        };
    }

    public boolean canTransitionTo(GamePhase next) {
        return next != null && nextPhases().contains(next);
    }

    /**
     * Phases the timeout sweep looks at.
     */
    public boolean isTimed() {
        return TIMED.contains(this);
    }

    public static Set<GamePhase> timedPhases() {
        return EnumSet.copyOf(TIMED);
    }
}
