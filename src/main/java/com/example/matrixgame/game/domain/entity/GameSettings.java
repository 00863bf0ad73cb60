package com.example.matrixgame.game.domain.entity;

import com.example.matrixgame.game.domain.state.GamePhase;
import com.example.matrixgame.game.domain.state.NarrationMode;
import com.example.matrixgame.game.domain.state.PersonaArgumentMode;
import com.example.matrixgame.game.domain.state.PersonaVotingMode;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Per-game rules consumed by the phase orchestrator. Timeout hours of -1 mean "no timeout".
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
public class GameSettings {

    public static final int INFINITE_TIMEOUT = -1;
    public static final int MAX_TIMEOUT_HOURS = 168;
    public static final int DEFAULT_ARGUMENT_LIMIT = 3;
    public static final String DEFAULT_RESOLUTION_METHOD = "token_draw";

    @Column(name = "argument_limit", nullable = false)
    private int argumentLimit = DEFAULT_ARGUMENT_LIMIT;

    @Column(name = "proposal_timeout_hours", nullable = false)
    private int proposalTimeoutHours = INFINITE_TIMEOUT;

    @Column(name = "argumentation_timeout_hours", nullable = false)
    private int argumentationTimeoutHours = INFINITE_TIMEOUT;

    @Column(name = "voting_timeout_hours", nullable = false)
    private int votingTimeoutHours = INFINITE_TIMEOUT;

    @Column(name = "narration_timeout_hours", nullable = false)
    private int narrationTimeoutHours = INFINITE_TIMEOUT;

    @Column(name = "resolution_method", nullable = false, length = 40)
    private String resolutionMethod = DEFAULT_RESOLUTION_METHOD;

    @Column(name = "allow_shared_personas", nullable = false)
    private boolean allowSharedPersonas = false;

    @Enumerated(EnumType.STRING)
    @Column(name = "shared_persona_voting", nullable = false, length = 20)
    private PersonaVotingMode sharedPersonaVoting = PersonaVotingMode.EACH_MEMBER;

    @Enumerated(EnumType.STRING)
    @Column(name = "shared_persona_arguments", nullable = false, length = 20)
    private PersonaArgumentMode sharedPersonaArguments = PersonaArgumentMode.INDEPENDENT;

    @Enumerated(EnumType.STRING)
    @Column(name = "narration_mode", nullable = false, length = 20)
    private NarrationMode narrationMode = NarrationMode.INITIATOR_ONLY;

    @Column(name = "personas_required", nullable = false)
    private boolean personasRequired = false;

    /**
     * Configured timeout for a phase in hours, or {@link #INFINITE_TIMEOUT} when the phase has none.
     */
    public int timeoutHoursFor(GamePhase phase) {
        return switch (phase) {
            case PROPOSAL -> proposalTimeoutHours;
            case ARGUMENTATION -> argumentationTimeoutHours;
            case VOTING -> votingTimeoutHours;
            case NARRATION -> narrationTimeoutHours;
            default -> INFINITE_TIMEOUT;
        };
    }

    public boolean isOnePerPersonaVoting() {
        return allowSharedPersonas && sharedPersonaVoting == PersonaVotingMode.ONE_PER_PERSONA;
    }

    public boolean isSharedArgumentPool() {
        return allowSharedPersonas && sharedPersonaArguments == PersonaArgumentMode.SHARED_POOL;
    }
}
