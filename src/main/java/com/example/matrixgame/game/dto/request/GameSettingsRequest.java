package com.example.matrixgame.game.dto.request;

import com.example.matrixgame.game.domain.entity.GameSettings;
import com.example.matrixgame.game.domain.state.NarrationMode;
import com.example.matrixgame.game.domain.state.PersonaArgumentMode;
import com.example.matrixgame.game.domain.state.PersonaVotingMode;

/**
 * Partial settings; absent fields keep their current value.
 */
public record GameSettingsRequest(
        Integer argumentLimit,
        Integer proposalTimeoutHours,
        Integer argumentationTimeoutHours,
        Integer votingTimeoutHours,
        Integer narrationTimeoutHours,
        String resolutionMethod,
        Boolean allowSharedPersonas,
        PersonaVotingMode sharedPersonaVoting,
        PersonaArgumentMode sharedPersonaArguments,
        NarrationMode narrationMode,
        Boolean personasRequired) {

    public GameSettings applyTo(GameSettings settings) {
        if (argumentLimit != null) settings.setArgumentLimit(argumentLimit);
        if (proposalTimeoutHours != null) settings.setProposalTimeoutHours(proposalTimeoutHours);
        if (argumentationTimeoutHours != null) settings.setArgumentationTimeoutHours(argumentationTimeoutHours);
        if (votingTimeoutHours != null) settings.setVotingTimeoutHours(votingTimeoutHours);
        if (narrationTimeoutHours != null) settings.setNarrationTimeoutHours(narrationTimeoutHours);
        if (resolutionMethod != null) settings.setResolutionMethod(resolutionMethod);
        if (allowSharedPersonas != null) settings.setAllowSharedPersonas(allowSharedPersonas);
        if (sharedPersonaVoting != null) settings.setSharedPersonaVoting(sharedPersonaVoting);
        if (sharedPersonaArguments != null) settings.setSharedPersonaArguments(sharedPersonaArguments);
        if (narrationMode != null) settings.setNarrationMode(narrationMode);
        if (personasRequired != null) settings.setPersonasRequired(personasRequired);
        return settings;
    }
}
