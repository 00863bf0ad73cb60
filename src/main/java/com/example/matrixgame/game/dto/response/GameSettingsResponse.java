package com.example.matrixgame.game.dto.response;

import com.example.matrixgame.game.domain.entity.GameSettings;
import com.example.matrixgame.game.domain.state.NarrationMode;
import com.example.matrixgame.game.domain.state.PersonaArgumentMode;
import com.example.matrixgame.game.domain.state.PersonaVotingMode;

public record GameSettingsResponse(
        int argumentLimit,
        int proposalTimeoutHours,
        int argumentationTimeoutHours,
        int votingTimeoutHours,
        int narrationTimeoutHours,
        String resolutionMethod,
        boolean allowSharedPersonas,
        PersonaVotingMode sharedPersonaVoting,
        PersonaArgumentMode sharedPersonaArguments,
        NarrationMode narrationMode,
        boolean personasRequired) {

    public static GameSettingsResponse from(GameSettings settings) {
        return new GameSettingsResponse(settings.getArgumentLimit(), settings.getProposalTimeoutHours(),
                settings.getArgumentationTimeoutHours(), settings.getVotingTimeoutHours(),
                settings.getNarrationTimeoutHours(), settings.getResolutionMethod(),
                settings.isAllowSharedPersonas(), settings.getSharedPersonaVoting(),
                settings.getSharedPersonaArguments(), settings.getNarrationMode(), settings.isPersonasRequired());
    }
}
