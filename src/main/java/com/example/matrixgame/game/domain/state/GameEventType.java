package com.example.matrixgame.game.domain.state;

public enum GameEventType {
    GAME_CREATED,
    PLAYER_JOINED,
    PLAYER_LEFT,
    PLAYER_REJOINED,
    PERSONA_SELECTED,
    PERSONA_LEAD_CHANGED,
    PLAYER_ROLE_CHANGED,
    SETTINGS_UPDATED,
    GAME_STARTED,
    GAME_DELETED,
    ROUND_STARTED,
    ROUND_SUMMARY_SUBMITTED,
    ROUND_SUMMARY_EDITED,
    PHASE_CHANGED,
    ACTION_PROPOSED,
    NPC_ACTION_PROPOSED,
    ARGUMENT_ADDED,
    ARGUMENTATION_COMPLETED,
    VOTE_CAST,
    ACTION_RESOLVED,
    TOKENS_DRAWN,
    NARRATION_SUBMITTED,
    ARGUMENTATION_SKIPPED,
    VOTING_SKIPPED,
    PROPOSALS_SKIPPED,
    ACTION_EDITED,
    ARGUMENT_EDITED,
    NARRATION_EDITED,
    ARGUMENT_STRENGTH_TOGGLED,
    ARBITER_REVIEW_COMPLETED,
    PROPOSAL_TIMEOUT,
    ARGUMENTATION_TIMEOUT,
    VOTING_TIMEOUT,
    NARRATION_TIMEOUT,
    TIMEOUT_EXTENDED
}
