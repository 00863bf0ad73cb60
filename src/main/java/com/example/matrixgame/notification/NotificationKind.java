package com.example.matrixgame.notification;

public enum NotificationKind {
    GAME_UPDATED,
    GAME_STARTED,
    PLAYER_JOINED,
    PLAYER_LEFT,
    PHASE_CHANGED,
    ROUND_STARTED,
    ROUND_SUMMARY_NEEDED,
    ACTION_PROPOSED,
    ARGUMENT_ADDED,
    ARGUMENTATION_COMPLETED,
    VOTING_STARTED,
    VOTE_CAST,
    ARBITER_REVIEW_READY,
    RESOLUTION_READY,
    TOKENS_DRAWN,
    NARRATION_SUBMITTED,
    TIMEOUT_WARNING
}
