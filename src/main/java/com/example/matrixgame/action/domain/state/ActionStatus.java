package com.example.matrixgame.action.domain.state;

/**
 * ARGUING -> VOTING -> RESOLVED -> NARRATED, never re-entered.
 */
public enum ActionStatus {
    ARGUING,
    VOTING,
    RESOLVED,
    NARRATED
}
