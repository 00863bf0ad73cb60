package com.example.matrixgame.global.error;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import static com.example.matrixgame.global.error.ErrorKind.INVALID_STATE;
import static com.example.matrixgame.global.error.ErrorKind.NOT_FOUND;
import static com.example.matrixgame.global.error.ErrorKind.PERMISSION_DENIED;

@Getter
public enum ErrorCode {
    // not found
    GAME_NOT_FOUND(NOT_FOUND, "GAME_NOT_FOUND", "Game not found"),
    ROUND_NOT_FOUND(NOT_FOUND, "ROUND_NOT_FOUND", "Round not found"),
    ROUND_SUMMARY_NOT_FOUND(NOT_FOUND, "ROUND_SUMMARY_NOT_FOUND", "Round summary not found"),
    PLAYER_NOT_FOUND(NOT_FOUND, "PLAYER_NOT_FOUND", "Player not found"),
    PERSONA_NOT_FOUND(NOT_FOUND, "PERSONA_NOT_FOUND", "Persona not found"),
    ACTION_NOT_FOUND(NOT_FOUND, "ACTION_NOT_FOUND", "Action not found"),
    ARGUMENT_NOT_FOUND(NOT_FOUND, "ARGUMENT_NOT_FOUND", "Argument not found"),
    NARRATION_NOT_FOUND(NOT_FOUND, "NARRATION_NOT_FOUND", "Narration not found"),

    // invalid state
    INVALID_INPUT(INVALID_STATE, "INVALID_INPUT", "Invalid input"),
    INVALID_PHASE_TRANSITION(INVALID_STATE, "INVALID_PHASE_TRANSITION", "Invalid phase transition"),
    WRONG_PHASE(INVALID_STATE, "WRONG_PHASE", "Operation is not allowed in the current phase"),
    GAME_NOT_IN_LOBBY(INVALID_STATE, "GAME_NOT_IN_LOBBY", "Game is not in the lobby"),
    GAME_NOT_ACTIVE(INVALID_STATE, "GAME_NOT_ACTIVE", "Game is not active"),
    NOT_ENOUGH_PLAYERS(INVALID_STATE, "NOT_ENOUGH_PLAYERS", "At least 2 active players are required"),
    PERSONA_REQUIRED(INVALID_STATE, "PERSONA_REQUIRED", "Every player must select a persona"),
    NPC_PERSONA_NOT_SELECTABLE(INVALID_STATE, "NPC_PERSONA_NOT_SELECTABLE", "The NPC persona cannot be selected"),
    MULTIPLE_NPC_PERSONAS(INVALID_STATE, "MULTIPLE_NPC_PERSONAS", "Only one NPC persona is allowed"),
    NOT_PERSONA_MEMBER(INVALID_STATE, "NOT_PERSONA_MEMBER", "Player is not a member of this persona"),
    HOST_CANNOT_LEAVE(INVALID_STATE, "HOST_CANNOT_LEAVE", "The host cannot leave the game"),
    INVALID_SETTINGS(INVALID_STATE, "INVALID_SETTINGS", "Invalid game settings"),
    UNKNOWN_RESOLUTION_STRATEGY(INVALID_STATE, "UNKNOWN_RESOLUTION_STRATEGY", "Unknown resolution strategy"),
    STRATEGY_MISMATCH(INVALID_STATE, "STRATEGY_MISMATCH", "Operation is not supported by the game's resolution strategy"),
    VOTING_NOT_USED(INVALID_STATE, "VOTING_NOT_USED", "Votes are not used by this resolution strategy"),
    NO_ARBITER(INVALID_STATE, "NO_ARBITER", "An arbiter must be assigned before review"),
    ACTION_NOT_ARGUING(INVALID_STATE, "ACTION_NOT_ARGUING", "Action is not in argumentation"),
    ACTION_NOT_VOTING(INVALID_STATE, "ACTION_NOT_VOTING", "Action is not in voting"),
    ACTION_NOT_RESOLVED(INVALID_STATE, "ACTION_NOT_RESOLVED", "Action has not been resolved"),
    INITIAL_ARGUMENTS_REQUIRED(INVALID_STATE, "INITIAL_ARGUMENTS_REQUIRED", "Between 1 and the argument limit of opening arguments are required"),
    CLARIFICATION_ONLY(INVALID_STATE, "CLARIFICATION_ONLY", "The initiator may only add clarifications"),
    CLARIFICATION_NOT_ALLOWED(INVALID_STATE, "CLARIFICATION_NOT_ALLOWED", "Only the initiator may add clarifications"),
    ARGUMENT_LIMIT_REACHED(INVALID_STATE, "ARGUMENT_LIMIT_REACHED", "Argument limit reached"),
    SIDE_LIMIT_REACHED(INVALID_STATE, "SIDE_LIMIT_REACHED", "Argument limit for this side reached"),
    NO_ACTIONS_THIS_ROUND(INVALID_STATE, "NO_ACTIONS_THIS_ROUND", "At least one action must be proposed before moving on"),
    ROUND_NOT_COMPLETE(INVALID_STATE, "ROUND_NOT_COMPLETE", "Round is not complete"),
    ROUND_ALREADY_FULL(INVALID_STATE, "ROUND_ALREADY_FULL", "Round already has all of its actions completed"),
    TIMEOUT_NOT_APPLICABLE(INVALID_STATE, "TIMEOUT_NOT_APPLICABLE", "The current phase has no timeout"),

    // permission denied
    NOT_A_MEMBER(PERMISSION_DENIED, "NOT_A_MEMBER", "Not a member of this game"),
    HOST_ONLY(PERMISSION_DENIED, "HOST_ONLY", "Only the host can perform this action"),
    INITIATOR_ONLY(PERMISSION_DENIED, "INITIATOR_ONLY", "Only the initiator can perform this action"),
    PERSONA_LEAD_ONLY(PERMISSION_DENIED, "PERSONA_LEAD_ONLY", "Only the persona lead can act for a shared persona"),
    ARBITER_ONLY(PERMISSION_DENIED, "ARBITER_ONLY", "Only the arbiter can perform this action"),
    NARRATION_NOT_PERMITTED(PERMISSION_DENIED, "NARRATION_NOT_PERMITTED", "Not allowed to narrate this action"),

    // conflict
    CONFLICT(ErrorKind.CONFLICT, "CONFLICT", "The request conflicts with existing data"),
    CONCURRENT_UPDATE(ErrorKind.CONFLICT, "CONCURRENT_UPDATE", "The state changed concurrently"),
    ACTION_ALREADY_PROPOSED(ErrorKind.CONFLICT, "ACTION_ALREADY_PROPOSED", "This acting unit already proposed an action this round"),
    ALREADY_VOTED(ErrorKind.CONFLICT, "ALREADY_VOTED", "Already voted on this action"),
    PERSONA_ALREADY_VOTED(ErrorKind.CONFLICT, "PERSONA_ALREADY_VOTED", "Another member of this persona already voted"),
    ALREADY_RESOLVED(ErrorKind.CONFLICT, "ALREADY_RESOLVED", "Action has already been resolved"),
    ALREADY_NARRATED(ErrorKind.CONFLICT, "ALREADY_NARRATED", "Action has already been narrated"),
    PERSONA_ALREADY_CLAIMED(ErrorKind.CONFLICT, "PERSONA_ALREADY_CLAIMED", "Persona is already claimed"),
    ARBITER_ALREADY_ASSIGNED(ErrorKind.CONFLICT, "ARBITER_ALREADY_ASSIGNED", "Another player is already the arbiter"),
    ARBITER_REVIEW_IN_PROGRESS(ErrorKind.CONFLICT, "ARBITER_REVIEW_IN_PROGRESS", "Cannot change the arbiter during review"),
    ROUND_SUMMARY_EXISTS(ErrorKind.CONFLICT, "ROUND_SUMMARY_EXISTS", "Round summary already submitted"),
    ;
    private final ErrorKind kind;
    private final String code;
    private final String message;

    ErrorCode(ErrorKind kind, String code, String message) {
        this.kind = kind;
        this.message = message;
        this.code = code;
    }

    public HttpStatus getStatus() {
        return kind.getStatus();
    }

    public CommonException commonException() {return new CommonException(this);}

    public CommonException commonException(String message) {return new CommonException(this, message);}
}
