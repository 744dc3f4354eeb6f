package com.example.fishbowl.global.error;

import java.util.Map;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public enum ErrorCode {
    INVALID_REQUEST(ErrorType.VALIDATION, HttpStatus.BAD_REQUEST, "INVALID_REQUEST", "Invalid request"),
    INVALID_GAME_CODE(ErrorType.VALIDATION, HttpStatus.BAD_REQUEST, "INVALID_GAME_CODE", "Invalid game code"),
    INVALID_GAME_CONFIG(ErrorType.VALIDATION, HttpStatus.BAD_REQUEST, "INVALID_GAME_CONFIG", "Invalid game configuration"),
    DUPLICATE_PLAYER_NAME(ErrorType.VALIDATION, HttpStatus.BAD_REQUEST, "DUPLICATE_PLAYER_NAME", "Player name is already taken in this game"),
    TEAM_COUNT_NOT_SATISFIED(ErrorType.VALIDATION, HttpStatus.BAD_REQUEST, "TEAM_COUNT_NOT_SATISFIED", "Number of teams does not match the game configuration"),
    NOT_ENOUGH_PLAYERS(ErrorType.VALIDATION, HttpStatus.BAD_REQUEST, "NOT_ENOUGH_PLAYERS", "Not enough players to start the game"),
    PLAYER_WITHOUT_TEAM(ErrorType.VALIDATION, HttpStatus.BAD_REQUEST, "PLAYER_WITHOUT_TEAM", "Every player must be assigned to a team"),
    NOT_ENOUGH_PHRASES(ErrorType.VALIDATION, HttpStatus.BAD_REQUEST, "NOT_ENOUGH_PHRASES", "Not enough phrases have been submitted"),
    PHRASE_QUOTA_NOT_MET(ErrorType.VALIDATION, HttpStatus.BAD_REQUEST, "PHRASE_QUOTA_NOT_MET", "A player has not submitted all of their phrases"),
    PHRASE_QUOTA_EXCEEDED(ErrorType.VALIDATION, HttpStatus.BAD_REQUEST, "PHRASE_QUOTA_EXCEEDED", "Player would exceed the phrase quota"),
    NOT_YOUR_TURN(ErrorType.VALIDATION, HttpStatus.FORBIDDEN, "NOT_YOUR_TURN", "Not your turn"),
    HOST_ONLY(ErrorType.VALIDATION, HttpStatus.FORBIDDEN, "HOST_ONLY", "Only the host can perform this operation"),
    PLAYER_NOT_IN_GAME(ErrorType.VALIDATION, HttpStatus.FORBIDDEN, "PLAYER_NOT_IN_GAME", "Player does not belong to this game"),
    PHRASE_NOT_OWNED(ErrorType.VALIDATION, HttpStatus.FORBIDDEN, "PHRASE_NOT_OWNED", "Phrase belongs to another player"),
    DUPLICATE_PHRASE(ErrorType.VALIDATION, HttpStatus.BAD_REQUEST, "DUPLICATE_PHRASE", "This phrase already exists in the game"),
    PHRASE_NOT_ACTIVE(ErrorType.VALIDATION, HttpStatus.BAD_REQUEST, "PHRASE_NOT_ACTIVE", "Phrase is not in play"),

    INVALID_GAME_STATE(ErrorType.STATE_CONFLICT, HttpStatus.CONFLICT, "INVALID_GAME_STATE", "Game is not in the correct state for this operation"),
    INVALID_STATE_TRANSITION(ErrorType.STATE_CONFLICT, HttpStatus.CONFLICT, "INVALID_STATE_TRANSITION", "Illegal game state transition"),
    GAME_NOT_ACCEPTING_PLAYERS(ErrorType.STATE_CONFLICT, HttpStatus.CONFLICT, "GAME_NOT_ACCEPTING_PLAYERS", "Game is no longer accepting new players"),
    NO_CURRENT_TURN(ErrorType.STATE_CONFLICT, HttpStatus.CONFLICT, "NO_CURRENT_TURN", "No current turn found"),
    NO_ELIGIBLE_PLAYER(ErrorType.STATE_CONFLICT, HttpStatus.CONFLICT, "NO_ELIGIBLE_PLAYER", "No connected player is available to take the turn"),

    GAME_NOT_FOUND(ErrorType.NOT_FOUND, HttpStatus.NOT_FOUND, "GAME_NOT_FOUND", "Game not found"),
    PLAYER_NOT_FOUND(ErrorType.NOT_FOUND, HttpStatus.NOT_FOUND, "PLAYER_NOT_FOUND", "Player not found"),
    TURN_NOT_FOUND(ErrorType.NOT_FOUND, HttpStatus.NOT_FOUND, "TURN_NOT_FOUND", "Turn not found"),
    PHRASE_NOT_FOUND(ErrorType.NOT_FOUND, HttpStatus.NOT_FOUND, "PHRASE_NOT_FOUND", "Phrase not found"),
    TEAM_NOT_FOUND(ErrorType.NOT_FOUND, HttpStatus.NOT_FOUND, "TEAM_NOT_FOUND", "Team not found"),

    TURN_ORDER_CORRUPTED(ErrorType.INTEGRITY, HttpStatus.INTERNAL_SERVER_ERROR, "TURN_ORDER_CORRUPTED", "Turn order is corrupted"),
    ;
    private final ErrorType type;
    private final HttpStatus status;
    private final String code;
    private final String message;

    ErrorCode(ErrorType type, HttpStatus status, String code, String message) {
        this.type = type;
        this.status = status;
        this.code = code;
        this.message = message;
    }

    public CommonException commonException() {return new CommonException(this);}

    public CommonException commonException(Map<String, Object> details) {return new CommonException(this, details);}
}
