package com.example.socialdeduction.global.error;

import lombok.Getter;

/**
 * Setup failures. Everything that can go wrong after the first phase starts is
 * recovered inside the engine and recorded as an incident instead.
 */
@Getter
public enum ErrorCode {
    INVALID_PLAYER_COUNT("INVALID_PLAYER_COUNT", "Player count is not supported by this game"),
    ROLE_COUNT_MISMATCH("ROLE_COUNT_MISMATCH", "Roster does not match the role table"),
    DUPLICATE_PLAYER_NAME("DUPLICATE_PLAYER_NAME", "Player names must be unique and non-blank"),
    UNKNOWN_VARIANT("UNKNOWN_VARIANT", "No game variant registered under this key"),
    MISSING_AGENT("MISSING_AGENT", "Every seat needs an agent"),
    ;
    private final String code;
    private final String message;

    ErrorCode(String code, String message) {
        this.message = message;
        this.code = code;
    }

    public CommonException commonException() {return new CommonException(this);}

    public CommonException commonException(String detail) {return new CommonException(this, detail);}
}
