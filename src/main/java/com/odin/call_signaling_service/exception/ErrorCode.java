package com.odin.call_signaling_service.exception;

import org.springframework.http.HttpStatus;

/**
 * Machine-readable rejection reasons surfaced to REST and signaling clients.
 */
public enum ErrorCode {

    VALIDATION_ERROR("validation_error", HttpStatus.BAD_REQUEST),
    UNAUTHORIZED("unauthorized", HttpStatus.UNAUTHORIZED),
    CANNOT_CALL_SELF("cannot_call_self", HttpStatus.BAD_REQUEST),
    PARTICIPANT_NOT_FOUND("participant_not_found", HttpStatus.NOT_FOUND),
    CALL_NOT_FOUND("call_not_found", HttpStatus.NOT_FOUND),
    NOT_A_PARTICIPANT("not_a_participant", HttpStatus.FORBIDDEN),
    ACCESS_DENIED("access_denied", HttpStatus.FORBIDDEN),
    CANNOT_ANSWER_NOW("cannot_answer_now", HttpStatus.BAD_REQUEST),
    CANNOT_DECLINE("cannot_decline", HttpStatus.BAD_REQUEST),
    INVALID_CALL_STATE("invalid_call_state", HttpStatus.BAD_REQUEST),
    INVITER_NOT_ACTIVE("inviter_not_active", HttpStatus.FORBIDDEN),
    EXCEEDS_MAX_PARTICIPANTS("exceeds_max_participants", HttpStatus.BAD_REQUEST),
    ALREADY_IN_CALL("already_in_call", HttpStatus.CONFLICT),
    CONCURRENT_MODIFICATION("concurrent_modification", HttpStatus.CONFLICT);

    private final String reason;
    private final HttpStatus httpStatus;

    ErrorCode(String reason, HttpStatus httpStatus) {
        this.reason = reason;
        this.httpStatus = httpStatus;
    }

    public String getReason() {
        return reason;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
