package com.odin.call_signaling_service.exception;

import lombok.Getter;

@Getter
public class CallServiceException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorCode errorCode;

    public CallServiceException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public CallServiceException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public boolean isConflict() {
        return errorCode == ErrorCode.ALREADY_IN_CALL || errorCode == ErrorCode.CONCURRENT_MODIFICATION;
    }
}
