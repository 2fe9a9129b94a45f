package com.arunika.websocket.exception;

import com.arunika.websocket.domain.ErrorCode;

/**
 * Base exception for voice server errors. Every subtype maps onto one
 * {@link ErrorCode} so it can be reported to the device unchanged.
 */
public class VoiceServerException extends RuntimeException {

    private final ErrorCode errorCode;

    public VoiceServerException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public VoiceServerException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
