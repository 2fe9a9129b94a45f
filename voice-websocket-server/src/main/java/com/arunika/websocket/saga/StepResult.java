package com.arunika.websocket.saga;

import com.arunika.websocket.domain.ErrorCode;
import com.arunika.websocket.exception.VoiceServerException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of one step execution.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class StepResult {
    boolean success;
    Object data;
    ErrorCode errorCode;
    String error;
    Throwable cause;

    public static StepResult success(Object data) {
        return new StepResult(true, data, null, null, null);
    }

    public static StepResult failure(ErrorCode errorCode, String error) {
        return new StepResult(false, null, errorCode, error, null);
    }

    public static StepResult failure(ErrorCode errorCode, String error, Throwable cause) {
        return new StepResult(false, null, errorCode, error, cause);
    }

    /**
     * Maps an exception thrown by a capability to a failed result, keeping the
     * code carried by {@link VoiceServerException}s.
     */
    public static StepResult fromException(Exception e) {
        if (e instanceof VoiceServerException vse) {
            return failure(vse.getErrorCode(), vse.getMessage(), vse);
        }
        return failure(ErrorCode.STREAM_ERROR, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), e);
    }
}
