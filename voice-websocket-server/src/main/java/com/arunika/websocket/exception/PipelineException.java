package com.arunika.websocket.exception;

import com.arunika.websocket.domain.ErrorCode;

/**
 * Thrown by the conversation pipeline when a run ends compensated. The error
 * code is the one recorded by the failing step.
 */
public class PipelineException extends VoiceServerException {

    private final String sagaId;

    public PipelineException(String sagaId, ErrorCode errorCode, String message) {
        super(errorCode, message);
        this.sagaId = sagaId;
    }

    public String getSagaId() {
        return sagaId;
    }
}
