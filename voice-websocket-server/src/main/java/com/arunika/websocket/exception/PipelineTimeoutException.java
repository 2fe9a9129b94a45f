package com.arunika.websocket.exception;

import com.arunika.websocket.domain.ErrorCode;

import java.time.Duration;

/**
 * Thrown when a caller gives up waiting for a pipeline run.
 */
public class PipelineTimeoutException extends VoiceServerException {

    public PipelineTimeoutException(String sagaId, Duration waited) {
        super(ErrorCode.TIMEOUT_ERROR,
                "pipeline " + sagaId + " did not finish within " + waited.toMillis() + "ms");
    }
}
