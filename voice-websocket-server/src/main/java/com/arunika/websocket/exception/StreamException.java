package com.arunika.websocket.exception;

import com.arunika.websocket.domain.ErrorCode;

/**
 * Thrown by capability adapters (recognizer, synthesizer, conversation model)
 * when a provider call fails.
 */
public class StreamException extends VoiceServerException {

    public StreamException(String message) {
        super(ErrorCode.STREAM_ERROR, message);
    }

    public StreamException(String message, Throwable cause) {
        super(ErrorCode.STREAM_ERROR, message, cause);
    }
}
