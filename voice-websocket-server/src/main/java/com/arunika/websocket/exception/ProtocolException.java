package com.arunika.websocket.exception;

import com.arunika.websocket.domain.ErrorCode;

/**
 * Thrown when a control message cannot be parsed or is not accepted from a device.
 */
public class ProtocolException extends VoiceServerException {

    public ProtocolException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(ErrorCode.VALIDATION_ERROR, message, cause);
    }
}
