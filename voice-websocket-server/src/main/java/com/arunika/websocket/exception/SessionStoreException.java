package com.arunika.websocket.exception;

import com.arunika.websocket.domain.ErrorCode;

/**
 * Thrown when the session store cannot read or write a session.
 */
public class SessionStoreException extends VoiceServerException {

    public SessionStoreException(String message) {
        super(ErrorCode.RESOURCE_ERROR, message);
    }

    public SessionStoreException(String message, Throwable cause) {
        super(ErrorCode.RESOURCE_ERROR, message, cause);
    }
}
