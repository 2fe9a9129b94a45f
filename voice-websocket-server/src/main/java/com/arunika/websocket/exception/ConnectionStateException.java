package com.arunika.websocket.exception;

import com.arunika.websocket.domain.ConnectionState;
import com.arunika.websocket.domain.ErrorCode;

/**
 * Thrown when a control message arrives in a state that does not accept it,
 * for example {@code listening_end} while idle.
 */
public class ConnectionStateException extends VoiceServerException {

    private final ConnectionState state;

    public ConnectionStateException(String operation, ConnectionState state) {
        super(ErrorCode.STATE_ERROR, operation + " not allowed while " + state);
        this.state = state;
    }

    public ConnectionState getState() {
        return state;
    }
}
