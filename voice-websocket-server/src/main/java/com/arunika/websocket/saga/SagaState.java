package com.arunika.websocket.saga;

/**
 * FAILED is only ever observed while compensation is running; every instance
 * ends COMPLETED or COMPENSATED.
 */
public enum SagaState {
    STARTED,
    RUNNING,
    COMPLETED,
    FAILED,
    COMPENSATED;

    public boolean isTerminal() {
        return this == COMPLETED || this == COMPENSATED;
    }
}
