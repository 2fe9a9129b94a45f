package com.arunika.websocket.saga;

public enum SagaEventType {
    SAGA_STARTED,
    SAGA_COMPLETED,
    SAGA_FAILED,
    SAGA_COMPENSATED,
    STEP_STARTED,
    STEP_COMPLETED,
    STEP_FAILED,
    STEP_COMPENSATED
}
