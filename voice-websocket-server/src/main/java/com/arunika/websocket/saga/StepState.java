package com.arunika.websocket.saga;

public enum StepState {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    COMPENSATED
}
