package com.arunika.websocket.saga;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class SagaEvent {
    String sagaId;
    String definition;
    /** Null for saga-level events. */
    String stepId;
    SagaEventType type;
    Instant timestamp;
    String error;
}
