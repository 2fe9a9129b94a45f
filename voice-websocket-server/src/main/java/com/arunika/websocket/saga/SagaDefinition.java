package com.arunika.websocket.saga;

import java.time.Duration;
import java.util.List;

/**
 * Named ordered list of steps with an overall deadline.
 */
public interface SagaDefinition {

    String name();

    List<SagaStep> steps();

    Duration timeout();
}
