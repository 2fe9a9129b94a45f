package com.arunika.websocket.saga;

/**
 * One unit of work in a saga. {@link #execute(SagaData)} reports failure
 * through its result; an exception thrown from it is treated the same way.
 */
public interface SagaStep {

    String id();

    StepResult execute(SagaData data);

    /**
     * Undoes a completed execution. Called at most once, in reverse step order.
     */
    void compensate(SagaData data) throws Exception;
}
