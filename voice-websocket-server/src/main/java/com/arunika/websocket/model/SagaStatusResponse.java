package com.arunika.websocket.model;

import com.arunika.websocket.domain.ErrorCode;
import com.arunika.websocket.saga.SagaInstance;
import com.arunika.websocket.saga.SagaState;
import com.arunika.websocket.saga.StepExecution;
import com.arunika.websocket.saga.StepState;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Saga progress as served by {@code GET /api/sagas/{id}}. Saga data is left
 * out since it holds audio and provider handles.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SagaStatusResponse {

    @JsonProperty("saga_id")
    private String sagaId;

    private String definition;
    private SagaState state;

    @JsonProperty("error_code")
    private ErrorCode errorCode;

    private String error;

    @JsonProperty("started_at")
    private Instant startedAt;

    @JsonProperty("completed_at")
    private Instant completedAt;

    private List<Step> steps;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Step {
        private String id;
        private StepState state;

        @JsonProperty("started_at")
        private Instant startedAt;

        @JsonProperty("completed_at")
        private Instant completedAt;

        private String error;
    }

    public static SagaStatusResponse from(SagaInstance instance) {
        return SagaStatusResponse.builder()
                .sagaId(instance.getId())
                .definition(instance.getDefinition())
                .state(instance.getState())
                .errorCode(instance.getErrorCode())
                .error(instance.getError())
                .startedAt(instance.getStartedAt())
                .completedAt(instance.getCompletedAt())
                .steps(instance.getSteps().stream().map(SagaStatusResponse::step).toList())
                .build();
    }

    private static Step step(StepExecution execution) {
        return Step.builder()
                .id(execution.getStepId())
                .state(execution.getState())
                .startedAt(execution.getStartedAt())
                .completedAt(execution.getCompletedAt())
                .error(execution.getError())
                .build();
    }
}
