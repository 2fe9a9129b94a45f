package com.arunika.websocket.saga;

import com.arunika.websocket.domain.ErrorCode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Execution record of one saga run. Instances handed out by
 * {@link SagaManager#get(String)} are snapshots.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SagaInstance {
    private String id;
    private String definition;
    private SagaState state;
    private SagaData data;
    @Builder.Default
    private List<StepExecution> steps = new ArrayList<>();
    private Instant startedAt;
    private Instant completedAt;
    private ErrorCode errorCode;
    private String error;

    public StepExecution step(int index) {
        return steps.get(index);
    }

    SagaInstance snapshot() {
        List<StepExecution> copied = new ArrayList<>(steps.size());
        for (StepExecution step : steps) {
            copied.add(step.copy());
        }
        return SagaInstance.builder()
                .id(id)
                .definition(definition)
                .state(state)
                .data(data)
                .steps(copied)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .errorCode(errorCode)
                .error(error)
                .build();
    }
}
