package com.arunika.websocket.saga;

import com.arunika.websocket.domain.ErrorCode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class StepExecution {
    private String stepId;
    private StepState state;
    private Instant startedAt;
    private Instant completedAt;
    private Object result;
    private ErrorCode errorCode;
    private String error;

    public StepExecution copy() {
        return toBuilder().build();
    }
}
