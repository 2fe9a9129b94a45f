package com.arunika.websocket.saga;

import com.arunika.websocket.config.VoiceProperties;
import com.arunika.websocket.domain.ErrorCode;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Runs saga definitions step by step with reverse-order compensation.
 *
 * <p>Each started instance gets one unit on the saga executor. The steps of an
 * instance run on the step executor so the saga unit can race the definition's
 * deadline. Instances live in a registry guarded by a read/write lock; readers
 * get snapshots. Lifecycle events go to a bounded queue and are dropped, with
 * a warning, when nobody drains it.
 */
@Service
@Slf4j
public class SagaManager {

    private final Map<String, SagaDefinition> definitions = new ConcurrentHashMap<>();
    private final Map<String, SagaInstance> instances = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final BlockingQueue<SagaEvent> events;
    private final AtomicLong droppedEvents = new AtomicLong();

    private final ExecutorService sagaExecutor;
    private final ExecutorService stepExecutor;
    private final ScheduledExecutorService maintenanceExecutor;
    private final Duration retention;
    private final Clock clock;

    public SagaManager(@Qualifier("sagaExecutor") ExecutorService sagaExecutor,
                       @Qualifier("sagaStepExecutor") ExecutorService stepExecutor,
                       VoiceProperties properties,
                       Clock clock) {
        this.sagaExecutor = sagaExecutor;
        this.stepExecutor = stepExecutor;
        this.clock = clock;
        this.events = new ArrayBlockingQueue<>(properties.getSaga().getEventQueueCapacity());
        this.retention = properties.getSaga().getRetention();

        this.maintenanceExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "saga-maintenance");
            t.setDaemon(true);
            return t;
        });
        long purgeMs = properties.getSaga().getPurgeInterval().toMillis();
        maintenanceExecutor.scheduleAtFixedRate(this::purgeExpired, purgeMs, purgeMs, TimeUnit.MILLISECONDS);

        log.info("SagaManager initialized: eventQueue={}, retention={}",
                properties.getSaga().getEventQueueCapacity(), retention);
    }

    public void registerDefinition(SagaDefinition definition) {
        definitions.put(definition.name(), definition);
        log.info("Registered saga definition: name={}, steps={}, timeout={}",
                definition.name(), definition.steps().stream().map(SagaStep::id).toList(), definition.timeout());
    }

    /**
     * Creates an instance for the named definition and schedules it.
     *
     * @return the instance id, {@code <definition>_<uuid>}
     * @throws IllegalArgumentException if the definition is unknown
     */
    public String start(String definitionName, SagaData data) {
        SagaDefinition definition = definitions.get(definitionName);
        if (definition == null) {
            throw new IllegalArgumentException("saga definition not found: " + definitionName);
        }

        String sagaId = definitionName + "_" + UUID.randomUUID();
        SagaInstance instance = SagaInstance.builder()
                .id(sagaId)
                .definition(definitionName)
                .state(SagaState.STARTED)
                .data(data)
                .startedAt(clock.instant())
                .build();
        for (SagaStep step : definition.steps()) {
            instance.getSteps().add(StepExecution.builder()
                    .stepId(step.id())
                    .state(StepState.PENDING)
                    .build());
        }

        lock.writeLock().lock();
        try {
            instances.put(sagaId, instance);
        } finally {
            lock.writeLock().unlock();
        }
        emit(instance, null, SagaEventType.SAGA_STARTED, null);

        try {
            sagaExecutor.execute(() -> run(definition, instance));
        } catch (RejectedExecutionException e) {
            log.error("Saga executor saturated, abandoning saga: sagaId={}", sagaId);
            fail(instance, -1, ErrorCode.RESOURCE_ERROR, "saga executor saturated");
            compensate(definition, instance, -1);
        }
        return sagaId;
    }

    /**
     * Non-blocking snapshot lookup.
     */
    public Optional<SagaInstance> get(String sagaId) {
        lock.readLock().lock();
        try {
            SagaInstance instance = instances.get(sagaId);
            return instance == null ? Optional.empty() : Optional.of(instance.snapshot());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Waits up to {@code timeout} for the next lifecycle event.
     *
     * @return the event, or {@code null} if none arrived
     */
    public SagaEvent pollEvent(Duration timeout) throws InterruptedException {
        return events.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public long getDroppedEventCount() {
        return droppedEvents.get();
    }

    public int getInstanceCount() {
        lock.readLock().lock();
        try {
            return instances.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    // ===== Execution =====

    private void run(SagaDefinition definition, SagaInstance instance) {
        List<SagaStep> steps = definition.steps();
        long deadlineNanos = System.nanoTime() + definition.timeout().toNanos();
        int current = -1;

        try {
            setState(instance, SagaState.RUNNING);

            for (int i = 0; i < steps.size(); i++) {
                current = i;
                SagaStep step = steps.get(i);
                StepResult result = executeStep(instance, i, step, deadlineNanos, definition.timeout());

                if (!result.isSuccess()) {
                    failStep(instance, i, result);
                    fail(instance, i, result.getErrorCode(), result.getError());
                    compensate(definition, instance, i - 1);
                    return;
                }
                completeStep(instance, i, result);
            }

            lock.writeLock().lock();
            try {
                instance.setState(SagaState.COMPLETED);
                instance.setCompletedAt(clock.instant());
            } finally {
                lock.writeLock().unlock();
            }
            emit(instance, null, SagaEventType.SAGA_COMPLETED, null);
            log.info("Saga completed: sagaId={}, elapsed={}ms", instance.getId(),
                    Duration.between(instance.getStartedAt(), instance.getCompletedAt()).toMillis());

        } catch (RuntimeException e) {
            // Never leave an instance non-terminal
            log.error("Saga execution crashed: sagaId={}", instance.getId(), e);
            if (current >= 0) {
                failStep(instance, current, StepResult.fromException(e));
            }
            fail(instance, current, ErrorCode.STREAM_ERROR, "saga execution crashed: " + e.getMessage());
            compensate(definition, instance, current - 1);
        }
    }

    private StepResult executeStep(SagaInstance instance, int index, SagaStep step,
                                   long deadlineNanos, Duration timeout) {
        long remainingNanos = deadlineNanos - System.nanoTime();
        if (remainingNanos <= 0) {
            return StepResult.failure(ErrorCode.TIMEOUT_ERROR, deadlineMessage(timeout, step));
        }

        lock.writeLock().lock();
        try {
            StepExecution execution = instance.step(index);
            execution.setState(StepState.RUNNING);
            execution.setStartedAt(clock.instant());
        } finally {
            lock.writeLock().unlock();
        }
        emit(instance, step.id(), SagaEventType.STEP_STARTED, null);
        log.debug("Executing step: sagaId={}, step={}", instance.getId(), step.id());

        Future<StepResult> future;
        try {
            future = stepExecutor.submit(() -> step.execute(instance.getData()));
        } catch (RejectedExecutionException e) {
            return StepResult.failure(ErrorCode.RESOURCE_ERROR, "step executor saturated", e);
        }

        try {
            StepResult result = future.get(remainingNanos, TimeUnit.NANOSECONDS);
            if (result == null) {
                return StepResult.failure(ErrorCode.STREAM_ERROR, "step " + step.id() + " returned no result");
            }
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Saga deadline exceeded: sagaId={}, step={}, timeout={}", instance.getId(), step.id(), timeout);
            return StepResult.failure(ErrorCode.TIMEOUT_ERROR, deadlineMessage(timeout, step));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) {
                return StepResult.fromException(ex);
            }
            throw new IllegalStateException("step " + step.id() + " failed fatally", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return StepResult.failure(ErrorCode.TIMEOUT_ERROR, "interrupted during step " + step.id());
        }
    }

    /**
     * Walks completed steps from {@code lastCompleted} down to the first.
     * A failing compensation is logged and the walk continues.
     */
    private void compensate(SagaDefinition definition, SagaInstance instance, int lastCompleted) {
        List<SagaStep> steps = definition.steps();
        for (int i = lastCompleted; i >= 0; i--) {
            SagaStep step = steps.get(i);
            StepExecution execution = instance.step(i);
            if (execution.getState() != StepState.COMPLETED) {
                continue;
            }
            try {
                step.compensate(instance.getData());
                lock.writeLock().lock();
                try {
                    execution.setState(StepState.COMPENSATED);
                } finally {
                    lock.writeLock().unlock();
                }
                emit(instance, step.id(), SagaEventType.STEP_COMPENSATED, null);
                log.debug("Step compensated: sagaId={}, step={}", instance.getId(), step.id());
            } catch (Exception e) {
                log.error("Compensation failed: sagaId={}, step={}", instance.getId(), step.id(), e);
                lock.writeLock().lock();
                try {
                    execution.setError("compensation failed: " + e.getMessage());
                } finally {
                    lock.writeLock().unlock();
                }
            }
        }

        lock.writeLock().lock();
        try {
            instance.setState(SagaState.COMPENSATED);
            instance.setCompletedAt(clock.instant());
        } finally {
            lock.writeLock().unlock();
        }
        emit(instance, null, SagaEventType.SAGA_COMPENSATED, instance.getError());
        log.info("Saga compensated: sagaId={}, errorCode={}, error={}",
                instance.getId(), instance.getErrorCode(), instance.getError());
    }

    private void completeStep(SagaInstance instance, int index, StepResult result) {
        StepExecution execution = instance.step(index);
        lock.writeLock().lock();
        try {
            execution.setState(StepState.COMPLETED);
            execution.setCompletedAt(clock.instant());
            execution.setResult(result.getData());
        } finally {
            lock.writeLock().unlock();
        }
        emit(instance, execution.getStepId(), SagaEventType.STEP_COMPLETED, null);
    }

    private void failStep(SagaInstance instance, int index, StepResult result) {
        StepExecution execution = instance.step(index);
        lock.writeLock().lock();
        try {
            execution.setState(StepState.FAILED);
            execution.setCompletedAt(clock.instant());
            execution.setErrorCode(result.getErrorCode());
            execution.setError(result.getError());
        } finally {
            lock.writeLock().unlock();
        }
        emit(instance, execution.getStepId(), SagaEventType.STEP_FAILED, result.getError());
        log.warn("Step failed: sagaId={}, step={}, errorCode={}, error={}",
                instance.getId(), execution.getStepId(), result.getErrorCode(), result.getError());
    }

    private void fail(SagaInstance instance, int stepIndex, ErrorCode errorCode, String error) {
        lock.writeLock().lock();
        try {
            instance.setState(SagaState.FAILED);
            instance.setErrorCode(errorCode != null ? errorCode : ErrorCode.STREAM_ERROR);
            instance.setError(error);
        } finally {
            lock.writeLock().unlock();
        }
        String stepId = stepIndex >= 0 ? instance.step(stepIndex).getStepId() : null;
        emit(instance, stepId, SagaEventType.SAGA_FAILED, error);
    }

    private void setState(SagaInstance instance, SagaState state) {
        lock.writeLock().lock();
        try {
            instance.setState(state);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void emit(SagaInstance instance, String stepId, SagaEventType type, String error) {
        SagaEvent event = SagaEvent.builder()
                .sagaId(instance.getId())
                .definition(instance.getDefinition())
                .stepId(stepId)
                .type(type)
                .timestamp(clock.instant())
                .error(error)
                .build();
        if (!events.offer(event)) {
            long dropped = droppedEvents.incrementAndGet();
            log.warn("Saga event queue full, dropping event: sagaId={}, type={}, dropped={}",
                    instance.getId(), type, dropped);
        }
    }

    private static String deadlineMessage(Duration timeout, SagaStep step) {
        return "deadline of " + timeout.toMillis() + "ms exceeded during step " + step.id();
    }

    // ===== Retention =====

    /**
     * Removes terminal instances that finished before {@code cutoff}.
     */
    public int purgeTerminal(Instant cutoff) {
        lock.writeLock().lock();
        try {
            int before = instances.size();
            instances.values().removeIf(instance -> instance.getState().isTerminal()
                    && instance.getCompletedAt() != null
                    && instance.getCompletedAt().isBefore(cutoff));
            return before - instances.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void purgeExpired() {
        try {
            int purged = purgeTerminal(clock.instant().minus(retention));
            if (purged > 0) {
                log.debug("Purged {} finished sagas", purged);
            }
        } catch (Exception e) {
            log.error("Error purging sagas", e);
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down SagaManager");
        maintenanceExecutor.shutdown();
        try {
            if (!maintenanceExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                maintenanceExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            maintenanceExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
