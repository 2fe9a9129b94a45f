package com.arunika.websocket.saga;

import com.arunika.websocket.config.VoiceProperties;
import com.arunika.websocket.domain.ErrorCode;
import com.arunika.websocket.testutil.MutableClock;
import com.arunika.websocket.testutil.RecordingStep;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SagaManagerTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-02T09:00:00Z"));
    private final List<String> journal = new CopyOnWriteArrayList<>();
    private ExecutorService sagaExecutor;
    private ExecutorService stepExecutor;
    private SagaManager sagaManager;

    @BeforeEach
    void setUp() {
        sagaExecutor = Executors.newFixedThreadPool(2);
        stepExecutor = Executors.newCachedThreadPool();
        sagaManager = newManager(100);
    }

    @AfterEach
    void tearDown() {
        sagaManager.shutdown();
        sagaExecutor.shutdownNow();
        stepExecutor.shutdownNow();
    }

    private SagaManager newManager(int eventQueueCapacity) {
        VoiceProperties properties = new VoiceProperties();
        properties.getSaga().setEventQueueCapacity(eventQueueCapacity);
        return new SagaManager(sagaExecutor, stepExecutor, properties, clock);
    }

    private static SagaDefinition definition(String name, Duration timeout, SagaStep... steps) {
        return new SagaDefinition() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public List<SagaStep> steps() {
                return List.of(steps);
            }

            @Override
            public Duration timeout() {
                return timeout;
            }
        };
    }

    private SagaInstance awaitTerminal(String sagaId) {
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (System.nanoTime() < deadline) {
            SagaInstance instance = sagaManager.get(sagaId).orElseThrow();
            if (instance.getState().isTerminal()) {
                return instance;
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AssertionError(e);
            }
        }
        throw new AssertionError("saga " + sagaId + " not terminal in time");
    }

    private List<SagaEvent> drainEvents() throws InterruptedException {
        List<SagaEvent> events = new ArrayList<>();
        SagaEvent event;
        while ((event = sagaManager.pollEvent(Duration.ofMillis(50))) != null) {
            events.add(event);
        }
        return events;
    }

    @Test
    void shouldRunAllStepsInOrderAndComplete() {
        // Arrange
        sagaManager.registerDefinition(definition("demo", Duration.ofSeconds(5),
                new RecordingStep("a", journal), new RecordingStep("b", journal), new RecordingStep("c", journal)));

        // Act
        String sagaId = sagaManager.start("demo", new SagaData());
        SagaInstance result = awaitTerminal(sagaId);

        // Assert
        assertThat(sagaId).startsWith("demo_");
        assertThat(result.getState()).isEqualTo(SagaState.COMPLETED);
        assertThat(result.getCompletedAt()).isNotNull();
        assertThat(journal).containsExactly("execute:a", "execute:b", "execute:c");
        assertThat(result.getSteps()).extracting(StepExecution::getState)
                .containsOnly(StepState.COMPLETED);
        assertThat(result.step(0).getResult()).isEqualTo("a-done");
        assertThat(result.getData().get("c", String.class)).contains("visited");
    }

    @Test
    void shouldCompensateCompletedStepsInReverseOrderWhenStepFails() {
        // Arrange
        sagaManager.registerDefinition(definition("demo", Duration.ofSeconds(5),
                new RecordingStep("a", journal),
                new RecordingStep("b", journal),
                new RecordingStep("c", journal).failingWith(ErrorCode.CONTENT_REJECTED, "nope"),
                new RecordingStep("d", journal)));

        // Act
        SagaInstance result = awaitTerminal(sagaManager.start("demo", new SagaData()));

        // Assert
        assertThat(result.getState()).isEqualTo(SagaState.COMPENSATED);
        assertThat(result.getErrorCode()).isEqualTo(ErrorCode.CONTENT_REJECTED);
        assertThat(result.getError()).isEqualTo("nope");
        assertThat(journal).containsExactly("execute:a", "execute:b", "execute:c", "compensate:b", "compensate:a");
        assertThat(result.getSteps()).extracting(StepExecution::getState).containsExactly(
                StepState.COMPENSATED, StepState.COMPENSATED, StepState.FAILED, StepState.PENDING);
    }

    @Test
    void shouldNotCompensateAnythingWhenFirstStepFails() {
        // Arrange
        sagaManager.registerDefinition(definition("demo", Duration.ofSeconds(5),
                new RecordingStep("a", journal).failingWith(ErrorCode.STREAM_ERROR, "stt down"),
                new RecordingStep("b", journal)));

        // Act
        SagaInstance result = awaitTerminal(sagaManager.start("demo", new SagaData()));

        // Assert
        assertThat(result.getState()).isEqualTo(SagaState.COMPENSATED);
        assertThat(journal).containsExactly("execute:a");
    }

    @Test
    void shouldContinueCompensationWhenCompensatorThrows() {
        // Arrange
        sagaManager.registerDefinition(definition("demo", Duration.ofSeconds(5),
                new RecordingStep("a", journal),
                new RecordingStep("b", journal).failingCompensation(new IllegalStateException("undo failed")),
                new RecordingStep("c", journal).failingWith(ErrorCode.STREAM_ERROR, "boom")));

        // Act
        SagaInstance result = awaitTerminal(sagaManager.start("demo", new SagaData()));

        // Assert
        assertThat(result.getState()).isEqualTo(SagaState.COMPENSATED);
        assertThat(journal).containsExactly("execute:a", "execute:b", "execute:c", "compensate:b", "compensate:a");
        assertThat(result.step(0).getState()).isEqualTo(StepState.COMPENSATED);
        assertThat(result.step(1).getState()).isEqualTo(StepState.COMPLETED);
        assertThat(result.step(1).getError()).contains("undo failed");
    }

    @Test
    void shouldTreatExceptionFromStepAsFailure() {
        // Arrange
        sagaManager.registerDefinition(definition("demo", Duration.ofSeconds(5),
                new RecordingStep("a", journal),
                new RecordingStep("b", journal).throwing(new IllegalArgumentException("bad input"))));

        // Act
        SagaInstance result = awaitTerminal(sagaManager.start("demo", new SagaData()));

        // Assert
        assertThat(result.getState()).isEqualTo(SagaState.COMPENSATED);
        assertThat(result.getErrorCode()).isEqualTo(ErrorCode.STREAM_ERROR);
        assertThat(result.getError()).isEqualTo("bad input");
        assertThat(journal).containsExactly("execute:a", "execute:b", "compensate:a");
    }

    @Test
    void shouldFailInFlightStepWithTimeoutWhenDeadlineElapses() {
        // Arrange
        sagaManager.registerDefinition(definition("slow", Duration.ofMillis(200),
                new RecordingStep("a", journal),
                new RecordingStep("b", journal).taking(Duration.ofSeconds(3)),
                new RecordingStep("c", journal)));

        // Act
        long started = System.nanoTime();
        SagaInstance result = awaitTerminal(sagaManager.start("slow", new SagaData()));
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);

        // Assert
        assertThat(elapsed).isLessThan(Duration.ofSeconds(2));
        assertThat(result.getState()).isEqualTo(SagaState.COMPENSATED);
        assertThat(result.getErrorCode()).isEqualTo(ErrorCode.TIMEOUT_ERROR);
        assertThat(result.step(1).getState()).isEqualTo(StepState.FAILED);
        assertThat(result.step(1).getErrorCode()).isEqualTo(ErrorCode.TIMEOUT_ERROR);
        assertThat(result.step(2).getState()).isEqualTo(StepState.PENDING);
        assertThat(journal).contains("compensate:a").doesNotContain("execute:c");
    }

    @Test
    void shouldRejectUnknownDefinition() {
        assertThatThrownBy(() -> sagaManager.start("missing", new SagaData()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("missing");
    }

    @Test
    void shouldReturnEmptyForUnknownSaga() {
        assertThat(sagaManager.get("nope_123")).isEmpty();
    }

    @Test
    void shouldEmitLifecycleEventsInOrder() throws InterruptedException {
        // Arrange
        sagaManager.registerDefinition(definition("demo", Duration.ofSeconds(5),
                new RecordingStep("a", journal),
                new RecordingStep("b", journal).failingWith(ErrorCode.STREAM_ERROR, "boom")));

        // Act
        String sagaId = sagaManager.start("demo", new SagaData());
        awaitTerminal(sagaId);
        List<SagaEvent> events = drainEvents();

        // Assert
        assertThat(events).extracting(SagaEvent::getType).containsExactly(
                SagaEventType.SAGA_STARTED,
                SagaEventType.STEP_STARTED,
                SagaEventType.STEP_COMPLETED,
                SagaEventType.STEP_STARTED,
                SagaEventType.STEP_FAILED,
                SagaEventType.SAGA_FAILED,
                SagaEventType.STEP_COMPENSATED,
                SagaEventType.SAGA_COMPENSATED);
        assertThat(events).extracting(SagaEvent::getSagaId).containsOnly(sagaId);
    }

    @Test
    void shouldDropEventsWhenQueueIsFullWithoutBlockingExecution() {
        // Arrange
        sagaManager.shutdown();
        sagaManager = newManager(2);
        sagaManager.registerDefinition(definition("demo", Duration.ofSeconds(5),
                new RecordingStep("a", journal), new RecordingStep("b", journal)));

        // Act
        SagaInstance result = awaitTerminal(sagaManager.start("demo", new SagaData()));

        // Assert
        assertThat(result.getState()).isEqualTo(SagaState.COMPLETED);
        assertThat(sagaManager.getDroppedEventCount()).isGreaterThan(0);
    }

    @Test
    void shouldHandOutSnapshotsThatDoNotTrackLaterChanges() {
        // Arrange
        sagaManager.registerDefinition(definition("demo", Duration.ofSeconds(5),
                new RecordingStep("a", journal).taking(Duration.ofMillis(300))));

        // Act
        String sagaId = sagaManager.start("demo", new SagaData());
        SagaInstance early = sagaManager.get(sagaId).orElseThrow();
        awaitTerminal(sagaId);

        // Assert
        assertThat(early.getState()).isIn(SagaState.STARTED, SagaState.RUNNING);
        assertThat(early.step(0).getState()).isIn(StepState.PENDING, StepState.RUNNING);
    }

    @Test
    void shouldPurgeOnlyTerminalInstancesOlderThanCutoff() {
        // Arrange
        sagaManager.registerDefinition(definition("demo", Duration.ofSeconds(5), new RecordingStep("a", journal)));
        String sagaId = sagaManager.start("demo", new SagaData());
        awaitTerminal(sagaId);

        // Act
        int notYet = sagaManager.purgeTerminal(clock.instant().minus(Duration.ofMinutes(10)));
        clock.advance(Duration.ofMinutes(11));
        int purged = sagaManager.purgeTerminal(clock.instant().minus(Duration.ofMinutes(10)));

        // Assert
        assertThat(notYet).isZero();
        assertThat(purged).isEqualTo(1);
        assertThat(sagaManager.get(sagaId)).isEmpty();
    }
}
