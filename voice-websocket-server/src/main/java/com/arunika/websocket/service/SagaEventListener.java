package com.arunika.websocket.service;

import com.arunika.websocket.saga.SagaEvent;
import com.arunika.websocket.saga.SagaManager;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Drains the saga event queue on its own thread, logging each event and
 * forwarding it to Kafka when publishing is enabled.
 */
@Component
@Slf4j
public class SagaEventListener {

    private static final Duration POLL_TIMEOUT = Duration.ofSeconds(1);

    private final SagaManager sagaManager;
    private final MetricsService metricsService;
    private final EventPublisher eventPublisher;

    private volatile boolean running;
    private Thread worker;

    public SagaEventListener(SagaManager sagaManager,
                             MetricsService metricsService,
                             @Autowired(required = false) EventPublisher eventPublisher) {
        this.sagaManager = sagaManager;
        this.metricsService = metricsService;
        this.eventPublisher = eventPublisher;
    }

    @PostConstruct
    public void start() {
        running = true;
        worker = new Thread(this::drain, "saga-events");
        worker.setDaemon(true);
        worker.start();
        log.info("Saga event listener started: kafka={}", eventPublisher != null);
    }

    private void drain() {
        while (running) {
            try {
                SagaEvent event = sagaManager.pollEvent(POLL_TIMEOUT);
                if (event != null) {
                    handle(event);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (Exception e) {
                log.error("Error handling saga event", e);
            }
        }
    }

    void handle(SagaEvent event) {
        metricsService.recordSagaEvent(event.getType().name());

        switch (event.getType()) {
            case STEP_FAILED, SAGA_FAILED -> log.warn("Saga event: type={}, sagaId={}, step={}, error={}",
                    event.getType(), event.getSagaId(), event.getStepId(), event.getError());
            case SAGA_STARTED, SAGA_COMPLETED, SAGA_COMPENSATED -> log.info("Saga event: type={}, sagaId={}",
                    event.getType(), event.getSagaId());
            default -> log.debug("Saga event: type={}, sagaId={}, step={}",
                    event.getType(), event.getSagaId(), event.getStepId());
        }

        if (eventPublisher != null) {
            eventPublisher.publishSagaEvent(event);
        }
    }

    @PreDestroy
    public void stop() {
        running = false;
        if (worker != null) {
            worker.interrupt();
        }
    }
}
