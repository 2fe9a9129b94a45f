package com.arunika.websocket.service;

import com.arunika.websocket.domain.DeviceSession;
import com.arunika.websocket.saga.SagaEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes saga and session lifecycle events to Kafka for analytics and
 * auditing. Sending is fire-and-forget; failures are logged and counted.
 *
 * Enable with: KAFKA_ENABLED=true
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "spring.kafka.enabled", havingValue = "true", matchIfMissing = false)
public class EventPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final MetricsService metricsService;

    @Value("${kafka.topics.saga-events:saga-events}")
    private String sagaEventsTopic;

    @Value("${kafka.topics.session-events:session-events}")
    private String sessionEventsTopic;

    public EventPublisher(KafkaTemplate<String, Object> kafkaTemplate, MetricsService metricsService) {
        this.kafkaTemplate = kafkaTemplate;
        this.metricsService = metricsService;
    }

    public void publishSagaEvent(SagaEvent sagaEvent) {
        Map<String, Object> event = new HashMap<>();
        event.put("eventType", sagaEvent.getType().name());
        event.put("timestamp", sagaEvent.getTimestamp().toString());
        event.put("sagaId", sagaEvent.getSagaId());
        event.put("definition", sagaEvent.getDefinition());
        if (sagaEvent.getStepId() != null) {
            event.put("stepId", sagaEvent.getStepId());
        }
        if (sagaEvent.getError() != null) {
            event.put("error", sagaEvent.getError());
        }

        publishEvent(sagaEventsTopic, sagaEvent.getSagaId(), event, sagaEvent.getType().name());
    }

    public void publishSessionStarted(DeviceSession session) {
        publishSessionEvent(session, "SESSION_STARTED");
    }

    public void publishSessionEnded(DeviceSession session) {
        publishSessionEvent(session, "SESSION_" + session.getStatus().name());
    }

    private void publishSessionEvent(DeviceSession session, String eventType) {
        Map<String, Object> event = new HashMap<>();
        event.put("eventType", eventType);
        event.put("timestamp", Instant.now().toString());
        event.put("sessionId", session.getId());
        event.put("deviceId", session.getDeviceId());
        event.put("turns", session.getTurns().size());

        publishEvent(sessionEventsTopic, session.getDeviceId(), event, eventType);
    }

    private void publishEvent(String topic, String key, Object event, String eventType) {
        try {
            CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topic, key, event);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    log.debug("Event published: type={}, topic={}, partition={}, offset={}",
                            eventType, topic,
                            result.getRecordMetadata().partition(),
                            result.getRecordMetadata().offset());
                } else {
                    log.error("Failed to publish event: type={}, topic={}", eventType, topic, ex);
                    metricsService.recordError("KAFKA_PUBLISH_ERROR", "EventPublisher");
                }
            });
        } catch (Exception e) {
            log.error("Error publishing event: type={}", eventType, e);
            metricsService.recordError("KAFKA_PUBLISH_ERROR", "EventPublisher");
        }
    }
}
