package com.arunika.websocket.service;

import io.micrometer.core.instrument.Tags;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Log-based metrics.
 *
 * Counters and gauges are kept in memory and written at debug level; the
 * Micrometer {@link Tags} overloads are accepted so call sites stay the same
 * once a registry is wired in.
 */
@Service
@Slf4j
public class MetricsService {

    private final ConcurrentHashMap<String, AtomicLong> counters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicInteger> gauges = new ConcurrentHashMap<>();

    public MetricsService() {
        log.info("MetricsService initialized (log-only mode)");
    }

    // ===== Counters =====

    public void incrementCounter(String name) {
        long count = counters.computeIfAbsent(name, k -> new AtomicLong(0)).incrementAndGet();
        log.debug("[METRIC] Counter: {} = {}", name, count);
    }

    public void incrementCounter(String name, Tags tags) {
        incrementCounter(name);
        tags.forEach(tag -> incrementCounter(name + "." + tag.getValue()));
    }

    // ===== Timers =====

    public TimerSample startTimer() {
        return new TimerSample();
    }

    public void stopTimer(TimerSample sample, String name) {
        recordTimer(name, sample.stop());
    }

    public void recordTimer(String name, Duration duration) {
        log.debug("[METRIC] Timer: {} = {}ms", name, duration.toMillis());
    }

    public void recordDistribution(String name, long value) {
        log.debug("[METRIC] Distribution: {} = {}", name, value);
    }

    // ===== Gauges =====

    public void incrementGauge(String name) {
        int value = gauges.computeIfAbsent(name, k -> new AtomicInteger(0)).incrementAndGet();
        log.debug("[METRIC] Gauge: {} = {}", name, value);
    }

    public void decrementGauge(String name) {
        int value = gauges.computeIfAbsent(name, k -> new AtomicInteger(0)).decrementAndGet();
        log.debug("[METRIC] Gauge: {} = {}", name, value);
    }

    // ===== Device connections =====

    public void recordDeviceConnected(String deviceId) {
        incrementCounter("device.connections");
        incrementGauge("active_devices");
        log.info("Device connected: deviceId={}", deviceId);
    }

    public void recordDeviceDisconnected(String deviceId) {
        incrementCounter("device.disconnections");
        decrementGauge("active_devices");
        log.info("Device disconnected: deviceId={}", deviceId);
    }

    public void recordDeviceReplaced(String deviceId) {
        incrementCounter("device.replaced");
        log.info("Device connection replaced: deviceId={}", deviceId);
    }

    public void recordControlMessage(String type) {
        incrementCounter("device.messages.received", Tags.of("type", type));
    }

    public void recordAudioFrame(int bytes) {
        incrementCounter("device.audio.frames");
        recordDistribution("device.audio.frame_bytes", bytes);
    }

    public void recordSlowConsumer(String deviceId) {
        incrementCounter("device.slow_consumer");
        log.warn("Outbound queue full, dropping device: deviceId={}", deviceId);
    }

    public void recordDeviceError(String deviceId, String errorCode) {
        incrementCounter("device.errors", Tags.of("code", errorCode));
        log.debug("Error sent to device: deviceId={}, code={}", deviceId, errorCode);
    }

    // ===== Conversation =====

    public void recordUtteranceCompleted(String sessionId, Duration elapsed, int audioChunks) {
        incrementCounter("utterance.completed");
        recordTimer("utterance.duration", elapsed);
        recordDistribution("utterance.audio_chunks", audioChunks);
        log.info("Utterance answered: sessionId={}, elapsed={}ms, chunks={}",
                sessionId, elapsed.toMillis(), audioChunks);
    }

    public void recordUtteranceFailed(String sessionId, String errorCode) {
        incrementCounter("utterance.failed", Tags.of("code", errorCode));
        log.warn("Utterance failed: sessionId={}, code={}", sessionId, errorCode);
    }

    public void recordSessionCreated(String deviceId) {
        incrementCounter("session.created");
        log.debug("Session created: deviceId={}", deviceId);
    }

    public void recordSessionPersistFailure(String sessionId) {
        incrementCounter("session.persist.failures");
    }

    public void recordSagaEvent(String type) {
        incrementCounter("saga.events", Tags.of("type", type));
    }

    public void recordAuthenticationAttempt(boolean success) {
        incrementCounter(success ? "authentication.success" : "authentication.failure");
        log.info("Device auth attempt: success={}", success);
    }

    public void recordError(String errorType, String component) {
        incrementCounter("errors");
        log.error("Error: type={}, component={}", errorType, component);
    }

    // ===== Utility =====

    public long getCounterValue(String name) {
        AtomicLong counter = counters.get(name);
        return counter != null ? counter.get() : 0;
    }

    public int getGaugeValue(String name) {
        AtomicInteger gauge = gauges.get(name);
        return gauge != null ? gauge.get() : 0;
    }

    public Map<String, Long> snapshotCounters() {
        Map<String, Long> snapshot = new TreeMap<>();
        counters.forEach((name, value) -> snapshot.put(name, value.get()));
        return snapshot;
    }

    public static class TimerSample {
        private final long startTime = System.nanoTime();

        public Duration stop() {
            return Duration.ofNanos(System.nanoTime() - startTime);
        }
    }
}
