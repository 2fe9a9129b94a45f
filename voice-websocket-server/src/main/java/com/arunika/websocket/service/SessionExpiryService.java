package com.arunika.websocket.service;

import com.arunika.websocket.capability.SessionStore;
import com.arunika.websocket.config.VoiceProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically marks sessions past their expiry as EXPIRED.
 */
@Service
@Slf4j
public class SessionExpiryService {

    private final SessionStore sessionStore;
    private final Clock clock;
    private final ScheduledExecutorService sweepExecutor;

    public SessionExpiryService(SessionStore sessionStore, VoiceProperties properties, Clock clock) {
        this.sessionStore = sessionStore;
        this.clock = clock;
        this.sweepExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "session-expiry");
            t.setDaemon(true);
            return t;
        });

        long intervalMs = properties.getSession().getExpirySweepInterval().toMillis();
        sweepExecutor.scheduleAtFixedRate(this::sweep, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    void sweep() {
        try {
            int expired = sessionStore.expireStale(clock.instant());
            if (expired > 0) {
                log.info("Expired {} stale sessions", expired);
            }
        } catch (Exception e) {
            log.error("Error expiring stale sessions", e);
        }
    }

    @PreDestroy
    public void shutdown() {
        sweepExecutor.shutdownNow();
    }
}
