package com.arunika.websocket.infrastructure;

import com.arunika.websocket.capability.SessionStore;
import com.arunika.websocket.domain.DeviceSession;
import com.arunika.websocket.domain.Turn;
import com.arunika.websocket.exception.SessionStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-node session store for development and tests. Sessions are held by
 * reference.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "voice.session.store", havingValue = "memory")
public class InMemorySessionStore implements SessionStore {

    private final Map<String, DeviceSession> sessions = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemorySessionStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<DeviceSession> getActive(String deviceId) {
        return sessions.values().stream()
                .filter(session -> session.getDeviceId().equals(deviceId) && session.isActive())
                .findFirst();
    }

    @Override
    public synchronized DeviceSession create(String deviceId) {
        Instant now = clock.instant();
        sessions.values().stream()
                .filter(session -> session.getDeviceId().equals(deviceId) && session.isActive())
                .forEach(session -> session.terminate(now));

        DeviceSession session = DeviceSession.start(deviceId, now);
        sessions.put(session.getId(), session);
        log.info("Session created: sessionId={}, deviceId={}", session.getId(), deviceId);
        return session;
    }

    @Override
    public DeviceSession update(DeviceSession session) {
        sessions.put(session.getId(), session);
        return session;
    }

    @Override
    public void addTurn(String sessionId, Turn turn) {
        DeviceSession session = sessions.get(sessionId);
        if (session == null) {
            throw new SessionStoreException("session not found: " + sessionId);
        }
        session.addTurn(turn, clock.instant());
    }

    @Override
    public synchronized void terminate(DeviceSession session) {
        session.terminate(clock.instant());
        sessions.put(session.getId(), session);
    }

    @Override
    public synchronized int expireStale(Instant now) {
        int expired = 0;
        for (DeviceSession session : sessions.values()) {
            if (session.isActive() && now.isAfter(session.getExpiresAt())) {
                session.expire(now);
                expired++;
            }
        }
        return expired;
    }
}
