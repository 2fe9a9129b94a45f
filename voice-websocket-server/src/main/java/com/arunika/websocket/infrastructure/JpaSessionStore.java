package com.arunika.websocket.infrastructure;

import com.arunika.websocket.capability.SessionStore;
import com.arunika.websocket.config.VoiceProperties;
import com.arunika.websocket.domain.DeviceSession;
import com.arunika.websocket.domain.DeviceSession.SessionStatus;
import com.arunika.websocket.domain.Turn;
import com.arunika.websocket.exception.SessionStoreException;
import com.arunika.websocket.repository.DeviceSessionRepository;
import com.arunika.websocket.service.DeviceLockService;
import com.arunika.websocket.service.EventPublisher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Session store on the relational database. Session creation runs under the
 * per-device Redis lock and commits before the lock is released.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "voice.session.store", havingValue = "jpa", matchIfMissing = true)
public class JpaSessionStore implements SessionStore {

    private final DeviceSessionRepository repository;
    private final DeviceLockService lockService;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final Duration lockTimeout;
    private final EventPublisher eventPublisher;

    public JpaSessionStore(DeviceSessionRepository repository,
                           DeviceLockService lockService,
                           PlatformTransactionManager transactionManager,
                           Clock clock,
                           VoiceProperties properties,
                           @Autowired(required = false) EventPublisher eventPublisher) {
        this.repository = repository;
        this.lockService = lockService;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
        this.lockTimeout = properties.getSession().getLockTimeout();
        this.eventPublisher = eventPublisher;
    }

    @Override
    public Optional<DeviceSession> getActive(String deviceId) {
        return access("look up active session for device " + deviceId,
                () -> repository.findFirstByDeviceIdAndStatusOrderByLastActiveAtDesc(deviceId, SessionStatus.ACTIVE));
    }

    @Override
    public DeviceSession create(String deviceId) {
        DeviceSession created;
        try {
            created = lockService.executeWithLock(deviceId, lockTimeout,
                    () -> transactionTemplate.execute(status -> createInTransaction(deviceId)))
                    .orElseThrow(() -> new SessionStoreException("could not lock device " + deviceId));
        } catch (DataAccessException | TransactionException e) {
            throw new SessionStoreException("failed to create session for device " + deviceId, e);
        }

        log.info("Session created: sessionId={}, deviceId={}", created.getId(), deviceId);
        if (eventPublisher != null) {
            eventPublisher.publishSessionStarted(created);
        }
        return created;
    }

    private DeviceSession createInTransaction(String deviceId) {
        Instant now = clock.instant();
        List<DeviceSession> active = repository.findByDeviceIdAndStatus(deviceId, SessionStatus.ACTIVE);
        for (DeviceSession stale : active) {
            stale.terminate(now);
            log.info("Terminating superseded session: sessionId={}, deviceId={}", stale.getId(), deviceId);
        }
        repository.saveAll(active);
        return repository.save(DeviceSession.start(deviceId, now));
    }

    @Override
    public DeviceSession update(DeviceSession session) {
        return access("update session " + session.getId(), () -> repository.save(session));
    }

    @Override
    public void addTurn(String sessionId, Turn turn) {
        access("add turn to session " + sessionId, () -> transactionTemplate.execute(status -> {
            DeviceSession session = repository.findById(sessionId)
                    .orElseThrow(() -> new SessionStoreException("session not found: " + sessionId));
            session.addTurn(turn, clock.instant());
            return repository.save(session);
        }));
    }

    @Override
    public void terminate(DeviceSession session) {
        session.terminate(clock.instant());
        access("terminate session " + session.getId(), () -> repository.save(session));
        log.info("Session terminated: sessionId={}, deviceId={}", session.getId(), session.getDeviceId());
        if (eventPublisher != null) {
            eventPublisher.publishSessionEnded(session);
        }
    }

    @Override
    public int expireStale(Instant now) {
        return access("expire stale sessions", () -> transactionTemplate.execute(status -> {
            List<DeviceSession> stale = repository.findByStatusAndExpiresAtBefore(SessionStatus.ACTIVE, now);
            stale.forEach(session -> session.expire(now));
            repository.saveAll(stale);
            return stale.size();
        }));
    }

    private <T> T access(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException | TransactionException e) {
            log.error("Session store failure: operation={}", operation, e);
            throw new SessionStoreException("failed to " + operation, e);
        }
    }
}
