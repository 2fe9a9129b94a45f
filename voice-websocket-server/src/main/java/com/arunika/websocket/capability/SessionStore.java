package com.arunika.websocket.capability;

import com.arunika.websocket.domain.DeviceSession;
import com.arunika.websocket.domain.Turn;

import java.time.Instant;
import java.util.Optional;

/**
 * Persistence for device sessions. A device never has more than one ACTIVE
 * session. Failures surface as
 * {@link com.arunika.websocket.exception.SessionStoreException}.
 */
public interface SessionStore {

    Optional<DeviceSession> getActive(String deviceId);

    /**
     * Creates a new ACTIVE session, terminating any session still active for
     * the device.
     */
    DeviceSession create(String deviceId);

    DeviceSession update(DeviceSession session);

    void addTurn(String sessionId, Turn turn);

    void terminate(DeviceSession session);

    /**
     * Marks ACTIVE sessions whose expiry has passed as EXPIRED.
     *
     * @return number of sessions expired
     */
    int expireStale(Instant now);
}
