package com.arunika.websocket.repository;

import com.arunika.websocket.domain.DeviceSession;
import com.arunika.websocket.domain.DeviceSession.SessionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface DeviceSessionRepository extends JpaRepository<DeviceSession, String> {

    Optional<DeviceSession> findFirstByDeviceIdAndStatusOrderByLastActiveAtDesc(String deviceId, SessionStatus status);

    List<DeviceSession> findByDeviceIdAndStatus(String deviceId, SessionStatus status);

    List<DeviceSession> findByStatusAndExpiresAtBefore(SessionStatus status, Instant cutoff);

    long countByDeviceIdAndStatus(String deviceId, SessionStatus status);
}
