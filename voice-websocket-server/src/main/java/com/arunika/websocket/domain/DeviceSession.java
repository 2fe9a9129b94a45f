package com.arunika.websocket.domain;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Server-side record of a device's multi-turn conversation.
 *
 * <p>{@code expiresAt} always equals {@code lastActiveAt + 24h}; every mutating
 * method refreshes both.
 */
@Entity
@Table(name = "device_sessions", indexes = {
    @Index(name = "idx_device_status", columnList = "deviceId,status"),
    @Index(name = "idx_expires_at", columnList = "expiresAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceSession implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final Duration SESSION_TTL = Duration.ofHours(24);
    public static final String DEFAULT_LANGUAGE = "id-ID";

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, length = 100)
    private String deviceId;

    @Enumerated(EnumType.STRING)
    @Column(length = 20, nullable = false)
    private SessionStatus status;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "device_session_turns", joinColumns = @JoinColumn(name = "session_id"))
    @OrderColumn(name = "turn_index")
    @Setter(AccessLevel.NONE)
    @Builder.Default
    private List<Turn> turns = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    private SessionMetadata metadata;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant lastActiveAt;

    private Instant lastTurnAt;

    @Column(nullable = false)
    private Instant expiresAt;

    public enum SessionStatus {
        ACTIVE,
        EXPIRED,
        TERMINATED
    }

    public static DeviceSession start(String deviceId, Instant now) {
        return DeviceSession.builder()
                .id(UUID.randomUUID().toString())
                .deviceId(deviceId)
                .status(SessionStatus.ACTIVE)
                .metadata(SessionMetadata.builder().language(DEFAULT_LANGUAGE).build())
                .createdAt(now)
                .lastActiveAt(now)
                .expiresAt(now.plus(SESSION_TTL))
                .build();
    }

    public List<Turn> getTurns() {
        return Collections.unmodifiableList(turns);
    }

    /**
     * Appends a turn. Turns must arrive in chronological order.
     *
     * @throws IllegalArgumentException if the turn is older than the last one
     */
    public void addTurn(Turn turn, Instant now) {
        if (!turns.isEmpty()) {
            Turn last = turns.get(turns.size() - 1);
            if (turn.getTimestamp().isBefore(last.getTimestamp())) {
                throw new IllegalArgumentException("turn at " + turn.getTimestamp()
                        + " precedes last turn at " + last.getTimestamp());
            }
        }
        turns.add(turn);
        lastTurnAt = now;
        touch(now);
    }

    public void touch(Instant now) {
        lastActiveAt = now;
        expiresAt = now.plus(SESSION_TTL);
    }

    public void terminate(Instant now) {
        status = SessionStatus.TERMINATED;
        touch(now);
    }

    public void expire(Instant now) {
        status = SessionStatus.EXPIRED;
        touch(now);
    }

    public boolean isActive() {
        return status == SessionStatus.ACTIVE;
    }

    public boolean isExpired(Instant now) {
        return status != SessionStatus.ACTIVE || now.isAfter(expiresAt);
    }

    /**
     * A session continues while it is active, unexpired and its last turn is
     * within the continuation window. A session without turns continues.
     */
    public boolean canContinue(Instant now, Duration continuationWindow) {
        if (isExpired(now)) {
            return false;
        }
        return lastTurnAt == null || !lastTurnAt.plus(continuationWindow).isBefore(now);
    }

    public String getLanguage() {
        if (metadata == null || metadata.getLanguage() == null || metadata.getLanguage().isBlank()) {
            return DEFAULT_LANGUAGE;
        }
        return metadata.getLanguage();
    }
}
