package com.arunika.websocket.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.io.Serializable;
import java.time.Instant;

/**
 * One message within a session. Turns have no setters; once appended to a
 * {@link DeviceSession} they are never changed.
 */
@Embeddable
@Getter
@Builder
@ToString
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class Turn implements Serializable {
    private static final long serialVersionUID = 1L;

    @Column(nullable = false)
    private Instant timestamp;

    @Enumerated(EnumType.STRING)
    @Column(length = 20, nullable = false)
    private Role role;

    @Column(length = 4000, nullable = false)
    private String content;

    @Column(nullable = false)
    private long durationMs;

    private Double confidence;

    @Column(length = 50)
    private String emotion;

    public enum Role {
        USER,
        ASSISTANT
    }

    public static Turn user(Instant timestamp, String content, long durationMs) {
        return Turn.builder()
                .timestamp(timestamp)
                .role(Role.USER)
                .content(content)
                .durationMs(durationMs)
                .build();
    }

    public static Turn assistant(Instant timestamp, String content, long durationMs, String emotion) {
        return Turn.builder()
                .timestamp(timestamp)
                .role(Role.ASSISTANT)
                .content(content)
                .durationMs(durationMs)
                .emotion(emotion)
                .build();
    }
}
