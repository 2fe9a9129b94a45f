package com.arunika.websocket.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One finished listening phase handed to the conversation pipeline.
 * Device connections always hand over the streamed {@code transcript};
 * {@code audio} is set only by callers that submit a recorded clip for
 * batch transcription instead.
 */
@Value
@Builder
public class Utterance {
    String deviceId;
    String sessionId;
    String transcript;
    byte[] audio;
    AudioConfig audioConfig;
    Instant startedAt;
    long durationMs;
}
