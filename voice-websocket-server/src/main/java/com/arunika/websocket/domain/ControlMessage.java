package com.arunika.websocket.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Arrays;
import java.util.Optional;

/**
 * JSON control envelope exchanged over the device socket. Audio travels in
 * binary frames and never appears here.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ControlMessage {

    private MessageType type;

    /** Unix seconds. */
    private Long timestamp;

    @JsonProperty("session_id")
    private String sessionId;

    @JsonProperty("sample_rate")
    private Integer sampleRate;

    private String encoding;
    private String language;
    private String status;
    private String transcript;
    private String text;

    private ErrorCode code;
    private String message;

    public enum MessageType {
        // Device → Server
        LISTENING_START("listening_start", true),
        LISTENING_END("listening_end", true),
        PING("ping", true),

        // Server → Device
        SPEAKING_START("speaking_start", false),
        SPEAKING_END("speaking_end", false),
        PONG("pong", false),
        ERROR("error", false);

        private final String wireName;
        private final boolean deviceOriginated;

        MessageType(String wireName, boolean deviceOriginated) {
            this.wireName = wireName;
            this.deviceOriginated = deviceOriginated;
        }

        @JsonValue
        public String wireName() {
            return wireName;
        }

        public boolean isDeviceOriginated() {
            return deviceOriginated;
        }

        public static Optional<MessageType> fromWire(String value) {
            return Arrays.stream(values())
                    .filter(t -> t.wireName.equals(value))
                    .findFirst();
        }
    }

    // Factory methods
    public static ControlMessage listeningReady(String sessionId) {
        return ControlMessage.builder()
                .type(MessageType.LISTENING_START)
                .sessionId(sessionId)
                .status("ready")
                .timestamp(now())
                .build();
    }

    public static ControlMessage listeningEnded(String sessionId, String transcript) {
        return ControlMessage.builder()
                .type(MessageType.LISTENING_END)
                .sessionId(sessionId)
                .transcript(transcript)
                .timestamp(now())
                .build();
    }

    public static ControlMessage speakingStart(String sessionId, String text) {
        return ControlMessage.builder()
                .type(MessageType.SPEAKING_START)
                .sessionId(sessionId)
                .text(text)
                .timestamp(now())
                .build();
    }

    public static ControlMessage speakingEnd(String sessionId) {
        return ControlMessage.builder()
                .type(MessageType.SPEAKING_END)
                .sessionId(sessionId)
                .timestamp(now())
                .build();
    }

    public static ControlMessage pong() {
        return ControlMessage.builder()
                .type(MessageType.PONG)
                .timestamp(now())
                .build();
    }

    public static ControlMessage error(ErrorCode code, String message) {
        return ControlMessage.builder()
                .type(MessageType.ERROR)
                .code(code)
                .message(message)
                .timestamp(now())
                .build();
    }

    private static long now() {
        return Instant.now().getEpochSecond();
    }
}
