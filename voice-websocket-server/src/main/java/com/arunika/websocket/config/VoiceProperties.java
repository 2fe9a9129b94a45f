package com.arunika.websocket.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Grouped settings under the {@code voice.*} prefix.
 */
@Data
@Component
@ConfigurationProperties(prefix = "voice")
public class VoiceProperties {

    private Connection connection = new Connection();
    private Session session = new Session();
    private Audio audio = new Audio();
    private Pipeline pipeline = new Pipeline();
    private Saga saga = new Saga();
    private Executor executor = new Executor();
    private Moderation moderation = new Moderation();

    @Data
    public static class Connection {
        /** Outbound frames buffered per device before the connection is dropped. */
        private int outboundQueueCapacity = 256;
        private Duration pingInterval = Duration.ofSeconds(54);
        private Duration writeTimeout = Duration.ofSeconds(10);
        private int maxMessageSize = 512 * 1024;
    }

    @Data
    public static class Session {
        private Duration continuationWindow = Duration.ofMinutes(30);
        private Duration expirySweepInterval = Duration.ofMinutes(5);
        private Duration lockTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Audio {
        private int minSampleRate = 8000;
        private int maxSampleRate = 48000;
        private List<String> supportedEncodings = new ArrayList<>(List.of("LINEAR16", "OGG_OPUS", "MULAW"));
    }

    @Data
    public static class Pipeline {
        /** Saga deadline. */
        private Duration deadline = Duration.ofSeconds(30);
        /** How long a connection waits for a saga result. */
        private Duration awaitTimeout = Duration.ofSeconds(35);
        private Duration pollInterval = Duration.ofMillis(100);
        private String voice = "child_friendly";
    }

    @Data
    public static class Saga {
        private int eventQueueCapacity = 100;
        private Duration retention = Duration.ofMinutes(10);
        private Duration purgeInterval = Duration.ofMinutes(1);
    }

    @Data
    public static class Executor {
        private int maxConnections = 10000;
        private int pipelineThreads = 16;
        private int sagaThreads = 16;
        private int stepThreads = 32;
        private int queueCapacity = 200;
    }

    @Data
    public static class Moderation {
        private List<String> blockedTerms = new ArrayList<>();
    }
}
