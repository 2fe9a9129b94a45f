package com.arunika.websocket.handler;

import com.arunika.websocket.capability.ConversationHandle;
import com.arunika.websocket.capability.ConversationModel;
import com.arunika.websocket.config.VoiceProperties;
import com.arunika.websocket.domain.ConnectionState;
import com.arunika.websocket.domain.DeviceSession;
import com.arunika.websocket.domain.Turn;
import com.arunika.websocket.infrastructure.ContentSafetyValidator;
import com.arunika.websocket.infrastructure.InMemorySessionStore;
import com.arunika.websocket.infrastructure.MockConversationModel;
import com.arunika.websocket.infrastructure.MockSpeechRecognizer;
import com.arunika.websocket.infrastructure.MockSpeechSynthesizer;
import com.arunika.websocket.saga.SagaManager;
import com.arunika.websocket.saga.conversation.ConversationSagaDefinition;
import com.arunika.websocket.saga.conversation.GenerateReplyStep;
import com.arunika.websocket.saga.conversation.SynthesizeStep;
import com.arunika.websocket.saga.conversation.TranscribeStep;
import com.arunika.websocket.saga.conversation.ValidateContentStep;
import com.arunika.websocket.service.ConversationPipelineService;
import com.arunika.websocket.service.MetricsService;
import com.arunika.websocket.testutil.FakeWebSocketSession;
import com.arunika.websocket.testutil.FlakySessionStore;
import com.arunika.websocket.testutil.MutableClock;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class DeviceConnectionTest {

    private static final Duration WAIT = Duration.ofSeconds(5);
    private static final String DEVICE_ID = "toy-001";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-02T09:00:00Z"));
    private final MetricsService metrics = new MetricsService();

    private VoiceProperties properties;
    private FlakySessionStore sessionStore;
    private ConversationModel conversationModel;
    private ExecutorService writerExecutor;
    private ExecutorService pipelineExecutor;
    private ExecutorService sagaExecutor;
    private ExecutorService stepExecutor;
    private SagaManager sagaManager;
    private FakeWebSocketSession socket;
    private DeviceConnection connection;

    @BeforeEach
    void setUp() {
        properties = new VoiceProperties();
        properties.getPipeline().setPollInterval(Duration.ofMillis(10));
        sessionStore = new FlakySessionStore(new InMemorySessionStore(clock));
        conversationModel = new MockConversationModel();
        writerExecutor = Executors.newCachedThreadPool();
        pipelineExecutor = Executors.newCachedThreadPool();
        sagaExecutor = Executors.newCachedThreadPool();
        stepExecutor = Executors.newCachedThreadPool();
        socket = new FakeWebSocketSession();
    }

    @AfterEach
    void tearDown() {
        if (connection != null) {
            connection.teardown();
        }
        if (sagaManager != null) {
            sagaManager.shutdown();
        }
        writerExecutor.shutdownNow();
        pipelineExecutor.shutdownNow();
        sagaExecutor.shutdownNow();
        stepExecutor.shutdownNow();
    }

    private DeviceConnection connect(boolean startWriter) {
        sagaManager = new SagaManager(sagaExecutor, stepExecutor, properties, clock);
        ConversationSagaDefinition definition = new ConversationSagaDefinition(
                new TranscribeStep(new MockSpeechRecognizer()),
                new ValidateContentStep(new ContentSafetyValidator(properties)),
                new GenerateReplyStep(conversationModel),
                new SynthesizeStep(new MockSpeechSynthesizer()),
                properties);

        ConnectionServices services = ConnectionServices.builder()
                .sessionStore(sessionStore)
                .speechRecognizer(new MockSpeechRecognizer())
                .conversationModel(conversationModel)
                .pipeline(new ConversationPipelineService(sagaManager, definition, properties))
                .codec(new ControlMessageCodec(objectMapper, properties))
                .metrics(metrics)
                .writerExecutor(writerExecutor)
                .pipelineExecutor(pipelineExecutor)
                .properties(properties)
                .clock(clock)
                .build();

        connection = new DeviceConnection(DEVICE_ID, socket, services);
        if (startWriter) {
            connection.start();
        }
        return connection;
    }

    private DeviceConnection connect() {
        return connect(true);
    }

    private JsonNode json(String text) {
        try {
            return objectMapper.readTree(text);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private JsonNode awaitMessage(String type) {
        return json(socket.awaitText(text -> type.equals(json(text).path("type").asText()), WAIT));
    }

    private JsonNode awaitError(String code) {
        return json(socket.awaitText(text -> {
            JsonNode node = json(text);
            return "error".equals(node.path("type").asText()) && code.equals(node.path("code").asText());
        }, WAIT));
    }

    private JsonNode awaitNewMessage(String type, int fromTextFrame) {
        long deadline = System.nanoTime() + WAIT.toNanos();
        while (System.nanoTime() < deadline) {
            List<String> texts = socket.textFrames();
            for (String text : texts.subList(Math.min(fromTextFrame, texts.size()), texts.size())) {
                JsonNode node = json(text);
                if (type.equals(node.path("type").asText())) {
                    return node;
                }
            }
            sleep(10);
        }
        throw new AssertionError("no new " + type + " frame, got " + socket.textFrames());
    }

    private List<String> messageTypes() {
        List<String> types = new ArrayList<>();
        for (Object frame : socket.frames()) {
            types.add(frame instanceof String text ? json(text).path("type").asText() : "<audio>");
        }
        return types;
    }

    private String talk(DeviceConnection device, int frameBytes) {
        int before = socket.textFrames().size();
        device.handleText("{\"type\":\"listening_start\",\"sample_rate\":16000,\"encoding\":\"linear16\"}");
        String sessionId = awaitNewMessage("listening_start", before).path("session_id").asText();
        device.handleBinary(new byte[frameBytes]);
        device.handleBinary(new byte[frameBytes / 2]);
        device.handleText("{\"type\":\"listening_end\"}");
        return sessionId;
    }

    private void awaitSpeakingEnds(int count) {
        long deadline = System.nanoTime() + WAIT.toNanos();
        while (System.nanoTime() < deadline) {
            if (messageTypes().stream().filter("speaking_end"::equals).count() >= count) {
                return;
            }
            sleep(10);
        }
        throw new AssertionError("expected " + count + " speaking_end frames, got " + messageTypes());
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssertionError(e);
        }
    }

    @Test
    void shouldAnswerOneUtteranceWithOrderedFrames() {
        // Arrange
        DeviceConnection device = connect();

        // Act
        String sessionId = talk(device, 2048);
        awaitSpeakingEnds(1);

        // Assert
        List<String> types = messageTypes();
        assertThat(types.get(0)).isEqualTo("listening_start");
        assertThat(types.get(1)).isEqualTo("listening_end");
        assertThat(types.get(2)).isEqualTo("speaking_start");
        assertThat(types.subList(3, types.size() - 1)).isNotEmpty().containsOnly("<audio>");
        assertThat(types.get(types.size() - 1)).isEqualTo("speaking_end");

        JsonNode ready = json(socket.textFrames().get(0));
        assertThat(ready.path("status").asText()).isEqualTo("ready");
        assertThat(json(socket.textFrames().get(1)).path("transcript").asText()).isEqualTo("Halo Arunika!");
        assertThat(json(socket.textFrames().get(2)).path("text").asText()).contains("Halo Arunika!");
        assertThat(json(socket.textFrames().get(3)).path("session_id").asText()).isEqualTo(sessionId);

        assertThat(device.getState()).isEqualTo(ConnectionState.IDLE);
        DeviceSession stored = sessionStore.getActive(DEVICE_ID).orElseThrow();
        assertThat(stored.getId()).isEqualTo(sessionId);
        assertThat(stored.getTurns()).extracting(Turn::getRole).containsExactly(Turn.Role.USER, Turn.Role.ASSISTANT);
        assertThat(stored.getTurns().get(0).getContent()).isEqualTo("Halo Arunika!");
    }

    @Test
    void shouldContinueSessionWithinContinuationWindow() {
        // Arrange
        DeviceConnection device = connect();
        String first = talk(device, 2048);
        awaitSpeakingEnds(1);

        // Act
        clock.advance(Duration.ofMinutes(10));
        String second = talk(device, 12000);
        awaitSpeakingEnds(2);

        // Assert
        assertThat(second).isEqualTo(first);
        assertThat(sessionStore.getActive(DEVICE_ID).orElseThrow().getTurns()).hasSize(4);
    }

    @Test
    void shouldStartNewSessionAfterContinuationWindowElapses() {
        // Arrange
        DeviceConnection device = connect();
        String first = talk(device, 2048);
        awaitSpeakingEnds(1);
        DeviceSession stale = sessionStore.getActive(DEVICE_ID).orElseThrow();
        stale.getMetadata().setLanguage("en-US");

        // Act
        clock.advance(Duration.ofMinutes(31));
        String second = talk(device, 2048);
        awaitSpeakingEnds(2);

        // Assert
        assertThat(second).isNotEqualTo(first);
        assertThat(sessionStore.terminatedIds).containsExactly(first);
        assertThat(stale.getStatus()).isEqualTo(DeviceSession.SessionStatus.TERMINATED);

        DeviceSession active = sessionStore.getActive(DEVICE_ID).orElseThrow();
        assertThat(active.getId()).isEqualTo(second);
        assertThat(active.getLanguage()).isEqualTo("id-ID");
        assertThat(active.getTurns()).hasSize(2);
    }

    @Test
    void shouldFinishSpeakingWhenClockStepsBackBetweenUtterances() {
        // Arrange
        DeviceConnection device = connect();
        String sessionId = talk(device, 2048);
        awaitSpeakingEnds(1);

        // Act
        clock.advance(Duration.ofSeconds(-5));
        talk(device, 2048);
        awaitSpeakingEnds(2);

        // Assert
        assertThat(device.getState()).isEqualTo(ConnectionState.IDLE);
        List<Turn> turns = sessionStore.getActive(DEVICE_ID).orElseThrow().getTurns();
        assertThat(turns).hasSize(4);
        for (int i = 1; i < turns.size(); i++) {
            assertThat(turns.get(i).getTimestamp()).isAfterOrEqualTo(turns.get(i - 1).getTimestamp());
        }

        int before = socket.textFrames().size();
        device.handleText("{\"type\":\"listening_start\"}");
        JsonNode started = awaitNewMessage("listening_start", before);
        assertThat(started.path("session_id").asText()).isEqualTo(sessionId);
        assertThat(device.getState()).isEqualTo(ConnectionState.LISTENING);
    }

    @Test
    void shouldReportRejectedContentAndReturnToIdle() {
        // Arrange
        properties.getModeration().setBlockedTerms(List.of("arunika"));
        DeviceConnection device = connect();

        // Act
        talk(device, 2048);
        JsonNode error = awaitError("CONTENT_REJECTED");

        // Assert
        assertThat(error.path("message").asText()).isNotBlank();
        assertThat(device.getState()).isEqualTo(ConnectionState.IDLE);
        assertThat(messageTypes()).doesNotContain("speaking_start", "<audio>");
        assertThat(sessionStore.getActive(DEVICE_ID).orElseThrow().getTurns()).isEmpty();
    }

    @Test
    void shouldRejectSecondListeningStartWhileListening() {
        // Arrange
        DeviceConnection device = connect();
        device.handleText("{\"type\":\"listening_start\"}");
        String sessionId = awaitMessage("listening_start").path("session_id").asText();
        device.handleBinary(new byte[2048]);

        // Act
        device.handleText("{\"type\":\"listening_start\"}");
        JsonNode error = awaitError("STATE_ERROR");
        device.handleBinary(new byte[1024]);
        device.handleText("{\"type\":\"listening_end\"}");
        awaitSpeakingEnds(1);

        // Assert
        assertThat(error.path("message").asText()).contains("LISTENING");
        assertThat(messageTypes()).filteredOn(type -> !"<audio>".equals(type)).containsExactly(
                "listening_start", "error", "listening_end", "speaking_start", "speaking_end");
        assertThat(messageTypes()).contains("<audio>");
        assertThat(awaitMessage("listening_end").path("transcript").asText()).isEqualTo("Halo Arunika!");
        assertThat(awaitMessage("speaking_start").path("session_id").asText()).isEqualTo(sessionId);
        assertThat(awaitMessage("speaking_end").path("session_id").asText()).isEqualTo(sessionId);
        assertThat(device.getState()).isEqualTo(ConnectionState.IDLE);
        assertThat(sessionStore.getActive(DEVICE_ID).orElseThrow().getTurns()).hasSize(2);
    }

    @Test
    void shouldRejectListeningEndWhileIdle() {
        // Arrange
        DeviceConnection device = connect();

        // Act
        device.handleText("{\"type\":\"listening_end\"}");

        // Assert
        assertThat(awaitError("STATE_ERROR").path("message").asText()).contains("IDLE");
        assertThat(device.getState()).isEqualTo(ConnectionState.IDLE);
    }

    @Test
    void shouldDropAudioOutsideListeningSilently() {
        // Arrange
        DeviceConnection device = connect();

        // Act
        device.handleBinary(new byte[640]);
        device.handleText("{\"type\":\"ping\"}");
        awaitMessage("pong");

        // Assert
        assertThat(messageTypes()).containsExactly("pong");
        assertThat(device.getState()).isEqualTo(ConnectionState.IDLE);
    }

    @Test
    void shouldAnswerMalformedJsonWithValidationError() {
        // Arrange
        DeviceConnection device = connect();

        // Act
        device.handleText("{not json");
        device.handleText("{\"type\":\"speaking_start\"}");

        // Assert
        awaitError("VALIDATION_ERROR");
        sleep(100);
        assertThat(socket.textFrames()).hasSize(2)
                .allSatisfy(text -> assertThat(json(text).path("code").asText()).isEqualTo("VALIDATION_ERROR"));
        assertThat(device.getState()).isEqualTo(ConnectionState.IDLE);
    }

    @Test
    void shouldReportStreamErrorWhenListeningEndsWithoutAudio() {
        // Arrange
        DeviceConnection device = connect();
        device.handleText("{\"type\":\"listening_start\"}");
        awaitMessage("listening_start");

        // Act
        device.handleText("{\"type\":\"listening_end\"}");

        // Assert
        assertThat(awaitError("STREAM_ERROR").path("message").asText()).isEqualTo("no audio received");
        assertThat(device.getState()).isEqualTo(ConnectionState.IDLE);
    }

    @Test
    void shouldKeepConversationGoingWhenTurnPersistenceFails() {
        // Arrange
        DeviceConnection device = connect();
        sessionStore.failUpdates = true;

        // Act
        talk(device, 2048);
        awaitSpeakingEnds(1);

        // Assert
        assertThat(sessionStore.updateCalls).isEqualTo(1);
        assertThat(metrics.getCounterValue("session.persist.failures")).isEqualTo(1);
        assertThat(device.getSession().orElseThrow().getTurns()).hasSize(2);
        assertThat(device.getState()).isEqualTo(ConnectionState.IDLE);
    }

    @Test
    void shouldReportResourceErrorWhenSessionLookupFails() {
        // Arrange
        DeviceConnection device = connect();
        sessionStore.failLookups = true;

        // Act
        device.handleText("{\"type\":\"listening_start\"}");

        // Assert
        assertThat(awaitError("RESOURCE_ERROR").path("message").asText()).contains("database unavailable");
        assertThat(device.getState()).isEqualTo(ConnectionState.IDLE);
    }

    @Test
    void shouldDropReplyWhenConnectionClosesDuringProcessing() throws InterruptedException {
        // Arrange
        CountDownLatch replied = new CountDownLatch(1);
        MockConversationModel delegate = new MockConversationModel();
        conversationModel = (sessionId, history) -> new SlowConversation(delegate.open(sessionId, history), replied);
        DeviceConnection device = connect();

        // Act
        talk(device, 2048);
        awaitMessage("listening_end");
        device.teardown();
        assertThat(replied.await(5, TimeUnit.SECONDS)).isTrue();
        sleep(300);

        // Assert
        assertThat(device.getState()).isEqualTo(ConnectionState.CLOSED);
        assertThat(messageTypes()).doesNotContain("speaking_start");
        assertThat(sessionStore.updateCalls).isZero();
    }

    @Test
    void shouldCloseSocketWhenOutboundQueueOverflows() {
        // Arrange
        properties.getConnection().setOutboundQueueCapacity(2);
        DeviceConnection device = connect(false);

        // Act
        device.handleText("{\"type\":\"ping\"}");
        device.handleText("{\"type\":\"ping\"}");
        device.handleText("{\"type\":\"ping\"}");

        // Assert
        assertThat(socket.isOpen()).isFalse();
        assertThat(socket.getCloseStatus().getCode()).isEqualTo(CloseStatus.SESSION_NOT_RELIABLE.getCode());
        assertThat(metrics.getCounterValue("device.slow_consumer")).isEqualTo(1);
    }

    @Test
    void shouldSendKeepalivePingsWhenIdle() {
        // Arrange
        properties.getConnection().setPingInterval(Duration.ofMillis(20));

        // Act
        connect();
        long deadline = System.nanoTime() + WAIT.toNanos();
        while (socket.getPingCount() < 2 && System.nanoTime() < deadline) {
            sleep(10);
        }

        // Assert
        assertThat(socket.getPingCount()).isGreaterThanOrEqualTo(2);
        assertThat(socket.frames()).isEmpty();
    }

    @Test
    void shouldCloseSocketWhenReplacedByNewerConnection() {
        // Arrange
        DeviceConnection device = connect();

        // Act
        device.closeReplaced();

        // Assert
        assertThat(device.getState()).isEqualTo(ConnectionState.CLOSED);
        assertThat(socket.getCloseStatus().getCode()).isEqualTo(CloseStatus.NORMAL.getCode());
    }

    private static class SlowConversation implements ConversationHandle {

        private final ConversationHandle delegate;
        private final CountDownLatch replied;

        SlowConversation(ConversationHandle delegate, CountDownLatch replied) {
            this.delegate = delegate;
            this.replied = replied;
        }

        @Override
        public String sessionId() {
            return delegate.sessionId();
        }

        @Override
        public String send(String text) {
            sleep(300);
            String reply = delegate.send(text);
            replied.countDown();
            return reply;
        }

        @Override
        public void close() {
            delegate.close();
        }
    }
}
