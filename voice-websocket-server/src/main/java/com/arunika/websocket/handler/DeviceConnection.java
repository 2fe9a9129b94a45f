package com.arunika.websocket.handler;

import com.arunika.websocket.capability.ConversationHandle;
import com.arunika.websocket.capability.StreamingRecognition;
import com.arunika.websocket.domain.AudioConfig;
import com.arunika.websocket.domain.ConnectionState;
import com.arunika.websocket.domain.ControlMessage;
import com.arunika.websocket.domain.ConversationReply;
import com.arunika.websocket.domain.DeviceSession;
import com.arunika.websocket.domain.ErrorCode;
import com.arunika.websocket.domain.Turn;
import com.arunika.websocket.domain.Utterance;
import com.arunika.websocket.exception.ConnectionStateException;
import com.arunika.websocket.exception.ProtocolException;
import com.arunika.websocket.exception.VoiceServerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One device's socket and its conversation state machine.
 *
 * <p>Inbound frames are handled on the container's dispatch thread, one at a
 * time. All outbound frames go through a bounded queue drained by a writer
 * task, which also sends WebSocket pings. Each finished utterance is answered
 * by a detached pipeline task. The state lock is held only while reading or
 * changing fields, never across provider or store calls.
 */
@Slf4j
public class DeviceConnection {

    static final String ASSISTANT_EMOTION = "friendly";

    private final String deviceId;
    private final WebSocketSession wsSession;
    private final ConnectionServices services;
    private final Instant connectedAt;

    private final BlockingQueue<OutboundFrame> outbound;
    private final AtomicBoolean outboundClosed = new AtomicBoolean();
    private final AtomicBoolean tornDown = new AtomicBoolean();

    private final ReentrantLock lock = new ReentrantLock();

    // Guarded by lock
    private ConnectionState state = ConnectionState.IDLE;
    private DeviceSession session;
    private ConversationHandle conversation;
    private StreamingRecognition recognition;
    private AudioConfig audioConfig;
    private Instant listeningStartedAt;
    private long audioBytes;
    private int audioFrames;

    DeviceConnection(String deviceId, WebSocketSession wsSession, ConnectionServices services) {
        this.deviceId = deviceId;
        this.wsSession = wsSession;
        this.services = services;
        this.connectedAt = services.getClock().instant();
        this.outbound = new ArrayBlockingQueue<>(services.getProperties().getConnection().getOutboundQueueCapacity());
    }

    /**
     * Starts the writer task.
     *
     * @throws RejectedExecutionException if the writer pool is exhausted
     */
    public void start() {
        services.getWriterExecutor().execute(this::writeLoop);
    }

    // ===== Inbound =====

    public void handleText(String payload) {
        ControlMessage message;
        try {
            message = services.getCodec().parse(payload);
        } catch (ProtocolException e) {
            log.warn("Invalid control message: deviceId={}, error={}", deviceId, e.getMessage());
            sendError(e.getErrorCode(), e.getMessage());
            return;
        }
        services.getMetrics().recordControlMessage(message.getType().wireName());

        try {
            switch (message.getType()) {
                case LISTENING_START -> onListeningStart(message);
                case LISTENING_END -> onListeningEnd();
                case PING -> enqueue(ControlMessage.pong());
                default -> throw new ProtocolException("unexpected message type: " + message.getType().wireName());
            }
        } catch (ConnectionStateException e) {
            log.warn("Rejected control message: deviceId={}, type={}, state={}",
                    deviceId, message.getType().wireName(), e.getState());
            sendError(e.getErrorCode(), e.getMessage());
        } catch (VoiceServerException e) {
            sendError(e.getErrorCode(), e.getMessage());
        }
    }

    /**
     * Forwards one audio frame to the open recognition. Frames outside a
     * listening phase are dropped without a reply.
     */
    public void handleBinary(byte[] audio) {
        StreamingRecognition target = null;
        ConnectionState current;
        lock.lock();
        try {
            current = state;
            if (state == ConnectionState.LISTENING && recognition != null) {
                target = recognition;
                audioBytes += audio.length;
                audioFrames++;
            }
        } finally {
            lock.unlock();
        }

        if (target == null) {
            log.warn("Dropping audio frame: deviceId={}, state={}, bytes={}", deviceId, current, audio.length);
            return;
        }

        services.getMetrics().recordAudioFrame(audio.length);
        try {
            target.stream(audio);
        } catch (RuntimeException e) {
            // Surfaces again when the stream is ended
            log.warn("Recognizer rejected audio frame: deviceId={}, error={}", deviceId, e.getMessage());
        }
    }

    private void onListeningStart(ControlMessage request) {
        Instant now = services.getClock().instant();
        DeviceSession current;
        ConversationHandle currentConversation;

        lock.lock();
        try {
            if (state != ConnectionState.IDLE) {
                throw new ConnectionStateException("listening_start", state);
            }
            state = ConnectionState.LISTENING;
            listeningStartedAt = now;
            audioBytes = 0;
            audioFrames = 0;
            current = session;
            currentConversation = conversation;
        } finally {
            lock.unlock();
        }

        StreamingRecognition opened = null;
        ConversationHandle handle = null;
        try {
            DeviceSession resolved = resolveSession(current, now);
            handle = currentConversation != null && currentConversation.sessionId().equals(resolved.getId())
                    ? currentConversation
                    : services.getConversationModel().open(resolved.getId(), resolved.getTurns());
            AudioConfig config = AudioConfig.negotiate(request, resolved.getLanguage());
            opened = services.getSpeechRecognizer().openStream(config);

            ConversationHandle replaced = null;
            boolean closedMeanwhile;
            lock.lock();
            try {
                closedMeanwhile = state != ConnectionState.LISTENING;
                if (!closedMeanwhile) {
                    session = resolved;
                    recognition = opened;
                    audioConfig = config;
                    if (conversation != handle) {
                        replaced = conversation;
                        conversation = handle;
                    }
                }
            } finally {
                lock.unlock();
            }

            if (closedMeanwhile) {
                opened.cancel();
                if (handle != currentConversation) {
                    closeQuietly(handle);
                }
                return;
            }
            if (replaced != null) {
                closeQuietly(replaced);
            }

            enqueue(ControlMessage.listeningReady(resolved.getId()));
            log.info("Listening started: deviceId={}, sessionId={}, sampleRate={}, encoding={}, language={}",
                    deviceId, resolved.getId(), config.getSampleRate(), config.getEncoding(), config.getLanguage());

        } catch (RuntimeException e) {
            if (opened != null) {
                opened.cancel();
            }
            if (handle != null && handle != currentConversation) {
                closeQuietly(handle);
            }
            returnToIdle(ConnectionState.LISTENING);

            ErrorCode code = e instanceof VoiceServerException vse ? vse.getErrorCode() : ErrorCode.STREAM_ERROR;
            log.error("Failed to start listening: deviceId={}, code={}", deviceId, code, e);
            sendError(code, "failed to start listening: " + e.getMessage());
        }
    }

    /**
     * Continues the active session while it is inside the continuation
     * window, otherwise terminates it and starts a new one. The in-memory
     * copy wins over the stored one because turn persistence may have failed.
     */
    private DeviceSession resolveSession(DeviceSession current, Instant now) {
        Optional<DeviceSession> active = services.getSessionStore().getActive(deviceId);
        if (active.isPresent()) {
            DeviceSession candidate = current != null && current.getId().equals(active.get().getId())
                    ? current
                    : active.get();
            if (candidate.canContinue(now, services.getProperties().getSession().getContinuationWindow())) {
                return candidate;
            }
            log.info("Session idle past continuation window: deviceId={}, sessionId={}, lastTurnAt={}",
                    deviceId, candidate.getId(), candidate.getLastTurnAt());
            services.getSessionStore().terminate(candidate);
        }

        DeviceSession created = services.getSessionStore().create(deviceId);
        services.getMetrics().recordSessionCreated(deviceId);
        return created;
    }

    private void onListeningEnd() {
        StreamingRecognition handle;
        DeviceSession boundSession;
        ConversationHandle boundConversation;
        AudioConfig config;
        Instant startedAt;
        long bytes;
        int frames;

        lock.lock();
        try {
            if (state != ConnectionState.LISTENING) {
                throw new ConnectionStateException("listening_end", state);
            }
            state = ConnectionState.PROCESSING;
            handle = recognition;
            recognition = null;
            boundSession = session;
            boundConversation = conversation;
            config = audioConfig;
            startedAt = listeningStartedAt;
            bytes = audioBytes;
            frames = audioFrames;
        } finally {
            lock.unlock();
        }

        long durationMs = Duration.between(startedAt, services.getClock().instant()).toMillis();
        String transcript;
        try {
            transcript = handle.end();
        } catch (RuntimeException e) {
            log.warn("Recognition failed: deviceId={}, frames={}, bytes={}, error={}",
                    deviceId, frames, bytes, e.getMessage());
            returnToIdle(ConnectionState.PROCESSING);
            sendError(ErrorCode.STREAM_ERROR, bytes == 0 ? "no audio received" : e.getMessage());
            return;
        }

        if (transcript == null || transcript.isBlank()) {
            log.info("Empty transcript: deviceId={}, frames={}, bytes={}", deviceId, frames, bytes);
            returnToIdle(ConnectionState.PROCESSING);
            sendError(ErrorCode.STREAM_ERROR, "no speech detected");
            return;
        }

        log.info("Listening ended: deviceId={}, sessionId={}, frames={}, bytes={}, transcript=\"{}\"",
                deviceId, boundSession.getId(), frames, bytes, transcript);
        enqueue(ControlMessage.listeningEnded(boundSession.getId(), transcript));

        Utterance utterance = Utterance.builder()
                .deviceId(deviceId)
                .sessionId(boundSession.getId())
                .transcript(transcript)
                .audioConfig(config)
                .startedAt(startedAt)
                .durationMs(durationMs)
                .build();
        try {
            services.getPipelineExecutor().execute(() -> respond(utterance, boundSession, boundConversation));
        } catch (RejectedExecutionException e) {
            log.error("Pipeline executor saturated: deviceId={}", deviceId);
            returnToIdle(ConnectionState.PROCESSING);
            sendError(ErrorCode.RESOURCE_ERROR, "server busy, try again");
        }
    }

    /**
     * Runs the pipeline for one utterance and streams the reply. Runs on the
     * pipeline executor, detached from the read unit.
     */
    void respond(Utterance utterance, DeviceSession boundSession, ConversationHandle boundConversation) {
        ConversationReply reply;
        try {
            reply = services.getPipeline().process(utterance, boundConversation);
        } catch (VoiceServerException e) {
            services.getMetrics().recordUtteranceFailed(utterance.getSessionId(), e.getErrorCode().name());
            returnToIdle(ConnectionState.PROCESSING);
            sendError(e.getErrorCode(), e.getMessage());
            return;
        } catch (RuntimeException e) {
            log.error("Pipeline crashed: deviceId={}, sessionId={}", deviceId, utterance.getSessionId(), e);
            services.getMetrics().recordUtteranceFailed(utterance.getSessionId(), ErrorCode.STREAM_ERROR.name());
            returnToIdle(ConnectionState.PROCESSING);
            sendError(ErrorCode.STREAM_ERROR, "pipeline failed");
            return;
        }

        lock.lock();
        try {
            if (state != ConnectionState.PROCESSING) {
                log.info("Connection closed before reply, dropping it: deviceId={}, sagaId={}",
                        deviceId, reply.getSagaId());
                return;
            }
            state = ConnectionState.SPEAKING;
        } finally {
            lock.unlock();
        }

        String sessionId = boundSession.getId();
        enqueue(ControlMessage.speakingStart(sessionId, reply.getText()));
        for (byte[] chunk : reply.getAudioChunks()) {
            enqueueFrame(OutboundFrame.binary(chunk));
        }

        try {
            recordTurns(boundSession, utterance, reply);
            persist(boundSession);
            services.getMetrics().recordUtteranceCompleted(sessionId, Duration.ofMillis(reply.getElapsedMs()),
                    reply.getAudioChunks().size());
        } catch (RuntimeException e) {
            log.error("Failed to record turns: deviceId={}, sessionId={}", deviceId, sessionId, e);
            services.getMetrics().recordSessionPersistFailure(sessionId);
        } finally {
            returnToIdle(ConnectionState.SPEAKING);
            enqueue(ControlMessage.speakingEnd(sessionId));
        }
    }

    /**
     * Turn timestamps never go backwards, even when the wall clock steps back
     * between two utterances.
     */
    private void recordTurns(DeviceSession boundSession, Utterance utterance, ConversationReply reply) {
        Instant now = services.getClock().instant();
        lock.lock();
        try {
            List<Turn> turns = boundSession.getTurns();
            Instant userAt = utterance.getStartedAt();
            if (!turns.isEmpty()) {
                Instant lastAt = turns.get(turns.size() - 1).getTimestamp();
                if (userAt.isBefore(lastAt)) {
                    userAt = lastAt;
                }
            }
            Instant assistantAt = now.isBefore(userAt) ? userAt : now;
            boundSession.addTurn(Turn.user(userAt, utterance.getTranscript(), utterance.getDurationMs()), now);
            boundSession.addTurn(Turn.assistant(assistantAt, reply.getText(), reply.getElapsedMs(),
                    ASSISTANT_EMOTION), now);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Store failures after a turn are logged and counted; the conversation
     * carries on from the in-memory session.
     */
    private void persist(DeviceSession boundSession) {
        try {
            services.getSessionStore().update(boundSession);
        } catch (RuntimeException e) {
            services.getMetrics().recordSessionPersistFailure(boundSession.getId());
            log.error("Failed to persist session turns: deviceId={}, sessionId={}",
                    deviceId, boundSession.getId(), e);
        }
    }

    private void returnToIdle(ConnectionState expected) {
        lock.lock();
        try {
            if (state == expected) {
                state = ConnectionState.IDLE;
            }
        } finally {
            lock.unlock();
        }
    }

    // ===== Outbound =====

    void sendError(ErrorCode code, String message) {
        services.getMetrics().recordDeviceError(deviceId, code.name());
        enqueue(ControlMessage.error(code, message));
    }

    boolean enqueue(ControlMessage message) {
        return enqueueFrame(OutboundFrame.text(services.getCodec().encode(message)));
    }

    private boolean enqueueFrame(OutboundFrame frame) {
        if (outboundClosed.get()) {
            log.debug("Outbound closed, dropping frame: deviceId={}, kind={}", deviceId, frame.getKind());
            return false;
        }
        if (outbound.offer(frame)) {
            return true;
        }
        services.getMetrics().recordSlowConsumer(deviceId);
        closeSession(CloseStatus.SESSION_NOT_RELIABLE.withReason("outbound queue full"));
        return false;
    }

    private void writeLoop() {
        long pingIntervalNanos = services.getProperties().getConnection().getPingInterval().toNanos();
        long nextPing = System.nanoTime() + pingIntervalNanos;

        try {
            while (true) {
                long waitNanos = nextPing - System.nanoTime();
                OutboundFrame frame = waitNanos > 0 ? outbound.poll(waitNanos, TimeUnit.NANOSECONDS) : null;

                if (frame == null) {
                    wsSession.sendMessage(new PingMessage());
                    nextPing = System.nanoTime() + pingIntervalNanos;
                    continue;
                }

                switch (frame.getKind()) {
                    case STOP -> {
                        return;
                    }
                    case TEXT -> wsSession.sendMessage(new TextMessage(frame.getText()));
                    case BINARY -> wsSession.sendMessage(new BinaryMessage(frame.getBytes()));
                    default -> throw new IllegalStateException("unknown frame kind " + frame.getKind());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException | RuntimeException e) {
            log.warn("Write failed, closing connection: deviceId={}, error={}", deviceId, e.getMessage());
            closeSession(CloseStatus.SERVER_ERROR);
        } finally {
            log.debug("Writer stopped: deviceId={}", deviceId);
        }
    }

    /**
     * Stops accepting outbound frames and lets the writer exit. Idempotent.
     */
    public void releaseOutbound() {
        if (outboundClosed.compareAndSet(false, true)) {
            outbound.clear();
            outbound.offer(OutboundFrame.STOP);
        }
    }

    // ===== Lifecycle =====

    /**
     * Releases everything bound to the connection after the socket closed.
     * An in-flight pipeline run is not cancelled; its reply is dropped.
     */
    public void teardown() {
        if (!tornDown.compareAndSet(false, true)) {
            return;
        }

        StreamingRecognition pending;
        ConversationHandle boundConversation;
        ConnectionState previous;
        lock.lock();
        try {
            previous = state;
            state = ConnectionState.CLOSED;
            pending = recognition;
            recognition = null;
            boundConversation = conversation;
            conversation = null;
        } finally {
            lock.unlock();
        }

        if (pending != null) {
            pending.cancel();
            try {
                pending.end();
            } catch (RuntimeException e) {
                log.debug("Recognition end after cancel: deviceId={}, error={}", deviceId, e.getMessage());
            }
        }
        if (boundConversation != null) {
            closeQuietly(boundConversation);
        }
        releaseOutbound();

        log.info("Connection torn down: deviceId={}, state={}, connected={}s", deviceId, previous,
                Duration.between(connectedAt, services.getClock().instant()).getSeconds());
    }

    /**
     * Closes a connection superseded by a newer one for the same device.
     */
    public void closeReplaced() {
        teardown();
        closeSession(CloseStatus.NORMAL.withReason("replaced by newer connection"));
    }

    void closeSession(CloseStatus status) {
        try {
            if (wsSession.isOpen()) {
                wsSession.close(status);
            }
        } catch (IOException e) {
            log.debug("Error closing socket: deviceId={}, error={}", deviceId, e.getMessage());
        }
    }

    private void closeQuietly(ConversationHandle handle) {
        try {
            handle.close();
        } catch (RuntimeException e) {
            log.warn("Error closing conversation: deviceId={}, sessionId={}", deviceId, handle.sessionId(), e);
        }
    }

    // ===== Accessors =====

    public String getDeviceId() {
        return deviceId;
    }

    public String getWebSocketId() {
        return wsSession.getId();
    }

    public ConnectionState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public Optional<DeviceSession> getSession() {
        lock.lock();
        try {
            return Optional.ofNullable(session);
        } finally {
            lock.unlock();
        }
    }
}
