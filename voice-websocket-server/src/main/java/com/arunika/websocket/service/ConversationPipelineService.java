package com.arunika.websocket.service;

import com.arunika.websocket.capability.ConversationHandle;
import com.arunika.websocket.config.VoiceProperties;
import com.arunika.websocket.domain.ConversationReply;
import com.arunika.websocket.domain.ErrorCode;
import com.arunika.websocket.domain.Utterance;
import com.arunika.websocket.exception.PipelineException;
import com.arunika.websocket.exception.PipelineTimeoutException;
import com.arunika.websocket.saga.SagaData;
import com.arunika.websocket.saga.SagaInstance;
import com.arunika.websocket.saga.SagaManager;
import com.arunika.websocket.saga.SagaState;
import com.arunika.websocket.saga.conversation.ConversationSagaDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

import static com.arunika.websocket.saga.conversation.ConversationDataKeys.AUDIO;
import static com.arunika.websocket.saga.conversation.ConversationDataKeys.AUDIO_CONFIG;
import static com.arunika.websocket.saga.conversation.ConversationDataKeys.CONVERSATION;
import static com.arunika.websocket.saga.conversation.ConversationDataKeys.DEVICE_ID;
import static com.arunika.websocket.saga.conversation.ConversationDataKeys.REPLY;
import static com.arunika.websocket.saga.conversation.ConversationDataKeys.RESPONSE_AUDIO;
import static com.arunika.websocket.saga.conversation.ConversationDataKeys.SESSION_ID;
import static com.arunika.websocket.saga.conversation.ConversationDataKeys.TRANSCRIPT;
import static com.arunika.websocket.saga.conversation.ConversationDataKeys.VOICE;

/**
 * Runs one utterance through the conversation saga and blocks the calling
 * worker until the saga is terminal.
 */
@Service
@Slf4j
public class ConversationPipelineService {

    private final SagaManager sagaManager;
    private final VoiceProperties properties;

    public ConversationPipelineService(SagaManager sagaManager,
                                       ConversationSagaDefinition definition,
                                       VoiceProperties properties) {
        this.sagaManager = sagaManager;
        this.properties = properties;
        sagaManager.registerDefinition(definition);
    }

    /**
     * @throws PipelineException if the saga ends compensated
     * @throws PipelineTimeoutException if the saga is not terminal in time
     */
    public ConversationReply process(Utterance utterance, ConversationHandle conversation) {
        SagaData data = new SagaData()
                .put(DEVICE_ID, utterance.getDeviceId())
                .put(SESSION_ID, utterance.getSessionId())
                .put(TRANSCRIPT, utterance.getTranscript())
                .put(AUDIO, utterance.getAudio())
                .put(AUDIO_CONFIG, utterance.getAudioConfig())
                .put(CONVERSATION, conversation)
                .put(VOICE, properties.getPipeline().getVoice());

        long started = System.nanoTime();
        String sagaId = sagaManager.start(ConversationSagaDefinition.NAME, data);
        log.debug("Conversation saga started: sagaId={}, sessionId={}", sagaId, utterance.getSessionId());

        SagaInstance result = awaitTerminal(sagaId, properties.getPipeline().getAwaitTimeout());
        if (result.getState() != SagaState.COMPLETED) {
            ErrorCode code = result.getErrorCode() != null ? result.getErrorCode() : ErrorCode.STREAM_ERROR;
            throw new PipelineException(sagaId, code, result.getError());
        }

        @SuppressWarnings("unchecked")
        List<byte[]> audio = result.getData().require(RESPONSE_AUDIO, List.class);
        return ConversationReply.builder()
                .sagaId(sagaId)
                .transcript(result.getData().require(TRANSCRIPT, String.class))
                .text(result.getData().require(REPLY, String.class))
                .audioChunks(List.copyOf(audio))
                .elapsedMs(Duration.ofNanos(System.nanoTime() - started).toMillis())
                .build();
    }

    /**
     * Polls the saga until it is terminal or {@code timeout} elapses.
     */
    public SagaInstance awaitTerminal(String sagaId, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        long pollMs = properties.getPipeline().getPollInterval().toMillis();

        while (true) {
            SagaInstance instance = sagaManager.get(sagaId)
                    .orElseThrow(() -> new IllegalStateException("saga not found: " + sagaId));
            if (instance.getState().isTerminal()) {
                return instance;
            }
            if (System.nanoTime() >= deadline) {
                log.warn("Gave up waiting for saga: sagaId={}, state={}", sagaId, instance.getState());
                throw new PipelineTimeoutException(sagaId, timeout);
            }
            try {
                Thread.sleep(pollMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new PipelineTimeoutException(sagaId, timeout);
            }
        }
    }
}
