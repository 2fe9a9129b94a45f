package com.arunika.websocket.saga.conversation;

import com.arunika.websocket.capability.SpeechRecognizer;
import com.arunika.websocket.domain.AudioConfig;
import com.arunika.websocket.domain.ErrorCode;
import com.arunika.websocket.saga.SagaData;
import com.arunika.websocket.saga.SagaStep;
import com.arunika.websocket.saga.StepResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

import static com.arunika.websocket.saga.conversation.ConversationDataKeys.AUDIO;
import static com.arunika.websocket.saga.conversation.ConversationDataKeys.AUDIO_CONFIG;
import static com.arunika.websocket.saga.conversation.ConversationDataKeys.TRANSCRIPT;

/**
 * Passes through a transcript produced by streaming recognition, or
 * transcribes recorded audio in one batch call. Device connections always
 * stream, so the batch path serves pipeline callers that submit a whole
 * clip.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TranscribeStep implements SagaStep {

    public static final String ID = "transcribe";

    private final SpeechRecognizer speechRecognizer;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public StepResult execute(SagaData data) {
        Optional<String> streamed = data.get(TRANSCRIPT, String.class).filter(t -> !t.isBlank());
        if (streamed.isPresent()) {
            return StepResult.success(streamed.get());
        }

        Optional<byte[]> audio = data.get(AUDIO, byte[].class);
        if (audio.isEmpty() || audio.get().length == 0) {
            return StepResult.failure(ErrorCode.STREAM_ERROR, "no transcript or audio to transcribe");
        }

        AudioConfig config = data.get(AUDIO_CONFIG, AudioConfig.class)
                .orElseGet(() -> AudioConfig.builder()
                        .sampleRate(AudioConfig.DEFAULT_SAMPLE_RATE)
                        .encoding(AudioConfig.DEFAULT_ENCODING)
                        .build());
        try {
            String transcript = speechRecognizer.transcribe(audio.get(), config);
            if (transcript == null || transcript.isBlank()) {
                return StepResult.failure(ErrorCode.STREAM_ERROR, "no speech detected in audio");
            }
            data.put(TRANSCRIPT, transcript);
            return StepResult.success(transcript);
        } catch (Exception e) {
            log.error("Batch transcription failed: bytes={}", audio.get().length, e);
            return StepResult.fromException(e);
        }
    }

    @Override
    public void compensate(SagaData data) {
        log.debug("Nothing to compensate for {}", ID);
    }
}
