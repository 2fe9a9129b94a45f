package com.arunika.websocket.saga.conversation;

import com.arunika.websocket.capability.SpeechSynthesizer;
import com.arunika.websocket.domain.ErrorCode;
import com.arunika.websocket.saga.SagaData;
import com.arunika.websocket.saga.SagaStep;
import com.arunika.websocket.saga.StepResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.arunika.websocket.saga.conversation.ConversationDataKeys.REPLY;
import static com.arunika.websocket.saga.conversation.ConversationDataKeys.RESPONSE_AUDIO;
import static com.arunika.websocket.saga.conversation.ConversationDataKeys.VOICE;

/**
 * Collects the synthesized reply audio so it can be sent only once the whole
 * saga has succeeded.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SynthesizeStep implements SagaStep {

    public static final String ID = "synthesize";

    private final SpeechSynthesizer speechSynthesizer;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public StepResult execute(SagaData data) {
        String reply = data.require(REPLY, String.class);
        String voice = data.get(VOICE, String.class).orElse(null);

        List<byte[]> chunks;
        try (Stream<byte[]> audio = speechSynthesizer.synthesize(reply, voice)) {
            chunks = audio.filter(chunk -> chunk != null && chunk.length > 0)
                    .collect(Collectors.toList());
        } catch (Exception e) {
            log.error("Speech synthesis failed", e);
            return StepResult.fromException(e);
        }

        if (chunks.isEmpty()) {
            return StepResult.failure(ErrorCode.STREAM_ERROR, "synthesizer produced no audio");
        }
        data.put(RESPONSE_AUDIO, chunks);
        return StepResult.success(chunks.size());
    }

    @Override
    public void compensate(SagaData data) {
        log.debug("Nothing to compensate for {}", ID);
    }
}
