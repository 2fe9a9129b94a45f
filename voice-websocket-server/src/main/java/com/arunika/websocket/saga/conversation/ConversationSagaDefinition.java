package com.arunika.websocket.saga.conversation;

import com.arunika.websocket.config.VoiceProperties;
import com.arunika.websocket.saga.SagaDefinition;
import com.arunika.websocket.saga.SagaStep;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * transcribe -> validate_content -> generate_reply -> synthesize
 */
@Component
public class ConversationSagaDefinition implements SagaDefinition {

    public static final String NAME = "conversation";

    private final List<SagaStep> steps;
    private final Duration timeout;

    public ConversationSagaDefinition(TranscribeStep transcribe,
                                      ValidateContentStep validateContent,
                                      GenerateReplyStep generateReply,
                                      SynthesizeStep synthesize,
                                      VoiceProperties properties) {
        this.steps = List.of(transcribe, validateContent, generateReply, synthesize);
        this.timeout = properties.getPipeline().getDeadline();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<SagaStep> steps() {
        return steps;
    }

    @Override
    public Duration timeout() {
        return timeout;
    }
}
