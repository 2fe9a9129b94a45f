package com.arunika.websocket.saga.conversation;

import com.arunika.websocket.capability.ConversationHandle;
import com.arunika.websocket.capability.ConversationModel;
import com.arunika.websocket.domain.ErrorCode;
import com.arunika.websocket.saga.SagaData;
import com.arunika.websocket.saga.SagaStep;
import com.arunika.websocket.saga.StepResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

import static com.arunika.websocket.saga.conversation.ConversationDataKeys.CONVERSATION;
import static com.arunika.websocket.saga.conversation.ConversationDataKeys.REPLY;
import static com.arunika.websocket.saga.conversation.ConversationDataKeys.SESSION_ID;
import static com.arunika.websocket.saga.conversation.ConversationDataKeys.TRANSCRIPT;

/**
 * Sends the transcript through the session's conversation handle. Without a
 * handle a one-off conversation is opened and closed again.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class GenerateReplyStep implements SagaStep {

    public static final String ID = "generate_reply";

    private final ConversationModel conversationModel;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public StepResult execute(SagaData data) {
        String transcript = data.require(TRANSCRIPT, String.class);
        Optional<ConversationHandle> handle = data.get(CONVERSATION, ConversationHandle.class);

        try {
            String reply;
            if (handle.isPresent()) {
                reply = handle.get().send(transcript);
            } else {
                String sessionId = data.get(SESSION_ID, String.class).orElse("adhoc");
                try (ConversationHandle adhoc = conversationModel.open(sessionId, List.of())) {
                    reply = adhoc.send(transcript);
                }
            }

            if (reply == null || reply.isBlank()) {
                return StepResult.failure(ErrorCode.STREAM_ERROR, "conversation model returned an empty reply");
            }
            data.put(REPLY, reply);
            return StepResult.success(reply);
        } catch (Exception e) {
            log.error("Reply generation failed", e);
            return StepResult.fromException(e);
        }
    }

    @Override
    public void compensate(SagaData data) {
        log.debug("Nothing to compensate for {}", ID);
    }
}
