package com.arunika.websocket.saga.conversation;

import com.arunika.websocket.capability.ContentModerator;
import com.arunika.websocket.domain.ErrorCode;
import com.arunika.websocket.domain.ModerationResult;
import com.arunika.websocket.saga.SagaData;
import com.arunika.websocket.saga.SagaStep;
import com.arunika.websocket.saga.StepResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import static com.arunika.websocket.saga.conversation.ConversationDataKeys.CONTENT_SAFE;
import static com.arunika.websocket.saga.conversation.ConversationDataKeys.TRANSCRIPT;

@Component
@Slf4j
@RequiredArgsConstructor
public class ValidateContentStep implements SagaStep {

    public static final String ID = "validate_content";

    private final ContentModerator contentModerator;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public StepResult execute(SagaData data) {
        String transcript = data.require(TRANSCRIPT, String.class);

        ModerationResult verdict;
        try {
            verdict = contentModerator.review(transcript);
        } catch (Exception e) {
            log.error("Content moderation failed", e);
            return StepResult.fromException(e);
        }

        data.put(CONTENT_SAFE, verdict.isAllowed());
        if (!verdict.isAllowed()) {
            log.info("Transcript rejected by moderation: reason={}, matched={}",
                    verdict.getReason(), verdict.getMatchedTerms());
            return StepResult.failure(ErrorCode.CONTENT_REJECTED, verdict.getReason());
        }
        return StepResult.success(true);
    }

    @Override
    public void compensate(SagaData data) {
        log.debug("Nothing to compensate for {}", ID);
    }
}
