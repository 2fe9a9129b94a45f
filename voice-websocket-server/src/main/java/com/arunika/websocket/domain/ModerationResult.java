package com.arunika.websocket.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Verdict of a content moderator for one transcript.
 */
@Value
@Builder
public class ModerationResult {
    boolean allowed;
    String reason;
    List<String> matchedTerms;

    public static ModerationResult allow() {
        return ModerationResult.builder()
                .allowed(true)
                .matchedTerms(List.of())
                .build();
    }

    public static ModerationResult reject(String reason, List<String> matchedTerms) {
        return ModerationResult.builder()
                .allowed(false)
                .reason(reason)
                .matchedTerms(List.copyOf(matchedTerms))
                .build();
    }
}
