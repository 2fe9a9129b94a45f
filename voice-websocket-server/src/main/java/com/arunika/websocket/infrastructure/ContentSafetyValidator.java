package com.arunika.websocket.infrastructure;

import com.arunika.websocket.capability.ContentModerator;
import com.arunika.websocket.config.VoiceProperties;
import com.arunika.websocket.domain.ModerationResult;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Rejects transcripts containing any configured blocked term as a whole word,
 * ignoring case.
 */
@Component
@Slf4j
public class ContentSafetyValidator implements ContentModerator {

    private static final int MAX_TRANSCRIPT_LENGTH = 2000;

    private final List<BlockedTerm> blockedTerms = new ArrayList<>();

    public ContentSafetyValidator(VoiceProperties properties) {
        for (String term : properties.getModeration().getBlockedTerms()) {
            String normalized = term.trim().toLowerCase(Locale.ROOT);
            if (!normalized.isEmpty()) {
                blockedTerms.add(new BlockedTerm(normalized,
                        Pattern.compile("\\b" + Pattern.quote(normalized) + "\\b")));
            }
        }
        log.info("Content moderation initialized: blockedTerms={}", blockedTerms.size());
    }

    @Override
    public ModerationResult review(String text) {
        if (text.length() > MAX_TRANSCRIPT_LENGTH) {
            return ModerationResult.reject("transcript too long", List.of());
        }

        String normalized = text.toLowerCase(Locale.ROOT);
        List<String> matched = new ArrayList<>();
        for (BlockedTerm term : blockedTerms) {
            if (term.getPattern().matcher(normalized).find()) {
                matched.add(term.getTerm());
            }
        }

        if (!matched.isEmpty()) {
            return ModerationResult.reject("content not suitable for children", matched);
        }
        return ModerationResult.allow();
    }

    @Value
    private static class BlockedTerm {
        String term;
        Pattern pattern;
    }
}
