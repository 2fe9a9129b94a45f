package com.arunika.websocket.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Audio parameters negotiated at {@code listening_start}.
 */
@Value
@Builder
public class AudioConfig {

    public static final int DEFAULT_SAMPLE_RATE = 48000;
    public static final String DEFAULT_ENCODING = "LINEAR16";

    int sampleRate;
    String encoding;
    String language;

    /**
     * Builds the config for a {@code listening_start} message, filling anything
     * the device left out from the defaults and the session language.
     */
    public static AudioConfig negotiate(ControlMessage request, String sessionLanguage) {
        return AudioConfig.builder()
                .sampleRate(request.getSampleRate() != null ? request.getSampleRate() : DEFAULT_SAMPLE_RATE)
                .encoding(request.getEncoding() != null ? request.getEncoding() : DEFAULT_ENCODING)
                .language(request.getLanguage() != null ? request.getLanguage() : sessionLanguage)
                .build();
    }
}
