package com.arunika.websocket.infrastructure;

import com.arunika.websocket.capability.SpeechSynthesizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Produces deterministic 16 kHz LINEAR16 tone chunks, 100 ms each, roughly
 * one chunk per 15 characters of text.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "voice.providers.speech", havingValue = "mock", matchIfMissing = true)
public class MockSpeechSynthesizer implements SpeechSynthesizer {

    static final int SAMPLE_RATE = 16000;
    static final int CHUNK_BYTES = SAMPLE_RATE / 10 * 2;
    private static final int CHARS_PER_CHUNK = 15;

    @Override
    public Stream<byte[]> synthesize(String text, String voice) {
        int chunks = Math.max(1, (text.length() + CHARS_PER_CHUNK - 1) / CHARS_PER_CHUNK);
        log.debug("Mock synthesis: voice={}, chars={}, chunks={}", voice, text.length(), chunks);
        return IntStream.range(0, chunks).mapToObj(MockSpeechSynthesizer::toneChunk);
    }

    private static byte[] toneChunk(int index) {
        byte[] pcm = new byte[CHUNK_BYTES];
        double frequency = 440.0 + (index % 4) * 55.0;
        for (int i = 0; i < CHUNK_BYTES / 2; i++) {
            short sample = (short) (Math.sin(2 * Math.PI * frequency * i / SAMPLE_RATE) * 3000);
            pcm[2 * i] = (byte) (sample & 0xff);
            pcm[2 * i + 1] = (byte) ((sample >> 8) & 0xff);
        }
        return pcm;
    }
}
