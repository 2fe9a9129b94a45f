package com.arunika.websocket.infrastructure;

import com.arunika.websocket.capability.SpeechRecognizer;
import com.arunika.websocket.capability.StreamingRecognition;
import com.arunika.websocket.domain.AudioConfig;
import com.arunika.websocket.exception.StreamException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Offline recognizer that picks a canned Indonesian transcript from the size
 * of the largest audio frame received.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "voice.providers.speech", havingValue = "mock", matchIfMissing = true)
public class MockSpeechRecognizer implements SpeechRecognizer {

    static String transcriptFor(int largestFrame) {
        if (largestFrame > 10000) {
            return "Halo Arunika, apa kabar? Saya ingin bercerita tentang hari ini.";
        } else if (largestFrame > 5000) {
            return "Terima kasih sudah mendengarkan.";
        } else if (largestFrame > 1000) {
            return "Halo Arunika!";
        }
        return "Hai";
    }

    @Override
    public String transcribe(byte[] audio, AudioConfig config) {
        if (audio == null || audio.length == 0) {
            throw new StreamException("no audio data received");
        }
        return transcriptFor(audio.length);
    }

    @Override
    public StreamingRecognition openStream(AudioConfig config) {
        log.debug("Opening mock recognition: sampleRate={}, encoding={}, language={}",
                config.getSampleRate(), config.getEncoding(), config.getLanguage());
        return new MockStreamingRecognition();
    }

    static class MockStreamingRecognition implements StreamingRecognition {

        private int largestFrame;
        private long totalBytes;
        private boolean ended;
        private boolean cancelled;

        @Override
        public synchronized void stream(byte[] audio) {
            if (ended || cancelled) {
                throw new StreamException("recognition stream is closed");
            }
            largestFrame = Math.max(largestFrame, audio.length);
            totalBytes += audio.length;
        }

        @Override
        public synchronized String end() {
            if (ended) {
                throw new StreamException("recognition stream already ended");
            }
            ended = true;
            if (cancelled) {
                throw new StreamException("recognition stream was cancelled");
            }
            if (totalBytes == 0) {
                throw new StreamException("no audio data received");
            }
            return transcriptFor(largestFrame);
        }

        @Override
        public synchronized void cancel() {
            cancelled = true;
        }
    }
}
