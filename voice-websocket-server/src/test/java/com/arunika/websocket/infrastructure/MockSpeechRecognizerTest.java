package com.arunika.websocket.infrastructure;

import com.arunika.websocket.capability.StreamingRecognition;
import com.arunika.websocket.domain.AudioConfig;
import com.arunika.websocket.exception.StreamException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MockSpeechRecognizerTest {

    private final MockSpeechRecognizer recognizer = new MockSpeechRecognizer();
    private final AudioConfig config = AudioConfig.builder()
            .sampleRate(16000).encoding("LINEAR16").language("id-ID").build();

    @Test
    void shouldPickTranscriptFromLargestFrame() {
        // Arrange
        StreamingRecognition stream = recognizer.openStream(config);

        // Act
        stream.stream(new byte[640]);
        stream.stream(new byte[6000]);
        stream.stream(new byte[320]);
        String transcript = stream.end();

        // Assert
        assertThat(transcript).isEqualTo("Terima kasih sudah mendengarkan.");
    }

    @Test
    void shouldFailWhenNoAudioWasStreamed() {
        StreamingRecognition stream = recognizer.openStream(config);

        assertThatThrownBy(stream::end)
                .isInstanceOf(StreamException.class)
                .hasMessage("no audio data received");
    }

    @Test
    void shouldRefuseAudioAfterEndAndSecondEnd() {
        // Arrange
        StreamingRecognition stream = recognizer.openStream(config);
        stream.stream(new byte[2000]);
        stream.end();

        // Act & Assert
        assertThatThrownBy(() -> stream.stream(new byte[10])).isInstanceOf(StreamException.class);
        assertThatThrownBy(stream::end).hasMessage("recognition stream already ended");
    }

    @Test
    void shouldFailEndAfterCancel() {
        // Arrange
        StreamingRecognition stream = recognizer.openStream(config);
        stream.stream(new byte[2000]);

        // Act
        stream.cancel();

        // Assert
        assertThatThrownBy(stream::end).hasMessage("recognition stream was cancelled");
    }

    @Test
    void shouldTranscribeBatchAudio() {
        assertThat(recognizer.transcribe(new byte[20000], config)).startsWith("Halo Arunika, apa kabar?");
        assertThat(recognizer.transcribe(new byte[100], config)).isEqualTo("Hai");
        assertThatThrownBy(() -> recognizer.transcribe(new byte[0], config)).isInstanceOf(StreamException.class);
    }
}
