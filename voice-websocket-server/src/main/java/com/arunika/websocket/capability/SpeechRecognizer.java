package com.arunika.websocket.capability;

import com.arunika.websocket.domain.AudioConfig;

/**
 * Speech-to-text provider.
 */
public interface SpeechRecognizer {

    /**
     * Transcribes a complete recording in one call.
     *
     * @throws com.arunika.websocket.exception.StreamException if the provider fails
     */
    String transcribe(byte[] audio, AudioConfig config);

    /**
     * Opens a streaming recognition for one listening phase.
     *
     * @throws com.arunika.websocket.exception.StreamException if the stream cannot be opened
     */
    StreamingRecognition openStream(AudioConfig config);
}
