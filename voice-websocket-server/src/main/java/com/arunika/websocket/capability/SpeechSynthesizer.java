package com.arunika.websocket.capability;

import java.util.stream.Stream;

/**
 * Text-to-speech provider. The returned stream yields audio chunks in playback
 * order and must be closed by the caller.
 */
public interface SpeechSynthesizer {

    Stream<byte[]> synthesize(String text, String voice);
}
