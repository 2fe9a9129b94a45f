package com.arunika.websocket.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ConversationReply {
    String sagaId;
    String transcript;
    String text;
    List<byte[]> audioChunks;
    long elapsedMs;

    public long totalAudioBytes() {
        return audioChunks.stream().mapToLong(chunk -> chunk.length).sum();
    }
}
