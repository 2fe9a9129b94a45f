package com.arunika.websocket.handler;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Entry in a connection's outbound queue.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
final class OutboundFrame {

    enum Kind {
        TEXT,
        BINARY,
        STOP
    }

    static final OutboundFrame STOP = new OutboundFrame(Kind.STOP, null, null);

    private final Kind kind;
    private final String text;
    private final byte[] bytes;

    static OutboundFrame text(String text) {
        return new OutboundFrame(Kind.TEXT, text, null);
    }

    static OutboundFrame binary(byte[] bytes) {
        return new OutboundFrame(Kind.BINARY, null, bytes);
    }
}
