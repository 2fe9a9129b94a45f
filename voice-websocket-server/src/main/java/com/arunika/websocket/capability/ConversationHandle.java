package com.arunika.websocket.capability;

/**
 * A conversation bound to one session. Each {@link #send(String)} adds the
 * user text and the model reply to the handle's own history.
 */
public interface ConversationHandle extends AutoCloseable {

    String sessionId();

    String send(String text);

    @Override
    void close();
}
