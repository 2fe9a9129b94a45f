package com.arunika.websocket.capability;

import com.arunika.websocket.domain.Turn;

import java.util.List;

/**
 * Reply-generating language model.
 */
public interface ConversationModel {

    /**
     * Opens a conversation seeded with the given history, oldest turn first.
     */
    ConversationHandle open(String sessionId, List<Turn> history);
}
