package com.arunika.websocket.infrastructure;

import com.arunika.websocket.capability.ConversationHandle;
import com.arunika.websocket.capability.ConversationModel;
import com.arunika.websocket.domain.Turn;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Friendly canned replies that keep track of the conversation length.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "voice.providers.conversation", havingValue = "mock", matchIfMissing = true)
public class MockConversationModel implements ConversationModel {

    @Override
    public ConversationHandle open(String sessionId, List<Turn> history) {
        log.debug("Opening mock conversation: sessionId={}, history={}", sessionId, history.size());
        return new MockConversation(sessionId, history);
    }

    static class MockConversation implements ConversationHandle {

        private final String sessionId;
        private final List<String> history = new ArrayList<>();

        MockConversation(String sessionId, List<Turn> seed) {
            this.sessionId = sessionId;
            seed.forEach(turn -> history.add(turn.getContent()));
        }

        @Override
        public String sessionId() {
            return sessionId;
        }

        @Override
        public synchronized String send(String text) {
            history.add(text);
            String reply;
            if (history.size() <= 1) {
                reply = "Halo juga! Aku Arunika. Kamu bilang: \"" + text + "\". Ceritakan lebih banyak, ya!";
            } else {
                reply = "Wah, menarik sekali! Tadi kamu bilang: \"" + text + "\". Lalu apa yang terjadi?";
            }
            history.add(reply);
            return reply;
        }

        @Override
        public void close() {
            log.debug("Closing mock conversation: sessionId={}", sessionId);
        }
    }
}
