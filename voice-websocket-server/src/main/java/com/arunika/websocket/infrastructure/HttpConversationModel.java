package com.arunika.websocket.infrastructure;

import com.arunika.websocket.capability.ConversationHandle;
import com.arunika.websocket.capability.ConversationModel;
import com.arunika.websocket.domain.Turn;
import com.arunika.websocket.exception.StreamException;
import com.arunika.websocket.service.AiServiceLoadBalancer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Conversation model served by the HTTP AI backends. The full history is sent
 * with every request, so backends stay stateless; requests for one session
 * stick to one node.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "voice.providers.conversation", havingValue = "http")
public class HttpConversationModel implements ConversationModel {

    static final String CHAT_PATH = "/chat";

    private final AiServiceLoadBalancer loadBalancer;

    @Override
    public ConversationHandle open(String sessionId, List<Turn> history) {
        List<Map<String, String>> messages = new ArrayList<>();
        for (Turn turn : history) {
            messages.add(message(turn.getRole().name().toLowerCase(Locale.ROOT), turn.getContent()));
        }
        return new HttpConversation(sessionId, messages);
    }

    private static Map<String, String> message(String role, String content) {
        Map<String, String> message = new HashMap<>();
        message.put("role", role);
        message.put("content", content);
        return message;
    }

    class HttpConversation implements ConversationHandle {

        private final String sessionId;
        private final List<Map<String, String>> messages;

        HttpConversation(String sessionId, List<Map<String, String>> messages) {
            this.sessionId = sessionId;
            this.messages = messages;
        }

        @Override
        public String sessionId() {
            return sessionId;
        }

        @Override
        public synchronized String send(String text) {
            Map<String, Object> body = new HashMap<>();
            body.put("session_id", sessionId);
            body.put("history", List.copyOf(messages));
            body.put("message", text);

            ResponseEntity<Map> response;
            try {
                response = loadBalancer.post(CHAT_PATH, body);
            } catch (RuntimeException e) {
                throw new StreamException("conversation backend unavailable", e);
            }

            Object reply = response.getBody() != null ? response.getBody().get("reply") : null;
            if (!(reply instanceof String replyText) || replyText.isBlank()) {
                throw new StreamException("conversation backend returned no reply");
            }

            messages.add(message("user", text));
            messages.add(message("assistant", replyText));
            return replyText;
        }

        @Override
        public void close() {
            log.debug("Closing HTTP conversation: sessionId={}, messages={}", sessionId, messages.size());
        }
    }
}
