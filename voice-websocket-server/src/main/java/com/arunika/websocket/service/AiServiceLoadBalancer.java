package com.arunika.websocket.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spreads conversation model requests over the configured backend nodes.
 * Requests carrying a {@code session_id} go to the session's sticky node
 * first and fail over to the others; the rest are round-robin.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "voice.providers.conversation", havingValue = "http")
public class AiServiceLoadBalancer {

    private final RestTemplate restTemplate;
    private final List<String> serviceUrls;
    private final AtomicInteger currentIndex = new AtomicInteger(0);

    public AiServiceLoadBalancer(RestTemplate restTemplate,
                                 @Value("${voice.providers.conversation-urls:http://localhost:8000}")
                                 String serviceUrlsConfig) {
        this.restTemplate = restTemplate;
        this.serviceUrls = parseUrls(serviceUrlsConfig);

        log.info("AiServiceLoadBalancer initialized with {} nodes: {}", serviceUrls.size(), serviceUrls);
    }

    static List<String> parseUrls(String urlsConfig) {
        List<String> urls = new ArrayList<>();
        for (String url : urlsConfig.split(",")) {
            String trimmed = url.trim();
            if (!trimmed.isEmpty()) {
                urls.add(trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed);
            }
        }
        return urls;
    }

    List<String> candidateUrls(String sessionId) {
        if (serviceUrls.isEmpty()) {
            throw new IllegalStateException("No conversation backend URLs configured");
        }

        List<String> candidates = new ArrayList<>();
        if (sessionId != null && !sessionId.isBlank()) {
            String sticky = serviceUrls.get(Math.floorMod(sessionId.hashCode(), serviceUrls.size()));
            candidates.add(sticky);
            for (String url : serviceUrls) {
                if (!url.equals(sticky)) {
                    candidates.add(url);
                }
            }
        } else {
            int start = currentIndex.getAndIncrement();
            for (int i = 0; i < serviceUrls.size(); i++) {
                candidates.add(serviceUrls.get(Math.floorMod(start + i, serviceUrls.size())));
            }
        }
        return candidates;
    }

    private static String extractSessionId(Object body) {
        if (body instanceof Map<?, ?> map && map.get("session_id") instanceof String sessionId) {
            return sessionId;
        }
        return null;
    }

    /**
     * Tries each candidate node once.
     *
     * @throws IllegalStateException if every node failed
     */
    public <T> ResponseEntity<T> execute(String path, HttpMethod method, Object body, Class<T> responseType) {
        List<String> candidates = candidateUrls(extractSessionId(body));
        Exception lastException = null;

        for (int attempt = 0; attempt < candidates.size(); attempt++) {
            String fullUrl = candidates.get(attempt) + path;
            try {
                log.debug("Conversation backend request: url={}, method={}, attempt={}/{}",
                        fullUrl, method, attempt + 1, candidates.size());

                HttpHeaders headers = new HttpHeaders();
                headers.setContentType(MediaType.APPLICATION_JSON);
                HttpEntity<?> entity = body != null ? new HttpEntity<>(body, headers) : new HttpEntity<>(headers);

                return restTemplate.exchange(fullUrl, method, entity, responseType);
            } catch (Exception e) {
                lastException = e;
                log.warn("Conversation backend request failed: url={}, attempt={}/{}, error={}",
                        fullUrl, attempt + 1, candidates.size(), e.getMessage());
            }
        }

        log.error("All conversation backends failed after {} attempts", candidates.size(), lastException);
        throw new IllegalStateException("All conversation backends are unavailable", lastException);
    }

    @SuppressWarnings("rawtypes")
    public ResponseEntity<Map> post(String path, Object body) {
        return execute(path, HttpMethod.POST, body, Map.class);
    }

    /**
     * Probes {@code /health} on every node.
     */
    @SuppressWarnings("rawtypes")
    public Map<String, Object> checkHealth() {
        List<Map<String, Object>> nodes = new ArrayList<>();
        int healthy = 0;

        for (String url : serviceUrls) {
            Map<String, Object> node = new HashMap<>();
            node.put("url", url);
            try {
                ResponseEntity<Map> response = restTemplate.getForEntity(url + "/health", Map.class);
                node.put("status", "healthy");
                node.put("http_status", response.getStatusCode().value());
                healthy++;
            } catch (Exception e) {
                node.put("status", "unhealthy");
                node.put("error", e.getMessage());
            }
            nodes.add(node);
        }

        Map<String, Object> status = new HashMap<>();
        status.put("total_nodes", serviceUrls.size());
        status.put("healthy_nodes", healthy);
        status.put("nodes", nodes);
        return status;
    }
}
