package com.arunika.websocket.handler;

import com.arunika.websocket.service.SecurityValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;
import java.util.Optional;

/**
 * Resolves the device id before the upgrade: from a signed token when device
 * auth is enabled, otherwise from the {@code device_id} query parameter.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DeviceHandshakeInterceptor implements HandshakeInterceptor {

    public static final String DEVICE_ID_ATTRIBUTE = "deviceId";

    private final SecurityValidator securityValidator;

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        Map<String, String> query = UriComponentsBuilder.fromUri(request.getURI()).build()
                .getQueryParams().toSingleValueMap();

        Optional<String> deviceId;
        if (securityValidator.isEnabled()) {
            String token = query.get("token");
            if (token == null) {
                token = request.getHeaders().getFirst("Authorization");
            }
            deviceId = securityValidator.validateDeviceToken(token);
        } else {
            deviceId = Optional.ofNullable(query.get("device_id")).filter(id -> !id.isBlank());
        }

        if (deviceId.isEmpty()) {
            log.warn("Rejecting handshake without device identity: uri={}", request.getURI().getPath());
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }

        attributes.put(DEVICE_ID_ATTRIBUTE, deviceId.get());
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
        if (exception != null) {
            log.warn("Handshake failed: uri={}, error={}", request.getURI().getPath(), exception.getMessage());
        }
    }
}
