package com.arunika.websocket.handler;

import com.arunika.websocket.config.VoiceProperties;
import com.arunika.websocket.service.MetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.nio.ByteBuffer;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;

/**
 * Entry point for device sockets on {@code /ws}. Text frames carry control
 * messages, binary frames carry audio.
 */
@Slf4j
@Component
public class DeviceWebSocketHandler extends AbstractWebSocketHandler {

    private final DeviceConnectionFactory connectionFactory;
    private final DeviceConnectionRegistry registry;
    private final MetricsService metricsService;
    private final VoiceProperties properties;

    // WebSocket session id -> connection
    private final Map<String, DeviceConnection> connections = new ConcurrentHashMap<>();

    public DeviceWebSocketHandler(DeviceConnectionFactory connectionFactory,
                                  DeviceConnectionRegistry registry,
                                  MetricsService metricsService,
                                  VoiceProperties properties) {
        this.connectionFactory = connectionFactory;
        this.registry = registry;
        this.metricsService = metricsService;
        this.properties = properties;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession wsSession) throws Exception {
        String deviceId = (String) wsSession.getAttributes().get(DeviceHandshakeInterceptor.DEVICE_ID_ATTRIBUTE);
        if (deviceId == null) {
            log.warn("Connection without device id: wsId={}", wsSession.getId());
            wsSession.close(CloseStatus.POLICY_VIOLATION.withReason("missing device id"));
            return;
        }

        int maxMessageSize = properties.getConnection().getMaxMessageSize();
        wsSession.setBinaryMessageSizeLimit(maxMessageSize);
        wsSession.setTextMessageSizeLimit(maxMessageSize);

        WebSocketSession guarded = new ConcurrentWebSocketSessionDecorator(wsSession,
                (int) properties.getConnection().getWriteTimeout().toMillis(), 2 * maxMessageSize);
        DeviceConnection connection = connectionFactory.create(deviceId, guarded);

        try {
            connection.start();
        } catch (RejectedExecutionException e) {
            log.error("No writer available, refusing device: deviceId={}", deviceId);
            metricsService.recordError("WRITER_POOL_EXHAUSTED", "DeviceWebSocketHandler");
            wsSession.close(CloseStatus.SERVICE_OVERLOAD);
            return;
        }

        connections.put(wsSession.getId(), connection);
        registry.register(connection);
        metricsService.recordDeviceConnected(deviceId);
        log.info("Device connected: deviceId={}, wsId={}, remote={}",
                deviceId, wsSession.getId(), wsSession.getRemoteAddress());
    }

    @Override
    protected void handleTextMessage(WebSocketSession wsSession, TextMessage message) {
        DeviceConnection connection = connections.get(wsSession.getId());
        if (connection == null) {
            log.warn("Text frame for unknown connection: wsId={}", wsSession.getId());
            return;
        }
        connection.handleText(message.getPayload());
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession wsSession, BinaryMessage message) {
        DeviceConnection connection = connections.get(wsSession.getId());
        if (connection == null) {
            log.warn("Binary frame for unknown connection: wsId={}", wsSession.getId());
            return;
        }
        ByteBuffer payload = message.getPayload();
        byte[] audio = new byte[payload.remaining()];
        payload.get(audio);
        connection.handleBinary(audio);
    }

    @Override
    protected void handlePongMessage(WebSocketSession wsSession, PongMessage message) {
        log.trace("Pong received: wsId={}", wsSession.getId());
    }

    @Override
    public void handleTransportError(WebSocketSession wsSession, Throwable exception) {
        DeviceConnection connection = connections.get(wsSession.getId());
        log.warn("Transport error: deviceId={}, wsId={}, error={}",
                connection != null ? connection.getDeviceId() : null, wsSession.getId(), exception.getMessage());
        metricsService.recordError("TRANSPORT_ERROR", "DeviceWebSocketHandler");
    }

    @Override
    public void afterConnectionClosed(WebSocketSession wsSession, CloseStatus status) {
        DeviceConnection connection = connections.remove(wsSession.getId());
        if (connection == null) {
            return;
        }
        connection.teardown();
        registry.unregister(connection);
        metricsService.recordDeviceDisconnected(connection.getDeviceId());
        log.info("Device disconnected: deviceId={}, wsId={}, status={}",
                connection.getDeviceId(), wsSession.getId(), status);
    }

    public int getOpenConnectionCount() {
        return connections.size();
    }
}
