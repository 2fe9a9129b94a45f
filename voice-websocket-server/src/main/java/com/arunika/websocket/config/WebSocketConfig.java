package com.arunika.websocket.config;

import com.arunika.websocket.handler.DeviceHandshakeInterceptor;
import com.arunika.websocket.handler.DeviceWebSocketHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final DeviceWebSocketHandler deviceWebSocketHandler;
    private final DeviceHandshakeInterceptor deviceHandshakeInterceptor;
    private final VoiceProperties properties;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(deviceWebSocketHandler, "/ws")
                .addInterceptors(deviceHandshakeInterceptor)
                .setAllowedOrigins("*"); // devices do not send an Origin we can pin
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        int maxMessageSize = properties.getConnection().getMaxMessageSize();
        container.setMaxBinaryMessageBufferSize(maxMessageSize);
        container.setMaxTextMessageBufferSize(maxMessageSize);
        container.setAsyncSendTimeout(properties.getConnection().getWriteTimeout().toMillis());
        return container;
    }
}
