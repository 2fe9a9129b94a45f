package com.arunika.websocket.controller;

import com.arunika.websocket.handler.DeviceConnectionRegistry;
import com.arunika.websocket.saga.SagaManager;
import com.arunika.websocket.service.AiServiceLoadBalancer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class HealthController {

    private final RedisTemplate<String, String> redisTemplate;
    private final DeviceConnectionRegistry registry;
    private final SagaManager sagaManager;
    private final AiServiceLoadBalancer loadBalancer;

    public HealthController(RedisTemplate<String, String> redisTemplate,
                            DeviceConnectionRegistry registry,
                            SagaManager sagaManager,
                            @Autowired(required = false) AiServiceLoadBalancer loadBalancer) {
        this.redisTemplate = redisTemplate;
        this.registry = registry;
        this.sagaManager = sagaManager;
        this.loadBalancer = loadBalancer;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "healthy");
        response.put("connections", registry.getConnectionCount());
        response.put("sagas", sagaManager.getInstanceCount());
        response.put("dropped_saga_events", sagaManager.getDroppedEventCount());

        try (RedisConnection connection = redisTemplate.getRequiredConnectionFactory().getConnection()) {
            connection.ping();
            response.put("redis", "connected");
        } catch (Exception e) {
            response.put("redis", "disconnected");
        }

        if (loadBalancer != null) {
            response.put("conversation_backends", loadBalancer.checkHealth());
        }
        return response;
    }
}
