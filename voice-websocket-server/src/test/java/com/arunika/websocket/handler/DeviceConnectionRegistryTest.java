package com.arunika.websocket.handler;

import com.arunika.websocket.config.VoiceProperties;
import com.arunika.websocket.domain.ConnectionState;
import com.arunika.websocket.service.MetricsService;
import com.arunika.websocket.testutil.FakeWebSocketSession;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.redisson.api.RMap;
import org.redisson.api.RedissonClient;
import org.springframework.web.socket.CloseStatus;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DeviceConnectionRegistryTest {

    private final MetricsService metrics = new MetricsService();
    private ExecutorService executor;
    private DeviceConnectionFactory factory;
    private DeviceConnectionRegistry registry;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        VoiceProperties properties = new VoiceProperties();
        factory = new DeviceConnectionFactory(null, null, null, null,
                new ControlMessageCodec(new ObjectMapper(), properties), metrics,
                executor, executor, properties, Clock.systemUTC());
        registry = new DeviceConnectionRegistry(null, metrics, "node-a");
    }

    @AfterEach
    void tearDown() {
        registry.shutdown();
        executor.shutdownNow();
    }

    @Test
    void shouldRegisterAndFindConnection() throws Exception {
        // Arrange
        DeviceConnection connection = factory.create("toy-001", new FakeWebSocketSession());

        // Act
        registry.register(connection).get(1, TimeUnit.SECONDS);

        // Assert
        assertThat(registry.find("toy-001")).containsSame(connection);
        assertThat(registry.find("toy-002")).isEmpty();
        assertThat(registry.getConnectionCount()).isEqualTo(1);
    }

    @Test
    void shouldCloseEarlierConnectionWhenSameDeviceReconnects() throws Exception {
        // Arrange
        FakeWebSocketSession oldSocket = new FakeWebSocketSession();
        DeviceConnection old = factory.create("toy-001", oldSocket);
        DeviceConnection fresh = factory.create("toy-001", new FakeWebSocketSession());
        registry.register(old).get(1, TimeUnit.SECONDS);

        // Act
        registry.register(fresh).get(1, TimeUnit.SECONDS);

        // Assert
        assertThat(registry.find("toy-001")).containsSame(fresh);
        assertThat(registry.getConnectionCount()).isEqualTo(1);
        assertThat(old.getState()).isEqualTo(ConnectionState.CLOSED);
        assertThat(oldSocket.getCloseStatus().getCode()).isEqualTo(CloseStatus.NORMAL.getCode());
        assertThat(metrics.getCounterValue("device.replaced")).isEqualTo(1);
    }

    @Test
    void shouldIgnoreUnregisterOfReplacedConnection() throws Exception {
        // Arrange
        DeviceConnection old = factory.create("toy-001", new FakeWebSocketSession());
        DeviceConnection fresh = factory.create("toy-001", new FakeWebSocketSession());
        registry.register(old).get(1, TimeUnit.SECONDS);
        registry.register(fresh).get(1, TimeUnit.SECONDS);

        // Act
        registry.unregister(old).get(1, TimeUnit.SECONDS);

        // Assert
        assertThat(registry.find("toy-001")).containsSame(fresh);
    }

    @Test
    void shouldRemoveConnectionOnUnregister() throws Exception {
        // Arrange
        DeviceConnection connection = factory.create("toy-001", new FakeWebSocketSession());
        registry.register(connection).get(1, TimeUnit.SECONDS);

        // Act
        registry.unregister(connection).get(1, TimeUnit.SECONDS);

        // Assert
        assertThat(registry.find("toy-001")).isEmpty();
        assertThat(registry.getConnectionCount()).isZero();
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldMirrorPresenceIntoRedis() throws Exception {
        // Arrange
        RedissonClient redisson = mock(RedissonClient.class);
        RMap<Object, Object> online = mock(RMap.class);
        when(redisson.getMap(anyString())).thenReturn(online);
        registry.shutdown();
        registry = new DeviceConnectionRegistry(redisson, metrics, "node-a");
        DeviceConnection connection = factory.create("toy-001", new FakeWebSocketSession());

        // Act
        registry.register(connection).get(1, TimeUnit.SECONDS);
        registry.unregister(connection).get(1, TimeUnit.SECONDS);

        // Assert
        verify(redisson, atLeastOnce()).getMap(DeviceConnectionRegistry.ONLINE_DEVICES_KEY);
        verify(online).fastPut("toy-001", "node-a");
        verify(online).remove("toy-001", "node-a");
    }
}
