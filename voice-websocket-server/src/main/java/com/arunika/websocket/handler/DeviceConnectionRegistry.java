package com.arunika.websocket.handler;

import com.arunika.websocket.service.MetricsService;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RMap;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Maps device ids to their live connection, at most one per device.
 *
 * Registrations and removals are applied one at a time by a dedicated loop
 * thread; lookups take the read lock and never wait on the loop. The online
 * set is mirrored into Redis so other nodes can see where a device is
 * connected.
 */
@Component
@Slf4j
public class DeviceConnectionRegistry {

    static final String ONLINE_DEVICES_KEY = "devices:online";

    private final Map<String, DeviceConnection> connections = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final ExecutorService registryLoop;
    private final RedissonClient redissonClient;
    private final MetricsService metricsService;
    private final String nodeId;

    public DeviceConnectionRegistry(@Autowired(required = false) RedissonClient redissonClient,
                                    MetricsService metricsService,
                                    @Value("${voice.node-id:${HOSTNAME:local}}") String nodeId) {
        this.redissonClient = redissonClient;
        this.metricsService = metricsService;
        this.nodeId = nodeId;
        this.registryLoop = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "device-registry");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Registers a connection, closing any earlier connection of the same
     * device.
     */
    public CompletableFuture<Void> register(DeviceConnection connection) {
        return CompletableFuture.runAsync(() -> doRegister(connection), registryLoop);
    }

    /**
     * Removes the connection if it is still the registered one and releases
     * its outbound queue either way.
     */
    public CompletableFuture<Void> unregister(DeviceConnection connection) {
        return CompletableFuture.runAsync(() -> doUnregister(connection), registryLoop);
    }

    private void doRegister(DeviceConnection connection) {
        DeviceConnection previous;
        int total;
        lock.writeLock().lock();
        try {
            previous = connections.put(connection.getDeviceId(), connection);
            total = connections.size();
        } finally {
            lock.writeLock().unlock();
        }

        if (previous != null && previous != connection) {
            log.info("Replacing connection: deviceId={}, oldWs={}, newWs={}",
                    connection.getDeviceId(), previous.getWebSocketId(), connection.getWebSocketId());
            metricsService.recordDeviceReplaced(connection.getDeviceId());
            previous.closeReplaced();
        }
        mirrorOnline(connection.getDeviceId(), true);

        log.info("Device registered: deviceId={}, total={}", connection.getDeviceId(), total);
    }

    private void doUnregister(DeviceConnection connection) {
        boolean removed = false;
        int total;
        lock.writeLock().lock();
        try {
            if (connections.get(connection.getDeviceId()) == connection) {
                connections.remove(connection.getDeviceId());
                removed = true;
            }
            total = connections.size();
        } finally {
            lock.writeLock().unlock();
        }

        connection.releaseOutbound();
        if (removed) {
            mirrorOnline(connection.getDeviceId(), false);
            log.info("Device unregistered: deviceId={}, total={}", connection.getDeviceId(), total);
        }
    }

    private void mirrorOnline(String deviceId, boolean online) {
        if (redissonClient == null) {
            return;
        }
        try {
            RMap<String, String> onlineDevices = redissonClient.getMap(ONLINE_DEVICES_KEY);
            if (online) {
                onlineDevices.fastPut(deviceId, nodeId);
            } else {
                onlineDevices.remove(deviceId, nodeId);
            }
        } catch (Exception e) {
            log.warn("Failed to mirror device presence: deviceId={}, online={}, error={}",
                    deviceId, online, e.getMessage());
        }
    }

    public Optional<DeviceConnection> find(String deviceId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(connections.get(deviceId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getConnectionCount() {
        lock.readLock().lock();
        try {
            return connections.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down DeviceConnectionRegistry...");
        registryLoop.shutdown();
        try {
            if (!registryLoop.awaitTermination(5, TimeUnit.SECONDS)) {
                registryLoop.shutdownNow();
            }
        } catch (InterruptedException e) {
            registryLoop.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
