package com.arunika.websocket.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Thread pools for the connection writers, the detached per-utterance work and
 * the saga engine.
 */
@Configuration
@Slf4j
public class ExecutorConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * One long-lived writer task per open connection, so no queueing.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService connectionWriterExecutor(VoiceProperties properties) {
        int max = properties.getExecutor().getMaxConnections();
        log.info("Connection writer pool: max={}", max);
        return new ThreadPoolExecutor(0, max, 60, TimeUnit.SECONDS,
                new SynchronousQueue<>(), new CustomizableThreadFactory("ws-writer-"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService pipelineExecutor(VoiceProperties properties) {
        return boundedPool("pipeline-", properties.getExecutor().getPipelineThreads(),
                properties.getExecutor().getQueueCapacity());
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService sagaExecutor(VoiceProperties properties) {
        return boundedPool("saga-", properties.getExecutor().getSagaThreads(),
                properties.getExecutor().getQueueCapacity());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService sagaStepExecutor(VoiceProperties properties) {
        return boundedPool("saga-step-", properties.getExecutor().getStepThreads(),
                properties.getExecutor().getQueueCapacity());
    }

    private ExecutorService boundedPool(String prefix, int threads, int queueCapacity) {
        log.info("Thread pool {}: threads={}, queue={}", prefix, threads, queueCapacity);
        return new ThreadPoolExecutor(threads, threads, 60, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(queueCapacity), new CustomizableThreadFactory(prefix));
    }
}
