package com.autoping.monitor.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class MonitorConfig {

    @Bean(name = "pingTimer", destroyMethod = "shutdownNow")
    public ScheduledExecutorService pingTimer(MonitorProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newScheduledThreadPool(properties.getScheduler().getTimerThreads(), runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("ping-timer-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean(name = "pingWorkerExecutor", destroyMethod = "shutdownNow")
    public ExecutorService pingWorkerExecutor(MonitorProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(properties.getScheduler().getWorkerThreads(), runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("ping-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(MonitorProperties properties) {
        int size = Math.max(4, properties.getScheduler().getWorkerThreads());
        return Executors.newFixedThreadPool(size);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
