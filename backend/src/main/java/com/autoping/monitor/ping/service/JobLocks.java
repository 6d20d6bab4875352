package com.autoping.monitor.ping.service;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/** One monitor per job id; every read-modify-write of a job runs under it. */
@Component
public class JobLocks {
    private final Map<Long, Object> locks = new ConcurrentHashMap<>();

    public <T> T withLock(long jobId, Supplier<T> action) {
        Object lock = locks.computeIfAbsent(jobId, ignored -> new Object());
        synchronized (lock) {
            return action.get();
        }
    }

    public void withLock(long jobId, Runnable action) {
        withLock(jobId, () -> {
            action.run();
            return null;
        });
    }

    public void forget(long jobId) {
        locks.remove(jobId);
    }
}
