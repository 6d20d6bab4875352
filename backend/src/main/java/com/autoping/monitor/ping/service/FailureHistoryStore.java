package com.autoping.monitor.ping.service;

import com.autoping.monitor.config.MonitorProperties;
import com.autoping.monitor.ping.model.FailureHistoryEntry;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Recent failures per job, kept in memory only to enrich alert bodies. */
@Component
public class FailureHistoryStore {
    private final Map<Long, List<FailureHistoryEntry>> history = new ConcurrentHashMap<>();
    private final int capacity;

    public FailureHistoryStore(MonitorProperties properties) {
        this.capacity = properties.getEscalation().getHistorySize();
    }

    public void append(long jobId, FailureHistoryEntry entry) {
        history.compute(jobId, (id, entries) -> {
            List<FailureHistoryEntry> next = entries == null ? new ArrayList<>() : new ArrayList<>(entries);
            next.add(entry);
            while (next.size() > capacity) {
                next.remove(0);
            }
            return List.copyOf(next);
        });
    }

    /** Oldest first. */
    public List<FailureHistoryEntry> snapshot(long jobId) {
        return history.getOrDefault(jobId, List.of());
    }

    public void clear(long jobId) {
        history.remove(jobId);
    }
}
