package com.autoping.monitor.ping.service;

import com.autoping.monitor.config.MonitorProperties;
import com.autoping.monitor.ping.model.FailureHistoryEntry;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FailureHistoryStoreTest {

    @Test
    void sixthEntryEvictsOldest() {
        FailureHistoryStore store = new FailureHistoryStore(new MonitorProperties());
        Instant start = Instant.parse("2026-01-01T00:00:00Z");
        for (int i = 1; i <= 6; i++) {
            store.append(7L, new FailureHistoryEntry(start.plusSeconds(i), "Error: attempt " + i, 10L));
        }

        List<FailureHistoryEntry> snapshot = store.snapshot(7L);
        assertThat(snapshot).hasSize(5);
        assertThat(snapshot.get(0).result()).isEqualTo("Error: attempt 2");
        assertThat(snapshot.get(4).result()).isEqualTo("Error: attempt 6");
    }

    @Test
    void historyIsPerJobAndClearable() {
        FailureHistoryStore store = new FailureHistoryStore(new MonitorProperties());
        store.append(1L, new FailureHistoryEntry(Instant.EPOCH, "Error: a", 1L));
        store.append(2L, new FailureHistoryEntry(Instant.EPOCH, "Error: b", 1L));

        store.clear(1L);

        assertThat(store.snapshot(1L)).isEmpty();
        assertThat(store.snapshot(2L)).hasSize(1);
    }
}
