package com.autoping.monitor.ping.model;

import java.time.Instant;

public record FailureHistoryEntry(
    Instant time,
    String result,
    long durationMs
) {
    public static FailureHistoryEntry from(ProbeResult probe) {
        return new FailureHistoryEntry(probe.checkedAt(), probe.resultText(), probe.durationMs());
    }
}
