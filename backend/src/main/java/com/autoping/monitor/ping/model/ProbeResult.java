package com.autoping.monitor.ping.model;

import java.time.Instant;

public record ProbeResult(
    boolean succeeded,
    long durationMs,
    String resultText,
    int statusCode,
    Instant checkedAt
) {
    public static ProbeResult success(int statusCode, long durationMs, Instant checkedAt) {
        return new ProbeResult(true, durationMs, "Success: " + statusCode, statusCode, checkedAt);
    }

    public static ProbeResult failure(int statusCode, String message, long durationMs, Instant checkedAt) {
        return new ProbeResult(false, durationMs, "Error: " + message, statusCode, checkedAt);
    }
}
