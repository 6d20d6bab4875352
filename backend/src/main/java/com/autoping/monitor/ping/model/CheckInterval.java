package com.autoping.monitor.ping.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Catalog of supported monitoring cadences. Every period divides one hour, so occurrences
 * aligned to the epoch line up with wall-clock boundaries.
 */
public enum CheckInterval {
    FIFTEEN_SECONDS("15 seconds", Duration.ofSeconds(15)),
    THIRTY_SECONDS("30 seconds", Duration.ofSeconds(30)),
    ONE_MINUTE("1 minute", Duration.ofMinutes(1)),
    FIVE_MINUTES("5 minutes", Duration.ofMinutes(5)),
    THIRTY_MINUTES("30 minutes", Duration.ofMinutes(30)),
    ONE_HOUR("1 hour", Duration.ofHours(1));

    public static final CheckInterval RAPID_CHECK = FIFTEEN_SECONDS;
    public static final CheckInterval DEFAULT = ONE_MINUTE;

    private static final long SKIP_WINDOW_MS = 1000L;

    private final String label;
    private final Duration period;

    CheckInterval(String label, Duration period) {
        this.label = label;
        this.period = period;
    }

    public String label() {
        return label;
    }

    public Duration period() {
        return period;
    }

    /** Unknown or missing labels fall back to {@link #DEFAULT}. */
    public static CheckInterval fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return DEFAULT;
        }
        String candidate = label.trim();
        for (CheckInterval interval : values()) {
            if (interval.label.equalsIgnoreCase(candidate)) {
                return interval;
            }
        }
        return DEFAULT;
    }

    public static boolean isKnownLabel(String label) {
        if (label == null) {
            return false;
        }
        for (CheckInterval interval : values()) {
            if (interval.label.equalsIgnoreCase(label.trim())) {
                return true;
            }
        }
        return false;
    }

    /** First period boundary strictly after {@code now}. */
    public Instant nextOccurrence(Instant now) {
        long periodMs = period.toMillis();
        long nowMs = now.toEpochMilli();
        long next = Math.floorDiv(nowMs, periodMs) * periodMs + periodMs;
        return Instant.ofEpochMilli(next);
    }

    /**
     * Next due instant as shown to operators: an occurrence falling within one second of
     * {@code now} is treated as already firing and skipped.
     */
    public Instant nextRunAfter(Instant now) {
        Instant next = nextOccurrence(now);
        if (next.toEpochMilli() - now.toEpochMilli() < SKIP_WINDOW_MS) {
            next = next.plus(period);
        }
        return next;
    }

    @Override
    public String toString() {
        return label;
    }
}
