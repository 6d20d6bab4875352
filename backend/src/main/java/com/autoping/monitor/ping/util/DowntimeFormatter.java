package com.autoping.monitor.ping.util;

import java.time.Duration;
import java.time.Instant;

public final class DowntimeFormatter {
    public static final String UNKNOWN = "Unknown";

    private DowntimeFormatter() {
    }

    public static String between(Instant start, Instant end) {
        if (start == null || end == null) {
            return UNKNOWN;
        }
        return format(Duration.between(start, end));
    }

    public static String format(Duration duration) {
        if (duration == null) {
            return UNKNOWN;
        }
        long totalMs = Math.max(0L, duration.toMillis());
        long minutes = totalMs / 60_000L;
        long seconds = (totalMs % 60_000L) / 1000L;
        if (minutes > 0) {
            return minutes + " " + plural("minute", minutes) + " " + seconds + " " + plural("second", seconds);
        }
        return seconds + " " + plural("second", seconds);
    }

    private static String plural(String unit, long value) {
        return value == 1 ? unit : unit + "s";
    }
}
