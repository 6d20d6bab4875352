package com.autoping.monitor.ping.model;

import java.util.Locale;

public enum JobStatus {
    ACTIVE,
    STOPPED;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static JobStatus fromDbValue(String value) {
        if (value == null || value.isBlank()) {
            return ACTIVE;
        }
        return "stopped".equalsIgnoreCase(value.trim()) ? STOPPED : ACTIVE;
    }
}
