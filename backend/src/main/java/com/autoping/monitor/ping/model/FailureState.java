package com.autoping.monitor.ping.model;

import java.util.Locale;

public enum FailureState {
    NORMAL,
    RAPID_CHECK,
    PAUSED,
    PERMANENTLY_PAUSED;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isEscalated() {
        return this == RAPID_CHECK || this == PAUSED;
    }

    public static FailureState fromDbValue(String value) {
        if (value == null || value.isBlank()) {
            return NORMAL;
        }
        try {
            return FailureState.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return NORMAL;
        }
    }
}
