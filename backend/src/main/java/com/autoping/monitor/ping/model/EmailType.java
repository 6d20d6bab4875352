package com.autoping.monitor.ping.model;

import java.util.Locale;

public enum EmailType {
    FAILURE,
    RECOVERY;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static EmailType fromDbValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return EmailType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
