package com.autoping.monitor.ping.model;

public enum JobField {
    CHECK_INTERVAL("check_interval"),
    ORIGINAL_INTERVAL("original_check_interval"),
    STATUS("status"),
    FAILURE_STATE("failure_state"),
    FAILURE_COUNT("failure_count"),
    FAILURE_CYCLES("failure_cycles"),
    FAILURE_STARTED_AT("failure_started_at"),
    PAUSE_UNTIL("pause_until"),
    PERMANENTLY_PAUSED("permanently_paused"),
    ALERT_EMAIL("alert_email"),
    LAST_EMAIL_SENT("last_email_sent"),
    EMAIL_SENT_AT("email_sent_at"),
    LAST_EMAIL_TYPE("last_email_type"),
    LAST_RUN("last_run"),
    LAST_DURATION_MS("last_duration_ms"),
    LAST_RESULT("last_result");

    private final String column;

    JobField(String column) {
        this.column = column;
    }

    public String column() {
        return column;
    }
}
