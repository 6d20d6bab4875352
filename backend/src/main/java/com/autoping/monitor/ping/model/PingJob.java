package com.autoping.monitor.ping.model;

import java.time.Instant;
import java.util.Optional;

/**
 * Persisted monitoring job. Nullable timestamps mean "absent"; use the optional accessors
 * where absence is meaningful.
 */
public record PingJob(
    long id,
    String url,
    CheckInterval checkInterval,
    CheckInterval originalInterval,
    JobStatus status,
    FailureState failureState,
    int failureCount,
    int failureCycles,
    Instant failureStartedAt,
    Instant pauseUntil,
    boolean permanentlyPaused,
    String alertEmail,
    Integer emailRateLimitMinutes,
    Instant lastEmailSent,
    Instant emailSentAt,
    EmailType lastEmailType,
    Instant lastRun,
    Long lastDurationMs,
    String lastResult,
    Instant createdAt
) {
    public boolean isStopped() {
        return status == JobStatus.STOPPED;
    }

    public boolean hasAlertEmail() {
        return alertEmail != null && !alertEmail.isBlank();
    }

    public Optional<Instant> pauseDeadline() {
        return Optional.ofNullable(pauseUntil);
    }

    /** Cadence to use once the current escalation ends. */
    public CheckInterval restorableInterval() {
        return originalInterval != null ? originalInterval : checkInterval;
    }

    public boolean hasPendingFailureAlert() {
        return lastEmailType == EmailType.FAILURE && emailSentAt != null;
    }
}
