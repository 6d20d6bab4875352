package com.autoping.monitor.ping.model;

import java.time.Instant;

public record PingJobView(
    long id,
    String url,
    String interval,
    String originalInterval,
    String status,
    String failureState,
    int failureCount,
    int failureCycles,
    Instant failureStartedAt,
    Instant pauseUntil,
    boolean permanentlyPaused,
    String alertEmail,
    Integer emailRateLimit,
    Instant lastEmailSent,
    Instant emailSentAt,
    String lastEmailType,
    Instant lastRun,
    Long lastDuration,
    String lastResult,
    Instant createdAt,
    Instant nextRun
) {
    public static PingJobView of(PingJob job, Instant nextRun) {
        return new PingJobView(
            job.id(),
            job.url(),
            job.checkInterval().label(),
            job.originalInterval() == null ? null : job.originalInterval().label(),
            job.status().dbValue(),
            job.failureState().dbValue(),
            job.failureCount(),
            job.failureCycles(),
            job.failureStartedAt(),
            job.pauseUntil(),
            job.permanentlyPaused(),
            job.alertEmail(),
            job.emailRateLimitMinutes(),
            job.lastEmailSent(),
            job.emailSentAt(),
            job.lastEmailType() == null ? null : job.lastEmailType().dbValue(),
            job.lastRun(),
            job.lastDurationMs(),
            job.lastResult(),
            job.createdAt(),
            nextRun
        );
    }
}
