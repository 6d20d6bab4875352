package com.autoping.monitor.ping.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Partial update of a {@link PingJob}. A field is either untouched (absent from the update),
 * set to a value, or explicitly cleared (present with a {@code null} value).
 */
public final class JobUpdate {
    private final EnumMap<JobField, Object> values = new EnumMap<>(JobField.class);

    public static JobUpdate create() {
        return new JobUpdate();
    }

    public JobUpdate probe(ProbeResult result) {
        values.put(JobField.LAST_RUN, result.checkedAt());
        values.put(JobField.LAST_DURATION_MS, result.durationMs());
        values.put(JobField.LAST_RESULT, result.resultText());
        return this;
    }

    public JobUpdate checkInterval(CheckInterval interval) {
        values.put(JobField.CHECK_INTERVAL, interval);
        return this;
    }

    public JobUpdate originalInterval(CheckInterval interval) {
        values.put(JobField.ORIGINAL_INTERVAL, interval);
        return this;
    }

    public JobUpdate status(JobStatus status) {
        values.put(JobField.STATUS, status);
        return this;
    }

    public JobUpdate failureState(FailureState state) {
        values.put(JobField.FAILURE_STATE, state);
        return this;
    }

    public JobUpdate failureCount(int count) {
        values.put(JobField.FAILURE_COUNT, count);
        return this;
    }

    public JobUpdate failureCycles(int cycles) {
        values.put(JobField.FAILURE_CYCLES, cycles);
        return this;
    }

    public JobUpdate failureStartedAt(Instant startedAt) {
        values.put(JobField.FAILURE_STARTED_AT, startedAt);
        return this;
    }

    public JobUpdate pauseUntil(Instant pauseUntil) {
        values.put(JobField.PAUSE_UNTIL, pauseUntil);
        return this;
    }

    public JobUpdate permanentlyPaused(boolean permanentlyPaused) {
        values.put(JobField.PERMANENTLY_PAUSED, permanentlyPaused);
        return this;
    }

    public JobUpdate alertEmail(String alertEmail) {
        values.put(JobField.ALERT_EMAIL, alertEmail);
        return this;
    }

    public JobUpdate lastEmailSent(Instant sentAt) {
        values.put(JobField.LAST_EMAIL_SENT, sentAt);
        return this;
    }

    public JobUpdate emailStamp(Instant sentAt, EmailType type) {
        values.put(JobField.EMAIL_SENT_AT, sentAt);
        values.put(JobField.LAST_EMAIL_TYPE, type);
        return this;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public boolean touches(JobField field) {
        return values.containsKey(field);
    }

    public Object valueOf(JobField field) {
        return values.get(field);
    }

    public Map<JobField, Object> values() {
        return Collections.unmodifiableMap(values);
    }

    /** Returns {@code job} with every field of this update applied. */
    public PingJob applyTo(PingJob job) {
        return new PingJob(
            job.id(),
            job.url(),
            pick(JobField.CHECK_INTERVAL, job.checkInterval()),
            pick(JobField.ORIGINAL_INTERVAL, job.originalInterval()),
            pick(JobField.STATUS, job.status()),
            pick(JobField.FAILURE_STATE, job.failureState()),
            pick(JobField.FAILURE_COUNT, job.failureCount()),
            pick(JobField.FAILURE_CYCLES, job.failureCycles()),
            pick(JobField.FAILURE_STARTED_AT, job.failureStartedAt()),
            pick(JobField.PAUSE_UNTIL, job.pauseUntil()),
            pick(JobField.PERMANENTLY_PAUSED, job.permanentlyPaused()),
            pick(JobField.ALERT_EMAIL, job.alertEmail()),
            job.emailRateLimitMinutes(),
            pick(JobField.LAST_EMAIL_SENT, job.lastEmailSent()),
            pick(JobField.EMAIL_SENT_AT, job.emailSentAt()),
            pick(JobField.LAST_EMAIL_TYPE, job.lastEmailType()),
            pick(JobField.LAST_RUN, job.lastRun()),
            pick(JobField.LAST_DURATION_MS, job.lastDurationMs()),
            pick(JobField.LAST_RESULT, job.lastResult()),
            job.createdAt()
        );
    }

    @SuppressWarnings("unchecked")
    private <T> T pick(JobField field, T current) {
        if (!values.containsKey(field)) {
            return current;
        }
        return (T) values.get(field);
    }

    @Override
    public String toString() {
        return "JobUpdate" + values;
    }
}
