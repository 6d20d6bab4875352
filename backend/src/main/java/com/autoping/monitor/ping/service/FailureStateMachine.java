package com.autoping.monitor.ping.service;

import com.autoping.monitor.config.MonitorProperties;
import com.autoping.monitor.ping.model.CheckInterval;
import com.autoping.monitor.ping.model.EmailType;
import com.autoping.monitor.ping.model.FailureHistoryEntry;
import com.autoping.monitor.ping.model.FailureState;
import com.autoping.monitor.ping.model.JobStatus;
import com.autoping.monitor.ping.model.JobUpdate;
import com.autoping.monitor.ping.model.PingJob;
import com.autoping.monitor.ping.model.ProbeResult;
import com.autoping.monitor.ping.notify.DesktopNotifier;
import com.autoping.monitor.ping.notify.EmailAlertService;
import com.autoping.monitor.ping.notify.NotificationThrottle;
import com.autoping.monitor.ping.util.DowntimeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;

/**
 * Escalation policy for a single job.
 *
 * <p>NORMAL goes to RAPID_CHECK on the first failure. RAPID_CHECK returns to NORMAL on success,
 * or after {@code failureThreshold} consecutive failures either pauses for
 * {@code pauseDurationMinutes} (alerting by email when the throttle allows) or, once
 * {@code maxFailureCycles} pause rounds have passed without a true recovery, stops the job
 * for good. Only {@link #manualReset(PingJob)} leaves PERMANENTLY_PAUSED.
 *
 * <p>Alert delivery never decides the transition: a throttled or failed send only withholds
 * the email stamp.
 */
@Service
public class FailureStateMachine {
    private static final Logger log = LoggerFactory.getLogger(FailureStateMachine.class);

    private final MonitorProperties properties;
    private final NotificationThrottle throttle;
    private final EmailAlertService emailAlertService;
    private final DesktopNotifier desktopNotifier;
    private final FailureHistoryStore failureHistory;

    public FailureStateMachine(
        MonitorProperties properties,
        NotificationThrottle throttle,
        EmailAlertService emailAlertService,
        DesktopNotifier desktopNotifier,
        FailureHistoryStore failureHistory
    ) {
        this.properties = properties;
        this.throttle = throttle;
        this.emailAlertService = emailAlertService;
        this.desktopNotifier = desktopNotifier;
        this.failureHistory = failureHistory;
    }

    public Transition onProbe(PingJob job, ProbeResult result, Instant now) {
        JobUpdate update = JobUpdate.create().probe(result);
        FailureState state = job.failureState();
        if (state == FailureState.PAUSED || state == FailureState.PERMANENTLY_PAUSED) {
            log.debug("Job {} is {}; recording probe result without transition", job.id(), state);
            return Transition.stay(update);
        }
        if (result.succeeded()) {
            return onSuccess(job, update, now);
        }
        return onFailure(job, result, update, now);
    }

    /** Deadline of a PAUSED job reached: start a new cycle at the original cadence. */
    public Transition resumeAfterPause(PingJob job) {
        int cycles = job.failureCycles() + 1;
        log.info(
            "Resuming job {} after pause (cycle {}/{})",
            job.id(),
            cycles,
            properties.getEscalation().getMaxFailureCycles()
        );
        failureHistory.clear(job.id());
        JobUpdate update = JobUpdate.create()
            .failureState(FailureState.NORMAL)
            .failureCount(0)
            .failureCycles(cycles)
            .checkInterval(job.restorableInterval())
            .originalInterval(null)
            .pauseUntil(null);
        return Transition.reprogram(update);
    }

    public Transition manualReset(PingJob job) {
        if (!job.permanentlyPaused()) {
            throw new InvalidJobStateException("job_not_permanently_paused", "Job is not permanently paused");
        }
        log.info("Manually resetting permanently paused job {}", job.id());
        failureHistory.clear(job.id());
        JobUpdate update = JobUpdate.create()
            .status(JobStatus.ACTIVE)
            .failureState(FailureState.NORMAL)
            .failureCount(0)
            .failureCycles(0)
            .permanentlyPaused(false)
            .pauseUntil(null)
            .failureStartedAt(null)
            .checkInterval(job.restorableInterval())
            .originalInterval(null);
        return Transition.reprogram(update);
    }

    private Transition onSuccess(PingJob job, JobUpdate update, Instant now) {
        failureHistory.clear(job.id());
        update.failureCount(0).failureStartedAt(null);

        if (job.failureState() == FailureState.RAPID_CHECK) {
            log.info("Job {} recovered; returning to {} cadence", job.id(), job.restorableInterval());
            update.failureCycles(0)
                .failureState(FailureState.NORMAL)
                .checkInterval(job.restorableInterval())
                .originalInterval(null);
            attemptRecoveryEmail(job, update, now);
            return Transition.reprogram(update);
        }

        if (job.hasPendingFailureAlert()) {
            log.info("Job {} recovered after a failure alert", job.id());
            update.failureCycles(0);
            attemptRecoveryEmail(job, update, now);
        }
        return Transition.stay(update);
    }

    private Transition onFailure(PingJob job, ProbeResult result, JobUpdate update, Instant now) {
        int failures = job.failureCount() + 1;
        failureHistory.append(job.id(), FailureHistoryEntry.from(result));
        update.failureCount(failures);
        log.warn("Job {} failure {}: {}", job.id(), failures, result.resultText());

        if (job.failureState() == FailureState.NORMAL) {
            log.info("Job {} first failure; switching to rapid check every {}", job.id(), CheckInterval.RAPID_CHECK);
            update.failureCount(1)
                .failureState(FailureState.RAPID_CHECK)
                .originalInterval(job.checkInterval())
                .checkInterval(CheckInterval.RAPID_CHECK)
                .failureStartedAt(now);
            return Transition.reprogram(update);
        }

        int threshold = properties.getEscalation().getFailureThreshold();
        if (failures < threshold) {
            return Transition.stay(update);
        }

        int maxCycles = properties.getEscalation().getMaxFailureCycles();
        if (job.failureCycles() >= maxCycles) {
            return permanentlyPause(job, update, maxCycles);
        }
        return pause(job, update, threshold, now);
    }

    private Transition permanentlyPause(PingJob job, JobUpdate update, int maxCycles) {
        log.warn("Job {} exceeded {} failure cycles; permanently pausing", job.id(), maxCycles);
        update.failureState(FailureState.PERMANENTLY_PAUSED)
            .permanentlyPaused(true)
            .status(JobStatus.STOPPED)
            .pauseUntil(null)
            .checkInterval(job.restorableInterval())
            .originalInterval(null);
        desktopNotifier.notify(
            "AutoPing - Site Permanently Paused",
            job.url() + " has failed " + maxCycles + " cycles and requires manual intervention."
        );
        return Transition.reprogram(update);
    }

    private Transition pause(PingJob job, JobUpdate update, int threshold, Instant now) {
        Duration pause = Duration.ofMinutes(properties.getEscalation().getPauseDurationMinutes());
        Instant pauseUntil = now.plus(pause);
        update.failureState(FailureState.PAUSED).pauseUntil(pauseUntil);
        log.warn(
            "Job {} failed {} times in a row (cycle {}); pausing until {}",
            job.id(),
            threshold,
            job.failureCycles() + 1,
            pauseUntil
        );

        if (!job.hasAlertEmail()) {
            log.warn("No alert email configured for job {}; skipping failure alert", job.id());
        } else if (!throttle.canSend(job, now)) {
            log.warn(
                "Failure alert for job {} throttled (rate limit {} minutes)",
                job.id(),
                throttle.effectiveRateLimit(job)
            );
        } else {
            PingJob alerted = update.applyTo(job);
            boolean sent = emailAlertService.sendFailure(alerted, failureHistory.snapshot(job.id()));
            if (sent) {
                update.lastEmailSent(now).emailStamp(now, EmailType.FAILURE);
                desktopNotifier.notify(
                    "AutoPing - Site Down Alert",
                    job.url() + " has failed " + threshold + " times. Email alert sent to " + job.alertEmail()
                );
            } else {
                log.warn("Failure alert for job {} was not delivered", job.id());
            }
        }
        return Transition.reprogram(update);
    }

    private void attemptRecoveryEmail(PingJob job, JobUpdate update, Instant now) {
        if (!job.hasAlertEmail()) {
            log.debug("No alert email configured for job {}; skipping recovery alert", job.id());
            if (job.hasPendingFailureAlert()) {
                update.emailStamp(null, null);
            }
            return;
        }
        String downtime = DowntimeFormatter.between(job.failureStartedAt(), now);
        boolean sent = emailAlertService.sendRecovery(update.applyTo(job), downtime);
        if (sent) {
            update.emailStamp(now, EmailType.RECOVERY);
        } else {
            log.warn("Recovery alert for job {} was not delivered", job.id());
            update.emailStamp(null, null);
        }
    }
}
