package com.autoping.monitor.ping.service;

import com.autoping.monitor.config.MonitorProperties;
import com.autoping.monitor.ping.http.PingHttpClient;
import com.autoping.monitor.ping.model.CheckInterval;
import com.autoping.monitor.ping.model.FailureState;
import com.autoping.monitor.ping.model.JobStatus;
import com.autoping.monitor.ping.model.JobUpdate;
import com.autoping.monitor.ping.model.PingJob;
import com.autoping.monitor.ping.model.PingJobView;
import com.autoping.monitor.ping.model.ProbeResult;
import com.autoping.monitor.ping.persistence.PingJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Commands and reads exposed to the API. Every read-modify-write of an existing job runs
 * under its {@link JobLocks} monitor so it never interleaves with a scheduler tick.
 */
@Service
public class PingJobService {
    private static final Logger log = LoggerFactory.getLogger(PingJobService.class);

    private final PingJobRepository repository;
    private final PingScheduler scheduler;
    private final FailureStateMachine stateMachine;
    private final PingHttpClient httpClient;
    private final JobLocks jobLocks;
    private final MonitorProperties properties;
    private final Clock clock;

    public PingJobService(
        PingJobRepository repository,
        PingScheduler scheduler,
        FailureStateMachine stateMachine,
        PingHttpClient httpClient,
        JobLocks jobLocks,
        MonitorProperties properties,
        Clock clock
    ) {
        this.repository = repository;
        this.scheduler = scheduler;
        this.stateMachine = stateMachine;
        this.httpClient = httpClient;
        this.jobLocks = jobLocks;
        this.properties = properties;
        this.clock = clock;
    }

    public List<PingJobView> listJobs() {
        Instant now = clock.instant();
        return repository.findAll().stream()
            .map(job -> PingJobView.of(job, nextRun(job, now)))
            .toList();
    }

    public PingJobView getJob(long jobId) {
        PingJob job = requireJob(jobId);
        return PingJobView.of(job, nextRun(job, clock.instant()));
    }

    /**
     * Stores a new job, probes it once synchronously so the first snapshot is available
     * immediately, then starts its timer.
     */
    public PingJobView createJob(String url, String intervalLabel, String alertEmail, Integer emailRateLimit) {
        CheckInterval interval = CheckInterval.fromLabel(intervalLabel);
        if (!CheckInterval.isKnownLabel(intervalLabel)) {
            log.warn("Unknown interval '{}' for {}; using {}", intervalLabel, url, interval);
        }
        int rateLimit = emailRateLimit == null || emailRateLimit <= 0
            ? properties.getMail().getDefaultRateLimitMinutes()
            : emailRateLimit;
        PingJob created = repository.createJob(url.trim(), interval, blankToNull(alertEmail), rateLimit, clock.instant());
        log.info("Created job {} for {} every {}", created.id(), created.url(), interval);

        ProbeResult first = httpClient.probe(created.url());
        log.info("Initial probe of job {}: {}", created.id(), first.resultText());

        // The job may have been toggled or deleted while the first probe was in flight.
        PingJob started = jobLocks.withLock(created.id(), () -> {
            PingJob current = repository.findById(created.id());
            if (current == null) {
                log.info("Job {} was deleted before its first probe completed", created.id());
                return null;
            }
            repository.recordProbe(created.id(), first);
            PingJob probed = JobUpdate.create().probe(first).applyTo(current);
            scheduler.start(probed);
            return probed;
        });
        if (started == null) {
            throw new JobNotFoundException(created.id());
        }
        return PingJobView.of(started, nextRun(started, clock.instant()));
    }

    public PingJobView toggleJob(long jobId) {
        PingJob toggled = jobLocks.withLock(jobId, () -> {
            PingJob job = requireJob(jobId);
            if (job.isStopped()) {
                if (job.permanentlyPaused()) {
                    throw new InvalidJobStateException(
                        "job_permanently_paused",
                        "Job is permanently paused; reset it before activating"
                    );
                }
                PingJob activated = apply(job, JobUpdate.create().status(JobStatus.ACTIVE));
                scheduler.start(activated);
                log.info("Activated job {}", jobId);
                return activated;
            }
            PingJob stopped = apply(job, JobUpdate.create().status(JobStatus.STOPPED));
            scheduler.stop(jobId);
            log.info("Stopped job {}", jobId);
            return stopped;
        });
        return PingJobView.of(toggled, nextRun(toggled, clock.instant()));
    }

    public PingJobView resetJob(long jobId) {
        PingJob reset = jobLocks.withLock(jobId, () -> {
            PingJob job = requireJob(jobId);
            Transition transition = stateMachine.manualReset(job);
            PingJob merged = apply(job, transition.update());
            scheduler.start(merged);
            return merged;
        });
        return PingJobView.of(reset, nextRun(reset, clock.instant()));
    }

    public PingJobView updateAlertEmail(long jobId, String alertEmail) {
        String normalized = blankToNull(alertEmail);
        PingJob updated = jobLocks.withLock(jobId, () -> {
            PingJob job = requireJob(jobId);
            return apply(job, JobUpdate.create().alertEmail(normalized));
        });
        log.info("Alert email of job {} {}", jobId, normalized == null ? "cleared" : "updated");
        return PingJobView.of(updated, nextRun(updated, clock.instant()));
    }

    public void deleteJob(long jobId) {
        jobLocks.withLock(jobId, () -> {
            requireJob(jobId);
            scheduler.stop(jobId);
            repository.deleteJob(jobId);
        });
        jobLocks.forget(jobId);
        log.info("Deleted job {}", jobId);
    }

    /**
     * Projected next probe time for display. Stopped and permanently paused jobs have none;
     * a paused job resumes at its restored cadence once the pause ends.
     */
    static Instant nextRun(PingJob job, Instant now) {
        if (job.isStopped() || job.failureState() == FailureState.PERMANENTLY_PAUSED) {
            return null;
        }
        if (job.failureState() == FailureState.PAUSED) {
            Instant from = job.pauseDeadline().filter(deadline -> deadline.isAfter(now)).orElse(now);
            return job.restorableInterval().nextRunAfter(from);
        }
        return job.checkInterval().nextRunAfter(now);
    }

    private PingJob requireJob(long jobId) {
        PingJob job = repository.findById(jobId);
        if (job == null) {
            throw new JobNotFoundException(jobId);
        }
        return job;
    }

    private PingJob apply(PingJob job, JobUpdate update) {
        repository.updateJob(job.id(), update);
        return update.applyTo(job);
    }

    private static String blankToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
