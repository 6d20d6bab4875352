package com.autoping.monitor.ping.service;

import com.autoping.monitor.config.MonitorProperties;
import com.autoping.monitor.ping.http.PingHttpClient;
import com.autoping.monitor.ping.model.FailureState;
import com.autoping.monitor.ping.model.PingJob;
import com.autoping.monitor.ping.model.ProbeResult;
import com.autoping.monitor.ping.persistence.PingJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns the live timer of every job. A job has at most one handle: either a fixed-rate probe
 * tick or a one-shot resume at the end of a pause. Callers hold the job's {@link JobLocks}
 * monitor around {@link #start(PingJob)} and {@link #stop(long)}.
 */
@Service
public class PingScheduler {
    private static final Logger log = LoggerFactory.getLogger(PingScheduler.class);

    private final PingJobRepository repository;
    private final PingHttpClient httpClient;
    private final FailureStateMachine stateMachine;
    private final FailureHistoryStore failureHistory;
    private final JobLocks jobLocks;
    private final MonitorProperties properties;
    private final ScheduledExecutorService timer;
    private final Executor worker;
    private final Clock clock;
    private final Map<Long, JobHandle> handles = new ConcurrentHashMap<>();

    public PingScheduler(
        PingJobRepository repository,
        PingHttpClient httpClient,
        FailureStateMachine stateMachine,
        FailureHistoryStore failureHistory,
        JobLocks jobLocks,
        MonitorProperties properties,
        @Qualifier("pingTimer") ScheduledExecutorService timer,
        @Qualifier("pingWorkerExecutor") Executor worker,
        Clock clock
    ) {
        this.repository = repository;
        this.httpClient = httpClient;
        this.stateMachine = stateMachine;
        this.failureHistory = failureHistory;
        this.jobLocks = jobLocks;
        this.properties = properties;
        this.timer = timer;
        this.worker = worker;
        this.clock = clock;
    }

    @PostConstruct
    public void loadIfEnabled() {
        if (properties.getScheduler().isEnabled()) {
            loadAll();
        }
    }

    @PreDestroy
    public void shutdown() {
        for (Long jobId : List.copyOf(handles.keySet())) {
            cancel(jobId);
        }
        log.info("Ping scheduler shut down");
    }

    /** Re-arms every stored job from its persisted state. */
    public int loadAll() {
        List<PingJob> jobs = repository.findAll();
        int started = 0;
        for (PingJob job : jobs) {
            try {
                jobLocks.withLock(job.id(), () -> start(job));
                started++;
            } catch (Exception e) {
                log.error("Failed to schedule job {} ({}) on startup", job.id(), job.url(), e);
            }
        }
        log.info("Loaded {} ping jobs ({} scheduled)", jobs.size(), handles.size());
        return started;
    }

    public void start(PingJob job) {
        long jobId = job.id();
        cancel(jobId);
        if (job.isStopped() || job.failureState() == FailureState.PERMANENTLY_PAUSED) {
            log.debug("Job {} is {} / {}; not scheduling", jobId, job.status(), job.failureState());
            return;
        }

        Instant now = clock.instant();
        if (job.failureState() == FailureState.PAUSED) {
            Instant deadline = job.pauseUntil();
            if (deadline == null || !deadline.isAfter(now)) {
                log.info("Pause of job {} already elapsed; resuming now", jobId);
                resume(job);
                return;
            }
            JobHandle handle = new JobHandle(true);
            long delayMs = Duration.between(now, deadline).toMillis();
            handle.future = timer.schedule(() -> dispatchResume(jobId, handle), delayMs, TimeUnit.MILLISECONDS);
            handles.put(jobId, handle);
            log.info("Job {} paused; resume scheduled at {}", jobId, deadline);
            return;
        }

        JobHandle handle = new JobHandle(false);
        long periodMs = job.checkInterval().period().toMillis();
        long initialDelayMs = Duration.between(now, job.checkInterval().nextOccurrence(now)).toMillis();
        handle.future = timer.scheduleAtFixedRate(
            () -> dispatchTick(jobId, handle),
            initialDelayMs,
            periodMs,
            TimeUnit.MILLISECONDS
        );
        handles.put(jobId, handle);
        log.info("Scheduled job {} ({}) every {}", jobId, job.url(), job.checkInterval());
    }

    public void stop(long jobId) {
        boolean cancelled = cancel(jobId);
        failureHistory.clear(jobId);
        if (cancelled) {
            log.info("Stopped monitoring job {}", jobId);
        }
    }

    public boolean isScheduled(long jobId) {
        return handles.containsKey(jobId);
    }

    public boolean isAwaitingResume(long jobId) {
        JobHandle handle = handles.get(jobId);
        return handle != null && handle.resume;
    }

    public Set<Long> scheduledJobIds() {
        return Set.copyOf(handles.keySet());
    }

    private boolean cancel(long jobId) {
        JobHandle handle = handles.remove(jobId);
        if (handle == null) {
            return false;
        }
        handle.cancel();
        return true;
    }

    private void dispatchTick(long jobId, JobHandle handle) {
        try {
            if (handle.cancelled.get()) {
                return;
            }
            if (!handle.inFlight.compareAndSet(false, true)) {
                log.debug("Previous probe of job {} still running; skipping tick", jobId);
                return;
            }
            try {
                worker.execute(() -> {
                    try {
                        runTick(jobId, handle);
                    } finally {
                        handle.inFlight.set(false);
                    }
                });
            } catch (RejectedExecutionException e) {
                handle.inFlight.set(false);
                log.warn("Probe of job {} rejected by worker pool", jobId);
            }
        } catch (RuntimeException e) {
            log.error("Tick dispatch failed for job {}", jobId, e);
        }
    }

    private void dispatchResume(long jobId, JobHandle handle) {
        try {
            worker.execute(() -> runResume(jobId, handle));
        } catch (RuntimeException e) {
            log.error("Resume dispatch failed for job {}", jobId, e);
        }
    }

    private void runTick(long jobId, JobHandle handle) {
        try {
            PingJob job = repository.findById(jobId);
            if (job == null) {
                log.info("Job {} no longer exists; stopping its timer", jobId);
                jobLocks.withLock(jobId, () -> stop(jobId));
                return;
            }
            ProbeResult result = httpClient.probe(job.url());
            jobLocks.withLock(jobId, () -> applyProbe(jobId, handle, result));
        } catch (RuntimeException e) {
            log.error("Probe tick failed for job {}", jobId, e);
        }
    }

    private void runResume(long jobId, JobHandle handle) {
        try {
            jobLocks.withLock(jobId, () -> {
                if (handle.cancelled.get()) {
                    return;
                }
                PingJob job = repository.findById(jobId);
                if (job == null) {
                    stop(jobId);
                    return;
                }
                if (job.failureState() != FailureState.PAUSED) {
                    start(job);
                    return;
                }
                resume(job);
            });
        } catch (RuntimeException e) {
            log.error("Resume failed for job {}", jobId, e);
        }
    }

    private void applyProbe(long jobId, JobHandle handle, ProbeResult result) {
        if (handle.cancelled.get()) {
            log.debug("Dropping probe result of job {}; timer was cancelled", jobId);
            return;
        }
        PingJob current = repository.findById(jobId);
        if (current == null || current.isStopped()) {
            log.info("Job {} is gone or stopped; dropping probe result and its timer", jobId);
            stop(jobId);
            return;
        }
        Transition transition = stateMachine.onProbe(current, result, clock.instant());
        PingJob merged = persist(current, transition);
        if (transition.reschedule()) {
            start(merged);
        }
    }

    private void resume(PingJob job) {
        Transition transition = stateMachine.resumeAfterPause(job);
        start(persist(job, transition));
    }

    private PingJob persist(PingJob job, Transition transition) {
        PingJob merged = transition.update().applyTo(job);
        try {
            repository.updateJob(job.id(), transition.update());
        } catch (DataAccessException e) {
            log.error("Failed to persist state of job {} ({})", job.id(), transition.update(), e);
        }
        return merged;
    }

    private static final class JobHandle {
        private final boolean resume;
        private final AtomicBoolean cancelled = new AtomicBoolean(false);
        private final AtomicBoolean inFlight = new AtomicBoolean(false);
        private volatile ScheduledFuture<?> future;

        JobHandle(boolean resume) {
            this.resume = resume;
        }

        private void cancel() {
            cancelled.set(true);
            ScheduledFuture<?> scheduled = future;
            if (scheduled != null) {
                scheduled.cancel(false);
            }
        }
    }
}
