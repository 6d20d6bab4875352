package com.autoping.monitor.ping.persistence;

import com.autoping.monitor.ping.model.CheckInterval;
import com.autoping.monitor.ping.model.EmailType;
import com.autoping.monitor.ping.model.FailureState;
import com.autoping.monitor.ping.model.JobStatus;
import com.autoping.monitor.ping.model.JobUpdate;
import com.autoping.monitor.ping.model.PingJob;
import com.autoping.monitor.ping.model.ProbeResult;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class PingJobRepositoryTest {
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Autowired
    private PingJobRepository repository;

    @Test
    void createdJobStartsHealthy() {
        PingJob job = repository.createJob("https://example.com", CheckInterval.FIVE_MINUTES, "ops@example.com", 30, NOW);

        assertThat(job.id()).isPositive();
        assertThat(job.checkInterval()).isEqualTo(CheckInterval.FIVE_MINUTES);
        assertThat(job.originalInterval()).isNull();
        assertThat(job.status()).isEqualTo(JobStatus.ACTIVE);
        assertThat(job.failureState()).isEqualTo(FailureState.NORMAL);
        assertThat(job.failureCount()).isZero();
        assertThat(job.failureCycles()).isZero();
        assertThat(job.permanentlyPaused()).isFalse();
        assertThat(job.pauseUntil()).isNull();
        assertThat(job.lastRun()).isNull();
        assertThat(job.lastDurationMs()).isNull();
        assertThat(job.emailRateLimitMinutes()).isEqualTo(30);
        assertThat(job.createdAt()).isEqualTo(NOW);
    }

    @Test
    void updateSetsAndClearsFieldsInOneStatement() {
        PingJob job = repository.createJob("https://example.org", CheckInterval.ONE_MINUTE, null, 30, NOW);
        Instant pauseUntil = NOW.plus(5, ChronoUnit.MINUTES);

        int rows = repository.updateJob(job.id(), JobUpdate.create()
            .failureState(FailureState.PAUSED)
            .checkInterval(CheckInterval.RAPID_CHECK)
            .originalInterval(CheckInterval.ONE_MINUTE)
            .failureCount(3)
            .pauseUntil(pauseUntil)
            .lastEmailSent(NOW)
            .emailStamp(NOW, EmailType.FAILURE));

        PingJob paused = repository.findById(job.id());
        assertThat(rows).isEqualTo(1);
        assertThat(paused.failureState()).isEqualTo(FailureState.PAUSED);
        assertThat(paused.checkInterval()).isEqualTo(CheckInterval.FIFTEEN_SECONDS);
        assertThat(paused.originalInterval()).isEqualTo(CheckInterval.ONE_MINUTE);
        assertThat(paused.pauseUntil()).isEqualTo(pauseUntil);
        assertThat(paused.lastEmailType()).isEqualTo(EmailType.FAILURE);

        repository.updateJob(job.id(), JobUpdate.create()
            .failureState(FailureState.NORMAL)
            .checkInterval(CheckInterval.ONE_MINUTE)
            .originalInterval(null)
            .pauseUntil(null)
            .emailStamp(null, null));

        PingJob resumed = repository.findById(job.id());
        assertThat(resumed.originalInterval()).isNull();
        assertThat(resumed.pauseUntil()).isNull();
        assertThat(resumed.emailSentAt()).isNull();
        assertThat(resumed.lastEmailType()).isNull();
        assertThat(resumed.lastEmailSent()).isEqualTo(NOW);
        assertThat(resumed.failureCount()).isEqualTo(3);
    }

    @Test
    void recordProbeStoresSnapshot() {
        PingJob job = repository.createJob("https://example.net", CheckInterval.ONE_HOUR, null, 30, NOW);

        repository.recordProbe(job.id(), ProbeResult.failure(0, "getaddrinfo ENOTFOUND example.net", 87L, NOW));

        PingJob stored = repository.findById(job.id());
        assertThat(stored.lastRun()).isEqualTo(NOW);
        assertThat(stored.lastDurationMs()).isEqualTo(87L);
        assertThat(stored.lastResult()).isEqualTo("Error: getaddrinfo ENOTFOUND example.net");
        assertThat(stored.failureState()).isEqualTo(FailureState.NORMAL);
    }

    @Test
    void findAllListsNewestFirstAndDeleteRemovesRow() {
        PingJob older = repository.createJob("https://older.example.com", CheckInterval.ONE_MINUTE, null, 30, NOW);
        PingJob newer = repository.createJob("https://newer.example.com", CheckInterval.ONE_MINUTE, null, 30, NOW.plusSeconds(60));

        List<Long> ids = repository.findAll().stream().map(PingJob::id).toList();
        assertThat(ids.indexOf(newer.id())).isLessThan(ids.indexOf(older.id()));

        assertThat(repository.deleteJob(older.id())).isEqualTo(1);
        assertThat(repository.findById(older.id())).isNull();
        assertThat(repository.updateJob(older.id(), JobUpdate.create().failureCount(1))).isZero();
    }
}
