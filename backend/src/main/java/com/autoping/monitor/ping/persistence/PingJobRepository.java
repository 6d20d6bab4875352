package com.autoping.monitor.ping.persistence;

import com.autoping.monitor.ping.model.CheckInterval;
import com.autoping.monitor.ping.model.EmailType;
import com.autoping.monitor.ping.model.FailureState;
import com.autoping.monitor.ping.model.JobField;
import com.autoping.monitor.ping.model.JobStatus;
import com.autoping.monitor.ping.model.JobUpdate;
import com.autoping.monitor.ping.model.PingJob;
import com.autoping.monitor.ping.model.ProbeResult;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

@Repository
public class PingJobRepository {
    private static final String SELECT_COLUMNS = """
        SELECT id,
               url,
               check_interval,
               original_check_interval,
               status,
               failure_state,
               failure_count,
               failure_cycles,
               failure_started_at,
               pause_until,
               permanently_paused,
               alert_email,
               email_rate_limit,
               last_email_sent,
               email_sent_at,
               last_email_type,
               last_run,
               last_duration_ms,
               last_result,
               created_at
        FROM ping_jobs
        """;

    private static final RowMapper<PingJob> JOB_MAPPER = PingJobRepository::mapJob;

    private final NamedParameterJdbcTemplate jdbc;

    public PingJobRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public PingJob createJob(String url, CheckInterval interval, String alertEmail, int rateLimitMinutes, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("url", url)
            .addValue("checkInterval", interval.label())
            .addValue("alertEmail", alertEmail)
            .addValue("rateLimit", rateLimitMinutes)
            .addValue("now", Timestamp.from(now));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO ping_jobs (url, check_interval, alert_email, email_rate_limit, created_at)
                VALUES (:url, :checkInterval, :alertEmail, :rateLimit, :now)
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("No id generated for ping job " + url);
        }
        PingJob created = findById(key.longValue());
        if (created == null) {
            throw new IllegalStateException("Ping job " + key + " vanished after insert");
        }
        return created;
    }

    public PingJob findById(long id) {
        List<PingJob> results = jdbc.query(
            SELECT_COLUMNS + " WHERE id = :id",
            new MapSqlParameterSource().addValue("id", id),
            JOB_MAPPER
        );
        return results.isEmpty() ? null : results.get(0);
    }

    public List<PingJob> findAll() {
        return jdbc.query(
            SELECT_COLUMNS + " ORDER BY created_at DESC, id DESC",
            new MapSqlParameterSource(),
            JOB_MAPPER
        );
    }

    /**
     * Writes every field present in {@code update} in a single statement.
     *
     * @return number of rows touched; 0 when the job no longer exists
     */
    public int updateJob(long id, JobUpdate update) {
        if (update == null || update.isEmpty()) {
            return 0;
        }
        MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", id);
        StringJoiner assignments = new StringJoiner(", ");
        for (Map.Entry<JobField, Object> entry : update.values().entrySet()) {
            JobField field = entry.getKey();
            String param = "p_" + field.column();
            assignments.add(field.column() + " = :" + param);
            params.addValue(param, toSqlValue(entry.getValue()), sqlType(field));
        }
        return jdbc.update("UPDATE ping_jobs SET " + assignments + " WHERE id = :id", params);
    }

    public int recordProbe(long id, ProbeResult result) {
        return updateJob(id, JobUpdate.create().probe(result));
    }

    public int deleteJob(long id) {
        return jdbc.update(
            "DELETE FROM ping_jobs WHERE id = :id",
            new MapSqlParameterSource().addValue("id", id)
        );
    }

    private static int sqlType(JobField field) {
        return switch (field) {
            case FAILURE_STARTED_AT, PAUSE_UNTIL, LAST_EMAIL_SENT, EMAIL_SENT_AT, LAST_RUN -> Types.TIMESTAMP;
            case FAILURE_COUNT, FAILURE_CYCLES -> Types.INTEGER;
            case LAST_DURATION_MS -> Types.BIGINT;
            case PERMANENTLY_PAUSED -> Types.BOOLEAN;
            default -> Types.VARCHAR;
        };
    }

    private static Object toSqlValue(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Instant instant) {
            return Timestamp.from(instant);
        }
        if (value instanceof CheckInterval interval) {
            return interval.label();
        }
        if (value instanceof JobStatus status) {
            return status.dbValue();
        }
        if (value instanceof FailureState state) {
            return state.dbValue();
        }
        if (value instanceof EmailType type) {
            return type.dbValue();
        }
        return value;
    }

    private static PingJob mapJob(ResultSet rs, int rowNum) throws SQLException {
        String originalInterval = rs.getString("original_check_interval");
        int rateLimit = rs.getInt("email_rate_limit");
        Integer rateLimitValue = rs.wasNull() ? null : rateLimit;
        long duration = rs.getLong("last_duration_ms");
        Long durationValue = rs.wasNull() ? null : duration;
        return new PingJob(
            rs.getLong("id"),
            rs.getString("url"),
            CheckInterval.fromLabel(rs.getString("check_interval")),
            originalInterval == null ? null : CheckInterval.fromLabel(originalInterval),
            JobStatus.fromDbValue(rs.getString("status")),
            FailureState.fromDbValue(rs.getString("failure_state")),
            rs.getInt("failure_count"),
            rs.getInt("failure_cycles"),
            toInstant(rs.getTimestamp("failure_started_at")),
            toInstant(rs.getTimestamp("pause_until")),
            rs.getBoolean("permanently_paused"),
            rs.getString("alert_email"),
            rateLimitValue,
            toInstant(rs.getTimestamp("last_email_sent")),
            toInstant(rs.getTimestamp("email_sent_at")),
            EmailType.fromDbValue(rs.getString("last_email_type")),
            toInstant(rs.getTimestamp("last_run")),
            durationValue,
            rs.getString("last_result"),
            toInstant(rs.getTimestamp("created_at"))
        );
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
