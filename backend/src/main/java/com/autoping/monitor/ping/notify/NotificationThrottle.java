package com.autoping.monitor.ping.notify;

import com.autoping.monitor.config.MonitorProperties;
import com.autoping.monitor.ping.model.PingJob;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

@Component
public class NotificationThrottle {
    private final MonitorProperties properties;

    public NotificationThrottle(MonitorProperties properties) {
        this.properties = properties;
    }

    /** True when nothing was sent yet or at least {@code rateLimitMinutes} have elapsed since. */
    public static boolean canSend(Instant lastSent, int rateLimitMinutes, Instant now) {
        if (lastSent == null) {
            return true;
        }
        double elapsedMinutes = Duration.between(lastSent, now).toMillis() / 60_000d;
        return elapsedMinutes >= rateLimitMinutes;
    }

    public boolean canSend(PingJob job, Instant now) {
        return canSend(job.lastEmailSent(), effectiveRateLimit(job), now);
    }

    public int effectiveRateLimit(PingJob job) {
        Integer configured = job.emailRateLimitMinutes();
        if (configured != null && configured > 0) {
            return configured;
        }
        return properties.getMail().getFallbackRateLimitMinutes();
    }
}
