package com.autoping.monitor.ping.notify;

import com.autoping.monitor.config.MonitorProperties;
import com.autoping.monitor.ping.PingJobFixtures;
import com.autoping.monitor.ping.model.CheckInterval;
import com.autoping.monitor.ping.model.PingJob;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NotificationThrottleTest {
    private static final Instant NOW = Instant.parse("2026-02-01T10:00:00Z");

    @Test
    void allowsFirstAlert() {
        assertTrue(NotificationThrottle.canSend(null, 30, NOW));
    }

    @Test
    void blocksUntilRateLimitElapsed() {
        assertFalse(NotificationThrottle.canSend(NOW.minus(Duration.ofMinutes(29)), 30, NOW));
        assertTrue(NotificationThrottle.canSend(NOW.minus(Duration.ofMinutes(30)), 30, NOW));
        assertTrue(NotificationThrottle.canSend(NOW.minus(Duration.ofMinutes(31)), 30, NOW));
    }

    @Test
    void jobWithoutRateLimitUsesFallback() {
        MonitorProperties properties = new MonitorProperties();
        NotificationThrottle throttle = new NotificationThrottle(properties);
        PingJob base = PingJobFixtures.healthy(1L, CheckInterval.ONE_MINUTE);
        PingJob unlimited = new PingJob(
            base.id(), base.url(), base.checkInterval(), null, base.status(), base.failureState(),
            0, 0, null, null, false, null, null,
            NOW.minus(Duration.ofMinutes(45)), null, null, null, null, null, base.createdAt()
        );

        assertEquals(60, throttle.effectiveRateLimit(unlimited));
        assertFalse(throttle.canSend(unlimited, NOW));
        assertEquals(30, throttle.effectiveRateLimit(base));
    }
}
