package com.autoping.monitor.ping;

import com.autoping.monitor.config.MonitorProperties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MonitorPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToSafeDefault() {
        MonitorProperties properties = new MonitorProperties();
        properties.setUserAgent("   ");
        assertTrue(properties.getUserAgent().startsWith("autoping/0.1"));
    }

    @Test
    void escalationDefaultsMatchPolicy() {
        MonitorProperties.Escalation escalation = new MonitorProperties().getEscalation();
        assertEquals(3, escalation.getFailureThreshold());
        assertEquals(5, escalation.getMaxFailureCycles());
        assertEquals(5, escalation.getPauseDurationMinutes());
        assertEquals(5, escalation.getHistorySize());
    }

    @Test
    void poolsAndTimeoutsAreClamped() {
        MonitorProperties properties = new MonitorProperties();
        properties.setRequestTimeoutSeconds(0);
        properties.getScheduler().setWorkerThreads(-2);
        properties.getEscalation().setFailureThreshold(0);
        properties.getMail().setFallbackRateLimitMinutes(-5);
        assertEquals(1, properties.getRequestTimeoutSeconds());
        assertEquals(1, properties.getScheduler().getWorkerThreads());
        assertEquals(1, properties.getEscalation().getFailureThreshold());
        assertEquals(0, properties.getMail().getFallbackRateLimitMinutes());
    }
}
