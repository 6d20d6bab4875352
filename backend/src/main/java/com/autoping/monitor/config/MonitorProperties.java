package com.autoping.monitor.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "monitor")
public class MonitorProperties {
    private static final String DEFAULT_USER_AGENT = "autoping/0.1 (+uptime monitor)";

    private String userAgent;
    private int requestTimeoutSeconds = 30;
    private Scheduler scheduler = new Scheduler();
    private Escalation escalation = new Escalation();
    private Mail mail = new Mail();
    private Desktop desktop = new Desktop();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Escalation getEscalation() {
        return escalation;
    }

    public void setEscalation(Escalation escalation) {
        this.escalation = escalation;
    }

    public Mail getMail() {
        return mail;
    }

    public void setMail(Mail mail) {
        this.mail = mail;
    }

    public Desktop getDesktop() {
        return desktop;
    }

    public void setDesktop(Desktop desktop) {
        this.desktop = desktop;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Scheduler {
        private boolean enabled = true;
        private int timerThreads = 2;
        private int workerThreads = 8;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getTimerThreads() {
            return Math.max(1, timerThreads);
        }

        public void setTimerThreads(int timerThreads) {
            this.timerThreads = Math.max(1, timerThreads);
        }

        public int getWorkerThreads() {
            return Math.max(1, workerThreads);
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = Math.max(1, workerThreads);
        }
    }

    public static class Escalation {
        private int failureThreshold = 3;
        private int maxFailureCycles = 5;
        private int pauseDurationMinutes = 5;
        private int historySize = 5;

        public int getFailureThreshold() {
            return Math.max(1, failureThreshold);
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = Math.max(1, failureThreshold);
        }

        public int getMaxFailureCycles() {
            return Math.max(0, maxFailureCycles);
        }

        public void setMaxFailureCycles(int maxFailureCycles) {
            this.maxFailureCycles = Math.max(0, maxFailureCycles);
        }

        public int getPauseDurationMinutes() {
            return Math.max(1, pauseDurationMinutes);
        }

        public void setPauseDurationMinutes(int pauseDurationMinutes) {
            this.pauseDurationMinutes = Math.max(1, pauseDurationMinutes);
        }

        public int getHistorySize() {
            return Math.max(1, historySize);
        }

        public void setHistorySize(int historySize) {
            this.historySize = Math.max(1, historySize);
        }
    }

    public static class Mail {
        private boolean enabled = true;
        private String from;
        private int defaultRateLimitMinutes = 30;
        private int fallbackRateLimitMinutes = 60;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getFrom() {
            return from;
        }

        public void setFrom(String from) {
            this.from = from;
        }

        public int getDefaultRateLimitMinutes() {
            return Math.max(0, defaultRateLimitMinutes);
        }

        public void setDefaultRateLimitMinutes(int defaultRateLimitMinutes) {
            this.defaultRateLimitMinutes = Math.max(0, defaultRateLimitMinutes);
        }

        public int getFallbackRateLimitMinutes() {
            return Math.max(0, fallbackRateLimitMinutes);
        }

        public void setFallbackRateLimitMinutes(int fallbackRateLimitMinutes) {
            this.fallbackRateLimitMinutes = Math.max(0, fallbackRateLimitMinutes);
        }
    }

    public static class Desktop {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
