package com.autoping.monitor.ping.api;

public record CreateJobRequest(
    String url,
    String interval,
    String alertEmail,
    Integer emailRateLimit
) {
}
