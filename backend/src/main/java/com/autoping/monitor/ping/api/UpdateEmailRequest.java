package com.autoping.monitor.ping.api;

public record UpdateEmailRequest(
    String alertEmail
) {
}
