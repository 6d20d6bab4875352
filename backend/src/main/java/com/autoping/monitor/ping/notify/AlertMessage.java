package com.autoping.monitor.ping.notify;

public record AlertMessage(
    String subject,
    String text,
    String html
) {
}
