package com.autoping.monitor.ping.http;

import com.autoping.monitor.config.MonitorProperties;
import com.autoping.monitor.ping.model.ProbeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;

/**
 * Performs a single GET against a monitored target. Anything below 500 counts as reachable;
 * timeouts, transport errors and 5xx responses are failures. Never retries.
 */
@Service
public class PingHttpClient {
    private static final Logger log = LoggerFactory.getLogger(PingHttpClient.class);
    private static final int SERVER_ERROR_THRESHOLD = 500;

    private final MonitorProperties properties;
    private final HttpClient client;
    private final Clock clock;

    public PingHttpClient(
        MonitorProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor,
        Clock clock
    ) {
        this.properties = properties;
        this.clock = clock;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    public ProbeResult probe(String url) {
        Instant checkedAt = clock.instant();
        long startedNanos = System.nanoTime();
        URI uri = parseUri(url);
        if (uri == null || uri.getHost() == null) {
            return ProbeResult.failure(0, "Invalid URL", elapsedMs(startedNanos), checkedAt);
        }

        int timeoutSeconds = properties.getRequestTimeoutSeconds();
        try {
            HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .header("User-Agent", properties.getUserAgent())
                .header("Accept", "*/*")
                .GET()
                .build();
            HttpResponse<Void> response = client.send(request, HttpResponse.BodyHandlers.discarding());
            long durationMs = elapsedMs(startedNanos);
            int status = response.statusCode();
            if (status >= SERVER_ERROR_THRESHOLD) {
                return ProbeResult.failure(status, "Request failed with status code " + status, durationMs, checkedAt);
            }
            return ProbeResult.success(status, durationMs, checkedAt);
        } catch (HttpTimeoutException e) {
            return ProbeResult.failure(
                0,
                "timeout of " + (timeoutSeconds * 1000L) + "ms exceeded",
                elapsedMs(startedNanos),
                checkedAt
            );
        } catch (IOException e) {
            return ProbeResult.failure(0, describe(e), elapsedMs(startedNanos), checkedAt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProbeResult.failure(0, "interrupted", elapsedMs(startedNanos), checkedAt);
        } catch (Exception e) {
            log.debug("Unexpected probe error for {}", url, e);
            return ProbeResult.failure(0, describe(e), elapsedMs(startedNanos), checkedAt);
        }
    }

    private String describe(Exception e) {
        String message = e.getMessage();
        if (message == null || message.isBlank()) {
            return e.getClass().getSimpleName();
        }
        return message;
    }

    private long elapsedMs(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos).toMillis();
    }

    private URI parseUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            return null;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
