package com.autoping.monitor.ping.http;

import com.autoping.monitor.config.MonitorProperties;
import com.autoping.monitor.ping.model.ProbeResult;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class PingHttpClientTest {
    private static final Instant NOW = Instant.parse("2026-05-01T09:00:00Z");

    private MockWebServer server;
    private ExecutorService executor;
    private MonitorProperties properties;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(2);
        properties = new MonitorProperties();
        properties.setRequestTimeoutSeconds(1);
        properties.setUserAgent("autoping-test/1.0");
    }

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void clientErrorsStillCountAsReachable() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(404).setBody("missing"));

        ProbeResult result = client().probe(server.url("/health").toString());

        assertThat(result.succeeded()).isTrue();
        assertThat(result.resultText()).isEqualTo("Success: 404");
        assertThat(result.statusCode()).isEqualTo(404);
        assertThat(result.checkedAt()).isEqualTo(NOW);
        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getMethod()).isEqualTo("GET");
        assertThat(request.getHeader("User-Agent")).isEqualTo("autoping-test/1.0");
    }

    @Test
    void serverErrorIsFailure() {
        server.enqueue(new MockResponse().setResponseCode(503));

        ProbeResult result = client().probe(server.url("/").toString());

        assertThat(result.succeeded()).isFalse();
        assertThat(result.resultText()).isEqualTo("Error: Request failed with status code 503");
    }

    @Test
    void redirectsAreFollowed() {
        server.enqueue(new MockResponse().setResponseCode(302).setHeader("Location", server.url("/final").toString()));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("ok"));

        ProbeResult result = client().probe(server.url("/start").toString());

        assertThat(result.resultText()).isEqualTo("Success: 200");
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void slowResponseTimesOut() {
        server.enqueue(new MockResponse().setResponseCode(200).setHeadersDelay(3, TimeUnit.SECONDS));

        ProbeResult result = client().probe(server.url("/slow").toString());

        assertThat(result.succeeded()).isFalse();
        assertThat(result.resultText()).isEqualTo("Error: timeout of 1000ms exceeded");
    }

    @Test
    void unreachableHostIsFailure() throws Exception {
        String url = server.url("/").toString();
        server.shutdown();
        server = null;

        ProbeResult result = client().probe(url);

        assertThat(result.succeeded()).isFalse();
        assertThat(result.resultText()).startsWith("Error: ");
    }

    @Test
    void malformedUrlIsReportedWithoutRequest() {
        ProbeResult result = client().probe("http://");

        assertThat(result.succeeded()).isFalse();
        assertThat(result.resultText()).isEqualTo("Error: Invalid URL");
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void urlWithoutSchemeIsRejected() {
        String hostAndPort = server.getHostName() + ":" + server.getPort() + "/health";

        ProbeResult result = client().probe(hostAndPort);

        assertThat(result.succeeded()).isFalse();
        assertThat(result.resultText()).isEqualTo("Error: Invalid URL");
        assertThat(server.getRequestCount()).isZero();
    }

    private PingHttpClient client() {
        return new PingHttpClient(properties, executor, Clock.fixed(NOW, ZoneOffset.UTC));
    }
}
