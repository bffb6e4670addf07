package com.acme.ztmc.access.transport.http;

import com.acme.ztmc.access.telemetry.AtomicPipelineMetrics;
import com.acme.ztmc.access.transport.api.TransportAck;
import com.acme.ztmc.access.transport.api.TransportNack;
import com.acme.ztmc.access.util.JsonCodec;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NettyAccessHttpAdapterTest {
    private final HttpClient client = HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(2))
        .build();

    private AtomicPipelineMetrics metrics;
    private NettyAccessHttpAdapter adapter;

    @BeforeEach
    void setUp() throws Exception {
        metrics = new AtomicPipelineMetrics();
        adapter = new NettyAccessHttpAdapter(0, 2, metrics);
        adapter.start();
    }

    @AfterEach
    void tearDown() throws Exception {
        adapter.stop();
    }

    @Test
    void bindsEphemeralPort() {
        assertNotEquals(0, adapter.listenPort());
    }

    @Test
    void postIsDispatchedToHandler() throws Exception {
        AtomicReference<String> seenBody = new AtomicReference<>();
        adapter.setInboundHandler(request -> {
            seenBody.set(request.body());
            return new TransportAck(200, "{\"decision\":\"ALLOW\"}");
        });

        HttpResponse<String> response = post("/v1/access?trace=1", "{\"user\":\"alice\"}");

        assertEquals(200, response.statusCode());
        assertEquals("{\"user\":\"alice\"}", seenBody.get());
        assertTrue(response.headers().firstValue("Content-Type").orElse("").startsWith("application/json"));
        assertEquals("ALLOW", JsonCodec.readTree(response.body()).get("decision").asText());
    }

    @Test
    void nackStatusAndErrorArePropagated() throws Exception {
        adapter.setInboundHandler(request -> new TransportNack(400, "missing field: user"));

        HttpResponse<String> response = post("/v1/access", "{}");

        assertEquals(400, response.statusCode());
        JsonNode body = JsonCodec.readTree(response.body());
        assertEquals("missing field: user", body.get("error").asText());
    }

    @Test
    void handlerFailureIsInternalError() throws Exception {
        adapter.setInboundHandler(request -> {
            throw new IllegalStateException("boom");
        });

        HttpResponse<String> response = post("/v1/access", "{}");

        assertEquals(500, response.statusCode());
        assertEquals("internal error", JsonCodec.readTree(response.body()).get("error").asText());
    }

    @Test
    void wrongPathAndMethodAreRejected() throws Exception {
        adapter.setInboundHandler(request -> new TransportAck(200, "{}"));

        HttpResponse<String> notFound = post("/v1/other", "{}");
        assertEquals(404, notFound.statusCode());

        HttpResponse<String> get = client.send(
            HttpRequest.newBuilder().uri(uri("/v1/access")).GET().build(),
            HttpResponse.BodyHandlers.ofString());
        assertEquals(405, get.statusCode());

        HttpResponse<String> getElsewhere = client.send(
            HttpRequest.newBuilder().uri(uri("/health")).GET().build(),
            HttpResponse.BodyHandlers.ofString());
        assertEquals(404, getElsewhere.statusCode());

        AtomicPipelineMetrics.Snapshot s = metrics.snapshot();
        assertEquals(2L, s.rejectedByReason().get(404));
        assertEquals(1L, s.rejectedByReason().get(405));
    }

    @Test
    void stopIsIdempotent() throws Exception {
        adapter.stop();
        adapter.stop();
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        return client.send(
            HttpRequest.newBuilder()
                .uri(uri(path))
                .header("Content-Type", "application/json")
                .timeout(Duration.ofSeconds(5))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build(),
            HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://127.0.0.1:" + adapter.listenPort() + path);
    }
}
