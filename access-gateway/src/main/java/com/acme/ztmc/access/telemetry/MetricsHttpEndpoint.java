package com.acme.ztmc.access.telemetry;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import com.acme.ztmc.access.policy.Decision;
import com.acme.ztmc.access.util.AccessDefaults;
import com.acme.ztmc.access.util.AccessStatusCodes;
import com.acme.ztmc.access.util.JsonCodec;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Machine-readable metrics endpoint: Prometheus text on {@code path} and the raw
 * {@link MetricsSnapshot} as JSON on {@code path + "/snapshot"}.
 */
public final class MetricsHttpEndpoint implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(MetricsHttpEndpoint.class.getName());
    private static final Pattern METRIC_NAME_SANITIZER = Pattern.compile("[^a-zA-Z0-9_]");
    private static final String PROMETHEUS_CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";
    private static final String JSON_CONTENT_TYPE = "application/json";

    private final Supplier<MetricsSnapshot> snapshotSupplier;
    private final AtomicPipelineMetrics pipelineMetrics;
    private final Supplier<Map<String, Long>> additionalCountersSupplier;
    private final int port;
    private final String path;
    private final HttpServer server;
    private final ExecutorService executor;

    public MetricsHttpEndpoint(Supplier<MetricsSnapshot> snapshotSupplier,
                               AtomicPipelineMetrics pipelineMetrics,
                               int port,
                               String path,
                               Supplier<Map<String, Long>> additionalCountersSupplier) throws IOException {
        this.snapshotSupplier = Objects.requireNonNull(snapshotSupplier, "snapshotSupplier");
        this.pipelineMetrics = Objects.requireNonNull(pipelineMetrics, "pipelineMetrics");
        this.additionalCountersSupplier = additionalCountersSupplier == null ? (() -> Map.of()) : additionalCountersSupplier;
        this.path = normalizePath(path);
        this.server = HttpServer.create(new InetSocketAddress(port), 0);
        this.port = server.getAddress().getPort();
        this.server.createContext(this.path, this::handle);
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "metrics-http-endpoint");
            t.setDaemon(true);
            return t;
        });
        this.server.setExecutor(executor);
    }

    public void start() {
        server.start();
        LOG.info("Metrics endpoint started on :" + port + path);
    }

    public int port() {
        return port;
    }

    private void handle(HttpExchange exchange) throws IOException {
        try {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                write(exchange, AccessStatusCodes.METHOD_NOT_ALLOWED, "text/plain", "method not allowed\n");
                return;
            }
            String requestPath = exchange.getRequestURI().getPath();
            if (requestPath.equals(path + "/snapshot")) {
                write(exchange, AccessStatusCodes.OK, JSON_CONTENT_TYPE, JsonCodec.writeString(snapshotSupplier.get()));
                return;
            }
            if (!requestPath.equals(path)) {
                write(exchange, AccessStatusCodes.NOT_FOUND, "text/plain", "not found\n");
                return;
            }
            Map<String, Long> extra = additionalCountersSupplier.get();
            String body = renderPrometheus(snapshotSupplier.get(), pipelineMetrics.snapshot(), extra == null ? Map.of() : extra);
            write(exchange, AccessStatusCodes.OK, PROMETHEUS_CONTENT_TYPE, body);
        } catch (Exception e) {
            LOG.log(Level.WARNING, "Metrics render failed", e);
            write(exchange, AccessStatusCodes.INTERNAL_ERROR, "text/plain", "internal error\n");
        }
    }

    private static void write(HttpExchange exchange, int status, String contentType, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private static String normalizePath(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return AccessDefaults.DEFAULT_METRICS_HTTP_PATH;
        }
        return rawPath.startsWith("/") ? rawPath : "/" + rawPath;
    }

    static String renderPrometheus(MetricsSnapshot snapshot,
                                   AtomicPipelineMetrics.Snapshot pipeline,
                                   Map<String, Long> additionalCounters) {
        StringBuilder sb = new StringBuilder(AccessDefaults.DEFAULT_METRICS_RENDER_BUFFER);

        appendHelpType(sb, "ztmc_access_requests_total", "Access requests recorded in the audit log", "counter");
        appendMetric(sb, "ztmc_access_requests_total", Map.of(), snapshot.totalAccessRequests());

        appendHelpType(sb, "ztmc_access_decisions_total", "Access decisions by outcome", "counter");
        for (Decision decision : Decision.values()) {
            appendMetric(sb, "ztmc_access_decisions_total", Map.of("decision", decision.name()),
                snapshot.decisionCount(decision));
        }

        appendHelpType(sb, "ztmc_remediations_total", "Remediation events recorded", "counter");
        appendMetric(sb, "ztmc_remediations_total", Map.of(), snapshot.totalRemediations());

        appendHelpType(sb, "ztmc_events_by_cloud_total", "Audit events by target cloud", "counter");
        for (Map.Entry<String, Long> e : snapshot.perCloud().entrySet()) {
            appendMetric(sb, "ztmc_events_by_cloud_total", Map.of("cloud", e.getKey()), e.getValue());
        }

        appendHelpType(sb, "ztmc_events_by_type_total", "Audit events by type", "counter");
        for (Map.Entry<String, Long> e : snapshot.eventsByType().entrySet()) {
            appendMetric(sb, "ztmc_events_by_type_total", Map.of("event_type", e.getKey()), e.getValue());
        }

        appendHelpType(sb, "ztmc_audit_last_sequence", "Sequence number of the last recorded audit entry", "gauge");
        appendMetric(sb, "ztmc_audit_last_sequence", Map.of(), snapshot.lastSequence());

        appendHelpType(sb, "ztmc_pipeline_requests_total", "Requests received by the enforcement point", "counter");
        appendMetric(sb, "ztmc_pipeline_requests_total", Map.of(), pipeline.requests());

        appendHelpType(sb, "ztmc_pipeline_rejected_total", "Requests rejected before decision by reason code", "counter");
        for (Map.Entry<Integer, Long> e : pipeline.rejectedByReason().entrySet()) {
            appendMetric(sb, "ztmc_pipeline_rejected_total", Map.of("reason_code", Integer.toString(e.getKey())), e.getValue());
        }

        appendHelpType(sb, "ztmc_pipeline_remediation_failures_total", "Remediation calls that failed or timed out", "counter");
        appendMetric(sb, "ztmc_pipeline_remediation_failures_total", Map.of(), pipeline.remediationFailures());

        appendHelpType(sb, "ztmc_pipeline_audit_write_failures_total", "Audit entries that could not be recorded", "counter");
        appendMetric(sb, "ztmc_pipeline_audit_write_failures_total", Map.of(), pipeline.auditWriteFailures());

        appendHelpType(sb, "ztmc_decision_duration_nanos", "Decision duration summary in nanoseconds", "summary");
        appendMetric(sb, "ztmc_decision_duration_nanos_sum", Map.of(), pipeline.decisionNanosTotal());
        appendMetric(sb, "ztmc_decision_duration_nanos_count", Map.of(), pipeline.decisionSamples());

        appendHelpType(sb, "ztmc_decision_p99_nanos", "Decision p99 latency in nanoseconds", "gauge");
        appendMetric(sb, "ztmc_decision_p99_nanos", Map.of(), pipeline.decisionP99Nanos());

        if (additionalCounters != null && !additionalCounters.isEmpty()) {
            for (Map.Entry<String, Long> e : additionalCounters.entrySet()) {
                String metricName = toMetricName("ztmc_" + e.getKey() + "_total");
                appendHelpType(sb, metricName, "Additional counter: " + e.getKey(), "counter");
                appendMetric(sb, metricName, Map.of(), e.getValue());
            }
        }
        return sb.toString();
    }

    private static String toMetricName(String raw) {
        String normalized = METRIC_NAME_SANITIZER.matcher(raw).replaceAll("_");
        if (normalized.isBlank()) {
            return "ztmc_unknown_metric_total";
        }
        char first = normalized.charAt(0);
        if ((first >= 'a' && first <= 'z') || (first >= 'A' && first <= 'Z') || first == '_') {
            return normalized;
        }
        return "ztmc_" + normalized;
    }

    private static void appendHelpType(StringBuilder sb, String metric, String help, String type) {
        sb.append("# HELP ").append(metric).append(' ').append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(' ').append(type).append('\n');
    }

    private static void appendMetric(StringBuilder sb, String name, Map<String, String> labels, long value) {
        sb.append(name);
        if (labels != null && !labels.isEmpty()) {
            sb.append('{');
            boolean first = true;
            for (Map.Entry<String, String> e : labels.entrySet()) {
                if (!first) {
                    sb.append(',');
                }
                first = false;
                sb.append(e.getKey()).append("=\"").append(escapeLabelValue(e.getValue())).append('"');
            }
            sb.append('}');
        }
        sb.append(' ').append(value).append('\n');
    }

    private static String escapeLabelValue(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        return value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }
}
