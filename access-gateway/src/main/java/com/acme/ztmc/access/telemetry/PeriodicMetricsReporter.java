package com.acme.ztmc.access.telemetry;

import com.acme.ztmc.access.util.JsonCodec;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Logs the metrics snapshot as one JSON line at a fixed interval.
 */
public final class PeriodicMetricsReporter implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(PeriodicMetricsReporter.class.getName());

    private final Supplier<MetricsSnapshot> snapshotSupplier;
    private final AtomicPipelineMetrics pipelineMetrics;
    private final ScheduledExecutorService executor;
    private final long intervalSeconds;

    public PeriodicMetricsReporter(Supplier<MetricsSnapshot> snapshotSupplier,
                                   AtomicPipelineMetrics pipelineMetrics,
                                   long intervalSeconds) {
        this.snapshotSupplier = Objects.requireNonNull(snapshotSupplier, "snapshotSupplier");
        this.pipelineMetrics = Objects.requireNonNull(pipelineMetrics, "pipelineMetrics");
        this.intervalSeconds = Math.max(1L, intervalSeconds);
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ztmc-metrics-reporter");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        executor.scheduleAtFixedRate(this::emit, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    }

    void emit() {
        try {
            LOG.info(render());
        } catch (RuntimeException e) {
            LOG.warning("Metrics reporter failure: " + e.getClass().getSimpleName());
        }
    }

    String render() {
        MetricsSnapshot s = snapshotSupplier.get();
        AtomicPipelineMetrics.Snapshot p = pipelineMetrics.snapshot();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("component", "access-gateway");
        payload.put("type", "access_metrics");
        payload.put("totalAccessRequests", s.totalAccessRequests());
        payload.put("decisionCounts", s.decisionCounts());
        payload.put("totalRemediations", s.totalRemediations());
        payload.put("perCloud", s.perCloud());
        payload.put("eventsByType", s.eventsByType());
        payload.put("lastSequence", s.lastSequence());
        payload.put("pipelineRequests", p.requests());
        payload.put("rejectedByReason", p.rejectedByReason());
        payload.put("remediationFailures", p.remediationFailures());
        payload.put("auditWriteFailures", p.auditWriteFailures());
        payload.put("decisionP99Nanos", p.decisionP99Nanos());
        try {
            return JsonCodec.writeString(payload);
        } catch (Exception e) {
            return payload.toString();
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
