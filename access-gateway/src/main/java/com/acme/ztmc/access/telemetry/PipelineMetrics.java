package com.acme.ztmc.access.telemetry;

/**
 * Operational telemetry of the request path. Unlike {@link MetricsSnapshot}
 * these counters are not derived from the audit log and reset with the process.
 */
public interface PipelineMetrics {
    void incRequests(long n);
    void incRejected(long n, int reasonCode);
    void incRemediationFailures(long n);
    void incAuditWriteFailures(long n);
    void observeDecisionNanos(long nanos);
}
