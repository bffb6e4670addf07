package com.acme.ztmc.access.telemetry;

public final class NoopPipelineMetrics implements PipelineMetrics {
    public static final NoopPipelineMetrics INSTANCE = new NoopPipelineMetrics();

    private NoopPipelineMetrics() {
    }

    @Override
    public void incRequests(long n) {
    }

    @Override
    public void incRejected(long n, int reasonCode) {
    }

    @Override
    public void incRemediationFailures(long n) {
    }

    @Override
    public void incAuditWriteFailures(long n) {
    }

    @Override
    public void observeDecisionNanos(long nanos) {
    }
}
