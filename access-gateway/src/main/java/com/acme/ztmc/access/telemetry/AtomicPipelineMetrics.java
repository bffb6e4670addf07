package com.acme.ztmc.access.telemetry;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicLongArray;
import java.util.concurrent.atomic.LongAdder;

public final class AtomicPipelineMetrics implements PipelineMetrics {
    private final LongAdder requests = new LongAdder();
    private final LongAdder remediationFailures = new LongAdder();
    private final LongAdder auditWriteFailures = new LongAdder();
    private final LongAdder decisionNanos = new LongAdder();
    private final LongAdder decisionSamples = new LongAdder();
    private final ConcurrentHashMap<Integer, LongAdder> rejectedByReason = new ConcurrentHashMap<>();

    private static final int LATENCY_RING_SIZE = 4096;
    private static final int LATENCY_RING_MASK = LATENCY_RING_SIZE - 1;
    private final AtomicLongArray latencyRing = new AtomicLongArray(LATENCY_RING_SIZE);
    private final AtomicLong latencyRingPos = new AtomicLong();

    @Override
    public void incRequests(long n) {
        requests.add(Math.max(0L, n));
    }

    @Override
    public void incRejected(long n, int reasonCode) {
        if (n <= 0) return;
        rejectedByReason.computeIfAbsent(reasonCode, ignored -> new LongAdder()).add(n);
    }

    @Override
    public void incRemediationFailures(long n) {
        remediationFailures.add(Math.max(0L, n));
    }

    @Override
    public void incAuditWriteFailures(long n) {
        auditWriteFailures.add(Math.max(0L, n));
    }

    @Override
    public void observeDecisionNanos(long nanos) {
        if (nanos < 0) return;
        decisionNanos.add(nanos);
        decisionSamples.increment();
        latencyRing.set((int) (latencyRingPos.getAndIncrement() & LATENCY_RING_MASK), nanos);
    }

    public long p99DecisionNanos() {
        long pos = latencyRingPos.get();
        int count = (int) Math.min(pos, LATENCY_RING_SIZE);
        if (count == 0) return 0;
        long[] samples = new long[count];
        int start = (int) ((pos - count) & LATENCY_RING_MASK);
        for (int i = 0; i < count; i++) {
            samples[i] = latencyRing.get((start + i) & LATENCY_RING_MASK);
        }
        Arrays.sort(samples);
        int idx = Math.min((int) (count * 0.99), count - 1);
        return samples[idx];
    }

    public Snapshot snapshot() {
        Map<Integer, Long> rejected = new HashMap<>();
        rejectedByReason.forEach((k, v) -> rejected.put(k, v.sum()));
        return new Snapshot(
            requests.sum(),
            remediationFailures.sum(),
            auditWriteFailures.sum(),
            decisionNanos.sum(),
            decisionSamples.sum(),
            p99DecisionNanos(),
            Collections.unmodifiableMap(rejected)
        );
    }

    public record Snapshot(long requests,
                           long remediationFailures,
                           long auditWriteFailures,
                           long decisionNanosTotal,
                           long decisionSamples,
                           long decisionP99Nanos,
                           Map<Integer, Long> rejectedByReason) {}
}
