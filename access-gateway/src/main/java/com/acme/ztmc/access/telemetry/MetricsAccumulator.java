package com.acme.ztmc.access.telemetry;

import com.acme.ztmc.access.audit.EventLogEntry;
import com.acme.ztmc.access.audit.EventType;
import com.acme.ztmc.access.policy.Decision;
import com.acme.ztmc.access.remediation.CloudProvider;

import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Mutable metrics state. Not thread-safe: the live instance is only touched
 * under the monitor lock, replay instances are thread-confined.
 */
final class MetricsAccumulator {
    private long eventsRecorded;
    private long lastSequence;
    private long totalAccessRequests;
    private long totalRemediations;
    private final Map<Decision, Long> decisionCounts = new EnumMap<>(Decision.class);
    private final Map<String, Long> perCloud = new TreeMap<>();
    private final Map<String, Long> eventsByType = new TreeMap<>();

    MetricsAccumulator() {
        for (Decision d : Decision.values()) {
            decisionCounts.put(d, 0L);
        }
        for (CloudProvider provider : CloudProvider.values()) {
            perCloud.put(provider.displayName(), 0L);
        }
    }

    /** Empty metrics whose next entry is numbered after {@code sequence}. */
    static MetricsAccumulator startingAfter(long sequence) {
        MetricsAccumulator acc = new MetricsAccumulator();
        acc.lastSequence = Math.max(0L, sequence);
        return acc;
    }

    void apply(EventLogEntry entry) {
        eventsRecorded++;
        lastSequence = Math.max(lastSequence, entry.sequence());
        if (entry.isType(EventType.ACCESS_REQUEST)) {
            totalAccessRequests++;
            if (entry.decision() != null) {
                decisionCounts.merge(entry.decision(), 1L, Long::sum);
            }
        } else if (entry.isType(EventType.REMEDIATION)) {
            totalRemediations++;
        }
        if (!entry.cloud().isBlank()) {
            perCloud.merge(entry.cloud(), 1L, Long::sum);
        }
        eventsByType.merge(entry.eventType(), 1L, Long::sum);
    }

    long lastSequence() {
        return lastSequence;
    }

    MetricsSnapshot snapshot() {
        return new MetricsSnapshot(
            eventsRecorded,
            lastSequence,
            totalAccessRequests,
            totalRemediations,
            decisionCounts,
            perCloud,
            eventsByType
        );
    }
}
