package com.acme.ztmc.access.telemetry;

import com.acme.ztmc.access.policy.Decision;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Point-in-time copy of the aggregate metrics derived from the audit log.
 *
 * @param eventsRecorded number of entries applied, i.e. the length of the log prefix this snapshot reflects
 * @param lastSequence sequence number of the last entry known to be in the log
 * @param decisionCounts decisions of ACCESS_REQUEST entries only
 * @param perCloud entries per cloud, over every entry that names a cloud
 * @param eventsByType entries per event type
 */
public record MetricsSnapshot(
    long eventsRecorded,
    long lastSequence,
    long totalAccessRequests,
    long totalRemediations,
    Map<Decision, Long> decisionCounts,
    Map<String, Long> perCloud,
    Map<String, Long> eventsByType
) {
    public MetricsSnapshot {
        EnumMap<Decision, Long> decisions = new EnumMap<>(Decision.class);
        if (decisionCounts != null) {
            decisions.putAll(decisionCounts);
        }
        decisionCounts = Collections.unmodifiableMap(decisions);
        perCloud = Collections.unmodifiableMap(new TreeMap<>(perCloud == null ? Map.of() : perCloud));
        eventsByType = Collections.unmodifiableMap(new TreeMap<>(eventsByType == null ? Map.of() : eventsByType));
    }

    public long decisionCount(Decision decision) {
        return decisionCounts.getOrDefault(decision, 0L);
    }

    public long decisionCountTotal() {
        long sum = 0L;
        for (Long v : decisionCounts.values()) {
            sum += v;
        }
        return sum;
    }
}
