package com.acme.ztmc.access.audit;

import com.acme.ztmc.access.policy.Decision;

import java.util.Map;

public record AuditSummary(
    long totalEvents,
    long malformedLines,
    Map<String, Long> eventsByType,
    Map<Decision, Long> accessDecisions,
    Map<String, Long> perCloud
) {
    public AuditSummary {
        eventsByType = Map.copyOf(eventsByType);
        accessDecisions = Map.copyOf(accessDecisions);
        perCloud = Map.copyOf(perCloud);
    }
}
