package com.acme.ztmc.access.audit;

import com.acme.ztmc.access.policy.Decision;

import java.time.Instant;

/**
 * Filter over the audit log. Null fields match everything.
 */
public record AuditQuery(Instant from, Instant to, String user, String eventType, Decision decision) {

    public static AuditQuery all() {
        return new AuditQuery(null, null, null, null, null);
    }

    public static AuditQuery ofType(EventType type) {
        return new AuditQuery(null, null, null, type.name(), null);
    }

    boolean matches(EventLogEntry entry) {
        if (from != null && entry.timestamp().isBefore(from)) {
            return false;
        }
        if (to != null && entry.timestamp().isAfter(to)) {
            return false;
        }
        if (user != null && !user.isBlank() && !user.equals(entry.user())) {
            return false;
        }
        if (eventType != null && !eventType.isBlank() && !eventType.equalsIgnoreCase(entry.eventType())) {
            return false;
        }
        return decision == null || decision == entry.decision();
    }
}
