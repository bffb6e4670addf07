package com.acme.ztmc.access.audit;

import com.acme.ztmc.access.policy.Decision;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * One audit record. {@code sequence} is assigned by the monitor when the entry
 * is appended; entries built by producers carry sequence 0.
 *
 * @param decision null for events that carry no decision
 * @param reason null for events that carry no reason
 */
public record EventLogEntry(
    String eventId,
    long sequence,
    Instant timestamp,
    String module,
    String eventType,
    String user,
    String resource,
    String cloud,
    Decision decision,
    String reason,
    List<String> actionsTaken,
    Map<String, String> details
) {
    public EventLogEntry {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(module, "module");
        Objects.requireNonNull(eventType, "eventType");
        user = user == null ? "" : user;
        resource = resource == null ? "" : resource;
        cloud = cloud == null ? "" : cloud;
        actionsTaken = List.copyOf(actionsTaken == null ? List.of() : actionsTaken);
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static EventLogEntry of(Instant timestamp,
                                   String module,
                                   EventType eventType,
                                   String user,
                                   String resource,
                                   String cloud,
                                   Decision decision,
                                   String reason,
                                   List<String> actionsTaken,
                                   Map<String, String> details) {
        return new EventLogEntry(
            UUID.randomUUID().toString(),
            0L,
            timestamp,
            module,
            eventType.name(),
            user,
            resource,
            cloud,
            decision,
            reason,
            actionsTaken,
            details
        );
    }

    public EventLogEntry withSequence(long seq) {
        return new EventLogEntry(eventId, seq, timestamp, module, eventType, user, resource, cloud,
            decision, reason, actionsTaken, details);
    }

    public boolean isType(EventType type) {
        return type.name().equals(eventType);
    }
}
