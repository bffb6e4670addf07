package com.acme.ztmc.access.audit;

import com.acme.ztmc.access.policy.Decision;
import com.acme.ztmc.access.util.JsonCodec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON line encoding of {@link EventLogEntry}. One object per line, no embedded newlines.
 */
public final class EventLogCodec {
    static final String LOG_SCHEMA = "ztmc.audit.v1";

    private EventLogCodec() {
    }

    public static String toJsonLine(EventLogEntry entry) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("schema", LOG_SCHEMA);
        row.put("eventId", entry.eventId());
        row.put("sequence", entry.sequence());
        row.put("timestamp", entry.timestamp().toString());
        row.put("module", entry.module());
        row.put("eventType", entry.eventType());
        row.put("user", entry.user());
        row.put("resource", entry.resource());
        row.put("cloud", entry.cloud());
        row.put("decision", entry.decision() == null ? null : entry.decision().name());
        row.put("reason", entry.reason());
        row.put("actionsTaken", entry.actionsTaken());
        row.put("details", entry.details());
        try {
            return JsonCodec.writeString(row);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot encode audit entry " + entry.eventId(), e);
        }
    }

    /**
     * Decodes one log line.
     *
     * @throws IllegalArgumentException if the line is not a well-formed entry
     */
    public static EventLogEntry fromJsonLine(String line) {
        JsonNode row;
        try {
            row = JsonCodec.readTree(line);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("not JSON", e);
        }
        if (row == null || !row.isObject()) {
            throw new IllegalArgumentException("not a JSON object");
        }
        String eventId = requiredText(row, "eventId");
        String eventType = requiredText(row, "eventType");
        String module = requiredText(row, "module");
        Instant timestamp;
        try {
            timestamp = Instant.parse(requiredText(row, "timestamp"));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("bad timestamp", e);
        }
        String rawDecision = optionalText(row, "decision");
        Decision decision = rawDecision == null || rawDecision.isBlank() ? null : Decision.parse(rawDecision);

        List<String> actions = new ArrayList<>();
        JsonNode actionsNode = row.get("actionsTaken");
        if (actionsNode != null && actionsNode.isArray()) {
            actionsNode.forEach(a -> actions.add(a.asText()));
        }
        Map<String, String> details = new LinkedHashMap<>();
        JsonNode detailsNode = row.get("details");
        if (detailsNode != null && detailsNode.isObject()) {
            detailsNode.fields().forEachRemaining(e -> details.put(e.getKey(), e.getValue().asText()));
        }
        JsonNode seq = row.get("sequence");
        return new EventLogEntry(
            eventId,
            seq != null && seq.canConvertToLong() ? seq.asLong() : 0L,
            timestamp,
            module,
            eventType,
            optionalText(row, "user"),
            optionalText(row, "resource"),
            optionalText(row, "cloud"),
            decision,
            optionalText(row, "reason"),
            actions,
            details
        );
    }

    private static String requiredText(JsonNode row, String field) {
        String v = optionalText(row, field);
        if (v == null || v.isBlank()) {
            throw new IllegalArgumentException("missing " + field);
        }
        return v;
    }

    private static String optionalText(JsonNode row, String field) {
        JsonNode v = row.get(field);
        if (v == null || v.isNull()) {
            return null;
        }
        return v.asText();
    }
}
