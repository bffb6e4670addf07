package com.acme.ztmc.access.audit;

import com.acme.ztmc.access.policy.Decision;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventLogReaderTest {

    @TempDir
    Path tempDir;

    @Test
    void missingLogReadsAsEmpty() {
        EventLogReader reader = new EventLogReader(tempDir.resolve("absent.jsonl"));
        assertTrue(reader.read(AuditQuery.all()).isEmpty());
        assertEquals(0L, reader.summarize(AuditQuery.all()).totalEvents());
    }

    @Test
    void filtersByUserTypeDecisionAndTime() throws IOException {
        Path file = tempDir.resolve("events.jsonl");
        try (JsonlEventLog log = new JsonlEventLog(file, false)) {
            log.append(entry(1, "2025-03-03T09:00:00Z", EventType.ACCESS_REQUEST, "alice", Decision.ALLOW, "AWS"));
            log.append(entry(2, "2025-03-03T10:00:00Z", EventType.REMEDIATION, "eve", Decision.DENY, "GCP"));
            log.append(entry(3, "2025-03-03T10:00:01Z", EventType.ACCESS_REQUEST, "eve", Decision.DENY, "GCP"));
            log.append(entry(4, "2025-03-03T11:00:00Z", EventType.ACCESS_REQUEST, "bob", Decision.REVIEW, "Azure"));
        }
        EventLogReader reader = new EventLogReader(file);

        List<EventLogEntry> eve = reader.read(new AuditQuery(null, null, "eve", null, null));
        assertEquals(List.of(2L, 3L), eve.stream().map(EventLogEntry::sequence).toList());

        List<EventLogEntry> denies = reader.read(new AuditQuery(null, null, null, "access_request", Decision.DENY));
        assertEquals(1, denies.size());
        assertEquals(3L, denies.get(0).sequence());

        List<EventLogEntry> window = reader.read(new AuditQuery(
            Instant.parse("2025-03-03T10:00:00Z"), Instant.parse("2025-03-03T10:30:00Z"), null, null, null));
        assertEquals(2, window.size());
    }

    @Test
    void skipsMalformedLinesAndSummarizes() throws IOException {
        Path file = tempDir.resolve("events.jsonl");
        try (JsonlEventLog log = new JsonlEventLog(file, false)) {
            log.append(entry(1, "2025-03-03T09:00:00Z", EventType.ACCESS_REQUEST, "alice", Decision.ALLOW, "AWS"));
        }
        Files.writeString(file, "{truncated\n\n", StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        try (JsonlEventLog log = new JsonlEventLog(file, false)) {
            log.append(entry(2, "2025-03-03T09:01:00Z", EventType.REMEDIATION, "eve", Decision.DENY, "AWS"));
            log.append(entry(3, "2025-03-03T09:01:01Z", EventType.ACCESS_REQUEST, "eve", Decision.DENY, "AWS"));
        }

        AuditSummary summary = new EventLogReader(file).summarize(AuditQuery.all());
        assertEquals(3L, summary.totalEvents());
        assertEquals(1L, summary.malformedLines());
        assertEquals(Map.of("ACCESS_REQUEST", 2L, "REMEDIATION", 1L), summary.eventsByType());
        assertEquals(Map.of(Decision.ALLOW, 1L, Decision.DENY, 1L), summary.accessDecisions());
        assertEquals(Map.of("AWS", 3L), summary.perCloud());
    }

    private static EventLogEntry entry(long seq, String time, EventType type, String user, Decision decision, String cloud) {
        return EventLogEntry.of(Instant.parse(time), "PEP", type, user, "res", cloud, decision, "r", List.of(), Map.of())
            .withSequence(seq);
    }
}
