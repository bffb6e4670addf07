package com.acme.ztmc.access.telemetry;

import com.acme.ztmc.access.audit.AuditWriteException;
import com.acme.ztmc.access.audit.EventLog;
import com.acme.ztmc.access.audit.EventLogEntry;
import com.acme.ztmc.access.audit.EventType;
import com.acme.ztmc.access.audit.JsonlEventLog;
import com.acme.ztmc.access.audit.LoggingAuditAlarm;
import com.acme.ztmc.access.policy.Decision;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CentralMonitorTest {

    @TempDir
    Path tempDir;

    @Test
    void assignsSequencesAndCountsDecisionsOfAccessEventsOnly() {
        Path log = tempDir.resolve("events.jsonl");
        try (CentralMonitor monitor = monitor(log)) {
            assertEquals(1L, monitor.recordEvent(event(EventType.REMEDIATION, "eve", Decision.DENY, "AWS")).sequence());
            assertEquals(2L, monitor.recordEvent(event(EventType.ACCESS_REQUEST, "eve", Decision.DENY, "AWS")).sequence());
            assertEquals(3L, monitor.recordEvent(event(EventType.ACCESS_REQUEST, "alice", Decision.ALLOW, "GCP")).sequence());

            MetricsSnapshot s = monitor.snapshot();
            assertEquals(3L, s.eventsRecorded());
            assertEquals(3L, s.lastSequence());
            assertEquals(2L, s.totalAccessRequests());
            assertEquals(1L, s.totalRemediations());
            assertEquals(1L, s.decisionCount(Decision.DENY));
            assertEquals(1L, s.decisionCount(Decision.ALLOW));
            assertEquals(0L, s.decisionCount(Decision.REVIEW));
            assertEquals(s.totalAccessRequests(), s.decisionCountTotal());
            assertEquals(Map.of("AWS", 2L, "Azure", 0L, "GCP", 1L), s.perCloud());
            assertEquals(Map.of("ACCESS_REQUEST", 2L, "REMEDIATION", 1L), s.eventsByType());
        }
    }

    @Test
    void snapshotsAreIndependentCopies() {
        try (CentralMonitor monitor = monitor(tempDir.resolve("events.jsonl"))) {
            monitor.recordEvent(event(EventType.ACCESS_REQUEST, "alice", Decision.ALLOW, "AWS"));
            MetricsSnapshot before = monitor.snapshot();
            monitor.recordEvent(event(EventType.ACCESS_REQUEST, "bob", Decision.DENY, "AWS"));

            assertEquals(1L, before.totalAccessRequests());
            assertEquals(0L, before.decisionCount(Decision.DENY));
            assertThrows(UnsupportedOperationException.class, () -> before.perCloud().put("AWS", 99L));
            assertEquals(2L, monitor.snapshot().totalAccessRequests());
        }
    }

    @Test
    void replayRebuildsTheLiveSnapshot() {
        Path log = tempDir.resolve("events.jsonl");
        MetricsSnapshot live;
        try (CentralMonitor monitor = monitor(log)) {
            monitor.recordEvent(event(EventType.ACCESS_REQUEST, "alice", Decision.ALLOW, "AWS"));
            monitor.recordEvent(event(EventType.REMEDIATION, "bob", Decision.REVIEW, "Azure"));
            monitor.recordEvent(event(EventType.ACCESS_REQUEST, "bob", Decision.REVIEW, "Azure"));
            monitor.recordEvent(event(EventType.POLICY_CHANGE, "", null, ""));
            live = monitor.snapshot();
        }
        assertEquals(live, CentralMonitor.replay(log));
    }

    @Test
    void openRecoversMetricsAndContinuesSequence() {
        Path log = tempDir.resolve("events.jsonl");
        CentralMonitor.Settings settings = new CentralMonitor.Settings(
            log, tempDir.resolve("metrics.json"), false, 3, 0L, true);
        try (CentralMonitor first = CentralMonitor.open(settings, null)) {
            first.recordEvent(event(EventType.ACCESS_REQUEST, "alice", Decision.ALLOW, "AWS"));
            first.recordEvent(event(EventType.ACCESS_REQUEST, "eve", Decision.DENY, "GCP"));
        }
        try (CentralMonitor second = CentralMonitor.open(settings, null)) {
            assertEquals(2L, second.snapshot().totalAccessRequests());
            assertEquals(3L, second.recordEvent(event(EventType.ACCESS_REQUEST, "bob", Decision.ALLOW, "AWS")).sequence());
        }
    }

    @Test
    void openWithoutRecoveryStillNumbersAfterExistingLog() {
        Path log = tempDir.resolve("events.jsonl");
        CentralMonitor.Settings recovering = new CentralMonitor.Settings(log, null, false, 3, 0L, true);
        try (CentralMonitor first = CentralMonitor.open(recovering, null)) {
            first.recordEvent(event(EventType.ACCESS_REQUEST, "alice", Decision.ALLOW, "AWS"));
            first.recordEvent(event(EventType.REMEDIATION, "eve", Decision.DENY, "AWS"));
        }
        CentralMonitor.Settings fresh = new CentralMonitor.Settings(log, null, false, 3, 0L, false);
        try (CentralMonitor second = CentralMonitor.open(fresh, null)) {
            assertEquals(0L, second.snapshot().eventsRecorded());
            assertEquals(3L, second.recordEvent(event(EventType.ACCESS_REQUEST, "bob", Decision.ALLOW, "AWS")).sequence());
        }
        MetricsSnapshot replayed = CentralMonitor.replay(log);
        assertEquals(3L, replayed.eventsRecorded());
        assertEquals(3L, replayed.lastSequence());
    }

    @Test
    void replayCountsRepeatedEntriesOnce() throws IOException {
        Path log = tempDir.resolve("events.jsonl");
        EventLogEntry first = event(EventType.ACCESS_REQUEST, "alice", Decision.ALLOW, "AWS").withSequence(1);
        try (JsonlEventLog writer = new JsonlEventLog(log, false)) {
            writer.append(first);
            writer.append(first);
            writer.append(event(EventType.ACCESS_REQUEST, "eve", Decision.DENY, "GCP").withSequence(2));
        }
        MetricsSnapshot replayed = CentralMonitor.replay(log);
        assertEquals(2L, replayed.eventsRecorded());
        assertEquals(2L, replayed.totalAccessRequests());
        assertEquals(1L, replayed.decisionCount(Decision.ALLOW));
        assertEquals(2L, replayed.lastSequence());
    }

    @Test
    void sideFileFailureIsCountedNotThrown() throws IOException {
        Path metricsFile = tempDir.resolve("metrics.json");
        Files.createDirectories(metricsFile);
        Files.writeString(metricsFile.resolve("occupied"), "x", StandardCharsets.UTF_8);
        try (CentralMonitor monitor = new CentralMonitor(
            new JsonlEventLog(tempDir.resolve("events.jsonl"), false), metricsFile, 1, 0L, null)) {
            monitor.recordEvent(event(EventType.ACCESS_REQUEST, "alice", Decision.ALLOW, "AWS"));
            assertEquals(1L, monitor.snapshot().totalAccessRequests());
            assertEquals(1L, monitor.operationalCounters().get("metricsPersistFailures"));
        }
    }

    @Test
    void persistsMetricsSideFile() throws IOException {
        Path metricsFile = tempDir.resolve("side/metrics.json");
        try (CentralMonitor monitor = new CentralMonitor(
            new JsonlEventLog(tempDir.resolve("events.jsonl"), false), metricsFile, 1, 0L, null)) {
            monitor.recordEvent(event(EventType.ACCESS_REQUEST, "alice", Decision.ALLOW, "AWS"));
        }
        String json = Files.readString(metricsFile, StandardCharsets.UTF_8);
        assertTrue(json.contains("\"totalAccessRequests\" : 1"), json);
        assertFalse(Files.exists(tempDir.resolve("side/metrics.json.tmp")));
    }

    @Test
    void retriesTransientAppendFailures() {
        FlakyEventLog log = new FlakyEventLog(2);
        LoggingAuditAlarm alarm = new LoggingAuditAlarm();
        try (CentralMonitor monitor = new CentralMonitor(log, null, 3, 0L, alarm)) {
            EventLogEntry written = monitor.recordEvent(event(EventType.ACCESS_REQUEST, "alice", Decision.ALLOW, "AWS"));
            assertEquals(1L, written.sequence());
            assertEquals(1, log.appended.size());
            assertEquals(2L, monitor.appendAttemptFailureCount());
            assertEquals(0L, alarm.raisedCount());
            assertEquals(1L, monitor.snapshot().totalAccessRequests());
        }
    }

    @Test
    void exhaustedRetriesRaiseAlarmAndLeaveMetricsUntouched() {
        FlakyEventLog log = new FlakyEventLog(Integer.MAX_VALUE);
        LoggingAuditAlarm alarm = new LoggingAuditAlarm();
        try (CentralMonitor monitor = new CentralMonitor(log, null, 3, 1L, alarm)) {
            AuditWriteException e = assertThrows(AuditWriteException.class,
                () -> monitor.recordEvent(event(EventType.ACCESS_REQUEST, "alice", Decision.ALLOW, "AWS")));
            assertEquals(3, e.attempts());
            assertEquals(1L, alarm.raisedCount());
            assertEquals(1L, monitor.auditWriteFailureCount());
            MetricsSnapshot s = monitor.snapshot();
            assertEquals(0L, s.eventsRecorded());
            assertEquals(0L, s.lastSequence());

            log.failuresLeft = 0;
            assertEquals(1L, monitor.recordEvent(event(EventType.ACCESS_REQUEST, "bob", Decision.DENY, "AWS")).sequence());
        }
    }

    @Test
    void uncheckedAppendFailuresAreRetriedAndAlarmed() {
        FlakyEventLog log = new FlakyEventLog(Integer.MAX_VALUE);
        log.unchecked = true;
        LoggingAuditAlarm alarm = new LoggingAuditAlarm();
        try (CentralMonitor monitor = new CentralMonitor(log, null, 3, 0L, alarm)) {
            AuditWriteException e = assertThrows(AuditWriteException.class,
                () -> monitor.recordEvent(event(EventType.ACCESS_REQUEST, "alice", Decision.ALLOW, "AWS")));
            assertInstanceOf(UncheckedIOException.class, e.getCause());
            assertEquals(3L, monitor.appendAttemptFailureCount());
            assertEquals(1L, alarm.raisedCount());
            assertEquals(0L, monitor.snapshot().eventsRecorded());

            log.failuresLeft = 1;
            assertEquals(1L, monitor.recordEvent(event(EventType.ACCESS_REQUEST, "bob", Decision.DENY, "AWS")).sequence());
            assertEquals(4L, monitor.appendAttemptFailureCount());
        }
    }

    @Test
    void concurrentWritersKeepLogAndMetricsConsistent() throws Exception {
        Path log = tempDir.resolve("events.jsonl");
        int threads = 8;
        int perThread = 50;
        try (CentralMonitor monitor = monitor(log)) {
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<List<Long>>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                String user = "user-" + t;
                futures.add(pool.submit(() -> {
                    start.await();
                    List<Long> seqs = new ArrayList<>();
                    for (int i = 0; i < perThread; i++) {
                        Decision d = i % 2 == 0 ? Decision.ALLOW : Decision.DENY;
                        seqs.add(monitor.recordEvent(event(EventType.ACCESS_REQUEST, user, d, "AWS")).sequence());
                    }
                    return seqs;
                }));
            }
            start.countDown();
            Set<Long> all = new TreeSet<>();
            for (Future<List<Long>> f : futures) {
                all.addAll(f.get(30, TimeUnit.SECONDS));
            }
            pool.shutdownNow();

            long total = (long) threads * perThread;
            assertEquals(total, all.size());
            assertEquals(1L, Collections.min(all));
            assertEquals(total, Collections.max(all));

            MetricsSnapshot live = monitor.snapshot();
            assertEquals(total, live.totalAccessRequests());
            assertEquals(total, live.decisionCountTotal());
            assertEquals(total, Files.readAllLines(log, StandardCharsets.UTF_8).size());
            assertEquals(live, CentralMonitor.replay(log));
        }
    }

    private CentralMonitor monitor(Path log) {
        return new CentralMonitor(new JsonlEventLog(log, false), tempDir.resolve("metrics.json"), 3, 0L, null);
    }

    static EventLogEntry event(EventType type, String user, Decision decision, String cloud) {
        return EventLogEntry.of(Instant.parse("2025-03-03T12:00:00Z"), "TEST", type,
            user, "resource-1", cloud, decision, "reason", List.of(), Map.of());
    }

    private static final class FlakyEventLog implements EventLog {
        private final List<EventLogEntry> appended = new ArrayList<>();
        private volatile int failuresLeft;
        private volatile boolean unchecked;

        FlakyEventLog(int failures) {
            this.failuresLeft = failures;
        }

        @Override
        public void append(EventLogEntry entry) throws IOException {
            if (failuresLeft > 0) {
                failuresLeft--;
                if (unchecked) {
                    throw new UncheckedIOException(new IOException("store down"));
                }
                throw new IOException("disk unavailable");
            }
            appended.add(entry);
        }

        @Override
        public void close() {
        }
    }
}
