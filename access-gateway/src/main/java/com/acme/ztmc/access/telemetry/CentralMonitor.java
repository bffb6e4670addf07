package com.acme.ztmc.access.telemetry;

import com.acme.ztmc.access.audit.AuditAlarm;
import com.acme.ztmc.access.audit.AuditQuery;
import com.acme.ztmc.access.audit.AuditWriteException;
import com.acme.ztmc.access.audit.EventLog;
import com.acme.ztmc.access.audit.EventLogEntry;
import com.acme.ztmc.access.audit.EventLogReader;
import com.acme.ztmc.access.audit.JsonlEventLog;
import com.acme.ztmc.access.audit.LoggingAuditAlarm;
import com.acme.ztmc.access.util.AccessDefaults;
import com.acme.ztmc.access.util.AccessEnvKeys;
import com.acme.ztmc.access.util.EnvVars;
import com.acme.ztmc.access.util.JsonCodec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Central monitoring: the durable audit log plus the metrics derived from it.
 *
 * <p>{@link #recordEvent} is the single serialization point of the pipeline. Under one lock it
 * appends the entry to the log, applies it to the metrics and persists the metrics side file, so
 * every {@link #snapshot()} reflects exactly a prefix of the log. The log is the source of truth:
 * an entry that could not be appended is never counted, and {@link #replay(Path)} rebuilds the
 * metrics from the log alone.</p>
 *
 * <p>Single-process, single-writer. Running several gateway processes requires replacing the
 * {@link EventLog} with a shared append-only store that does its own concurrency control.</p>
 */
public final class CentralMonitor implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(CentralMonitor.class.getName());

    private final EventLog eventLog;
    private final Path metricsFile;
    private final int maxAppendAttempts;
    private final long retryBackoffMs;
    private final AuditAlarm alarm;
    private final ReentrantLock lock = new ReentrantLock();
    private final MetricsAccumulator metrics;

    private final AtomicLong appendAttemptFailures = new AtomicLong();
    private final AtomicLong auditWriteFailures = new AtomicLong();
    private final AtomicLong metricsPersistFailures = new AtomicLong();

    public CentralMonitor(EventLog eventLog, Path metricsFile, int maxAppendAttempts, long retryBackoffMs, AuditAlarm alarm) {
        this(eventLog, metricsFile, maxAppendAttempts, retryBackoffMs, alarm, new MetricsAccumulator());
    }

    private CentralMonitor(EventLog eventLog,
                           Path metricsFile,
                           int maxAppendAttempts,
                           long retryBackoffMs,
                           AuditAlarm alarm,
                           MetricsAccumulator initial) {
        this.eventLog = Objects.requireNonNull(eventLog, "eventLog");
        this.metricsFile = metricsFile;
        this.maxAppendAttempts = Math.max(1, maxAppendAttempts);
        this.retryBackoffMs = Math.max(0L, retryBackoffMs);
        this.alarm = alarm == null ? new LoggingAuditAlarm() : alarm;
        this.metrics = Objects.requireNonNull(initial, "initial");
    }

    /**
     * Opens a monitor over a JSONL log file. With {@code recoverOnStart} the metrics are rebuilt by
     * replaying the existing log; otherwise they start from zero. Either way new entries are
     * numbered after the highest sequence already in the log.
     */
    public static CentralMonitor open(Settings settings, AuditAlarm alarm) {
        Objects.requireNonNull(settings, "settings");
        MetricsAccumulator initial = settings.recoverOnStart()
            ? replayInto(settings.logFile())
            : MetricsAccumulator.startingAfter(lastSequenceIn(settings.logFile()));
        CentralMonitor monitor = new CentralMonitor(
            new JsonlEventLog(settings.logFile(), settings.fsync()),
            settings.metricsFile(),
            settings.maxAppendAttempts(),
            settings.retryBackoffMs(),
            alarm,
            initial
        );
        if (settings.recoverOnStart()) {
            MetricsSnapshot recovered = monitor.snapshot();
            LOG.info(() -> "Metrics recovered from " + settings.logFile()
                + " events=" + recovered.eventsRecorded() + " lastSequence=" + recovered.lastSequence());
        }
        return monitor;
    }

    /**
     * Appends {@code entry} to the audit log and updates the metrics.
     *
     * @return the entry as written, carrying its assigned sequence number
     * @throws AuditWriteException if the append failed on every attempt; the alarm has been raised
     */
    public EventLogEntry recordEvent(EventLogEntry entry) {
        Objects.requireNonNull(entry, "entry");
        lock.lock();
        try {
            EventLogEntry sequenced = entry.withSequence(metrics.lastSequence() + 1);
            appendWithRetry(sequenced);
            metrics.apply(sequenced);
            persistMetrics(metrics.snapshot());
            return sequenced;
        } finally {
            lock.unlock();
        }
    }

    /** Returns an independent copy of the current metrics. */
    public MetricsSnapshot snapshot() {
        lock.lock();
        try {
            return metrics.snapshot();
        } finally {
            lock.unlock();
        }
    }

    /** Rebuilds metrics from the log alone, as a fresh process would. */
    public static MetricsSnapshot replay(Path logFile) {
        return replayInto(logFile).snapshot();
    }

    public long appendAttemptFailureCount() {
        return appendAttemptFailures.get();
    }

    public long auditWriteFailureCount() {
        return auditWriteFailures.get();
    }

    public long metricsPersistFailureCount() {
        return metricsPersistFailures.get();
    }

    public Map<String, Long> operationalCounters() {
        return Map.of(
            "auditAppendAttemptFailures", appendAttemptFailureCount(),
            "auditWriteFailures", auditWriteFailureCount(),
            "metricsPersistFailures", metricsPersistFailureCount()
        );
    }

    private static MetricsAccumulator replayInto(Path logFile) {
        MetricsAccumulator acc = new MetricsAccumulator();
        long[] duplicates = {0L};
        long malformed = new EventLogReader(logFile).scan(AuditQuery.all(), entry -> {
            // a sequence at or below the last applied one is a repeated write of an entry already counted
            if (entry.sequence() > 0 && entry.sequence() <= acc.lastSequence()) {
                duplicates[0]++;
                return;
            }
            acc.apply(entry);
        });
        if (malformed > 0) {
            LOG.warning("Metrics replay skipped " + malformed + " malformed audit lines in " + logFile);
        }
        if (duplicates[0] > 0) {
            LOG.warning("Metrics replay skipped " + duplicates[0] + " already applied audit entries in " + logFile);
        }
        return acc;
    }

    private static long lastSequenceIn(Path logFile) {
        long[] last = {0L};
        new EventLogReader(logFile).scan(AuditQuery.all(), entry -> last[0] = Math.max(last[0], entry.sequence()));
        return last[0];
    }

    private void appendWithRetry(EventLogEntry entry) {
        Exception last = null;
        for (int attempt = 1; attempt <= maxAppendAttempts; attempt++) {
            try {
                eventLog.append(entry);
                return;
            } catch (IOException | RuntimeException e) {
                last = e;
                appendAttemptFailures.incrementAndGet();
                LOG.warning("Audit append failed attempt=" + attempt + "/" + maxAppendAttempts
                    + " eventId=" + entry.eventId() + ": " + e.getClass().getSimpleName());
                if (attempt < maxAppendAttempts && !backoff(attempt)) {
                    break;
                }
            }
        }
        auditWriteFailures.incrementAndGet();
        AuditWriteException failure = new AuditWriteException(
            "audit append failed eventId=" + entry.eventId(), maxAppendAttempts, last);
        try {
            alarm.raise(entry, failure);
        } catch (RuntimeException alarmError) {
            LOG.log(Level.SEVERE, "Audit alarm failed", alarmError);
        }
        throw failure;
    }

    private boolean backoff(int attempt) {
        if (retryBackoffMs == 0L) {
            return true;
        }
        try {
            Thread.sleep(retryBackoffMs * attempt);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void persistMetrics(MetricsSnapshot snapshot) {
        if (metricsFile == null) {
            return;
        }
        try {
            Path parent = metricsFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = metricsFile.resolveSibling(metricsFile.getFileName() + ".tmp");
            Files.writeString(tmp, JsonCodec.writePrettyString(snapshot), StandardCharsets.UTF_8);
            try {
                Files.move(tmp, metricsFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, metricsFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            metricsPersistFailures.incrementAndGet();
            LOG.warning("Metrics side file write failed " + metricsFile + ": " + e.getClass().getSimpleName());
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            eventLog.close();
        } catch (IOException e) {
            LOG.warning("Audit log close failed: " + e.getClass().getSimpleName());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Monitor settings.
     *
     * @param metricsFile side file for the metrics cache; null disables persistence
     */
    public record Settings(
        Path logFile,
        Path metricsFile,
        boolean fsync,
        int maxAppendAttempts,
        long retryBackoffMs,
        boolean recoverOnStart
    ) {
        public Settings {
            Objects.requireNonNull(logFile, "logFile");
        }

        public static Settings fromEnvironment(Map<String, String> env) {
            return new Settings(
                Path.of(EnvVars.getOrDefault(env, AccessEnvKeys.ZTMC_AUDIT_LOG_FILE, AccessDefaults.DEFAULT_AUDIT_LOG_FILE)),
                Path.of(EnvVars.getOrDefault(env, AccessEnvKeys.ZTMC_METRICS_FILE, AccessDefaults.DEFAULT_METRICS_FILE)),
                EnvVars.getBoolean(env, AccessEnvKeys.ZTMC_AUDIT_FSYNC, false),
                EnvVars.getIntClamped(env, AccessEnvKeys.ZTMC_AUDIT_MAX_APPEND_ATTEMPTS,
                    AccessDefaults.DEFAULT_MAX_APPEND_ATTEMPTS, 1, 20),
                EnvVars.getLongClamped(env, AccessEnvKeys.ZTMC_AUDIT_RETRY_BACKOFF_MS,
                    AccessDefaults.DEFAULT_RETRY_BACKOFF_MS, 0L, 10_000L),
                EnvVars.getBoolean(env, AccessEnvKeys.ZTMC_METRICS_RECOVER_ON_START, true)
            );
        }
    }
}
