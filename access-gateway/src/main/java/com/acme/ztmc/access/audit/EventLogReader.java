package com.acme.ztmc.access.audit;

import com.acme.ztmc.access.policy.Decision;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Read-only query access to the JSONL audit log. Malformed lines are skipped and counted.
 */
public final class EventLogReader {
    private static final Logger LOG = Logger.getLogger(EventLogReader.class.getName());

    private final Path file;

    public EventLogReader(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    public List<EventLogEntry> read(AuditQuery query) {
        List<EventLogEntry> out = new ArrayList<>();
        scan(query, out::add);
        return out;
    }

    public AuditSummary summarize(AuditQuery query) {
        Map<String, Long> byType = new TreeMap<>();
        Map<Decision, Long> decisions = new EnumMap<>(Decision.class);
        Map<String, Long> perCloud = new TreeMap<>();
        long[] total = new long[1];
        long malformed = scan(query, entry -> {
            total[0]++;
            byType.merge(entry.eventType(), 1L, Long::sum);
            if (entry.isType(EventType.ACCESS_REQUEST) && entry.decision() != null) {
                decisions.merge(entry.decision(), 1L, Long::sum);
            }
            if (!entry.cloud().isBlank()) {
                perCloud.merge(entry.cloud(), 1L, Long::sum);
            }
        });
        return new AuditSummary(total[0], malformed, byType, decisions, perCloud);
    }

    /**
     * Streams matching entries in log order and returns the number of malformed lines skipped.
     *
     * @throws UncheckedIOException if the log exists but cannot be read
     */
    public long scan(AuditQuery query, Consumer<EventLogEntry> sink) {
        Objects.requireNonNull(query, "query");
        if (!Files.exists(file)) {
            return 0L;
        }
        long malformed = 0L;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            long lineNo = 0L;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) {
                    continue;
                }
                EventLogEntry entry;
                try {
                    entry = EventLogCodec.fromJsonLine(line);
                } catch (IllegalArgumentException e) {
                    malformed++;
                    long at = lineNo;
                    LOG.warning(() -> "Skipping malformed audit line " + at + " in " + file + ": " + e.getMessage());
                    continue;
                }
                if (query.matches(entry)) {
                    sink.accept(entry);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read audit log " + file, e);
        }
        return malformed;
    }
}
