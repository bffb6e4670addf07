package com.acme.ztmc.access.audit;

import java.io.IOException;

/**
 * Durable append-only sink for audit entries.
 *
 * <p>{@link #append} returns only after the entry has been handed to durable
 * storage. Callers serialize appends; implementations need not be thread-safe.</p>
 */
public interface EventLog extends AutoCloseable {
    void append(EventLogEntry entry) throws IOException;

    @Override
    void close() throws IOException;
}
