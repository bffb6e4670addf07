package com.acme.ztmc.access.audit;

import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class LoggingAuditAlarm implements AuditAlarm {
    private static final Logger LOG = Logger.getLogger(LoggingAuditAlarm.class.getName());

    private final AtomicLong raised = new AtomicLong();

    @Override
    public void raise(EventLogEntry entry, AuditWriteException failure) {
        raised.incrementAndGet();
        LOG.log(Level.SEVERE, "AUDIT TRAIL BROKEN: entry not recorded eventId=" + entry.eventId()
            + " type=" + entry.eventType() + " user=" + entry.user()
            + " attempts=" + failure.attempts(), failure);
    }

    public long raisedCount() {
        return raised.get();
    }
}
