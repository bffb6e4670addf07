package com.acme.ztmc.access.audit;

/**
 * Process-level escalation hook raised when the audit trail cannot be written.
 */
@FunctionalInterface
public interface AuditAlarm {
    void raise(EventLogEntry entry, AuditWriteException failure);
}
