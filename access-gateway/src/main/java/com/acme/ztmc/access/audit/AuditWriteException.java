package com.acme.ztmc.access.audit;

/**
 * An audit entry could not be durably appended after all retry attempts.
 */
public final class AuditWriteException extends RuntimeException {
    private final int attempts;

    public AuditWriteException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
