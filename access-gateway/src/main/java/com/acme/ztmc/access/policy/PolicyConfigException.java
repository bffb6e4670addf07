package com.acme.ztmc.access.policy;

/**
 * Policy document missing, unreadable or invalid.
 */
public final class PolicyConfigException extends RuntimeException {
    public PolicyConfigException(String message) {
        super(message);
    }

    public PolicyConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
