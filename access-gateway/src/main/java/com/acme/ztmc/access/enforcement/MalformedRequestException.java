package com.acme.ztmc.access.enforcement;

/**
 * Request rejected before any decision was made. Such requests are not audited.
 */
public final class MalformedRequestException extends RuntimeException {
    public MalformedRequestException(String message) {
        super(message);
    }

    public MalformedRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
