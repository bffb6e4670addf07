package com.acme.ztmc.access.util;

/**
 * HTTP status codes used by the ingress and metrics endpoints, and as
 * reason codes in pipeline telemetry.
 */
public final class AccessStatusCodes {

    // ---- Success ----
    public static final int OK = 200;

    // ---- Client errors ----
    public static final int BAD_REQUEST = 400;
    public static final int NOT_FOUND = 404;
    public static final int METHOD_NOT_ALLOWED = 405;

    // ---- Server errors ----
    public static final int INTERNAL_ERROR = 500;

    private AccessStatusCodes() {
    }
}
