package com.acme.ztmc.access.util;

import java.util.List;

/**
 * Default locations, capacities, timeouts and trust settings for the access gateway runtime.
 * <p>
 * These values are used when the corresponding environment variable is not set.
 */
public final class AccessDefaults {

    // ---- Policy ----
    public static final String DEFAULT_POLICY_FILE = "config/policies.json";
    public static final int DEFAULT_POLICY_RELOAD_INTERVAL_SEC = 0;

    // ---- Context trust ----
    public static final List<String> DEFAULT_TRUSTED_NETWORK_PREFIXES = List.of("192.168.", "10.0.");
    public static final List<String> DEFAULT_TRUSTED_DEVICES = List.of("device-laptop-001", "device-admin-001");
    public static final int DEFAULT_BUSINESS_HOURS_START = 8;
    public static final int DEFAULT_BUSINESS_HOURS_END = 20;

    // ---- Ingress ----
    public static final int DEFAULT_HTTP_PORT = 8085;
    public static final int DEFAULT_SO_BACKLOG = 1024;
    public static final int MAX_CONTENT_LENGTH = 64 * 1024;
    public static final String ACCESS_PATH = "/v1/access";

    // ---- Remediation ----
    public static final long DEFAULT_REMEDIATION_TIMEOUT_MS = 5_000L;
    public static final int DEFAULT_REMEDIATION_THREADS = 4;

    // ---- Audit ----
    public static final String DEFAULT_AUDIT_LOG_FILE = "./build/audit/ztmc-events.jsonl";
    public static final String DEFAULT_METRICS_FILE = "./build/audit/ztmc-metrics.json";
    public static final int DEFAULT_MAX_APPEND_ATTEMPTS = 3;
    public static final long DEFAULT_RETRY_BACKOFF_MS = 50L;

    // ---- Metrics endpoint ----
    public static final int DEFAULT_METRICS_HTTP_PORT = 9464;
    public static final String DEFAULT_METRICS_HTTP_PATH = "/metrics";
    public static final int DEFAULT_METRICS_LOG_INTERVAL_SEC = 60;
    public static final int DEFAULT_METRICS_RENDER_BUFFER = 2048;

    private AccessDefaults() {
    }
}
