package com.acme.ztmc.access.util;

/**
 * Canonical environment variable names used by the access gateway runtime.
 */
public final class AccessEnvKeys {
    public static final String ZTMC_POLICY_FILE = "ZTMC_POLICY_FILE";
    public static final String ZTMC_POLICY_RELOAD_INTERVAL_SEC = "ZTMC_POLICY_RELOAD_INTERVAL_SEC";

    public static final String ZTMC_TRUSTED_NETWORK_PREFIXES = "ZTMC_TRUSTED_NETWORK_PREFIXES";
    public static final String ZTMC_TRUSTED_DEVICES = "ZTMC_TRUSTED_DEVICES";
    public static final String ZTMC_BUSINESS_HOURS_START = "ZTMC_BUSINESS_HOURS_START";
    public static final String ZTMC_BUSINESS_HOURS_END = "ZTMC_BUSINESS_HOURS_END";
    public static final String ZTMC_TIMEZONE = "ZTMC_TIMEZONE";

    public static final String ZTMC_HTTP_PORT = "ZTMC_HTTP_PORT";

    public static final String ZTMC_REMEDIATION_TIMEOUT_MS = "ZTMC_REMEDIATION_TIMEOUT_MS";
    public static final String ZTMC_REMEDIATION_THREADS = "ZTMC_REMEDIATION_THREADS";

    public static final String ZTMC_AUDIT_LOG_FILE = "ZTMC_AUDIT_LOG_FILE";
    public static final String ZTMC_METRICS_FILE = "ZTMC_METRICS_FILE";
    public static final String ZTMC_AUDIT_FSYNC = "ZTMC_AUDIT_FSYNC";
    public static final String ZTMC_AUDIT_MAX_APPEND_ATTEMPTS = "ZTMC_AUDIT_MAX_APPEND_ATTEMPTS";
    public static final String ZTMC_AUDIT_RETRY_BACKOFF_MS = "ZTMC_AUDIT_RETRY_BACKOFF_MS";
    public static final String ZTMC_METRICS_RECOVER_ON_START = "ZTMC_METRICS_RECOVER_ON_START";

    public static final String ZTMC_METRICS_LOG_INTERVAL_SEC = "ZTMC_METRICS_LOG_INTERVAL_SEC";
    public static final String ZTMC_METRICS_HTTP_ENABLED = "ZTMC_METRICS_HTTP_ENABLED";
    public static final String ZTMC_METRICS_HTTP_PORT = "ZTMC_METRICS_HTTP_PORT";
    public static final String ZTMC_METRICS_HTTP_PATH = "ZTMC_METRICS_HTTP_PATH";

    private AccessEnvKeys() {
    }
}
