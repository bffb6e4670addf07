package com.acme.ztmc.access.policy;

import com.acme.ztmc.access.util.AccessDefaults;
import com.acme.ztmc.access.util.AccessEnvKeys;
import com.acme.ztmc.access.util.EnvVars;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Static trust configuration for context evaluation.
 *
 * @param trustedNetworkPrefixes source IP prefixes considered inside the trusted network
 * @param trustedDevices device ids allowed without review
 * @param businessHoursStart first hour of the business window (inclusive)
 * @param businessHoursEnd hour at which the business window closes (exclusive)
 * @param zone deployment time zone used to read the hour of a request
 */
public record TrustConfig(
    List<String> trustedNetworkPrefixes,
    Set<String> trustedDevices,
    int businessHoursStart,
    int businessHoursEnd,
    ZoneId zone
) {
    private static final Logger LOG = Logger.getLogger(TrustConfig.class.getName());

    public TrustConfig {
        trustedNetworkPrefixes = List.copyOf(Objects.requireNonNull(trustedNetworkPrefixes, "trustedNetworkPrefixes"));
        trustedDevices = Set.copyOf(Objects.requireNonNull(trustedDevices, "trustedDevices"));
        Objects.requireNonNull(zone, "zone");
        if (businessHoursStart < 0 || businessHoursStart > 24 || businessHoursEnd < 0 || businessHoursEnd > 24) {
            throw new IllegalArgumentException("business hours must be within [0, 24]");
        }
        if (businessHoursStart > businessHoursEnd) {
            throw new IllegalArgumentException("business hours start " + businessHoursStart
                + " is after end " + businessHoursEnd);
        }
    }

    public static TrustConfig defaults() {
        return new TrustConfig(
            AccessDefaults.DEFAULT_TRUSTED_NETWORK_PREFIXES,
            Set.copyOf(AccessDefaults.DEFAULT_TRUSTED_DEVICES),
            AccessDefaults.DEFAULT_BUSINESS_HOURS_START,
            AccessDefaults.DEFAULT_BUSINESS_HOURS_END,
            ZoneId.systemDefault()
        );
    }

    public static TrustConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static TrustConfig fromEnvironment(Map<String, String> env) {
        List<String> prefixes = EnvVars.getList(env, AccessEnvKeys.ZTMC_TRUSTED_NETWORK_PREFIXES,
            AccessDefaults.DEFAULT_TRUSTED_NETWORK_PREFIXES);
        List<String> devices = EnvVars.getList(env, AccessEnvKeys.ZTMC_TRUSTED_DEVICES,
            AccessDefaults.DEFAULT_TRUSTED_DEVICES);
        int start = EnvVars.getIntClamped(env, AccessEnvKeys.ZTMC_BUSINESS_HOURS_START,
            AccessDefaults.DEFAULT_BUSINESS_HOURS_START, 0, 24);
        int end = EnvVars.getIntClamped(env, AccessEnvKeys.ZTMC_BUSINESS_HOURS_END,
            AccessDefaults.DEFAULT_BUSINESS_HOURS_END, start, 24);
        return new TrustConfig(prefixes, Set.copyOf(devices), start, end, resolveZone(env));
    }

    public boolean inTrustedNetwork(String sourceIp) {
        for (String prefix : trustedNetworkPrefixes) {
            if (sourceIp.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    public boolean withinBusinessHours(int hourOfDay) {
        return businessHoursStart <= hourOfDay && hourOfDay < businessHoursEnd;
    }

    public boolean isTrustedDevice(String deviceId) {
        return trustedDevices.contains(deviceId);
    }

    private static ZoneId resolveZone(Map<String, String> env) {
        String raw = EnvVars.getOrDefault(env, AccessEnvKeys.ZTMC_TIMEZONE, "");
        if (raw.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(raw.trim());
        } catch (DateTimeException e) {
            LOG.warning("Unknown " + AccessEnvKeys.ZTMC_TIMEZONE + "=" + raw + ", using system default zone");
            return ZoneId.systemDefault();
        }
    }
}
