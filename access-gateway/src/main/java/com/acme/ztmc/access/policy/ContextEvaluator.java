package com.acme.ztmc.access.policy;

import java.util.Objects;

/**
 * Evaluates network, time and device trust signals of a request.
 *
 * <p>Checks run in a fixed order and the first failing check decides:
 * network, then business hours, then device. Stateless and thread-safe.</p>
 */
public final class ContextEvaluator {
    public static final String REASON_UNTRUSTED_NETWORK = "untrusted network source";
    public static final String REASON_OUTSIDE_HOURS = "outside business hours";
    public static final String REASON_UNRECOGNIZED_DEVICE = "unrecognized device";
    public static final String REASON_VALIDATED = "context validated";

    private final TrustConfig trustConfig;

    public ContextEvaluator(TrustConfig trustConfig) {
        this.trustConfig = Objects.requireNonNull(trustConfig, "trustConfig");
    }

    public ContextVerdict evaluate(AccessRequest request) {
        if (!trustConfig.inTrustedNetwork(request.sourceIp())) {
            return new ContextVerdict(Decision.DENY, REASON_UNTRUSTED_NETWORK);
        }
        int hour = request.requestTime().atZone(trustConfig.zone()).getHour();
        if (!trustConfig.withinBusinessHours(hour)) {
            return new ContextVerdict(Decision.DENY, REASON_OUTSIDE_HOURS);
        }
        if (!trustConfig.isTrustedDevice(request.deviceId())) {
            return new ContextVerdict(Decision.REVIEW, REASON_UNRECOGNIZED_DEVICE);
        }
        return new ContextVerdict(Decision.ALLOW, REASON_VALIDATED);
    }
}
