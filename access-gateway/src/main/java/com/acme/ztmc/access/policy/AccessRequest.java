package com.acme.ztmc.access.policy;

import java.time.Instant;
import java.util.Objects;

public record AccessRequest(
    String user,
    String action,
    String resource,
    String sourceIp,
    String deviceId,
    Instant requestTime
) {
    public AccessRequest {
        Objects.requireNonNull(user, "user");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(resource, "resource");
        Objects.requireNonNull(sourceIp, "sourceIp");
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(requestTime, "requestTime");
    }
}
