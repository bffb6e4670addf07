package com.acme.ztmc.access.enforcement;

import com.acme.ztmc.access.policy.AccessRequest;
import com.acme.ztmc.access.policy.Decision;
import com.acme.ztmc.access.remediation.CloudProvider;

import java.util.List;
import java.util.Objects;

/**
 * Result of enforcing one request.
 *
 * @param remediationActions empty for ALLOW
 */
public record EnforcementOutcome(
    AccessRequest request,
    Decision decision,
    String reason,
    CloudProvider cloud,
    EnforcementAction enforcement,
    List<String> remediationActions
) {
    public EnforcementOutcome {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(decision, "decision");
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(cloud, "cloud");
        Objects.requireNonNull(enforcement, "enforcement");
        remediationActions = List.copyOf(remediationActions == null ? List.of() : remediationActions);
    }
}
