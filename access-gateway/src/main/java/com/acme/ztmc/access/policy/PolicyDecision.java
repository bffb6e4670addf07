package com.acme.ztmc.access.policy;

import java.util.Objects;

/**
 * Combined PDP result for one request.
 */
public record PolicyDecision(
    Decision decision,
    String reason,
    ContextVerdict contextVerdict,
    ContextVerdict actionVerdict,
    String policyVersion
) {
    public PolicyDecision {
        Objects.requireNonNull(decision, "decision");
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(contextVerdict, "contextVerdict");
        Objects.requireNonNull(actionVerdict, "actionVerdict");
        policyVersion = policyVersion == null ? "" : policyVersion;
    }
}
