package com.acme.ztmc.access.policy;

import java.util.List;
import java.util.Objects;

/**
 * Immutable, ordered rule set. The first policy whose actions match wins.
 */
public record PolicySet(
    String version,
    List<Policy> policies,
    Decision defaultDecision
) {
    public PolicySet {
        version = version == null ? "" : version;
        policies = List.copyOf(policies == null ? List.of() : policies);
        Objects.requireNonNull(defaultDecision, "defaultDecision");
    }
}
