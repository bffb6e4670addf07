package com.acme.ztmc.access.policy;

import java.util.Objects;

/**
 * A decision paired with the reason that produced it. Used for both the
 * context evaluation and the action-policy lookup of a single request.
 */
public record ContextVerdict(Decision decision, String reason) {
    public ContextVerdict {
        Objects.requireNonNull(decision, "decision");
        Objects.requireNonNull(reason, "reason");
    }
}
