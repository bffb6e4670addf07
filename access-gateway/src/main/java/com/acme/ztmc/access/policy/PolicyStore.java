package com.acme.ztmc.access.policy;

import java.util.Objects;

/**
 * Source of the active {@link PolicySet}.
 *
 * <p>Implementations must publish a new set only after it is fully built;
 * readers never observe a partially updated set.</p>
 */
public interface PolicyStore {
    /** Returns the current rule set. Never null. */
    PolicySet activePolicySet();

    static PolicyStore fixed(PolicySet policySet) {
        Objects.requireNonNull(policySet, "policySet");
        return () -> policySet;
    }
}
