package com.acme.ztmc.access.enforcement;

import com.acme.ztmc.access.policy.Decision;

/**
 * What the enforcement point does with a decision. FLAG_FOR_REVIEW blocks the
 * request like BLOCK but is kept distinct in the audit trail.
 */
public enum EnforcementAction {
    PERMIT,
    BLOCK,
    FLAG_FOR_REVIEW;

    public static EnforcementAction forDecision(Decision decision) {
        return switch (decision) {
            case ALLOW -> PERMIT;
            case REVIEW -> FLAG_FOR_REVIEW;
            case DENY -> BLOCK;
        };
    }

    public boolean grantsAccess() {
        return this == PERMIT;
    }
}
