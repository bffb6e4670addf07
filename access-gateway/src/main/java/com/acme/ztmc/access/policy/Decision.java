package com.acme.ztmc.access.policy;

import java.util.Locale;

/**
 * Tri-state access decision. Declaration order is strictness order: DENY is the strictest.
 */
public enum Decision {
    ALLOW,
    REVIEW,
    DENY;

    /**
     * Parses a decision name case-insensitively.
     *
     * @throws IllegalArgumentException for blank or unknown names
     */
    public static Decision parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("decision is blank");
        }
        return switch (raw.trim().toUpperCase(Locale.ROOT)) {
            case "ALLOW" -> ALLOW;
            case "REVIEW" -> REVIEW;
            case "DENY" -> DENY;
            default -> throw new IllegalArgumentException("unknown decision: " + raw);
        };
    }
}
