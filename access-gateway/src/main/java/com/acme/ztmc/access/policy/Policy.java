package com.acme.ztmc.access.policy;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Action-based policy. Each {@code matchActions} entry is an exact action name,
 * {@code *} for any action, or a prefix wildcard such as {@code s3:*}.
 * Entries are stored lower-cased; matching is case-insensitive.
 */
public record Policy(
    String id,
    Set<String> matchActions,
    Decision decision,
    String description
) {
    public static final String ANY_ACTION = "*";

    public Policy {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(decision, "decision");
        description = description == null ? "" : description;
        Set<String> normalized = new LinkedHashSet<>();
        if (matchActions != null) {
            for (String action : matchActions) {
                if (action != null && !action.isBlank()) {
                    normalized.add(action.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        matchActions = Set.copyOf(normalized);
    }

    public boolean matches(String action) {
        if (action == null) {
            return false;
        }
        String candidate = action.trim().toLowerCase(Locale.ROOT);
        for (String entry : matchActions) {
            if (entry.equals(ANY_ACTION) || entry.equals(candidate)) {
                return true;
            }
            if (entry.length() > 1 && entry.endsWith(ANY_ACTION)
                && candidate.startsWith(entry.substring(0, entry.length() - 1))) {
                return true;
            }
        }
        return false;
    }
}
