package com.acme.ztmc.access.policy;

import java.util.Objects;

/**
 * Combines context trust signals with action policies into one decision
 * using deny-overrides, fail-closed semantics.
 *
 * <p>Holds no mutable state; the policy set is read once per call from the
 * store, so concurrent callers always see a complete rule set.</p>
 */
public final class PolicyDecisionPoint {
    public static final String REASON_DEFAULT = "no matching policy (default)";

    private final ContextEvaluator contextEvaluator;
    private final PolicyStore policyStore;

    public PolicyDecisionPoint(ContextEvaluator contextEvaluator, PolicyStore policyStore) {
        this.contextEvaluator = Objects.requireNonNull(contextEvaluator, "contextEvaluator");
        this.policyStore = Objects.requireNonNull(policyStore, "policyStore");
    }

    public PolicyDecision decide(AccessRequest request) {
        return decide(request, policyStore.activePolicySet());
    }

    public PolicyDecision decide(AccessRequest request, PolicySet policySet) {
        ContextVerdict context = contextEvaluator.evaluate(request);
        ContextVerdict action = evaluateAction(request, policySet);
        Decision combined = combine(context.decision(), action.decision());
        String reason = combined == context.decision() ? context.reason() : action.reason();
        return new PolicyDecision(combined, reason, context, action, policySet.version());
    }

    public static ContextVerdict evaluateAction(AccessRequest request, PolicySet policySet) {
        for (Policy policy : policySet.policies()) {
            if (policy.matches(request.action())) {
                return new ContextVerdict(policy.decision(), policy.description());
            }
        }
        return new ContextVerdict(policySet.defaultDecision(), REASON_DEFAULT);
    }

    /**
     * Deny-overrides combination. Not symmetric: context ALLOW with action REVIEW
     * is DENY while context REVIEW with action ALLOW is REVIEW.
     */
    public static Decision combine(Decision context, Decision action) {
        if (context == Decision.DENY || action == Decision.DENY) {
            return Decision.DENY;
        }
        if (context == Decision.REVIEW && action == Decision.ALLOW) {
            return Decision.REVIEW;
        }
        if (context == Decision.ALLOW && action == Decision.ALLOW) {
            return Decision.ALLOW;
        }
        return Decision.DENY;
    }
}
