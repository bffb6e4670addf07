package com.acme.ztmc.access.policy;

import com.acme.ztmc.access.util.JsonCodec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Parses the JSON policy document:
 *
 * <pre>
 * {"version": "2024-06-01",
 *  "policies": [{"id": "read-s3", "conditions": {"action": ["s3:GetObject"]},
 *                "decision": "allow", "description": "..."}],
 *  "default_action": "deny"}
 * </pre>
 */
public final class PolicyDocumentParser {
    private PolicyDocumentParser() {
    }

    public static PolicySet parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new PolicyConfigException("policy document is empty");
        }
        JsonNode root;
        try {
            root = JsonCodec.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new PolicyConfigException("policy document is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new PolicyConfigException("policy document must be a JSON object");
        }
        JsonNode policiesNode = root.get("policies");
        if (policiesNode == null || !policiesNode.isArray()) {
            throw new PolicyConfigException("policy document has no 'policies' array");
        }

        List<Policy> policies = new ArrayList<>(policiesNode.size());
        for (int i = 0; i < policiesNode.size(); i++) {
            policies.add(parsePolicy(policiesNode.get(i), i));
        }
        Decision defaultDecision = parseDecision(textOrNull(root, "default_action"), Decision.DENY, "default_action");
        return new PolicySet(textOrNull(root, "version"), policies, defaultDecision);
    }

    private static Policy parsePolicy(JsonNode node, int index) {
        if (node == null || !node.isObject()) {
            throw new PolicyConfigException("policies[" + index + "] must be an object");
        }
        String id = textOrNull(node, "id");
        if (id == null || id.isBlank()) {
            id = "policy-" + index;
        }
        Set<String> actions = new LinkedHashSet<>();
        JsonNode conditions = node.get("conditions");
        JsonNode actionNode = conditions == null ? null : conditions.get("action");
        if (actionNode != null && actionNode.isArray()) {
            actionNode.forEach(a -> {
                if (a.isTextual()) {
                    actions.add(a.asText());
                }
            });
        } else if (actionNode != null && actionNode.isTextual()) {
            actions.add(actionNode.asText());
        }
        String rawDecision = textOrNull(node, "decision");
        if (rawDecision == null) {
            throw new PolicyConfigException("policy " + id + " has no decision");
        }
        Decision decision = parseDecision(rawDecision, null, "policy " + id);
        return new Policy(id, actions, decision, textOrNull(node, "description"));
    }

    private static Decision parseDecision(String raw, Decision fallback, String where) {
        if (raw == null || raw.isBlank()) {
            if (fallback != null) {
                return fallback;
            }
            throw new PolicyConfigException(where + ": decision is blank");
        }
        try {
            return Decision.parse(raw);
        } catch (IllegalArgumentException e) {
            throw new PolicyConfigException(where + ": " + e.getMessage(), e);
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) {
            return null;
        }
        return v.asText();
    }
}
