package com.acme.ztmc.access.enforcement;

import com.acme.ztmc.access.policy.AccessRequest;
import com.acme.ztmc.access.util.JsonCodec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Decodes and validates access requests.
 *
 * <p>JSON body: {@code {"user", "action", "resource", "sourceIp", "deviceId"}}. The legacy
 * field name {@code ip} is accepted for {@code sourceIp}. The request time is stamped on
 * arrival, never taken from the body.</p>
 */
public final class AccessRequestDecoder {

    private AccessRequestDecoder() {
    }

    public static AccessRequest decode(String body, Instant receivedAt) {
        if (body == null || body.isBlank()) {
            throw new MalformedRequestException("empty request body");
        }
        JsonNode root;
        try {
            root = JsonCodec.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MalformedRequestException("request body is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedRequestException("request body must be a JSON object");
        }
        String sourceIp = text(root, "sourceIp");
        if (sourceIp == null) {
            sourceIp = text(root, "ip");
        }
        return validate(
            text(root, "user"),
            text(root, "action"),
            text(root, "resource"),
            sourceIp,
            text(root, "deviceId"),
            receivedAt
        );
    }

    public static AccessRequest validate(AccessRequest request) {
        if (request == null) {
            throw new MalformedRequestException("request is required");
        }
        return validate(request.user(), request.action(), request.resource(),
            request.sourceIp(), request.deviceId(), request.requestTime());
    }

    private static AccessRequest validate(String user,
                                          String action,
                                          String resource,
                                          String sourceIp,
                                          String deviceId,
                                          Instant requestTime) {
        requireField("user", user);
        requireField("action", action);
        requireField("resource", resource);
        requireField("sourceIp", sourceIp);
        requireField("deviceId", deviceId);
        if (requestTime == null) {
            throw new MalformedRequestException("missing field: requestTime");
        }
        return new AccessRequest(user, action, resource, sourceIp, deviceId, requestTime);
    }

    private static void requireField(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new MalformedRequestException("missing field: " + name);
        }
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull() || !node.isValueNode()) {
            return null;
        }
        return node.asText();
    }
}
