package com.acme.ztmc.access.policy;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ContextEvaluatorTest {
    private static final TrustConfig TRUST = new TrustConfig(
        List.of("192.168.", "10.0."),
        Set.of("device-laptop-001", "device-admin-001"),
        8,
        20,
        ZoneOffset.UTC
    );
    private final ContextEvaluator evaluator = new ContextEvaluator(TRUST);

    @Test
    void trustedRequestInsideBusinessHoursIsAllowed() {
        ContextVerdict verdict = evaluator.evaluate(request("192.168.1.12", "device-laptop-001", "2025-03-03T10:15:00Z"));
        assertEquals(Decision.ALLOW, verdict.decision());
        assertEquals(ContextEvaluator.REASON_VALIDATED, verdict.reason());
    }

    @Test
    void untrustedNetworkIsCheckedFirst() {
        ContextVerdict verdict = evaluator.evaluate(request("8.8.8.8", "unknown-device-999", "2025-03-03T23:00:00Z"));
        assertEquals(Decision.DENY, verdict.decision());
        assertEquals("untrusted network source", verdict.reason());
    }

    @Test
    void hoursAreCheckedBeforeDevice() {
        ContextVerdict verdict = evaluator.evaluate(request("10.0.0.5", "unknown-device-999", "2025-03-03T22:00:00Z"));
        assertEquals(Decision.DENY, verdict.decision());
        assertEquals("outside business hours", verdict.reason());
    }

    @Test
    void businessHoursAreHalfOpen() {
        assertEquals(Decision.ALLOW,
            evaluator.evaluate(request("10.0.0.5", "device-admin-001", "2025-03-03T08:00:00Z")).decision());
        assertEquals(Decision.ALLOW,
            evaluator.evaluate(request("10.0.0.5", "device-admin-001", "2025-03-03T19:59:59Z")).decision());
        assertEquals(Decision.DENY,
            evaluator.evaluate(request("10.0.0.5", "device-admin-001", "2025-03-03T20:00:00Z")).decision());
        assertEquals(Decision.DENY,
            evaluator.evaluate(request("10.0.0.5", "device-admin-001", "2025-03-03T07:59:59Z")).decision());
    }

    @Test
    void unknownDeviceNeedsReview() {
        ContextVerdict verdict = evaluator.evaluate(request("192.168.1.12", "unknown-device-999", "2025-03-03T12:00:00Z"));
        assertEquals(Decision.REVIEW, verdict.decision());
        assertEquals("unrecognized device", verdict.reason());
    }

    @Test
    void hourIsReadInConfiguredZone() {
        TrustConfig plusTwo = new TrustConfig(List.of("10.0."), Set.of("d"), 8, 20, ZoneOffset.ofHours(2));
        ContextEvaluator zoned = new ContextEvaluator(plusTwo);
        // 06:30 UTC is 08:30 at +02:00
        assertEquals(Decision.ALLOW, zoned.evaluate(request("10.0.0.1", "d", "2025-03-03T06:30:00Z")).decision());
    }

    @Test
    void trustConfigRejectsInvertedHours() {
        assertThrows(IllegalArgumentException.class,
            () -> new TrustConfig(List.of(), Set.of(), 20, 8, ZoneOffset.UTC));
        assertThrows(IllegalArgumentException.class,
            () -> new TrustConfig(List.of(), Set.of(), 0, 25, ZoneOffset.UTC));
    }

    static AccessRequest request(String ip, String device, String time) {
        return new AccessRequest("alice", "s3:GetObject", "arn:aws:s3:::reports", ip, device, Instant.parse(time));
    }
}
