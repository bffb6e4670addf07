package com.acme.ztmc.access.policy;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PolicyTest {

    @Test
    void matchesExactActionCaseInsensitively() {
        Policy policy = new Policy("read", Set.of("s3:GetObject"), Decision.ALLOW, "read");
        assertTrue(policy.matches("s3:getobject"));
        assertTrue(policy.matches("S3:GETOBJECT"));
        assertFalse(policy.matches("s3:GetObjectAcl"));
    }

    @Test
    void starMatchesAnyAction() {
        Policy policy = new Policy("all", Set.of("*"), Decision.REVIEW, "everything");
        assertTrue(policy.matches("ec2:StartInstances"));
        assertTrue(policy.matches("anything"));
    }

    @Test
    void prefixWildcardMatchesOnlyThatService() {
        Policy policy = new Policy("s3", Set.of("s3:*"), Decision.ALLOW, "s3");
        assertTrue(policy.matches("S3:PutObject"));
        assertFalse(policy.matches("ec2:StartInstances"));
    }

    @Test
    void blankEntriesAreIgnoredAndNullNeverMatches() {
        Policy policy = new Policy("p", Set.of(" ", "iam:CreateUser"), Decision.DENY, null);
        assertEquals(Set.of("iam:createuser"), policy.matchActions());
        assertEquals("", policy.description());
        assertFalse(policy.matches(null));
    }

    @Test
    void decisionParsingIsCaseInsensitiveAndStrict() {
        assertEquals(Decision.REVIEW, Decision.parse(" review "));
        assertEquals(Decision.DENY, Decision.parse("Deny"));
        assertThrows(IllegalArgumentException.class, () -> Decision.parse("maybe"));
        assertThrows(IllegalArgumentException.class, () -> Decision.parse(""));
    }
}
