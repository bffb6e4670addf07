package com.acme.ztmc.access.audit;

/**
 * Event types written by the access pipeline. The log itself stores the type
 * as text, so entries written by other producers with other types still replay.
 */
public enum EventType {
    ACCESS_REQUEST,
    REMEDIATION,
    POLICY_CHANGE
}
