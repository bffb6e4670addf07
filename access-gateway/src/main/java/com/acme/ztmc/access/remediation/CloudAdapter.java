package com.acme.ztmc.access.remediation;

/**
 * Per-cloud remediation capability.
 *
 * <p>Implementations are called from the dispatcher's executor and may be called
 * again for the same user; {@link #revokeAccess} must be idempotent.</p>
 */
public interface CloudAdapter {
    /** Returns the cloud this adapter acts on. */
    CloudProvider provider();

    /**
     * Revokes the user's sensitive access and returns a human-readable description of what was done.
     *
     * @throws Exception on any provider failure; the dispatcher turns it into a failure description
     */
    String revokeAccess(String user) throws Exception;
}
