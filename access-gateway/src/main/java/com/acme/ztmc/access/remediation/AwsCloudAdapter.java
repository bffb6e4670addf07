package com.acme.ztmc.access.remediation;

import java.util.logging.Logger;

/**
 * Stand-in for the IAM group removal; performs no remote call.
 */
public final class AwsCloudAdapter implements CloudAdapter {
    private static final Logger LOG = Logger.getLogger(AwsCloudAdapter.class.getName());

    @Override
    public CloudProvider provider() {
        return CloudProvider.AWS;
    }

    @Override
    public String revokeAccess(String user) {
        LOG.fine(() -> "AWS revoke requested user=" + user);
        return "Removed " + user + " from SensitiveAccess group in AWS (mock)";
    }
}
