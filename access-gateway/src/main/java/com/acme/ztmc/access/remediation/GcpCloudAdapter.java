package com.acme.ztmc.access.remediation;

import java.util.logging.Logger;

public final class GcpCloudAdapter implements CloudAdapter {
    private static final Logger LOG = Logger.getLogger(GcpCloudAdapter.class.getName());

    @Override
    public CloudProvider provider() {
        return CloudProvider.GCP;
    }

    @Override
    public String revokeAccess(String user) {
        LOG.fine(() -> "GCP revoke requested user=" + user);
        return "GCP remediation triggered for " + user;
    }
}
