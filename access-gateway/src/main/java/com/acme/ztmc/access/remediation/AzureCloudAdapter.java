package com.acme.ztmc.access.remediation;

import java.util.logging.Logger;

public final class AzureCloudAdapter implements CloudAdapter {
    private static final Logger LOG = Logger.getLogger(AzureCloudAdapter.class.getName());

    @Override
    public CloudProvider provider() {
        return CloudProvider.AZURE;
    }

    @Override
    public String revokeAccess(String user) {
        LOG.fine(() -> "Azure revoke requested user=" + user);
        return "Azure remediation triggered for " + user;
    }
}
