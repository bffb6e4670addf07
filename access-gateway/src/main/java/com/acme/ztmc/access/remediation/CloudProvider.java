package com.acme.ztmc.access.remediation;

import java.util.Locale;
import java.util.Optional;

/**
 * Clouds with a remediation adapter.
 */
public enum CloudProvider {
    AWS("AWS"),
    AZURE("Azure"),
    GCP("GCP");

    private final String displayName;

    CloudProvider(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Derives the target cloud of a resource identifier. Best effort: the identifier is split
     * into alphanumeric tokens so that a name merely containing "aws" or "gcp" inside a longer
     * word is not misread. AWS wins over Azure when both appear; anything unrecognized is GCP.
     */
    public static CloudProvider classify(String resource) {
        if (resource == null || resource.isBlank()) {
            return GCP;
        }
        String low = resource.toLowerCase(Locale.ROOT);
        if (low.startsWith("arn:aws")) {
            return AWS;
        }
        boolean azure = low.startsWith("/subscriptions/");
        for (String token : low.split("[^a-z0-9]+")) {
            if (token.equals("aws") || token.equals("amazonaws")) {
                return AWS;
            }
            if (token.equals("azure") || token.equals("windows")) {
                azure = true;
            }
        }
        return azure ? AZURE : GCP;
    }

    /**
     * Resolves a cloud name case-insensitively; the name matches a provider when it contains
     * the provider's name, e.g. {@code "aws-prod"} resolves to AWS.
     */
    public static Optional<CloudProvider> match(String cloud) {
        if (cloud == null || cloud.isBlank()) {
            return Optional.empty();
        }
        String low = cloud.toLowerCase(Locale.ROOT);
        for (CloudProvider provider : values()) {
            if (low.contains(provider.name().toLowerCase(Locale.ROOT))) {
                return Optional.of(provider);
            }
        }
        return Optional.empty();
    }
}
