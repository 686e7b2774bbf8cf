package com.microsoft.finops.domain.model;

import java.util.Locale;

/**
 * Clouds whose billing data the engine ingests.
 *
 * Each provider has distinct billing exports, service names and tag conventions.
 * The normalization layer abstracts these differences; OTHER covers anything
 * that is billed outside the three hyperscalers (SaaS invoices, colocation).
 */
public enum CloudProvider {
    AWS("Amazon Web Services"),
    GCP("Google Cloud Platform"),
    AZURE("Azure"),
    OTHER("Other");

    private final String displayName;

    CloudProvider(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Lenient parse used by scope expressions and CSV exports.
     */
    public static CloudProvider fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Cloud code must not be blank");
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        for (CloudProvider provider : values()) {
            if (provider.name().equals(normalized)
                    || provider.displayName.toUpperCase(Locale.ROOT).equals(normalized)) {
                return provider;
            }
        }
        throw new IllegalArgumentException("Unknown cloud provider: " + code);
    }
}
