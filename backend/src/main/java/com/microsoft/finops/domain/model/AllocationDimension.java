package com.microsoft.finops.domain.model;

/**
 * What a chargeback report attributes cost to.
 */
public enum AllocationDimension {
    TEAM("team"),
    PRODUCT("product"),
    ENVIRONMENT("environment"),
    COST_CENTER("cost_center");

    private final String canonicalTagKey;

    AllocationDimension(String canonicalTagKey) {
        this.canonicalTagKey = canonicalTagKey;
    }

    /**
     * Tag key read by tag-based rules when none is configured.
     */
    public String getCanonicalTagKey() {
        return canonicalTagKey;
    }
}
