package com.microsoft.finops.domain.model;

import java.util.Set;

/**
 * Discriminates the predicate a governance policy evaluates.
 * Each type declares the rule parameters it requires.
 */
public enum PolicyType {
    /**
     * Resource metadata attribute compared to a value.
     * Parameters: attribute, operator (EQUALS | CONTAINS | MATCHES), value.
     */
    RESOURCE_ATTRIBUTE_MATCH(Set.of("attribute", "operator", "value")),

    /**
     * Spend of a resource over the evaluation window above a limit.
     * Parameters: maxAmountMinorUnits.
     */
    SPEND_THRESHOLD(Set.of("maxAmountMinorUnits")),

    /**
     * Cost records of a resource lack one of the required tags.
     * Parameters: requiredTags (comma separated).
     */
    TAG_PRESENCE(Set.of("requiredTags")),

    /**
     * Resource runs outside the approved regions.
     * Parameters: regions (comma separated); optional whenTag (key=value).
     */
    ALLOWED_REGIONS(Set.of("regions"));

    private final Set<String> requiredParameters;

    PolicyType(Set<String> requiredParameters) {
        this.requiredParameters = requiredParameters;
    }

    public Set<String> getRequiredParameters() {
        return requiredParameters;
    }
}
