package com.microsoft.finops.adapters;

import java.util.Map;

/**
 * Inventory facts about a resource, supplied by the optimization scanners or
 * an inventory collector and consumed by governance policies.
 */
public record ResourceMetadata(
        String resourceId,
        String instanceType,
        boolean gpuPresent,
        Map<String, String> attributes
) {
    public ResourceMetadata {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    /**
     * Named attribute; instance_type and gpu_present are always resolvable.
     */
    public String attribute(String name) {
        return switch (name) {
            case "instance_type" -> instanceType;
            case "gpu_present" -> String.valueOf(gpuPresent);
            default -> attributes.get(name);
        };
    }
}
