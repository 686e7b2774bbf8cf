package com.microsoft.finops.governance;

import com.microsoft.finops.adapters.ResourceMetadata;
import com.microsoft.finops.domain.model.CloudProvider;

import java.util.Optional;
import java.util.SortedMap;
import java.util.SortedSet;

/**
 * Join of one subject's cost records in the evaluation window with its
 * resource metadata. A subject is a resource, or an account for spend
 * without resource granularity.
 *
 * @param tags union of the records' tags; on conflicting values the most recent record wins
 */
public record ResourceFacts(
        String subjectKey,
        CloudProvider cloud,
        String accountId,
        String resourceId,
        SortedSet<String> services,
        SortedSet<String> regions,
        SortedMap<String, String> tags,
        long spendMinorUnits,
        Optional<ResourceMetadata> metadata
) {

    /**
     * Attribute for attribute-match policies: metadata first, then record fields
     * (cloud, account, resource_id, service, region, tag:&lt;key&gt;).
     */
    public Optional<String> attribute(String name) {
        if (metadata.isPresent()) {
            String value = metadata.get().attribute(name);
            if (value != null) {
                return Optional.of(value);
            }
        }
        if (name.startsWith("tag:")) {
            return Optional.ofNullable(tags.get(name.substring(4)));
        }
        return switch (name) {
            case "cloud" -> Optional.of(cloud.name());
            case "account" -> Optional.of(accountId);
            case "resource_id" -> Optional.ofNullable(resourceId);
            case "service" -> services.isEmpty() ? Optional.empty() : Optional.of(String.join(",", services));
            case "region" -> regions.isEmpty() ? Optional.empty() : Optional.of(String.join(",", regions));
            default -> Optional.empty();
        };
    }

    public String primaryRegion() {
        return regions.isEmpty() ? null : regions.first();
    }
}
