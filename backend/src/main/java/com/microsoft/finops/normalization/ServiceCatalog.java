package com.microsoft.finops.normalization;

import com.microsoft.finops.domain.model.CloudProvider;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Maps provider service identifiers to canonical service names.
 *
 * Lookup keys are normalized (lower case, no spaces, dashes, underscores or dots)
 * so "Amazon EC2", "AmazonEC2" and "amazon-ec2" hit the same entry. A code that
 * already is a canonical name of that cloud maps to itself, which keeps
 * re-normalization of exported data stable.
 */
public final class ServiceCatalog {

    public static final String OTHER = "Other";

    private final Map<CloudProvider, Map<String, String>> entries;

    public ServiceCatalog(Map<CloudProvider, Map<String, String>> catalog) {
        Map<CloudProvider, Map<String, String>> copy = new EnumMap<>(CloudProvider.class);
        catalog.forEach((cloud, mappings) -> {
            Map<String, String> normalized = new TreeMap<>();
            mappings.forEach((code, canonical) -> {
                normalized.put(normalizeCode(code), canonical);
                normalized.putIfAbsent(normalizeCode(canonical), canonical);
            });
            copy.put(cloud, Collections.unmodifiableMap(normalized));
        });
        this.entries = Collections.unmodifiableMap(copy);
    }

    public static ServiceCatalog empty() {
        return new ServiceCatalog(new HashMap<>());
    }

    public Optional<String> resolve(CloudProvider cloud, String serviceCode) {
        if (serviceCode == null || serviceCode.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.getOrDefault(cloud, Map.of()).get(normalizeCode(serviceCode)));
    }

    public Map<CloudProvider, Map<String, String>> entries() {
        return entries;
    }

    public static String normalizeCode(String code) {
        return code.trim().toLowerCase(Locale.ROOT)
                .replace(" ", "")
                .replace("-", "")
                .replace("_", "")
                .replace(".", "");
    }
}
