package com.microsoft.finops.normalization;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Resolves provider tag keys to canonical keys.
 *
 * Keys are trimmed and lower-cased; a key listed as an alias of a canonical key
 * ("Team", "owner-team" for "team") is renamed to it. Blank values are dropped.
 * When several source keys resolve to the same canonical key, the one already
 * spelled canonically wins, otherwise the alphabetically first source key.
 */
public final class TagResolutionPolicy {

    private final Map<String, String> aliasToCanonical;

    public TagResolutionPolicy(Map<String, List<String>> aliasesByCanonicalKey) {
        Map<String, String> lookup = new TreeMap<>();
        aliasesByCanonicalKey.forEach((canonical, aliases) -> {
            String canonicalKey = normalizeKey(canonical);
            lookup.put(canonicalKey, canonicalKey);
            if (aliases != null) {
                aliases.forEach(alias -> lookup.put(normalizeKey(alias), canonicalKey));
            }
        });
        this.aliasToCanonical = Collections.unmodifiableMap(lookup);
    }

    public static TagResolutionPolicy empty() {
        return new TagResolutionPolicy(new HashMap<>());
    }

    public Map<String, String> resolve(Map<String, String> providerTags) {
        Map<String, String> resolved = new TreeMap<>();
        if (providerTags == null || providerTags.isEmpty()) {
            return resolved;
        }
        Map<String, String> exact = new HashMap<>();
        new TreeMap<>(providerTags).forEach((rawKey, rawValue) -> {
            if (rawKey == null || rawValue == null || rawValue.isBlank()) {
                return;
            }
            String key = normalizeKey(rawKey);
            String canonical = aliasToCanonical.getOrDefault(key, key);
            String value = rawValue.trim();
            if (key.equals(canonical)) {
                exact.put(canonical, value);
            }
            resolved.putIfAbsent(canonical, value);
        });
        resolved.putAll(exact);
        return resolved;
    }

    public Map<String, String> aliases() {
        return aliasToCanonical;
    }

    public static String normalizeKey(String key) {
        return key.trim().toLowerCase(Locale.ROOT);
    }
}
