package com.microsoft.finops.scope;

import com.microsoft.finops.domain.model.CloudProvider;
import com.microsoft.finops.domain.model.CostRecord;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Conjunction of value sets over cost record dimensions.
 *
 * An empty set leaves its dimension unrestricted; a non-empty set requires the
 * record's value to be one of its members. Tag clauses require the tag to be
 * present with one of the listed values. Service and region compare ignoring case.
 */
public record CostFilter(
        Set<CloudProvider> clouds,
        SortedSet<String> accounts,
        SortedSet<String> projects,
        SortedSet<String> services,
        SortedSet<String> regions,
        SortedMap<String, SortedSet<String>> tags
) {

    private static final CostFilter ALL = new CostFilter(
            EnumSet.noneOf(CloudProvider.class), new TreeSet<>(), new TreeSet<>(),
            new TreeSet<>(), new TreeSet<>(), new TreeMap<>());

    public CostFilter {
        clouds = clouds.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(CloudProvider.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(clouds));
        accounts = Collections.unmodifiableSortedSet(new TreeSet<>(accounts));
        projects = Collections.unmodifiableSortedSet(new TreeSet<>(projects));
        services = Collections.unmodifiableSortedSet(lowerCased(services));
        regions = Collections.unmodifiableSortedSet(lowerCased(regions));
        SortedMap<String, SortedSet<String>> tagCopy = new TreeMap<>();
        tags.forEach((key, values) -> tagCopy.put(key.toLowerCase(Locale.ROOT),
                Collections.unmodifiableSortedSet(new TreeSet<>(values))));
        tags = Collections.unmodifiableSortedMap(tagCopy);
    }

    public static CostFilter all() {
        return ALL;
    }

    public boolean isUnrestricted() {
        return clouds.isEmpty() && accounts.isEmpty() && projects.isEmpty()
                && services.isEmpty() && regions.isEmpty() && tags.isEmpty();
    }

    public boolean matches(CostRecord record) {
        if (!clouds.isEmpty() && !clouds.contains(record.getCloud())) {
            return false;
        }
        if (!accounts.isEmpty() && !accounts.contains(record.getAccountId())) {
            return false;
        }
        if (!projects.isEmpty() && !projects.contains(record.getProjectId())) {
            return false;
        }
        if (!services.isEmpty() && !containsIgnoreCase(services, record.getService())) {
            return false;
        }
        if (!regions.isEmpty() && !containsIgnoreCase(regions, record.getRegion())) {
            return false;
        }
        for (Map.Entry<String, SortedSet<String>> clause : tags.entrySet()) {
            String value = record.tag(clause.getKey());
            if (value == null || !clause.getValue().contains(value)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return ScopeExpressionParser.format(this);
    }

    private static boolean containsIgnoreCase(Set<String> lowerCasedValues, String value) {
        return value != null && lowerCasedValues.contains(value.toLowerCase(Locale.ROOT));
    }

    private static SortedSet<String> lowerCased(Set<String> values) {
        SortedSet<String> result = new TreeSet<>();
        values.forEach(v -> result.add(v.toLowerCase(Locale.ROOT)));
        return result;
    }
}
