package com.microsoft.finops.scope;

import com.microsoft.finops.domain.model.CloudProvider;
import com.microsoft.finops.exception.InvalidScopeExpressionException;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Parses scope expressions into {@link CostFilter}s.
 *
 * Grammar: clauses separated by ';', each clause {@code dimension=value[,value...]}.
 * Dimensions are cloud, account, project, service, region and {@code tag:<key>}.
 * An empty expression or "*" selects everything. Example:
 * <pre>cloud=AWS,GCP; account=123456789012; tag:team=backend</pre>
 */
public final class ScopeExpressionParser {

    public static final String ALL = "*";

    private static final String TAG_PREFIX = "tag:";

    private ScopeExpressionParser() {
        // Utility class
    }

    public static CostFilter parse(String expression) {
        if (expression == null || expression.isBlank() || ALL.equals(expression.trim())) {
            return CostFilter.all();
        }

        Set<CloudProvider> clouds = EnumSet.noneOf(CloudProvider.class);
        SortedSet<String> accounts = new TreeSet<>();
        SortedSet<String> projects = new TreeSet<>();
        SortedSet<String> services = new TreeSet<>();
        SortedSet<String> regions = new TreeSet<>();
        SortedMap<String, SortedSet<String>> tags = new TreeMap<>();
        Set<String> seen = new HashSet<>();

        for (String rawClause : expression.split(";")) {
            String clause = rawClause.trim();
            if (clause.isEmpty()) {
                continue;
            }
            int eq = clause.indexOf('=');
            if (eq <= 0) {
                throw new InvalidScopeExpressionException("Clause '" + clause + "' is not of the form dimension=values");
            }
            String dimension = clause.substring(0, eq).trim().toLowerCase(Locale.ROOT);
            List<String> values = values(clause, clause.substring(eq + 1));
            if (!seen.add(dimension)) {
                throw new InvalidScopeExpressionException("Dimension '" + dimension + "' appears more than once");
            }

            switch (dimension) {
                case "cloud" -> values.forEach(v -> clouds.add(cloud(v)));
                case "account" -> accounts.addAll(values);
                case "project" -> projects.addAll(values);
                case "service" -> services.addAll(values);
                case "region" -> regions.addAll(values);
                default -> {
                    if (!dimension.startsWith(TAG_PREFIX) || dimension.length() == TAG_PREFIX.length()) {
                        throw new InvalidScopeExpressionException("Unknown scope dimension '" + dimension + "'");
                    }
                    tags.put(dimension.substring(TAG_PREFIX.length()).trim(), new TreeSet<>(values));
                }
            }
        }

        return new CostFilter(clouds, accounts, projects, services, regions, tags);
    }

    /**
     * Canonical text of a filter; parse(format(f)) equals f.
     */
    public static String format(CostFilter filter) {
        if (filter.isUnrestricted()) {
            return ALL;
        }
        List<String> clauses = new ArrayList<>();
        if (!filter.clouds().isEmpty()) {
            clauses.add("cloud=" + String.join(",", filter.clouds().stream().map(Enum::name).sorted().toList()));
        }
        addClause(clauses, "account", filter.accounts());
        addClause(clauses, "project", filter.projects());
        addClause(clauses, "service", filter.services());
        addClause(clauses, "region", filter.regions());
        for (Map.Entry<String, SortedSet<String>> tag : filter.tags().entrySet()) {
            addClause(clauses, TAG_PREFIX + tag.getKey(), tag.getValue());
        }
        return String.join("; ", clauses);
    }

    private static void addClause(List<String> clauses, String dimension, Set<String> values) {
        if (!values.isEmpty()) {
            clauses.add(dimension + "=" + String.join(",", values));
        }
    }

    private static List<String> values(String clause, String rawValues) {
        List<String> values = new ArrayList<>();
        for (String raw : rawValues.split(",", -1)) {
            String value = raw.trim();
            if (value.isEmpty()) {
                throw new InvalidScopeExpressionException("Clause '" + clause + "' has an empty value");
            }
            values.add(value);
        }
        return values;
    }

    private static CloudProvider cloud(String value) {
        try {
            return CloudProvider.fromCode(value);
        } catch (IllegalArgumentException e) {
            throw new InvalidScopeExpressionException("Unknown cloud '" + value + "' in scope", e);
        }
    }
}
