package com.microsoft.finops.governance;

import com.microsoft.finops.domain.model.Policy;
import com.microsoft.finops.exception.ConfigurationException;
import com.microsoft.finops.exception.MalformedPolicyException;
import com.microsoft.finops.scope.CostFilter;
import com.microsoft.finops.scope.ScopeExpressionParser;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Turns a stored policy into an executable predicate.
 *
 * Compilation runs when a policy is saved, so a malformed rule (missing
 * parameter, bad regex, unknown operator, bad scope) is rejected before it can
 * reach an evaluation cycle.
 */
@Component
public class PolicyCompiler {

    enum Operator { EQUALS, CONTAINS, MATCHES }

    public CompiledPolicy compile(Policy policy) {
        if (policy.getType() == null) {
            throw new MalformedPolicyException("Policy '" + policy.getName() + "' has no type");
        }
        Map<String, String> params = policy.getParameters() == null ? Map.of() : policy.getParameters();
        for (String required : policy.getType().getRequiredParameters()) {
            String value = params.get(required);
            if (value == null || value.isBlank()) {
                throw new MalformedPolicyException("Policy '" + policy.getName() + "' of type "
                        + policy.getType() + " requires parameter '" + required + "'");
            }
        }

        CostFilter scope;
        try {
            scope = ScopeExpressionParser.parse(policy.getScope());
        } catch (ConfigurationException e) {
            throw new MalformedPolicyException("Policy '" + policy.getName() + "' has an invalid scope: "
                    + e.getMessage(), e);
        }

        PolicyPredicate predicate = switch (policy.getType()) {
            case RESOURCE_ATTRIBUTE_MATCH -> attributeMatch(policy.getName(), params);
            case SPEND_THRESHOLD -> spendThreshold(policy.getName(), params);
            case TAG_PRESENCE -> tagPresence(policy.getName(), params);
            case ALLOWED_REGIONS -> allowedRegions(policy.getName(), params);
        };
        return new CompiledPolicy(policy, scope, predicate);
    }

    private PolicyPredicate attributeMatch(String name, Map<String, String> params) {
        String attribute = params.get("attribute").trim();
        String expected = params.get("value");
        Operator operator;
        try {
            operator = Operator.valueOf(params.get("operator").trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new MalformedPolicyException("Policy '" + name + "' has unknown operator '"
                    + params.get("operator") + "'", e);
        }

        return switch (operator) {
            case EQUALS -> facts -> facts.attribute(attribute)
                    .filter(actual -> actual.equalsIgnoreCase(expected))
                    .map(actual -> attribute + " is " + actual);
            case CONTAINS -> facts -> facts.attribute(attribute)
                    .filter(actual -> actual.toLowerCase(Locale.ROOT).contains(expected.toLowerCase(Locale.ROOT)))
                    .map(actual -> attribute + " " + actual + " contains " + expected);
            case MATCHES -> {
                Pattern pattern;
                try {
                    pattern = Pattern.compile(expected);
                } catch (PatternSyntaxException e) {
                    throw new MalformedPolicyException("Policy '" + name + "' has an invalid pattern: "
                            + e.getDescription(), e);
                }
                yield facts -> facts.attribute(attribute)
                        .filter(actual -> pattern.matcher(actual).matches())
                        .map(actual -> attribute + " " + actual + " matches " + expected);
            }
        };
    }

    private PolicyPredicate spendThreshold(String name, Map<String, String> params) {
        long max;
        try {
            max = Long.parseLong(params.get("maxAmountMinorUnits").trim());
        } catch (NumberFormatException e) {
            throw new MalformedPolicyException("Policy '" + name + "' has a non-numeric maxAmountMinorUnits", e);
        }
        if (max < 0) {
            throw new MalformedPolicyException("Policy '" + name + "' has a negative maxAmountMinorUnits");
        }
        return facts -> facts.spendMinorUnits() > max
                ? Optional.of("spend " + facts.spendMinorUnits() + " exceeds " + max)
                : Optional.empty();
    }

    private PolicyPredicate tagPresence(String name, Map<String, String> params) {
        List<String> required = list(params.get("requiredTags"));
        if (required.isEmpty()) {
            throw new MalformedPolicyException("Policy '" + name + "' lists no required tags");
        }
        return facts -> {
            List<String> missing = new ArrayList<>();
            for (String tag : required) {
                if (!facts.tags().containsKey(tag)) {
                    missing.add(tag);
                }
            }
            return missing.isEmpty() ? Optional.empty() : Optional.of("missing tags " + missing);
        };
    }

    private PolicyPredicate allowedRegions(String name, Map<String, String> params) {
        Set<String> allowed = new LinkedHashSet<>(list(params.get("regions")));
        if (allowed.isEmpty()) {
            throw new MalformedPolicyException("Policy '" + name + "' lists no allowed regions");
        }
        String whenTag = params.get("whenTag");
        String tagKey;
        String tagValue;
        if (whenTag == null || whenTag.isBlank()) {
            tagKey = null;
            tagValue = null;
        } else {
            int eq = whenTag.indexOf('=');
            if (eq <= 0 || eq == whenTag.length() - 1) {
                throw new MalformedPolicyException("Policy '" + name + "' has whenTag '" + whenTag
                        + "', expected key=value");
            }
            tagKey = whenTag.substring(0, eq).trim().toLowerCase(Locale.ROOT);
            tagValue = whenTag.substring(eq + 1).trim();
        }

        return facts -> {
            if (tagKey != null && !tagValue.equals(facts.tags().get(tagKey))) {
                return Optional.empty();
            }
            List<String> outside = facts.regions().stream()
                    .filter(region -> !allowed.contains(region))
                    .toList();
            return outside.isEmpty() ? Optional.empty() : Optional.of("runs in unapproved regions " + outside);
        };
    }

    private static List<String> list(String commaSeparated) {
        return Arrays.stream(commaSeparated.split(","))
                .map(v -> v.trim().toLowerCase(Locale.ROOT))
                .filter(v -> !v.isEmpty())
                .toList();
    }
}
