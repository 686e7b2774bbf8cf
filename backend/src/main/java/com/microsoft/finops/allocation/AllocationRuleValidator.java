package com.microsoft.finops.allocation;

import com.microsoft.finops.domain.model.AllocationRule;
import com.microsoft.finops.exception.InvalidAllocationConfigException;
import com.microsoft.finops.scope.ScopeExpressionParser;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Rejects allocation rules that could not allocate correctly.
 */
public final class AllocationRuleValidator {

    static final BigDecimal SHARE_EPSILON = new BigDecimal("0.000001");

    private AllocationRuleValidator() {
        // Utility class
    }

    public static void validate(AllocationRule rule) {
        if (rule.getName() == null || rule.getName().isBlank()) {
            throw new InvalidAllocationConfigException("Allocation rule name is required");
        }
        if (rule.getDimension() == null || rule.getMethod() == null) {
            throw new InvalidAllocationConfigException("Allocation rule '" + rule.getName()
                    + "' needs a dimension and a method");
        }
        ScopeExpressionParser.parse(rule.getScope());

        switch (rule.getMethod()) {
            case TAG_BASED -> {
                if (rule.getTagKey() != null && rule.getTagKey().isBlank()) {
                    throw new InvalidAllocationConfigException("Tag key of rule '" + rule.getName() + "' is blank");
                }
            }
            case ACCOUNT_BASED -> {
                if (rule.getAccountMappings() == null || rule.getAccountMappings().isEmpty()) {
                    throw new InvalidAllocationConfigException("Rule '" + rule.getName() + "' maps no accounts");
                }
                rule.getAccountMappings().forEach((account, target) -> {
                    if (isBlank(account) || isBlank(target)) {
                        throw new InvalidAllocationConfigException("Rule '" + rule.getName()
                                + "' has a blank account or target in its mapping");
                    }
                });
            }
            case FIXED_PERCENTAGE -> validateShares(rule.getName(), rule.getShares());
        }
    }

    static void validateShares(String ruleName, Map<String, BigDecimal> shares) {
        if (shares == null || shares.isEmpty()) {
            throw new InvalidAllocationConfigException("Rule '" + ruleName + "' defines no shares");
        }
        BigDecimal sum = BigDecimal.ZERO;
        for (Map.Entry<String, BigDecimal> share : shares.entrySet()) {
            if (isBlank(share.getKey())) {
                throw new InvalidAllocationConfigException("Rule '" + ruleName + "' has a share without a target");
            }
            if (share.getValue() == null || share.getValue().signum() <= 0 || share.getValue().compareTo(BigDecimal.ONE) > 0) {
                throw new InvalidAllocationConfigException("Share of '" + share.getKey() + "' in rule '" + ruleName
                        + "' must be in (0, 1]");
            }
            sum = sum.add(share.getValue());
        }
        if (sum.subtract(BigDecimal.ONE).abs().compareTo(SHARE_EPSILON) > 0) {
            throw new InvalidAllocationConfigException("Shares of rule '" + ruleName + "' sum to " + sum + ", not 1");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
