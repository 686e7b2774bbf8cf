package com.microsoft.finops.governance;

import java.util.Optional;

/**
 * Compiled policy rule.
 */
@FunctionalInterface
public interface PolicyPredicate {

    /**
     * Reason the subject violates the rule, empty when it complies.
     */
    Optional<String> violation(ResourceFacts facts);
}
