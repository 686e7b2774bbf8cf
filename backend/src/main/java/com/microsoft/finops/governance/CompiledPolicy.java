package com.microsoft.finops.governance;

import com.microsoft.finops.domain.model.Policy;
import com.microsoft.finops.scope.CostFilter;

public record CompiledPolicy(Policy policy, CostFilter scope, PolicyPredicate predicate) {
}
