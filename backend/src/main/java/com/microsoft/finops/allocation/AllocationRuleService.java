package com.microsoft.finops.allocation;

import com.microsoft.finops.domain.model.AllocationDimension;
import com.microsoft.finops.domain.model.AllocationMethod;
import com.microsoft.finops.domain.model.AllocationRule;
import com.microsoft.finops.domain.model.TimeWindow;
import com.microsoft.finops.domain.repository.AllocationRuleRepository;
import com.microsoft.finops.exception.InvalidAllocationConfigException;
import com.microsoft.finops.exception.NotFoundException;
import com.microsoft.finops.scope.ScopeExpressionParser;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Allocation rule configuration. Rules are validated on save, so allocation
 * never runs with shares that do not sum to one.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AllocationRuleService {

    private final AllocationRuleRepository ruleRepository;
    private final AllocationEngine allocationEngine;

    @Transactional
    public AllocationRule create(AllocationRuleRequest request) {
        AllocationRule rule = AllocationRule.builder()
                .name(request.name() == null ? null : request.name().trim())
                .dimension(request.dimension())
                .method(request.method())
                .scope(request.scope() == null ? "" : request.scope().trim())
                .tagKey(request.tagKey())
                .accountMappings(request.accountMappings() == null ? new HashMap<>() : new HashMap<>(request.accountMappings()))
                .shares(request.shares() == null ? new HashMap<>() : new HashMap<>(request.shares()))
                .build();

        AllocationRuleValidator.validate(rule);
        if (ruleRepository.existsByName(rule.getName())) {
            throw new InvalidAllocationConfigException("An allocation rule named '" + rule.getName() + "' already exists");
        }

        AllocationRule saved = ruleRepository.save(rule);
        log.info("Created {} allocation rule '{}' ({}) for {}", saved.getMethod(), saved.getName(),
                saved.getId(), saved.getDimension());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<AllocationRule> list() {
        return ruleRepository.findAllByOrderByIdAsc();
    }

    @Transactional(readOnly = true)
    public AllocationRule get(Long id) {
        return ruleRepository.findById(id).orElseThrow(() -> new NotFoundException("Allocation rule", id));
    }

    @Transactional
    public void delete(Long id) {
        AllocationRule rule = get(id);
        ruleRepository.delete(rule);
        log.info("Deleted allocation rule '{}' ({})", rule.getName(), id);
    }

    public AllocationResult allocate(Long ruleId, String scopeExpression, TimeWindow window) {
        return allocationEngine.allocate(get(ruleId), ScopeExpressionParser.parse(scopeExpression), window);
    }

    public record AllocationRuleRequest(
            @NotBlank String name,
            @NotNull AllocationDimension dimension,
            @NotNull AllocationMethod method,
            String scope,
            String tagKey,
            Map<String, String> accountMappings,
            Map<String, BigDecimal> shares
    ) {
    }
}
