package com.microsoft.finops.allocation;

import com.microsoft.finops.domain.model.AllocationRule;
import com.microsoft.finops.domain.model.CostRecord;
import com.microsoft.finops.domain.model.TimeWindow;
import com.microsoft.finops.exception.ConsistencyViolationException;
import com.microsoft.finops.normalization.NormalizationConfigProvider;
import com.microsoft.finops.scope.CostFilter;
import com.microsoft.finops.scope.ScopeExpressionParser;
import com.microsoft.finops.store.CostStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Chargeback: attributes spend in a scope to teams, products, environments or
 * cost centers.
 *
 * METHODS:
 * - TAG_BASED: key is the record's tag value; untagged spend is Unallocated
 * - ACCOUNT_BASED: key is the account's mapped target; unmapped accounts are Unallocated
 * - FIXED_PERCENTAGE: every record is split by the shares, rounding each part
 *   toward zero and giving the remainder to the largest share (ties: key ascending)
 *
 * The allocated amounts always sum to the scope total to the minor unit; a
 * mismatch is a defect and fails the call.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AllocationEngine {

    public static final String UNALLOCATED = "Unallocated";

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final CostStore costStore;
    private final NormalizationConfigProvider configProvider;

    /**
     * Allocate spend matching both the rule scope and the request scope.
     */
    public AllocationResult allocate(AllocationRule rule, CostFilter requestScope, TimeWindow window) {
        CostFilter ruleScope = ScopeExpressionParser.parse(rule.getScope());
        List<CostRecord> records = costStore.snapshot(ruleScope, window).stream()
                .filter(requestScope::matches)
                .toList();

        String scope = requestScope.isUnrestricted()
                ? ruleScope.toString()
                : ruleScope + " & " + requestScope;
        return allocate(rule, records, scope, window, configProvider.current().organizationCurrency());
    }

    /**
     * Pure allocation over already selected records.
     */
    AllocationResult allocate(AllocationRule rule, List<CostRecord> records, String scope,
                              TimeWindow window, String currency) {
        Map<String, Long> amounts = new TreeMap<>();
        amounts.put(UNALLOCATED, 0L);

        for (CostRecord record : records) {
            switch (rule.getMethod()) {
                case TAG_BASED -> add(amounts, orUnallocated(record.tag(rule.effectiveTagKey())), record.getAmountMinorUnits());
                case ACCOUNT_BASED -> add(amounts, orUnallocated(rule.getAccountMappings().get(record.getAccountId())),
                        record.getAmountMinorUnits());
                case FIXED_PERCENTAGE -> split(rule.getShares(), record.getAmountMinorUnits())
                        .forEach((key, part) -> add(amounts, key, part));
            }
        }

        long total = 0;
        for (CostRecord record : records) {
            total = Math.addExact(total, record.getAmountMinorUnits());
        }
        long allocated = amounts.values().stream().mapToLong(Long::longValue).sum();
        if (allocated != total) {
            log.error("Allocation rule '{}' ({}) allocated {} but scope total is {} over {}",
                    rule.getName(), rule.getMethod(), allocated, total, window);
            throw new ConsistencyViolationException("Allocation of rule '" + rule.getName() + "' sums to "
                    + allocated + " but the scope total is " + total);
        }

        List<AllocationEntry> entries = new ArrayList<>();
        for (Map.Entry<String, Long> amount : amounts.entrySet()) {
            entries.add(new AllocationEntry(amount.getKey(), amount.getValue(), pct(amount.getValue(), total)));
        }
        entries.sort(Comparator.comparingLong(AllocationEntry::amountMinorUnits).reversed()
                .thenComparing(AllocationEntry::key));

        log.debug("Rule '{}' allocated {} over {} record(s) into {} bucket(s)",
                rule.getName(), total, records.size(), entries.size());
        return new AllocationResult(rule.getId(), rule.getName(), rule.getDimension(), rule.getMethod(),
                scope, window, currency, total, !records.isEmpty(), List.copyOf(entries));
    }

    /**
     * Split an amount by shares. Parts are rounded toward zero and the remainder
     * goes to the largest share, so the parts always add up to the amount.
     */
    static Map<String, Long> split(Map<String, BigDecimal> shares, long amount) {
        Map<String, Long> parts = new TreeMap<>();
        String largest = null;
        long assigned = 0;
        for (Map.Entry<String, BigDecimal> share : new TreeMap<>(shares).entrySet()) {
            long part = BigDecimal.valueOf(amount).multiply(share.getValue())
                    .setScale(0, RoundingMode.DOWN)
                    .longValueExact();
            parts.put(share.getKey(), part);
            assigned += part;
            if (largest == null || share.getValue().compareTo(shares.get(largest)) > 0) {
                largest = share.getKey();
            }
        }
        parts.merge(largest, amount - assigned, Long::sum);
        return parts;
    }

    private static void add(Map<String, Long> amounts, String key, long amount) {
        amounts.merge(key, amount, Math::addExact);
    }

    private static String orUnallocated(String key) {
        return key == null || key.isBlank() ? UNALLOCATED : key;
    }

    private static BigDecimal pct(long amount, long total) {
        if (total == 0) {
            return null;
        }
        return BigDecimal.valueOf(amount).multiply(HUNDRED)
                .divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_EVEN);
    }
}
