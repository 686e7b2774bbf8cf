package com.microsoft.finops.aggregation;

import com.microsoft.finops.domain.model.CostRecord;
import com.microsoft.finops.domain.model.TimeWindow;
import com.microsoft.finops.normalization.NormalizationConfigProvider;
import com.microsoft.finops.scope.CostFilter;
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
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Grouped, filtered spend summaries computed on demand.
 *
 * The engine keeps no derived state: every call reads the store, so budgets,
 * chargeback and the overview always agree. Rows are ordered by amount
 * descending, then key ascending.
 *
 * TREND:
 * - dimension groupings compare with the same group in the preceding window of
 *   equal length
 * - DAY/MONTH groupings compare each bucket with the bucket right before it
 * A group has no comparison when no earlier data exists at all; a group that
 * simply had no spend in the comparison period trends from zero.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AggregationEngine {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final CostStore costStore;
    private final NormalizationConfigProvider configProvider;

    public AggregationResult aggregate(CostFilter filter, GroupBy groupBy, TimeWindow window) {
        List<CostRecord> records = costStore.snapshot(filter, window);
        List<CostRecord> prior = costStore.snapshot(filter, comparisonWindow(groupBy, window));

        AggregationResult result = summarize(filter, groupBy, window,
                configProvider.current().organizationCurrency(), records, prior);
        log.debug("Aggregated {} record(s) by {} for {} {}: {} row(s)",
                records.size(), groupBy, filter, window, result.rows().size());
        return result;
    }

    /**
     * Filtered total in organization-currency minor units.
     */
    public long total(CostFilter filter, TimeWindow window) {
        return sum(costStore.snapshot(filter, window));
    }

    static TimeWindow comparisonWindow(GroupBy groupBy, TimeWindow window) {
        if (!groupBy.isTimeBucket()) {
            return window.preceding();
        }
        return new TimeWindow(TimeWindow.startOfDay(groupBy.previousBucketStart(window.startDate())), window.start());
    }

    /**
     * Pure grouping over already selected records.
     */
    static AggregationResult summarize(CostFilter filter, GroupBy groupBy, TimeWindow window, String currency,
                                       List<CostRecord> records, List<CostRecord> prior) {
        SortedMap<String, long[]> groups = group(groupBy, records);
        SortedMap<String, long[]> priorGroups = group(groupBy, prior);
        long total = sum(records);

        SortedMap<String, Long> timeline = new TreeMap<>();
        if (groupBy.isTimeBucket()) {
            priorGroups.forEach((key, acc) -> timeline.merge(key, acc[0], Long::sum));
            groups.forEach((key, acc) -> timeline.merge(key, acc[0], Long::sum));
        }

        List<GroupedTotal> rows = new ArrayList<>(groups.size());
        for (Map.Entry<String, long[]> group : groups.entrySet()) {
            String key = group.getKey();
            long amount = group.getValue()[0];
            int count = (int) group.getValue()[1];

            Long trend;
            if (groupBy.isTimeBucket()) {
                boolean earlierData = !timeline.headMap(key).isEmpty();
                trend = earlierData ? timeline.getOrDefault(groupBy.previousBucket(key), 0L) : null;
            } else {
                trend = prior.isEmpty() ? null : priorGroups.getOrDefault(key, new long[]{0, 0})[0];
            }
            rows.add(new GroupedTotal(key, amount, pct(amount, total), trend, trend != null, count));
        }

        rows.sort(Comparator.comparingLong(GroupedTotal::amountMinorUnits).reversed()
                .thenComparing(GroupedTotal::key));

        return new AggregationResult(filter.toString(), groupBy, window, currency, total,
                !records.isEmpty(), List.copyOf(rows));
    }

    static BigDecimal pct(long amount, long total) {
        if (total == 0) {
            return null;
        }
        return BigDecimal.valueOf(amount).multiply(HUNDRED)
                .divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_EVEN);
    }

    private static SortedMap<String, long[]> group(GroupBy groupBy, List<CostRecord> records) {
        SortedMap<String, long[]> groups = new TreeMap<>();
        for (CostRecord record : records) {
            long[] acc = groups.computeIfAbsent(groupBy.keyOf(record), k -> new long[2]);
            acc[0] = Math.addExact(acc[0], record.getAmountMinorUnits());
            acc[1]++;
        }
        return groups;
    }

    private static long sum(List<CostRecord> records) {
        long total = 0;
        for (CostRecord record : records) {
            total = Math.addExact(total, record.getAmountMinorUnits());
        }
        return total;
    }
}
