package com.microsoft.finops.budget;

import com.microsoft.finops.aggregation.AggregationEngine;
import com.microsoft.finops.config.FinOpsProperties;
import com.microsoft.finops.domain.model.Budget;
import com.microsoft.finops.domain.model.TimeWindow;
import com.microsoft.finops.scope.CostFilter;
import com.microsoft.finops.scope.ScopeExpressionParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Budget consumption, status and run-rate forecast.
 *
 * The current period is the one containing the as-of date; spend counted is
 * [period start, as-of), so days elapsed and consumed spend cover the same days.
 *
 * STATUS:
 * - OVER when consumed >= amount, compared in minor units
 * - INSUFFICIENT_DATA when no day of the period has elapsed
 * - ON_TRACK when consumed % <= elapsed % + tolerance
 * - AT_RISK otherwise
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BudgetTracker {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final AggregationEngine aggregationEngine;
    private final FinOpsProperties properties;

    public BudgetStatus evaluate(Budget budget, LocalDate asOf) {
        BudgetPeriodBounds period = currentPeriod(budget, asOf);
        LocalDate periodStart = period.start();
        LocalDate periodEnd = period.end();
        long daysInPeriod = ChronoUnit.DAYS.between(periodStart, periodEnd);
        long daysElapsed = Math.max(0, ChronoUnit.DAYS.between(periodStart, asOf));

        CostFilter filter = ScopeExpressionParser.parse(budget.getScope());
        long consumed = daysElapsed == 0
                ? 0
                : aggregationEngine.total(filter, TimeWindow.ofDays(periodStart, asOf));

        long amount = budget.getAmountMinorUnits();
        BigDecimal consumedRatio = BigDecimal.valueOf(consumed).multiply(HUNDRED)
                .divide(BigDecimal.valueOf(amount), MathContext.DECIMAL64);
        BigDecimal expectedRatio = BigDecimal.valueOf(daysElapsed).multiply(HUNDRED)
                .divide(BigDecimal.valueOf(daysInPeriod), MathContext.DECIMAL64);

        BudgetHealth health;
        if (consumed >= amount) {
            health = BudgetHealth.OVER;
        } else if (daysElapsed == 0) {
            health = BudgetHealth.INSUFFICIENT_DATA;
        } else if (consumedRatio.compareTo(expectedRatio.add(properties.getBudget().getTolerancePct())) <= 0) {
            health = BudgetHealth.ON_TRACK;
        } else {
            health = BudgetHealth.AT_RISK;
        }

        Long forecast = null;
        Long variance = null;
        if (daysElapsed > 0) {
            forecast = BigDecimal.valueOf(consumed)
                    .multiply(BigDecimal.valueOf(daysInPeriod))
                    .divide(BigDecimal.valueOf(daysElapsed), 0, RoundingMode.HALF_EVEN)
                    .longValueExact();
            variance = forecast - amount;
        }

        BigDecimal consumedPct = consumedRatio.setScale(2, RoundingMode.DOWN);
        boolean alert = consumedRatio.compareTo(budget.getAlertThresholdPct()) >= 0;

        log.debug("Budget '{}' as of {}: consumed {} of {} ({}%), {}", budget.getName(), asOf,
                consumed, amount, consumedPct, health);

        return new BudgetStatus(
                budget.getId(),
                budget.getName(),
                budget.getScope(),
                budget.getCurrency(),
                periodStart,
                periodEnd,
                asOf,
                daysElapsed,
                daysInPeriod,
                amount,
                consumed,
                consumedPct,
                expectedRatio.setScale(2, RoundingMode.HALF_EVEN),
                health,
                forecast,
                variance,
                alert
        );
    }

    /**
     * Period containing asOf; the first period when asOf precedes the anchor.
     *
     * Both bounds are offsets from the anchor, never from a clamped earlier bound,
     * so a Jan 31 anchor yields Feb 29 - Mar 31 and then Mar 31 - Apr 30.
     */
    static BudgetPeriodBounds currentPeriod(Budget budget, LocalDate asOf) {
        LocalDate anchor = budget.getAnchorDate();
        int months = budget.getPeriod().getMonths();
        if (!asOf.isAfter(anchor)) {
            return new BudgetPeriodBounds(anchor, anchor.plusMonths(months));
        }
        long k = ChronoUnit.MONTHS.between(anchor, asOf) / months;
        while (k > 0 && anchor.plusMonths(k * months).isAfter(asOf)) {
            k--;
        }
        while (!anchor.plusMonths((k + 1) * months).isAfter(asOf)) {
            k++;
        }
        return new BudgetPeriodBounds(anchor.plusMonths(k * months), anchor.plusMonths((k + 1) * months));
    }

    record BudgetPeriodBounds(LocalDate start, LocalDate end) {
    }
}
