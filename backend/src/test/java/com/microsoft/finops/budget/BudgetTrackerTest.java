package com.microsoft.finops.budget;

import com.microsoft.finops.aggregation.AggregationEngine;
import com.microsoft.finops.config.FinOpsProperties;
import com.microsoft.finops.domain.model.Budget;
import com.microsoft.finops.domain.model.BudgetPeriod;
import com.microsoft.finops.domain.model.TimeWindow;
import com.microsoft.finops.scope.ScopeExpressionParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for BudgetTracker.
 *
 * April 2024 has 30 days, so elapsed percentages are round numbers.
 */
@ExtendWith(MockitoExtension.class)
class BudgetTrackerTest {

    private static final LocalDate APRIL_1 = LocalDate.of(2024, 4, 1);

    @Mock
    private AggregationEngine aggregationEngine;

    private BudgetTracker budgetTracker;

    @BeforeEach
    void setUp() {
        budgetTracker = new BudgetTracker(aggregationEngine, new FinOpsProperties());
    }

    private static Budget monthlyBudget(long amountMinorUnits) {
        return Budget.builder()
                .id(7L)
                .name("Engineering")
                .scope("tag:team=Engineering")
                .amountMinorUnits(amountMinorUnits)
                .currency("USD")
                .period(BudgetPeriod.MONTHLY)
                .anchorDate(APRIL_1)
                .alertThresholdPct(BigDecimal.valueOf(80))
                .build();
    }

    private void givenConsumed(LocalDate asOf, long consumed) {
        when(aggregationEngine.total(eq(ScopeExpressionParser.parse("tag:team=Engineering")),
                eq(TimeWindow.ofDays(APRIL_1, asOf)))).thenReturn(consumed);
    }

    @Nested
    @DisplayName("Status Boundary Tests")
    class StatusBoundaryTests {

        @Test
        @DisplayName("Should report OVER at exactly 100% consumed")
        void shouldBeOverAtExactlyHundredPercent() {
            // Given
            LocalDate asOf = LocalDate.of(2024, 4, 16);
            givenConsumed(asOf, 10_000);

            // When
            BudgetStatus status = budgetTracker.evaluate(monthlyBudget(10_000), asOf);

            // Then
            assertThat(status.status()).isEqualTo(BudgetHealth.OVER);
            assertThat(status.consumedPct()).isEqualByComparingTo(new BigDecimal("100.00"));
        }

        @Test
        @DisplayName("Should never report OVER at 99.99% consumed")
        void shouldNotBeOverJustBelowHundredPercent() {
            // Given - halfway through the month
            LocalDate asOf = LocalDate.of(2024, 4, 16);
            givenConsumed(asOf, 9_999);

            // When
            BudgetStatus status = budgetTracker.evaluate(monthlyBudget(10_000), asOf);

            // Then
            assertThat(status.status()).isEqualTo(BudgetHealth.AT_RISK);
            assertThat(status.consumedPct()).isEqualByComparingTo(new BigDecimal("99.99"));
            assertThat(status.expectedPct()).isEqualByComparingTo(new BigDecimal("50.00"));
        }

        @Test
        @DisplayName("Should be ON_TRACK at 99.99% when the period is almost over")
        void shouldBeOnTrackNearPeriodEnd() {
            // Given
            LocalDate asOf = LocalDate.of(2024, 4, 30);
            givenConsumed(asOf, 9_999);

            // When
            BudgetStatus status = budgetTracker.evaluate(monthlyBudget(10_000), asOf);

            // Then
            assertThat(status.status()).isEqualTo(BudgetHealth.ON_TRACK);
        }

        @Test
        @DisplayName("Should allow spend ahead of pace up to the tolerance")
        void shouldApplyTolerance() {
            // Given - 50% elapsed, 60% consumed (exactly at tolerance)
            LocalDate asOf = LocalDate.of(2024, 4, 16);
            givenConsumed(asOf, 6_000);

            // When
            BudgetStatus status = budgetTracker.evaluate(monthlyBudget(10_000), asOf);

            // Then
            assertThat(status.status()).isEqualTo(BudgetHealth.ON_TRACK);
        }
    }

    @Nested
    @DisplayName("Forecast Tests")
    class ForecastTests {

        @Test
        @DisplayName("Should project the run rate to the end of the period")
        void shouldForecastRunRate() {
            // Given - $30.00 over 10 days of a 30 day period
            LocalDate asOf = LocalDate.of(2024, 4, 11);
            givenConsumed(asOf, 3_000);

            // When
            BudgetStatus status = budgetTracker.evaluate(monthlyBudget(10_000), asOf);

            // Then
            assertThat(status.daysElapsed()).isEqualTo(10);
            assertThat(status.daysInPeriod()).isEqualTo(30);
            assertThat(status.forecastMinorUnits()).isEqualTo(9_000L);
            assertThat(status.varianceMinorUnits()).isEqualTo(-1_000L);
            assertThat(status.alertTriggered()).isFalse();
        }

        @Test
        @DisplayName("Should report insufficient data on the first day of the period")
        void shouldReportInsufficientData() {
            // When
            BudgetStatus status = budgetTracker.evaluate(monthlyBudget(10_000), APRIL_1);

            // Then
            assertThat(status.status()).isEqualTo(BudgetHealth.INSUFFICIENT_DATA);
            assertThat(status.forecastMinorUnits()).isNull();
            assertThat(status.varianceMinorUnits()).isNull();
            assertThat(status.consumedMinorUnits()).isZero();
            verify(aggregationEngine, never()).total(any(), any());
        }

        @Test
        @DisplayName("Should trigger the alert at the threshold")
        void shouldTriggerAlert() {
            // Given
            LocalDate asOf = LocalDate.of(2024, 4, 28);
            givenConsumed(asOf, 8_000);

            // When
            BudgetStatus status = budgetTracker.evaluate(monthlyBudget(10_000), asOf);

            // Then
            assertThat(status.alertTriggered()).isTrue();
        }
    }

    @Nested
    @DisplayName("Period Tests")
    class PeriodTests {

        @Test
        @DisplayName("Should roll monthly periods forward from the anchor")
        void shouldFindCurrentMonthlyPeriod() {
            Budget budget = monthlyBudget(10_000);
            budget.setAnchorDate(LocalDate.of(2024, 1, 15));

            assertThat(BudgetTracker.currentPeriod(budget, LocalDate.of(2024, 3, 14)).start())
                    .isEqualTo(LocalDate.of(2024, 2, 15));
            assertThat(BudgetTracker.currentPeriod(budget, LocalDate.of(2024, 3, 15)).start())
                    .isEqualTo(LocalDate.of(2024, 3, 15));
        }

        @Test
        @DisplayName("Should roll quarterly periods forward from the anchor")
        void shouldFindCurrentQuarterlyPeriod() {
            Budget budget = monthlyBudget(10_000);
            budget.setPeriod(BudgetPeriod.QUARTERLY);
            budget.setAnchorDate(LocalDate.of(2024, 1, 1));

            assertThat(BudgetTracker.currentPeriod(budget, LocalDate.of(2024, 5, 20)).start())
                    .isEqualTo(LocalDate.of(2024, 4, 1));
        }

        @Test
        @DisplayName("Should use the first period when as-of precedes the anchor")
        void shouldUseAnchorBeforeFirstPeriod() {
            Budget budget = monthlyBudget(10_000);

            assertThat(BudgetTracker.currentPeriod(budget, LocalDate.of(2024, 3, 1)).start()).isEqualTo(APRIL_1);
        }

        @Test
        @DisplayName("Should keep month-end anchored periods contiguous across February")
        void shouldNotDriftFromMonthEndAnchor() {
            // Given
            Budget budget = monthlyBudget(31_000);
            budget.setAnchorDate(LocalDate.of(2024, 1, 31));
            LocalDate asOf = LocalDate.of(2024, 3, 30);
            when(aggregationEngine.total(any(), any())).thenReturn(10_000L);

            // When
            BudgetStatus status = budgetTracker.evaluate(budget, asOf);

            // Then
            assertThat(status.periodStart()).isEqualTo(LocalDate.of(2024, 2, 29));
            assertThat(status.periodEnd()).isEqualTo(LocalDate.of(2024, 3, 31));
            assertThat(status.daysInPeriod()).isEqualTo(31);
            assertThat(status.daysElapsed()).isEqualTo(30);
            assertThat(status.expectedPct()).isEqualByComparingTo(new BigDecimal("96.77"));
            assertThat(BudgetTracker.currentPeriod(budget, LocalDate.of(2024, 2, 28)))
                    .isEqualTo(new BudgetTracker.BudgetPeriodBounds(LocalDate.of(2024, 1, 31), LocalDate.of(2024, 2, 29)));
            assertThat(BudgetTracker.currentPeriod(budget, LocalDate.of(2024, 3, 31)))
                    .isEqualTo(new BudgetTracker.BudgetPeriodBounds(LocalDate.of(2024, 3, 31), LocalDate.of(2024, 4, 30)));
        }
    }
}
