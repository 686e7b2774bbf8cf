package com.microsoft.finops.allocation;

import com.microsoft.finops.domain.model.AllocationDimension;
import com.microsoft.finops.domain.model.AllocationMethod;
import com.microsoft.finops.domain.model.AllocationRule;
import com.microsoft.finops.domain.model.CloudProvider;
import com.microsoft.finops.domain.model.CostRecord;
import com.microsoft.finops.domain.model.RecordType;
import com.microsoft.finops.domain.model.TimeWindow;
import com.microsoft.finops.normalization.NormalizationConfig;
import com.microsoft.finops.normalization.NormalizationConfigProvider;
import com.microsoft.finops.scope.CostFilter;
import com.microsoft.finops.scope.ScopeExpressionParser;
import com.microsoft.finops.store.CostStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

/**
 * Unit tests for AllocationEngine.
 *
 * Every test also checks conservation: the entries add up to the scope total.
 */
@ExtendWith(MockitoExtension.class)
class AllocationEngineTest {

    private static final TimeWindow MARCH = TimeWindow.ofDays(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 4, 1));

    @Mock
    private CostStore costStore;

    @Mock
    private NormalizationConfigProvider configProvider;

    @InjectMocks
    private AllocationEngine allocationEngine;

    private static CostRecord record(String account, long amount, Map<String, String> tags) {
        return CostRecord.builder()
                .cloud(CloudProvider.AWS)
                .accountId(account)
                .service("EC2")
                .tags(tags)
                .periodStart(Instant.parse("2024-03-10T00:00:00Z"))
                .periodEnd(Instant.parse("2024-03-11T00:00:00Z"))
                .recordType(amount < 0 ? RecordType.CREDIT : RecordType.USAGE)
                .amountMinorUnits(amount)
                .currency("USD")
                .sourceBatchId("AWS:batch")
                .build();
    }

    private static AllocationRule rule(AllocationMethod method) {
        return AllocationRule.builder()
                .id(1L)
                .name("Team chargeback")
                .dimension(AllocationDimension.TEAM)
                .method(method)
                .build();
    }

    private AllocationResult allocate(AllocationRule rule, List<CostRecord> records) {
        return allocationEngine.allocate(rule, records, "*", MARCH, "USD");
    }

    private static void assertConserved(AllocationResult result) {
        assertThat(result.entries().stream().mapToLong(AllocationEntry::amountMinorUnits).sum())
                .isEqualTo(result.totalMinorUnits());
    }

    @Nested
    @DisplayName("Tag-Based Tests")
    class TagBasedTests {

        @Test
        @DisplayName("Should put untagged spend into Unallocated")
        void shouldAllocateUntaggedToUnallocated() {
            // Given - {team=backend: $70}, {no tag: $30}
            var records = List.of(
                    record("A1", 7_000, Map.of("team", "backend")),
                    record("A1", 3_000, Map.of()));

            // When
            var result = allocate(rule(AllocationMethod.TAG_BASED), records);

            // Then
            assertThat(result.entries())
                    .extracting(AllocationEntry::key, AllocationEntry::amountMinorUnits)
                    .containsExactly(tuple("backend", 7_000L), tuple(AllocationEngine.UNALLOCATED, 3_000L));
            assertThat(result.totalMinorUnits()).isEqualTo(10_000L);
            assertThat(result.unallocatedMinorUnits()).isEqualTo(3_000L);
            assertThat(result.entries().get(0).pctOfTotal()).isEqualByComparingTo(new BigDecimal("70.00"));
            assertConserved(result);
        }

        @Test
        @DisplayName("Should read a configured tag key instead of the dimension default")
        void shouldUseConfiguredTagKey() {
            // Given
            AllocationRule rule = rule(AllocationMethod.TAG_BASED);
            rule.setTagKey("Squad");
            var records = List.of(
                    record("A1", 500, Map.of("squad", "payments", "team", "backend")),
                    record("A1", 250, Map.of("team", "backend")));

            // When
            var result = allocate(rule, records);

            // Then
            assertThat(result.entries())
                    .extracting(AllocationEntry::key, AllocationEntry::amountMinorUnits)
                    .containsExactly(tuple("payments", 500L), tuple(AllocationEngine.UNALLOCATED, 250L));
        }

        @Test
        @DisplayName("Should always report Unallocated, even when empty")
        void shouldAlwaysReportUnallocated() {
            // When
            var result = allocate(rule(AllocationMethod.TAG_BASED), List.of(record("A1", 100, Map.of("team", "data"))));

            // Then
            assertThat(result.entries()).extracting(AllocationEntry::key)
                    .containsExactly("data", AllocationEngine.UNALLOCATED);
            assertThat(result.unallocatedMinorUnits()).isZero();
        }

        @Test
        @DisplayName("Should report no data with only the Unallocated bucket")
        void shouldReportNoData() {
            var result = allocate(rule(AllocationMethod.TAG_BASED), List.of());

            assertThat(result.dataAvailable()).isFalse();
            assertThat(result.entries()).singleElement().satisfies(entry -> {
                assertThat(entry.key()).isEqualTo(AllocationEngine.UNALLOCATED);
                assertThat(entry.pctOfTotal()).isNull();
            });
        }
    }

    @Nested
    @DisplayName("Account-Based Tests")
    class AccountBasedTests {

        @Test
        @DisplayName("Should map accounts to targets and unmapped accounts to Unallocated")
        void shouldMapAccounts() {
            // Given
            AllocationRule rule = rule(AllocationMethod.ACCOUNT_BASED);
            rule.setAccountMappings(new HashMap<>(Map.of("A1", "backend", "A2", "backend", "A3", "data")));
            var records = List.of(
                    record("A1", 1_000, Map.of()),
                    record("A2", 2_000, Map.of()),
                    record("A3", 1_500, Map.of()),
                    record("A9", 400, Map.of()));

            // When
            var result = allocate(rule, records);

            // Then
            assertThat(result.entries())
                    .extracting(AllocationEntry::key, AllocationEntry::amountMinorUnits)
                    .containsExactly(
                            tuple("backend", 3_000L),
                            tuple("data", 1_500L),
                            tuple(AllocationEngine.UNALLOCATED, 400L));
            assertConserved(result);
        }
    }

    @Nested
    @DisplayName("Fixed-Percentage Tests")
    class FixedPercentageTests {

        @Test
        @DisplayName("Should give rounding remainders to the largest share")
        void shouldAssignRemainderToLargestShare() {
            // When - 100 cents split three ways
            Map<String, Long> parts = AllocationEngine.split(Map.of(
                    "a", new BigDecimal("0.333333"),
                    "b", new BigDecimal("0.333334"),
                    "c", new BigDecimal("0.333333")), 100);

            // Then
            assertThat(parts).containsExactlyInAnyOrderEntriesOf(Map.of("a", 33L, "b", 34L, "c", 33L));
        }

        @Test
        @DisplayName("Should break ties between equal largest shares by key")
        void shouldBreakTiesByKey() {
            Map<String, Long> parts = AllocationEngine.split(Map.of(
                    "web", new BigDecimal("0.5"),
                    "api", new BigDecimal("0.5")), 101);

            assertThat(parts).containsExactlyInAnyOrderEntriesOf(Map.of("api", 51L, "web", 50L));
        }

        @Test
        @DisplayName("Should split credits without losing a cent")
        void shouldSplitCredits() {
            Map<String, Long> parts = AllocationEngine.split(Map.of(
                    "a", new BigDecimal("0.7"),
                    "b", new BigDecimal("0.3")), -1_001);

            assertThat(parts.values().stream().mapToLong(Long::longValue).sum()).isEqualTo(-1_001L);
            assertThat(parts).containsEntry("b", -300L);
        }

        @Test
        @DisplayName("Should conserve the total across many odd-cent records")
        void shouldConserveAcrossRecords() {
            // Given
            AllocationRule rule = rule(AllocationMethod.FIXED_PERCENTAGE);
            rule.setShares(new HashMap<>(Map.of(
                    "backend", new BigDecimal("0.45"),
                    "data", new BigDecimal("0.35"),
                    "web", new BigDecimal("0.20"))));
            var records = List.of(
                    record("A1", 1, Map.of()),
                    record("A1", 7, Map.of()),
                    record("A1", 999, Map.of()),
                    record("A1", 12_345, Map.of()),
                    record("A1", -33, Map.of()));

            // When
            var result = allocate(rule, records);

            // Then
            assertThat(result.totalMinorUnits()).isEqualTo(13_319L);
            assertConserved(result);
            assertThat(result.unallocatedMinorUnits()).isZero();
        }
    }

    @Nested
    @DisplayName("Scope Tests")
    class ScopeTests {

        @Test
        @DisplayName("Should intersect the rule scope with the request scope")
        void shouldIntersectScopes() {
            // Given
            AllocationRule rule = rule(AllocationMethod.TAG_BASED);
            rule.setScope("cloud=AWS");
            CostFilter ruleScope = ScopeExpressionParser.parse("cloud=AWS");
            when(configProvider.current())
                    .thenReturn(new NormalizationConfig("test", "USD", null, null, null, Map.of()));
            when(costStore.snapshot(eq(ruleScope), eq(MARCH))).thenReturn(List.of(
                    record("A1", 1_000, Map.of("team", "backend")),
                    record("A2", 500, Map.of("team", "data"))));

            // When
            var result = allocationEngine.allocate(rule, ScopeExpressionParser.parse("account=A2"), MARCH);

            // Then
            assertThat(result.totalMinorUnits()).isEqualTo(500L);
            assertThat(result.entries()).extracting(AllocationEntry::key)
                    .containsExactly("data", AllocationEngine.UNALLOCATED);
            assertThat(result.scope()).isEqualTo("cloud=AWS & account=A2");
        }
    }
}
