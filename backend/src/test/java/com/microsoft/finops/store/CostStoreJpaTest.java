package com.microsoft.finops.store;

import com.microsoft.finops.domain.model.BatchStatus;
import com.microsoft.finops.domain.model.CloudProvider;
import com.microsoft.finops.domain.model.CostRecord;
import com.microsoft.finops.domain.model.IngestionBatch;
import com.microsoft.finops.domain.model.RecordType;
import com.microsoft.finops.domain.model.TimeWindow;
import com.microsoft.finops.domain.repository.CostRecordRepository;
import com.microsoft.finops.scope.CostFilter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * CostStore against the real schema: supersession, batch replacement and restore
 * go through the actual repository queries.
 */
@DataJpaTest
@Import({CostStore.class, PartitionLocks.class, CostStoreJpaTest.ClockConfig.class})
class CostStoreJpaTest {

    private static final Instant NOW = Instant.parse("2024-03-12T03:00:00Z");
    private static final TimeWindow DAY = TimeWindow.ofDay(LocalDate.of(2024, 3, 10));

    @TestConfiguration
    static class ClockConfig {

        @Bean
        Clock clock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }

    @Autowired
    private CostStore costStore;

    @Autowired
    private CostRecordRepository costRecordRepository;

    private static CostRecord usage(String batchId, String resourceId, long amount) {
        return CostRecord.builder()
                .cloud(CloudProvider.AWS)
                .accountId("111111111111")
                .service("EC2")
                .serviceMapped(true)
                .resourceId(resourceId)
                .region("us-east-1")
                .tags(new HashMap<>(Map.of("team", "web")))
                .periodStart(DAY.start())
                .periodEnd(DAY.end())
                .recordType(RecordType.USAGE)
                .amountMinorUnits(amount)
                .currency("USD")
                .originalAmountMinorUnits(amount)
                .originalCurrency("USD")
                .ingestedAt(NOW)
                .sourceBatchId(batchId)
                .build();
    }

    private static CostRecord credit(String batchId, String resourceId, long amount) {
        CostRecord record = usage(batchId, resourceId, amount);
        record.setRecordType(RecordType.CREDIT);
        return record;
    }

    private IngestionBatch commit(String batchId, CostRecord... records) {
        return costStore.commitBatch(new BatchCommit(batchId, CloudProvider.AWS, DAY, BatchStatus.COMMITTED,
                Arrays.asList(records), List.of(), 0, "cfg-1", null, NOW.minusSeconds(30)));
    }

    private long liveTotal() {
        return costStore.snapshot(CostFilter.all(), DAY).stream()
                .mapToLong(CostRecord::getAmountMinorUnits)
                .sum();
    }

    @Nested
    @DisplayName("Batch Replacement Tests")
    class BatchReplacementTests {

        @Test
        @DisplayName("Should leave the live total unchanged when a batch is committed twice")
        void shouldBeIdempotentOnRecommit() {
            // Given
            commit("AWS:a", usage("AWS:a", "i-web", 5_000), usage("AWS:a", "i-db", 900));

            // When
            IngestionBatch batch = commit("AWS:a", usage("AWS:a", "i-web", 5_000), usage("AWS:a", "i-db", 900));

            // Then
            assertThat(liveTotal()).isEqualTo(5_900L);
            assertThat(costRecordRepository.findBySourceBatchId("AWS:a")).hasSize(2);
            assertThat(batch.getRecordCount()).isEqualTo(2);
            assertThat(batch.getFinishedAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("Should supersede another batch's row and restore it when that batch drops the key")
        void shouldSupersedeAndRestore() {
            // Given
            commit("AWS:a", usage("AWS:a", "i-web", 5_000), usage("AWS:a", "i-db", 900));

            // When
            commit("AWS:b", usage("AWS:b", "i-web", 5_200));

            // Then
            assertThat(liveTotal()).isEqualTo(6_100L);
            assertThat(costRecordRepository.findBySupersededByBatchId("AWS:b"))
                    .singleElement()
                    .satisfies(old -> {
                        assertThat(old.getSourceBatchId()).isEqualTo("AWS:a");
                        assertThat(old.getResourceId()).isEqualTo("i-web");
                    });

            // When
            commit("AWS:b");

            // Then
            assertThat(liveTotal()).isEqualTo(5_900L);
            assertThat(costRecordRepository.findBySupersededByBatchId("AWS:b")).isEmpty();
            assertThat(costRecordRepository.findBySourceBatchId("AWS:b")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Record Type Tests")
    class RecordTypeTests {

        @Test
        @DisplayName("Should keep usage and a later credit for the same resource both live")
        void shouldKeepUsageAndCreditLive() {
            // Given
            commit("AWS:a", usage("AWS:a", "i-web", 5_000));

            // When
            commit("AWS:c", credit("AWS:c", "i-web", -1_000));

            // Then
            assertThat(liveTotal()).isEqualTo(4_000L);
            assertThat(costStore.snapshot(CostFilter.all(), DAY))
                    .extracting(CostRecord::getRecordType)
                    .containsExactlyInAnyOrder(RecordType.USAGE, RecordType.CREDIT);
        }

        @Test
        @DisplayName("Should keep usage and credit committed together in one batch")
        void shouldKeepUsageAndCreditInOneBatch() {
            // When
            commit("AWS:a", usage("AWS:a", "i-web", 5_000), credit("AWS:a", "i-web", -1_000));

            // Then
            assertThat(liveTotal()).isEqualTo(4_000L);
            assertThat(costRecordRepository.findBySourceBatchId("AWS:a")).hasSize(2);
        }
    }
}
