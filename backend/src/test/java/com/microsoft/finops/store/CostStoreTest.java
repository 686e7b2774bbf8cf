package com.microsoft.finops.store;

import com.microsoft.finops.domain.model.BatchStatus;
import com.microsoft.finops.domain.model.CloudProvider;
import com.microsoft.finops.domain.model.CostRecord;
import com.microsoft.finops.domain.model.IngestionBatch;
import com.microsoft.finops.domain.model.RecordType;
import com.microsoft.finops.domain.model.TimeWindow;
import com.microsoft.finops.domain.repository.CostRecordRepository;
import com.microsoft.finops.domain.repository.IngestionBatchRepository;
import com.microsoft.finops.domain.repository.PendingCostFactRepository;
import com.microsoft.finops.scope.ScopeExpressionParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.AdditionalAnswers.returnsFirstArg;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for CostStore write and read semantics against mocked repositories.
 */
@ExtendWith(MockitoExtension.class)
class CostStoreTest {

    private static final Instant NOW = Instant.parse("2024-03-12T03:00:00Z");
    private static final TimeWindow DAY = TimeWindow.ofDay(LocalDate.of(2024, 3, 10));

    @Mock
    private CostRecordRepository costRecordRepository;

    @Mock
    private PendingCostFactRepository pendingCostFactRepository;

    @Mock
    private IngestionBatchRepository ingestionBatchRepository;

    @Mock
    private TransactionTemplate transactionTemplate;

    private CostStore costStore;

    @BeforeEach
    void setUp() {
        lenient().when(transactionTemplate.execute(any()))
                .thenAnswer(invocation -> invocation.<TransactionCallback<?>>getArgument(0).doInTransaction(null));
        costStore = new CostStore(costRecordRepository, pendingCostFactRepository, ingestionBatchRepository,
                new PartitionLocks(), transactionTemplate, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static CostRecord record(Long id, String batchId, String resourceId, long amount, Instant ingestedAt) {
        return CostRecord.builder()
                .id(id)
                .cloud(CloudProvider.AWS)
                .accountId("111111111111")
                .service("EC2")
                .resourceId(resourceId)
                .region("us-east-1")
                .tags(Map.of("team", "web"))
                .periodStart(DAY.start())
                .periodEnd(DAY.end())
                .recordType(RecordType.USAGE)
                .amountMinorUnits(amount)
                .currency("USD")
                .originalAmountMinorUnits(amount)
                .originalCurrency("USD")
                .ingestedAt(ingestedAt)
                .sourceBatchId(batchId)
                .build();
    }

    private static BatchCommit commit(String batchId, List<CostRecord> records) {
        return new BatchCommit(batchId, CloudProvider.AWS, DAY, BatchStatus.COMMITTED, records, List.of(),
                0, "cfg-1", null, NOW.minusSeconds(5));
    }

    @Nested
    @DisplayName("Commit Tests")
    class CommitTests {

        @Test
        @DisplayName("Should supersede a live record of another batch with the same natural key")
        void shouldSupersedeOtherBatch() {
            // Given
            CostRecord old = record(1L, "AWS:old", "i-web", 4_000, NOW.minusSeconds(86_400));
            CostRecord fresh = record(null, "AWS:new", "i-web", 4_200, NOW);
            when(costRecordRepository.findLiveInPartitionFromOtherBatches(
                    eq(CloudProvider.AWS), eq("111111111111"), eq("AWS:new"), eq(DAY.start()), eq(DAY.end())))
                    .thenReturn(List.of(old));
            when(ingestionBatchRepository.findById("AWS:new")).thenReturn(Optional.empty());
            when(ingestionBatchRepository.save(any())).then(returnsFirstArg());

            // When
            IngestionBatch batch = costStore.commitBatch(commit("AWS:new", List.of(fresh)));

            // Then
            assertThat(old.getSupersededByBatchId()).isEqualTo("AWS:new");
            assertThat(fresh.isLive()).isTrue();
            verify(costRecordRepository).saveAll(List.of(old));
            verify(costRecordRepository).saveAll(List.of(fresh));
            assertThat(batch.getStatus()).isEqualTo(BatchStatus.COMMITTED);
            assertThat(batch.getRecordCount()).isEqualTo(1);
            assertThat(batch.getConfigVersion()).isEqualTo("cfg-1");
            assertThat(batch.getFinishedAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("Should leave usage live when another batch commits a credit for the same resource")
        void shouldNotSupersedeUsageWithCredit() {
            // Given
            CostRecord usage = record(1L, "AWS:old", "i-web", 5_000, NOW.minusSeconds(86_400));
            CostRecord credit = record(null, "AWS:new", "i-web", -1_000, NOW);
            credit.setRecordType(RecordType.CREDIT);
            when(costRecordRepository.findLiveInPartitionFromOtherBatches(
                    eq(CloudProvider.AWS), eq("111111111111"), eq("AWS:new"), eq(DAY.start()), eq(DAY.end())))
                    .thenReturn(List.of(usage));
            when(ingestionBatchRepository.findById("AWS:new")).thenReturn(Optional.empty());
            when(ingestionBatchRepository.save(any())).then(returnsFirstArg());

            // When
            costStore.commitBatch(commit("AWS:new", List.of(credit)));

            // Then
            assertThat(usage.isLive()).isTrue();
            verify(costRecordRepository, never()).saveAll(List.of(usage));
            verify(costRecordRepository).saveAll(List.of(credit));
        }

        @Test
        @DisplayName("Should replace the rows of a re-committed batch and release what it superseded")
        void shouldReplaceRecommittedBatch() {
            // Given
            CostRecord previous = record(5L, "AWS:b", "i-web", 4_000, NOW.minusSeconds(60));
            CostRecord released = record(2L, "AWS:a", "i-db", 900, NOW.minusSeconds(86_400));
            CostRecord replacement = record(null, "AWS:b", "i-web", 4_100, NOW);
            when(costRecordRepository.findBySourceBatchId("AWS:b")).thenReturn(List.of(previous));
            when(costRecordRepository.findBySupersededByBatchId("AWS:b")).thenReturn(List.of(released));
            when(ingestionBatchRepository.findById("AWS:b"))
                    .thenReturn(Optional.of(IngestionBatch.builder().batchId("AWS:b").build()));
            when(ingestionBatchRepository.save(any())).then(returnsFirstArg());

            // When
            costStore.commitBatch(commit("AWS:b", List.of(replacement)));

            // Then
            verify(costRecordRepository).deleteAll(List.of(previous));
            verify(costRecordRepository).releaseSupersededBy("AWS:b");
            verify(pendingCostFactRepository).deleteBySourceBatchId("AWS:b");
            verify(costRecordRepository).saveAll(List.of(replacement));
        }

        @Test
        @DisplayName("Should keep only the newest live row when a restore leaves two for one key")
        void shouldSettleRestoredDuplicates() {
            // Given - the re-committed batch no longer carries i-db, two older rows come back to life
            CostRecord older = record(2L, "AWS:a", "i-db", 900, NOW.minusSeconds(172_800));
            CostRecord newer = record(3L, "AWS:c", "i-db", 950, NOW.minusSeconds(86_400));
            when(costRecordRepository.findBySupersededByBatchId("AWS:b")).thenReturn(List.of(older));
            when(costRecordRepository.findLiveInPartitionFromOtherBatches(
                    eq(CloudProvider.AWS), eq("111111111111"), eq("AWS:b"), any(), any()))
                    .thenReturn(List.of(older, newer));
            when(ingestionBatchRepository.findById("AWS:b")).thenReturn(Optional.empty());
            when(ingestionBatchRepository.save(any())).then(returnsFirstArg());

            // When
            costStore.commitBatch(commit("AWS:b", List.of()));

            // Then
            assertThat(older.getSupersededByBatchId()).isEqualTo("AWS:c");
            assertThat(newer.isLive()).isTrue();
        }
    }

    @Nested
    @DisplayName("Failure Tests")
    class FailureTests {

        @Test
        @DisplayName("Should create a FAILED batch when the window never committed")
        void shouldCreateFailedBatch() {
            when(ingestionBatchRepository.findById("AWS:x")).thenReturn(Optional.empty());
            when(ingestionBatchRepository.save(any())).then(returnsFirstArg());

            IngestionBatch batch = costStore.recordFailure("AWS:x", CloudProvider.AWS, DAY, "throttled", NOW);

            assertThat(batch.getStatus()).isEqualTo(BatchStatus.FAILED);
            assertThat(batch.getLastFailureAt()).isEqualTo(NOW);
            assertThat(batch.getErrorMessage()).isEqualTo("throttled");
            verify(costRecordRepository, never()).deleteAll(anyList());
        }

        @Test
        @DisplayName("Should keep a committed batch visible after a failed retry")
        void shouldKeepCommittedBatchOnFailure() {
            IngestionBatch committed = IngestionBatch.builder()
                    .batchId("AWS:x")
                    .status(BatchStatus.COMMITTED)
                    .finishedAt(NOW.minusSeconds(3_600))
                    .build();
            when(ingestionBatchRepository.findById("AWS:x")).thenReturn(Optional.of(committed));
            when(ingestionBatchRepository.save(any())).then(returnsFirstArg());

            IngestionBatch batch = costStore.recordFailure("AWS:x", CloudProvider.AWS, DAY, "x".repeat(2_000), NOW);

            assertThat(batch.getStatus()).isEqualTo(BatchStatus.COMMITTED);
            assertThat(batch.getLastFailureAt()).isEqualTo(NOW);
            assertThat(batch.getErrorMessage()).hasSize(1_024).endsWith("...");
        }
    }

    @Test
    @DisplayName("Should filter live records by scope on read")
    void shouldFilterSnapshot() {
        CostRecord web = record(1L, "AWS:a", "i-web", 100, NOW);
        CostRecord db = record(2L, "AWS:a", "i-db", 200, NOW);
        db.setRegion("eu-west-1");
        when(costRecordRepository.findLiveStartingBetween(DAY.start(), DAY.end())).thenReturn(List.of(web, db));

        assertThat(costStore.snapshot(ScopeExpressionParser.parse("region=eu-west-1"), DAY)).containsExactly(db);
    }
}
