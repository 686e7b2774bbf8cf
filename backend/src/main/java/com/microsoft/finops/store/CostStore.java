package com.microsoft.finops.store;

import com.microsoft.finops.domain.model.BatchStatus;
import com.microsoft.finops.domain.model.CloudProvider;
import com.microsoft.finops.domain.model.CostRecord;
import com.microsoft.finops.domain.model.CostRecordKey;
import com.microsoft.finops.domain.model.IngestionBatch;
import com.microsoft.finops.domain.model.TimeWindow;
import com.microsoft.finops.domain.repository.CostRecordRepository;
import com.microsoft.finops.domain.repository.IngestionBatchRepository;
import com.microsoft.finops.domain.repository.PendingCostFactRepository;
import com.microsoft.finops.scope.CostFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Canonical cost store: the only writer of cost records.
 *
 * WRITE MODEL:
 * - A batch commits all-or-nothing in one transaction, so readers never see part of it
 * - Re-committing a batch id replaces that batch's rows; records it had superseded
 *   become live again unless another batch still covers their key
 * - A record from a different batch with the same natural key supersedes the live
 *   one (supersededByBatchId is stamped), keeping the replaced row for audit
 * - Writers serialize on the batch id, then on every (cloud, account) partition they touch
 *
 * Reads return live records only and never lock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CostStore {

    private static final String BATCH_LOCK_PREFIX = "batch:";

    private final CostRecordRepository costRecordRepository;
    private final PendingCostFactRepository pendingCostFactRepository;
    private final IngestionBatchRepository ingestionBatchRepository;
    private final PartitionLocks partitionLocks;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    /**
     * Atomically replace the contents of a batch.
     */
    public IngestionBatch commitBatch(BatchCommit commit) {
        String batchId = commit.batchId();
        return partitionLocks.withLocks(List.of(BATCH_LOCK_PREFIX + batchId), () -> {
            Set<String> partitions = partitionsOf(commit.records());
            partitions.addAll(partitionsOf(costRecordRepository.findBySourceBatchId(batchId)));
            partitions.addAll(partitionsOf(costRecordRepository.findBySupersededByBatchId(batchId)));

            IngestionBatch batch = partitionLocks.withLocks(partitions,
                    () -> transactionTemplate.execute(status -> replaceBatch(commit)));

            log.info("Committed batch {} ({}): {} record(s), {} pending, {} issue(s)",
                    batchId, commit.status(), commit.records().size(), commit.pending().size(), commit.issueCount());
            return batch;
        });
    }

    /**
     * Note a failed attempt. Records committed by an earlier attempt stay live.
     */
    public IngestionBatch recordFailure(String batchId, CloudProvider cloud, TimeWindow window,
                                        String message, Instant startedAt) {
        return partitionLocks.withLocks(List.of(BATCH_LOCK_PREFIX + batchId), () ->
                transactionTemplate.execute(status -> {
                    Instant now = clock.instant();
                    IngestionBatch batch = ingestionBatchRepository.findById(batchId)
                            .orElseGet(() -> IngestionBatch.builder()
                                    .batchId(batchId)
                                    .cloud(cloud)
                                    .windowStart(window.start())
                                    .windowEnd(window.end())
                                    .status(BatchStatus.FAILED)
                                    .startedAt(startedAt)
                                    .build());
                    batch.setErrorMessage(truncate(message));
                    batch.setLastFailureAt(now);
                    return ingestionBatchRepository.save(batch);
                }));
    }

    /**
     * Add records recovered from held facts to an existing batch and drop the
     * pending rows they came from.
     */
    public int appendToBatch(String batchId, List<CostRecord> records, Collection<Long> resolvedPendingIds) {
        return partitionLocks.withLocks(List.of(BATCH_LOCK_PREFIX + batchId), () ->
                partitionLocks.withLocks(partitionsOf(records), () -> transactionTemplate.execute(status -> {
                    Set<CostRecordKey> keys = records.stream().map(CostRecord::naturalKey).collect(Collectors.toSet());
                    List<CostRecord> sameBatch = costRecordRepository.findBySourceBatchId(batchId).stream()
                            .filter(r -> keys.contains(r.naturalKey()))
                            .toList();
                    costRecordRepository.deleteAll(sameBatch);
                    costRecordRepository.flush();

                    supersedeAndSave(batchId, records, List.of());
                    pendingCostFactRepository.deleteAllById(resolvedPendingIds);

                    ingestionBatchRepository.findById(batchId).ifPresent(batch -> {
                        batch.setRecordCount(batch.getRecordCount() + records.size() - sameBatch.size());
                        batch.setPendingCount(Math.max(0, batch.getPendingCount() - resolvedPendingIds.size()));
                        ingestionBatchRepository.save(batch);
                    });
                    log.info("Appended {} recovered record(s) to batch {}", records.size(), batchId);
                    return records.size();
                })));
    }

    /**
     * Live records whose period starts inside the window and that match the filter.
     * Ordered by id, so repeated reads of an unchanged store are identical.
     */
    @Transactional(readOnly = true)
    public List<CostRecord> snapshot(CostFilter filter, TimeWindow window) {
        return costRecordRepository.findLiveStartingBetween(window.start(), window.end()).stream()
                .filter(filter::matches)
                .toList();
    }

    private IngestionBatch replaceBatch(BatchCommit commit) {
        String batchId = commit.batchId();

        List<CostRecord> previous = costRecordRepository.findBySourceBatchId(batchId);
        if (!previous.isEmpty()) {
            log.info("Replacing {} record(s) previously committed by batch {}", previous.size(), batchId);
            costRecordRepository.deleteAll(previous);
            costRecordRepository.flush();
        }
        List<CostRecord> restored = costRecordRepository.findBySupersededByBatchId(batchId);
        if (!restored.isEmpty()) {
            costRecordRepository.releaseSupersededBy(batchId);
        }

        supersedeAndSave(batchId, commit.records(), restored);

        pendingCostFactRepository.deleteBySourceBatchId(batchId);
        pendingCostFactRepository.saveAll(commit.pending());

        IngestionBatch batch = ingestionBatchRepository.findById(batchId)
                .orElseGet(() -> IngestionBatch.builder().batchId(batchId).build());
        batch.setCloud(commit.cloud());
        batch.setWindowStart(commit.window().start());
        batch.setWindowEnd(commit.window().end());
        batch.setStatus(commit.status());
        batch.setRecordCount(commit.records().size());
        batch.setPendingCount(commit.pending().size());
        batch.setIssueCount(commit.issueCount());
        batch.setConfigVersion(commit.configVersion());
        batch.setErrorMessage(truncate(commit.message()));
        batch.setStartedAt(commit.startedAt());
        batch.setFinishedAt(clock.instant());
        return ingestionBatchRepository.save(batch);
    }

    /**
     * Supersede live rows of other batches sharing a key with the new records, settle
     * keys left with more than one live row after a restore, then insert.
     */
    private void supersedeAndSave(String batchId, List<CostRecord> records, List<CostRecord> restored) {
        List<CostRecord> touched = new ArrayList<>(records);
        touched.addAll(restored);
        if (touched.isEmpty()) {
            return;
        }
        Instant from = touched.stream().map(CostRecord::getPeriodStart).min(Comparator.naturalOrder()).orElseThrow();
        Instant to = touched.stream().map(CostRecord::getPeriodEnd).max(Comparator.naturalOrder()).orElseThrow();
        Set<CostRecordKey> newKeys = records.stream().map(CostRecord::naturalKey).collect(Collectors.toSet());

        Map<String, List<CostRecord>> byPartition = touched.stream()
                .collect(Collectors.groupingBy(r -> r.naturalKey().partition(), LinkedHashMap::new, Collectors.toList()));

        List<CostRecord> changed = new ArrayList<>();
        for (List<CostRecord> partitionRecords : byPartition.values()) {
            CostRecord sample = partitionRecords.get(0);
            Map<CostRecordKey, List<CostRecord>> liveByKey = costRecordRepository
                    .findLiveInPartitionFromOtherBatches(sample.getCloud(), sample.getAccountId(), batchId, from, to)
                    .stream()
                    .collect(Collectors.groupingBy(CostRecord::naturalKey));

            liveByKey.forEach((key, live) -> {
                if (newKeys.contains(key)) {
                    live.forEach(r -> r.setSupersededByBatchId(batchId));
                    changed.addAll(live);
                } else if (live.size() > 1) {
                    CostRecord newest = live.stream()
                            .max(Comparator.comparing(CostRecord::getIngestedAt).thenComparing(CostRecord::getId))
                            .orElseThrow();
                    live.stream().filter(r -> r != newest).forEach(r -> {
                        r.setSupersededByBatchId(newest.getSourceBatchId());
                        changed.add(r);
                    });
                }
            });
        }

        if (!changed.isEmpty()) {
            log.debug("Batch {} supersedes {} record(s)", batchId, changed.size());
            costRecordRepository.saveAll(changed);
        }
        costRecordRepository.saveAll(records);
    }

    private static Set<String> partitionsOf(List<CostRecord> records) {
        Set<String> partitions = new HashSet<>();
        records.forEach(r -> partitions.add(r.naturalKey().partition()));
        return partitions;
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= 1024) {
            return message;
        }
        return message.substring(0, 1021) + "...";
    }
}
