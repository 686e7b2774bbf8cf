package com.microsoft.finops.ingestion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.microsoft.finops.adapters.CloudCostAdapter;
import com.microsoft.finops.adapters.RawCostFact;
import com.microsoft.finops.domain.model.BatchStatus;
import com.microsoft.finops.domain.model.CloudProvider;
import com.microsoft.finops.domain.model.CostRecord;
import com.microsoft.finops.domain.model.CostRecordKey;
import com.microsoft.finops.domain.model.IngestionBatch;
import com.microsoft.finops.domain.model.PendingCostFact;
import com.microsoft.finops.domain.model.TimeWindow;
import com.microsoft.finops.domain.repository.IngestionBatchRepository;
import com.microsoft.finops.domain.repository.PendingCostFactRepository;
import com.microsoft.finops.exception.NotFoundException;
import com.microsoft.finops.exception.PartialDataException;
import com.microsoft.finops.exception.SourceException;
import com.microsoft.finops.normalization.CostNormalizer;
import com.microsoft.finops.normalization.NormalizationConfig;
import com.microsoft.finops.normalization.NormalizationConfigProvider;
import com.microsoft.finops.normalization.NormalizationResult;
import com.microsoft.finops.store.BatchCommit;
import com.microsoft.finops.store.CostStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

/**
 * Orchestrates fetch, normalization and atomic commit of billing data.
 *
 * SYNC FLOW (per cloud, clouds in parallel):
 * 1. Fetch the window from the cloud's adapter
 * 2. Normalize with the current config snapshot
 * 3. Commit records and held facts as one batch
 *
 * The batch id is derived from (cloud, window), so syncing a window again is a
 * safe retry that replaces the earlier batch. A source failure leaves the last
 * committed data visible and is reported through {@link #status()}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CostIngestionService {

    private final Map<CloudProvider, CloudCostAdapter> costAdapters;
    private final CostNormalizer normalizer;
    private final NormalizationConfigProvider configProvider;
    private final CostStore costStore;
    private final IngestionBatchRepository batchRepository;
    private final PendingCostFactRepository pendingRepository;
    private final ObjectMapper objectMapper;
    private final ExecutorService ingestionExecutor;
    private final Clock clock;

    public static String batchId(CloudProvider cloud, TimeWindow window) {
        return cloud.name() + ":" + window.start() + ":" + window.end();
    }

    /**
     * Sync every registered cloud for the window, fetching in parallel.
     */
    public SyncReport sync(TimeWindow window) {
        log.info("Starting sync of {} cloud(s) for window {}", costAdapters.size(), window);

        List<CompletableFuture<CloudSyncResult>> futures = costAdapters.keySet().stream()
                .sorted()
                .map(cloud -> CompletableFuture
                        .supplyAsync(() -> syncCloud(cloud, window), ingestionExecutor)
                        .exceptionally(ex -> unexpectedFailure(cloud, window, ex)))
                .toList();

        List<CloudSyncResult> results = futures.stream().map(CompletableFuture::join).toList();
        SyncReport report = new SyncReport(window, results);
        log.info("Sync for {} finished: {}", window, results.stream()
                .map(r -> r.cloud() + "=" + r.status())
                .collect(Collectors.joining(", ")));
        return report;
    }

    public CloudSyncResult syncCloud(CloudProvider cloud, TimeWindow window) {
        CloudCostAdapter adapter = costAdapters.get(cloud);
        if (adapter == null) {
            throw new NotFoundException("Cost adapter", cloud);
        }

        Instant startedAt = clock.instant();
        String batchId = batchId(cloud, window);

        List<RawCostFact> facts;
        BatchStatus status = BatchStatus.COMMITTED;
        String message = null;
        try {
            facts = adapter.fetch(window);
        } catch (PartialDataException e) {
            log.warn("Partial data from {} for {}: {}", cloud, window, e.getMessage());
            facts = e.getPartialFacts();
            status = BatchStatus.PARTIAL;
            message = e.getMessage();
        } catch (SourceException e) {
            log.error("Sync of {} for {} failed, keeping previously committed data", cloud, window, e);
            costStore.recordFailure(batchId, cloud, window, e.getMessage(), startedAt);
            return CloudSyncResult.failed(cloud, batchId, e.getMessage());
        }

        NormalizationConfig config = configProvider.current();
        NormalizationResult result = normalizer.normalize(cloud, facts, config, batchId, startedAt);

        List<PendingCostFact> pending = result.held().stream()
                .map(held -> toPending(cloud, batchId, held, startedAt))
                .toList();

        costStore.commitBatch(new BatchCommit(
                batchId, cloud, window, status, result.records(), pending,
                result.issues().size(), config.version(), message, startedAt));

        return new CloudSyncResult(cloud, batchId, status, result.records().size(), pending.size(),
                result.issues().size(), result.totalMinorUnits(), message);
    }

    /**
     * Retry held facts against the current rate table. Recovered facts are appended
     * to the batch they were held from.
     */
    public ReprocessReport reprocessPending() {
        NormalizationConfig config = configProvider.current();
        Instant now = clock.instant();
        List<PendingCostFact> pending = pendingRepository.findAllByOrderByIdAsc();

        Map<String, List<PendingCostFact>> byBatch = pending.stream()
                .collect(Collectors.groupingBy(PendingCostFact::getSourceBatchId, LinkedHashMap::new, Collectors.toList()));

        int recovered = 0;
        int rejected = 0;
        int stillHeld = 0;

        for (Map.Entry<String, List<PendingCostFact>> entry : byBatch.entrySet()) {
            String batchId = entry.getKey();
            Map<CostRecordKey, CostRecord> records = new LinkedHashMap<>();
            List<Long> resolved = new ArrayList<>();
            List<PendingCostFact> retry = new ArrayList<>();

            for (PendingCostFact held : entry.getValue()) {
                Optional<RawCostFact> fact = fromPending(held);
                if (fact.isEmpty()) {
                    retry.add(held);
                    continue;
                }
                NormalizationResult result = normalizer.normalize(
                        held.getCloud(), List.of(fact.get()), config, batchId, now);
                if (!result.held().isEmpty()) {
                    retry.add(held);
                } else {
                    result.records().forEach(r -> records.put(r.naturalKey(), r));
                    if (result.records().isEmpty()) {
                        rejected++;
                    }
                    resolved.add(held.getId());
                }
            }

            if (!resolved.isEmpty()) {
                costStore.appendToBatch(batchId, new ArrayList<>(records.values()), resolved);
                recovered += records.size();
            }
            for (PendingCostFact held : retry) {
                held.setAttempts(held.getAttempts() + 1);
                held.setLastAttemptAt(now);
            }
            pendingRepository.saveAll(retry);
            stillHeld += retry.size();
        }

        log.info("Reprocessed {} held fact(s): {} recovered, {} rejected, {} still held",
                pending.size(), recovered, rejected, stillHeld);
        return new ReprocessReport(pending.size(), recovered, rejected, stillHeld);
    }

    public List<SyncStatus> status() {
        return costAdapters.keySet().stream()
                .sorted()
                .map(this::statusOf)
                .toList();
    }

    private SyncStatus statusOf(CloudProvider cloud) {
        Optional<IngestionBatch> committed = batchRepository.findTopByCloudAndFinishedAtNotNullOrderByFinishedAtDesc(cloud);
        Optional<IngestionBatch> failed = batchRepository.findTopByCloudAndLastFailureAtNotNullOrderByLastFailureAtDesc(cloud);

        Instant committedAt = committed.map(IngestionBatch::getFinishedAt).orElse(null);
        Instant failedAt = failed.map(IngestionBatch::getLastFailureAt).orElse(null);
        boolean lastSyncFailed = failedAt != null && (committedAt == null || failedAt.isAfter(committedAt));

        return new SyncStatus(
                cloud,
                committed.map(IngestionBatch::getBatchId).orElse(null),
                committed.map(IngestionBatch::getStatus).orElse(null),
                committedAt,
                failedAt,
                failed.map(IngestionBatch::getErrorMessage).orElse(null),
                lastSyncFailed,
                pendingRepository.countByCloud(cloud));
    }

    private CloudSyncResult unexpectedFailure(CloudProvider cloud, TimeWindow window, Throwable ex) {
        Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
        log.error("Unexpected error syncing {} for {}", cloud, window, cause);
        String batchId = batchId(cloud, window);
        costStore.recordFailure(batchId, cloud, window, String.valueOf(cause.getMessage()), clock.instant());
        return CloudSyncResult.failed(cloud, batchId, cause.getMessage());
    }

    private PendingCostFact toPending(CloudProvider cloud, String batchId,
                                      NormalizationResult.HeldFact held, Instant heldAt) {
        try {
            return PendingCostFact.builder()
                    .cloud(cloud)
                    .sourceBatchId(batchId)
                    .currency(held.fact().currency())
                    .payload(objectMapper.writeValueAsString(held.fact()))
                    .reason(held.reason())
                    .attempts(0)
                    .heldAt(heldAt)
                    .build();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize held cost fact for batch " + batchId, e);
        }
    }

    private Optional<RawCostFact> fromPending(PendingCostFact held) {
        try {
            return Optional.of(objectMapper.readValue(held.getPayload(), RawCostFact.class));
        } catch (JsonProcessingException e) {
            log.error("Held fact {} of batch {} has an unreadable payload", held.getId(), held.getSourceBatchId(), e);
            return Optional.empty();
        }
    }
}
