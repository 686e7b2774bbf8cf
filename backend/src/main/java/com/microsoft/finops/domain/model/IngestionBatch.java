package com.microsoft.finops.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Provenance and status of the ingestion batch for one (cloud, window).
 *
 * The batch id is deterministic for (cloud, window), so a retry of the same window
 * reuses the row and replaces the records it committed earlier. A failed retry
 * only stamps lastFailureAt/errorMessage; the committed status and records stay.
 */
@Entity
@Table(name = "ingestion_batches", indexes = {
    @Index(name = "idx_batch_cloud_finished", columnList = "cloud, finishedAt"),
    @Index(name = "idx_batch_cloud_failure", columnList = "cloud, lastFailureAt")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IngestionBatch {

    @Id
    @Column(length = 128)
    private String batchId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private CloudProvider cloud;

    @Column(nullable = false)
    private Instant windowStart;

    @Column(nullable = false)
    private Instant windowEnd;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private BatchStatus status;

    private int recordCount;

    private int pendingCount;

    private int issueCount;

    /**
     * Version of the normalization config snapshot used for this batch.
     */
    @Column(length = 64)
    private String configVersion;

    @Column(length = 1024)
    private String errorMessage;

    @Column(nullable = false)
    private Instant startedAt;

    /**
     * When records were last committed, null if the window never committed.
     */
    private Instant finishedAt;

    private Instant lastFailureAt;
}
