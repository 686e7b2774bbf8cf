package com.microsoft.finops.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Normalized cost record - the core abstraction for cloud-agnostic spend analysis.
 *
 * DESIGN RATIONALE:
 * This entity is the "lingua franca" of multi-cloud billing data.
 * Every provider-specific billing line is transformed into this schema before
 * aggregation, budgeting, chargeback or governance sees it.
 *
 * MONEY:
 * Amounts are integer minor units of the organization currency. The amount the
 * provider billed is kept alongside for audit.
 *
 * IMMUTABILITY NOTE:
 * Cost records are append-only per ingestion batch. A later batch carrying the same
 * natural key supersedes a record (supersededByBatchId is set); the row itself is
 * never edited otherwise. Re-committing the same batch replaces its rows wholesale.
 */
@Entity
@Table(name = "cost_records", indexes = {
    @Index(name = "idx_cost_record_partition", columnList = "cloud, accountId"),
    @Index(name = "idx_cost_record_period", columnList = "periodStart"),
    @Index(name = "idx_cost_record_batch", columnList = "sourceBatchId"),
    @Index(name = "idx_cost_record_resource", columnList = "resourceId")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class CostRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private CloudProvider cloud;

    /**
     * Provider-scoped billing account.
     * - AWS: 12-digit account id
     * - Azure: subscription id
     * - GCP: billing account id
     */
    @Column(nullable = false, length = 128)
    private String accountId;

    /**
     * Optional project (GCP project, Azure resource group, AWS linked sub-scope).
     */
    @Column(length = 128)
    private String projectId;

    /**
     * Canonical service name from the service catalog, "Other" when unmapped.
     */
    @Column(nullable = false, length = 128)
    private String service;

    /**
     * False when the provider service code had no catalog entry.
     */
    @Column(nullable = false)
    private boolean serviceMapped;

    @Column(length = 512)
    private String resourceId;

    /**
     * Canonical region, see RegionNormalizer.
     */
    @Column(length = 64)
    private String region;

    /**
     * Tags with lower-cased keys. Canonical keys (team, product, ...) are resolved
     * from provider aliases during normalization.
     */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "cost_record_tags", joinColumns = @JoinColumn(name = "cost_record_id"))
    @MapKeyColumn(name = "tag_key", length = 128)
    @Column(name = "tag_value", length = 256)
    @Builder.Default
    private Map<String, String> tags = new HashMap<>();

    /**
     * Half-open interval [periodStart, periodEnd), UTC.
     */
    @Column(nullable = false)
    private Instant periodStart;

    @Column(nullable = false)
    private Instant periodEnd;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private RecordType recordType;

    /**
     * Amount in minor units of the organization currency.
     */
    @Column(nullable = false)
    private long amountMinorUnits;

    @Column(nullable = false, length = 3)
    private String currency;

    /**
     * Amount as billed, in minor units of originalCurrency.
     */
    @Column(nullable = false)
    private long originalAmountMinorUnits;

    @Column(nullable = false, length = 3)
    private String originalCurrency;

    @Column(nullable = false)
    private Instant ingestedAt;

    @Column(nullable = false, length = 128)
    private String sourceBatchId;

    /**
     * Batch that replaced this record, null while the record is live.
     */
    @Column(length = 128)
    private String supersededByBatchId;

    @PrePersist
    protected void onCreate() {
        if (ingestedAt == null) {
            ingestedAt = Instant.now();
        }
    }

    public boolean isLive() {
        return supersededByBatchId == null;
    }

    public String tag(String key) {
        return tags == null ? null : tags.get(key);
    }

    /**
     * Natural key without the batch id. Two live records never share it.
     */
    public CostRecordKey naturalKey() {
        return new CostRecordKey(cloud, accountId, service, resourceId, periodStart, periodEnd, recordType);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CostRecord that = (CostRecord) o;
        return cloud == that.cloud &&
               Objects.equals(accountId, that.accountId) &&
               Objects.equals(service, that.service) &&
               Objects.equals(resourceId, that.resourceId) &&
               Objects.equals(periodStart, that.periodStart) &&
               Objects.equals(periodEnd, that.periodEnd) &&
               recordType == that.recordType &&
               Objects.equals(sourceBatchId, that.sourceBatchId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cloud, accountId, service, resourceId, periodStart, periodEnd, recordType, sourceBatchId);
    }
}
