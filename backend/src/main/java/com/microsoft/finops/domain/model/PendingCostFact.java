package com.microsoft.finops.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Raw cost fact held back because no exchange rate was in effect for its period.
 *
 * Held facts are never discarded; they are retried once rates are configured.
 */
@Entity
@Table(name = "pending_cost_facts", indexes = {
    @Index(name = "idx_pending_cloud", columnList = "cloud")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PendingCostFact {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private CloudProvider cloud;

    @Column(nullable = false, length = 128)
    private String sourceBatchId;

    @Column(nullable = false, length = 3)
    private String currency;

    /**
     * RawCostFact serialized as JSON.
     */
    @Lob
    @Column(nullable = false)
    private String payload;

    @Column(length = 512)
    private String reason;

    private int attempts;

    @Column(nullable = false)
    private Instant heldAt;

    private Instant lastAttemptAt;
}
