package com.microsoft.finops.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * A spend limit over a scope and a recurring period.
 *
 * Consumption is never stored here; BudgetTracker derives it from live cost
 * records on every read.
 */
@Entity
@Table(name = "budgets", indexes = {
    @Index(name = "idx_budget_name", columnList = "name", unique = true)
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Budget {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 128)
    private String name;

    /**
     * Scope expression, e.g. "cloud=AWS; tag:team=backend". Empty means all spend.
     */
    @Column(nullable = false, length = 1024)
    private String scope;

    @Column(nullable = false)
    private long amountMinorUnits;

    @Column(nullable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private BudgetPeriod period;

    /**
     * First day of the first period. Later periods follow back to back.
     */
    @Column(nullable = false)
    private LocalDate anchorDate;

    /**
     * Consumed percentage at which an alert is raised (0-100).
     */
    @Column(nullable = false, precision = 5, scale = 2)
    private BigDecimal alertThresholdPct;

    @Column(nullable = false)
    private Instant createdAt;

    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (alertThresholdPct == null) {
            alertThresholdPct = BigDecimal.valueOf(80);
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
