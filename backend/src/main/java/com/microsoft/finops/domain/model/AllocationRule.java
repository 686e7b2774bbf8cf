package com.microsoft.finops.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Chargeback model: how spend in a scope is attributed to teams or products.
 *
 * Only the parameters of the configured method are meaningful:
 * - TAG_BASED: tagKey (defaults to the dimension's canonical key)
 * - ACCOUNT_BASED: accountMappings, account id to team/product
 * - FIXED_PERCENTAGE: shares, team/product to fraction; must sum to 1
 */
@Entity
@Table(name = "allocation_rules", indexes = {
    @Index(name = "idx_allocation_rule_name", columnList = "name", unique = true)
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AllocationRule {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 128)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AllocationDimension dimension;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 24)
    private AllocationMethod method;

    @Column(nullable = false, length = 1024)
    @Builder.Default
    private String scope = "";

    @Column(length = 128)
    private String tagKey;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "allocation_account_mappings", joinColumns = @JoinColumn(name = "rule_id"))
    @MapKeyColumn(name = "account_id", length = 128)
    @Column(name = "target", length = 128)
    @Builder.Default
    private Map<String, String> accountMappings = new HashMap<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "allocation_shares", joinColumns = @JoinColumn(name = "rule_id"))
    @MapKeyColumn(name = "target", length = 128)
    @Column(name = "share", precision = 9, scale = 6)
    @Builder.Default
    private Map<String, BigDecimal> shares = new HashMap<>();

    @Column(nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    /**
     * Tag key this rule reads, falling back to the dimension default.
     */
    public String effectiveTagKey() {
        return tagKey == null || tagKey.isBlank() ? dimension.getCanonicalTagKey() : tagKey.toLowerCase(Locale.ROOT);
    }
}
