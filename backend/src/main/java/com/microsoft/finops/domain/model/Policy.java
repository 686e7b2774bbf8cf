package com.microsoft.finops.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Declarative governance policy.
 *
 * The rule is expressed by type plus parameters and compiled into a predicate
 * by PolicyCompiler when the policy is saved. A policy that does not compile is
 * never persisted.
 */
@Entity
@Table(name = "policies", indexes = {
    @Index(name = "idx_policy_name", columnList = "name", unique = true)
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Policy {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 128)
    private String name;

    @Column(length = 512)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private PolicyType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Severity severity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private PolicyStatus status;

    /**
     * Restricts which cost records the policy looks at. Empty means all.
     */
    @Column(nullable = false, length = 1024)
    @Builder.Default
    private String scope = "";

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "policy_parameters", joinColumns = @JoinColumn(name = "policy_id"))
    @MapKeyColumn(name = "param_key", length = 64)
    @Column(name = "param_value", length = 1024)
    @Builder.Default
    private Map<String, String> parameters = new HashMap<>();

    /**
     * Remediation hint shown next to violations.
     */
    @Column(length = 512)
    private String actionHint;

    @Column(nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (status == null) {
            status = PolicyStatus.ACTIVE;
        }
    }

    public boolean isActive() {
        return status == PolicyStatus.ACTIVE;
    }
}
