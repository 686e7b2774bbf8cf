package com.microsoft.finops.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * A (policy, subject) pair that satisfied a policy predicate during an evaluation window.
 *
 * The subject key is "resource:&lt;cloud&gt;:&lt;id&gt;", or "account:&lt;cloud&gt;:&lt;id&gt;" for
 * spend without line-item resources. The unique constraint makes a retried evaluation cycle idempotent.
 */
@Entity
@Table(name = "violations",
    uniqueConstraints = @UniqueConstraint(
        name = "uk_violation_policy_subject_window",
        columnNames = {"policyId", "subjectKey", "windowStart"}),
    indexes = {
        @Index(name = "idx_violation_status", columnList = "status"),
        @Index(name = "idx_violation_account", columnList = "accountId")
    })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Violation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long policyId;

    @Column(nullable = false, length = 128)
    private String policyName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Severity severity;

    @Column(nullable = false, length = 640)
    private String subjectKey;

    @Column(length = 512)
    private String resourceId;

    @Column(nullable = false, length = 128)
    private String accountId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private CloudProvider cloud;

    @Column(length = 64)
    private String region;

    @Column(nullable = false)
    private Instant detectedAt;

    @Column(nullable = false)
    private Instant windowStart;

    @Column(nullable = false)
    private Instant windowEnd;

    /**
     * Why the subject violates the policy, as found by the engine.
     */
    @Column(length = 1024)
    private String detail;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ViolationStatus status;

    @Column(length = 128)
    private String actionedBy;

    private Instant actionedAt;

    /**
     * Comment left with the approve/reject action.
     */
    @Column(length = 1024)
    private String note;
}
