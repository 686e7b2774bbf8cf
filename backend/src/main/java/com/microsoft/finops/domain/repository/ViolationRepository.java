package com.microsoft.finops.domain.repository;

import com.microsoft.finops.domain.model.Severity;
import com.microsoft.finops.domain.model.Violation;
import com.microsoft.finops.domain.model.ViolationStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface ViolationRepository extends JpaRepository<Violation, Long> {

    /**
     * Whether any violation, open or resolved, exists for the pair in a window
     * overlapping [windowStart, windowEnd).
     */
    @Query("SELECT COUNT(v) > 0 FROM Violation v WHERE v.policyId = :policyId " +
           "AND v.subjectKey = :subjectKey " +
           "AND v.windowStart < :windowEnd AND v.windowEnd > :windowStart")
    boolean existsInWindow(
            @Param("policyId") Long policyId,
            @Param("subjectKey") String subjectKey,
            @Param("windowStart") Instant windowStart,
            @Param("windowEnd") Instant windowEnd
    );

    /**
     * Violation list with optional filters; null parameters match everything.
     */
    @Query("SELECT v FROM Violation v WHERE " +
           "(:policyId IS NULL OR v.policyId = :policyId) " +
           "AND (:status IS NULL OR v.status = :status) " +
           "AND (:severity IS NULL OR v.severity = :severity) " +
           "AND (:accountId IS NULL OR v.accountId = :accountId) " +
           "ORDER BY v.detectedAt DESC, v.id DESC")
    List<Violation> search(
            @Param("policyId") Long policyId,
            @Param("status") ViolationStatus status,
            @Param("severity") Severity severity,
            @Param("accountId") String accountId
    );
}
