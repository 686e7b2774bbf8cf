package com.microsoft.finops.domain.repository;

import com.microsoft.finops.domain.model.CloudProvider;
import com.microsoft.finops.domain.model.CostRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface CostRecordRepository extends JpaRepository<CostRecord, Long> {

    /**
     * Live records whose period starts inside [from, to), in insertion order.
     */
    @Query("SELECT c FROM CostRecord c WHERE c.supersededByBatchId IS NULL " +
           "AND c.periodStart >= :from AND c.periodStart < :to " +
           "ORDER BY c.id ASC")
    List<CostRecord> findLiveStartingBetween(
            @Param("from") Instant from,
            @Param("to") Instant to
    );

    /**
     * Live records of one partition written by other batches and overlapping a window.
     * Candidates for supersession when a new batch commits.
     */
    @Query("SELECT c FROM CostRecord c WHERE c.supersededByBatchId IS NULL " +
           "AND c.cloud = :cloud AND c.accountId = :accountId " +
           "AND c.sourceBatchId <> :batchId " +
           "AND c.periodStart < :to AND c.periodEnd > :from")
    List<CostRecord> findLiveInPartitionFromOtherBatches(
            @Param("cloud") CloudProvider cloud,
            @Param("accountId") String accountId,
            @Param("batchId") String batchId,
            @Param("from") Instant from,
            @Param("to") Instant to
    );

    List<CostRecord> findBySourceBatchId(String sourceBatchId);

    List<CostRecord> findBySupersededByBatchId(String batchId);

    /**
     * Makes the records a batch superseded live again, before that batch is replaced.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE CostRecord c SET c.supersededByBatchId = NULL WHERE c.supersededByBatchId = :batchId")
    int releaseSupersededBy(@Param("batchId") String batchId);
}
