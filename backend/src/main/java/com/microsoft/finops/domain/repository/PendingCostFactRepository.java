package com.microsoft.finops.domain.repository;

import com.microsoft.finops.domain.model.CloudProvider;
import com.microsoft.finops.domain.model.PendingCostFact;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PendingCostFactRepository extends JpaRepository<PendingCostFact, Long> {

    List<PendingCostFact> findAllByOrderByIdAsc();

    List<PendingCostFact> findBySourceBatchIdOrderByIdAsc(String sourceBatchId);

    long countByCloud(CloudProvider cloud);

    @Modifying
    @Query("DELETE FROM PendingCostFact p WHERE p.sourceBatchId = :batchId")
    int deleteBySourceBatchId(@Param("batchId") String batchId);
}
