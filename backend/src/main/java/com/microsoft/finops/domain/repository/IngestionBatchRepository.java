package com.microsoft.finops.domain.repository;

import com.microsoft.finops.domain.model.CloudProvider;
import com.microsoft.finops.domain.model.IngestionBatch;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface IngestionBatchRepository extends JpaRepository<IngestionBatch, String> {

    /**
     * Most recent successful commit for a cloud.
     */
    Optional<IngestionBatch> findTopByCloudAndFinishedAtNotNullOrderByFinishedAtDesc(CloudProvider cloud);

    /**
     * Most recent failed attempt for a cloud.
     */
    Optional<IngestionBatch> findTopByCloudAndLastFailureAtNotNullOrderByLastFailureAtDesc(CloudProvider cloud);
}
