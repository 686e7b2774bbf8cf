package com.microsoft.finops.adapters;

import com.microsoft.finops.domain.model.CloudProvider;
import com.microsoft.finops.domain.model.TimeWindow;

import java.util.List;

/**
 * Port interface for cloud billing ingestion.
 *
 * ADAPTER PATTERN:
 * Each cloud provider (or billing export format) implements this interface and
 * emits provider-native facts. Normalization into CostRecords happens downstream,
 * so an adapter never maps services, converts currencies or resolves tags.
 *
 * IMPLEMENTATION REQUIREMENTS:
 * 1. Idempotent: fetching the same window twice must produce facts that normalize
 *    to an identical set of records
 * 2. Truncated results are signalled with PartialDataException, never returned silently
 * 3. Log every call to the provider for audit
 */
public interface CloudCostAdapter {

    /**
     * Returns the cloud provider this adapter handles.
     */
    CloudProvider getProvider();

    /**
     * Fetch raw billing facts whose usage starts inside the window.
     *
     * @param window half-open UTC window
     * @return provider-native facts, never null
     * @throws com.microsoft.finops.exception.SourceUnavailableException provider or export unreachable
     * @throws com.microsoft.finops.exception.SourceAuthenticationException credentials rejected
     * @throws com.microsoft.finops.exception.PartialDataException result truncated, carries the facts that arrived
     */
    List<RawCostFact> fetch(TimeWindow window);

    /**
     * Validate that credentials are configured and valid.
     */
    boolean validateCredentials();
}
