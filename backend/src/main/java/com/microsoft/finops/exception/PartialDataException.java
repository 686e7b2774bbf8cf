package com.microsoft.finops.exception;

import com.microsoft.finops.adapters.RawCostFact;
import com.microsoft.finops.domain.model.CloudProvider;

import java.util.List;

/**
 * The source returned a truncated but usable result, e.g. pagination cut short
 * by a quota. The facts that did arrive travel with the exception so the caller
 * can commit them and surface the truncation.
 */
public class PartialDataException extends SourceException {

    private final transient List<RawCostFact> partialFacts;

    public PartialDataException(CloudProvider cloud, String message, List<RawCostFact> partialFacts) {
        super(cloud, message);
        this.partialFacts = List.copyOf(partialFacts);
    }

    public List<RawCostFact> getPartialFacts() {
        return partialFacts;
    }
}
