package com.microsoft.finops.adapters;

import com.microsoft.finops.domain.model.CloudProvider;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * One billing line as the provider reports it.
 *
 * Field values are provider-native: serviceCode is e.g. "AmazonEC2" or
 * "Compute Engine", tag keys keep the provider's casing, amount is in major
 * units of the billed currency.
 *
 * @param lineItemType provider line type ("Usage", "Credit", "Refund", ...); null means usage
 */
public record RawCostFact(
        CloudProvider cloud,
        String accountId,
        String projectId,
        String serviceCode,
        String resourceId,
        String region,
        Map<String, String> tags,
        Instant usageStart,
        Instant usageEnd,
        BigDecimal amount,
        String currency,
        String lineItemType
) {
    public RawCostFact {
        tags = tags == null ? Map.of() : Map.copyOf(tags);
    }
}
