package com.microsoft.finops.ingestion;

/**
 * @param examined  held facts looked at
 * @param recovered facts converted and appended to their batch
 * @param rejected  facts dropped because they no longer pass validation
 * @param stillHeld facts still waiting for a rate
 */
public record ReprocessReport(int examined, int recovered, int rejected, int stillHeld) {
}
