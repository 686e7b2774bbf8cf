package com.microsoft.finops.ingestion;

import com.microsoft.finops.domain.model.TimeWindow;

import java.util.List;

public record SyncReport(TimeWindow window, List<CloudSyncResult> results) {

    public boolean allSucceeded() {
        return results.stream().allMatch(CloudSyncResult::succeeded);
    }
}
