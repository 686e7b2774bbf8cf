package com.microsoft.finops.api;

import com.microsoft.finops.domain.model.TimeWindow;
import com.microsoft.finops.governance.GovernanceRuleEngine;
import com.microsoft.finops.ingestion.CostIngestionService;
import com.microsoft.finops.ingestion.ReprocessReport;
import com.microsoft.finops.ingestion.SyncReport;
import com.microsoft.finops.ingestion.SyncStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

/**
 * Manual ingestion triggers and sync health.
 */
@RestController
@RequestMapping("/api/sync")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Sync", description = "Billing ingestion")
@SecurityRequirement(name = "bearer-jwt")
public class SyncController {

    private final CostIngestionService ingestionService;
    private final GovernanceRuleEngine governanceRuleEngine;

    @PostMapping
    @Operation(summary = "Sync every cloud for a date range",
               description = "Re-syncing a range replaces the batches previously committed for it")
    public ResponseEntity<SyncReport> sync(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(defaultValue = "false") boolean evaluate
    ) {
        log.info("Manual sync requested for {} .. {}", from, to);
        SyncReport report = ingestionService.sync(TimeWindow.ofDays(from, to));
        if (evaluate) {
            governanceRuleEngine.evaluate();
        }
        return ResponseEntity.ok(report);
    }

    @GetMapping("/status")
    @Operation(summary = "Last committed batch and last failure per cloud")
    public ResponseEntity<List<SyncStatus>> status() {
        return ResponseEntity.ok(ingestionService.status());
    }

    @PostMapping("/pending/reprocess")
    @Operation(summary = "Retry facts held for a missing currency rate")
    public ResponseEntity<ReprocessReport> reprocess() {
        return ResponseEntity.ok(ingestionService.reprocessPending());
    }
}
