package com.microsoft.finops.api;

import com.microsoft.finops.domain.model.TimeWindow;
import com.microsoft.finops.governance.EvaluationReport;
import com.microsoft.finops.governance.GovernanceRuleEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

@RestController
@RequestMapping("/api/governance")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Governance", description = "Policy evaluation cycles")
@SecurityRequirement(name = "bearer-jwt")
public class GovernanceController {

    private final GovernanceRuleEngine governanceRuleEngine;

    /**
     * Without dates the configured trailing window is evaluated. Re-running a cycle
     * never duplicates violations.
     */
    @PostMapping("/evaluate")
    @Operation(summary = "Run a governance cycle")
    public ResponseEntity<EvaluationReport> evaluate(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        if (from == null && to == null) {
            return ResponseEntity.ok(governanceRuleEngine.evaluate());
        }
        if (from == null || to == null) {
            throw new IllegalArgumentException("Both from and to are required for an explicit window");
        }
        log.info("Manual governance cycle over {} .. {}", from, to);
        return ResponseEntity.ok(governanceRuleEngine.evaluate(TimeWindow.ofDays(from, to)));
    }
}
