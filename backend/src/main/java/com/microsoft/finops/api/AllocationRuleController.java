package com.microsoft.finops.api;

import com.microsoft.finops.allocation.AllocationResult;
import com.microsoft.finops.allocation.AllocationRuleService;
import com.microsoft.finops.allocation.AllocationRuleService.AllocationRuleRequest;
import com.microsoft.finops.domain.model.AllocationRule;
import com.microsoft.finops.domain.model.TimeWindow;
import com.microsoft.finops.export.CsvExportService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

/**
 * Chargeback rules and their evaluation.
 */
@RestController
@RequestMapping("/api/allocation-rules")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Allocation", description = "Chargeback and showback rules")
@SecurityRequirement(name = "bearer-jwt")
public class AllocationRuleController {

    private final AllocationRuleService allocationRuleService;
    private final CsvExportService csvExportService;

    @PostMapping
    @Operation(summary = "Create an allocation rule",
               description = "Rules are validated on save; shares must lie in (0, 1] and sum to 1")
    public ResponseEntity<AllocationRule> create(@Valid @RequestBody AllocationRuleRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(allocationRuleService.create(request));
    }

    @GetMapping
    @Operation(summary = "List allocation rules")
    public ResponseEntity<List<AllocationRule>> list() {
        return ResponseEntity.ok(allocationRuleService.list());
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get an allocation rule")
    public ResponseEntity<AllocationRule> get(@PathVariable Long id) {
        return ResponseEntity.ok(allocationRuleService.get(id));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete an allocation rule")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        allocationRuleService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/allocate")
    @Operation(summary = "Allocate spend",
               description = "Distributes the scoped total across the rule's dimension, with an Unallocated remainder")
    public ResponseEntity<AllocationResult> allocate(
            @PathVariable Long id,
            @RequestParam(defaultValue = "*") String scope,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        return ResponseEntity.ok(allocationRuleService.allocate(id, scope, TimeWindow.ofDays(from, to)));
    }

    @GetMapping("/{id}/allocate.csv")
    @Operation(summary = "Allocate spend as CSV")
    public ResponseEntity<String> allocateCsv(
            @PathVariable Long id,
            @RequestParam(defaultValue = "*") String scope,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        AllocationResult result = allocationRuleService.allocate(id, scope, TimeWindow.ofDays(from, to));
        return CostController.csv("allocation-" + id + ".csv", csvExportService.allocationCsv(result));
    }
}
