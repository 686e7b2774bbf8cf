package com.microsoft.finops.api;

import com.microsoft.finops.budget.BudgetService;
import com.microsoft.finops.budget.BudgetService.BudgetRequest;
import com.microsoft.finops.budget.BudgetStatus;
import com.microsoft.finops.domain.model.Budget;
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

@RestController
@RequestMapping("/api/budgets")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Budgets", description = "Budget configuration and burn-down status")
@SecurityRequirement(name = "bearer-jwt")
public class BudgetController {

    private final BudgetService budgetService;
    private final CsvExportService csvExportService;

    @PostMapping
    @Operation(summary = "Create a budget")
    public ResponseEntity<Budget> create(@Valid @RequestBody BudgetRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(budgetService.create(request));
    }

    @GetMapping
    @Operation(summary = "List budgets")
    public ResponseEntity<List<Budget>> list() {
        return ResponseEntity.ok(budgetService.list());
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get a budget")
    public ResponseEntity<Budget> get(@PathVariable Long id) {
        return ResponseEntity.ok(budgetService.get(id));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update a budget")
    public ResponseEntity<Budget> update(@PathVariable Long id, @Valid @RequestBody BudgetRequest request) {
        return ResponseEntity.ok(budgetService.update(id, request));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a budget")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        budgetService.delete(id);
        return ResponseEntity.noContent().build();
    }

    /**
     * Status is computed on read; {@code asOf} defaults to today (UTC).
     */
    @GetMapping("/{id}/status")
    @Operation(summary = "Budget status",
               description = "Consumed amount, pace, linear forecast and health as of a date")
    public ResponseEntity<BudgetStatus> status(
            @PathVariable Long id,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf
    ) {
        return ResponseEntity.ok(budgetService.status(id, asOf));
    }

    @GetMapping("/status")
    @Operation(summary = "Status of every budget")
    public ResponseEntity<List<BudgetStatus>> statusAll(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf
    ) {
        return ResponseEntity.ok(budgetService.statusAll(asOf));
    }

    @GetMapping("/status.csv")
    @Operation(summary = "Status of every budget as CSV")
    public ResponseEntity<String> statusAllCsv(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf
    ) {
        return CostController.csv("budgets.csv", csvExportService.budgetCsv(budgetService.statusAll(asOf)));
    }
}
