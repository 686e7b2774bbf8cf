package com.microsoft.finops.api;

import com.microsoft.finops.aggregation.AggregationEngine;
import com.microsoft.finops.aggregation.AggregationResult;
import com.microsoft.finops.aggregation.GroupBy;
import com.microsoft.finops.domain.model.TimeWindow;
import com.microsoft.finops.export.CsvExportService;
import com.microsoft.finops.scope.ScopeExpressionParser;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

/**
 * Spend explorer endpoints.
 *
 * Dates are whole UTC days: {@code from} inclusive, {@code to} exclusive.
 */
@RestController
@RequestMapping("/api/costs")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Costs", description = "Grouped spend over a date range")
@SecurityRequirement(name = "bearer-jwt")
public class CostController {

    static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");

    private final AggregationEngine aggregationEngine;
    private final CsvExportService csvExportService;

    @GetMapping("/aggregate")
    @Operation(summary = "Aggregate spend",
               description = "Groups live cost records matching the scope by one dimension or time bucket")
    public ResponseEntity<AggregationResult> aggregate(
            @RequestParam(defaultValue = "*") String scope,
            @RequestParam(defaultValue = "service") String groupBy,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        return ResponseEntity.ok(run(scope, groupBy, from, to));
    }

    @GetMapping("/aggregate.csv")
    @Operation(summary = "Aggregate spend as CSV")
    public ResponseEntity<String> aggregateCsv(
            @RequestParam(defaultValue = "*") String scope,
            @RequestParam(defaultValue = "service") String groupBy,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        AggregationResult result = run(scope, groupBy, from, to);
        return csv("spend-" + result.groupBy().name().toLowerCase(java.util.Locale.ROOT) + ".csv",
                csvExportService.aggregationCsv(result));
    }

    private AggregationResult run(String scope, String groupBy, LocalDate from, LocalDate to) {
        log.debug("Aggregate request: scope={}, groupBy={}, from={}, to={}", scope, groupBy, from, to);
        return aggregationEngine.aggregate(
                ScopeExpressionParser.parse(scope), GroupBy.fromCode(groupBy), TimeWindow.ofDays(from, to));
    }

    static ResponseEntity<String> csv(String filename, String body) {
        return ResponseEntity.ok()
                .contentType(TEXT_CSV)
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
                .body(body);
    }
}
