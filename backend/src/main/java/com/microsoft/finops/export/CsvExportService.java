package com.microsoft.finops.export;

import com.microsoft.finops.aggregation.AggregationResult;
import com.microsoft.finops.aggregation.GroupedTotal;
import com.microsoft.finops.allocation.AllocationEntry;
import com.microsoft.finops.allocation.AllocationResult;
import com.microsoft.finops.budget.BudgetStatus;
import com.microsoft.finops.domain.model.Money;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;

/**
 * Row-oriented CSV export of engine results.
 *
 * Column order is fixed per result type. Amounts are written in major units
 * next to a currency column; absent values (no trend, no forecast) are empty cells.
 */
@Service
@Slf4j
public class CsvExportService {

    static final String[] AGGREGATION_HEADER = {
            "group_by", "key", "amount", "currency", "pct_of_total",
            "trend_amount", "comparison_available", "record_count", "window_start", "window_end"
    };

    static final String[] BUDGET_HEADER = {
            "budget_id", "name", "scope", "period_start", "period_end", "as_of",
            "budget_amount", "consumed_amount", "currency", "consumed_pct", "expected_pct",
            "status", "forecast_amount", "variance_amount", "alert_triggered"
    };

    static final String[] ALLOCATION_HEADER = {
            "rule", "dimension", "method", "key", "amount", "currency", "pct_of_total",
            "window_start", "window_end"
    };

    public String aggregationCsv(AggregationResult result) {
        return render(writer -> writeAggregation(result, writer));
    }

    public String budgetCsv(List<BudgetStatus> statuses) {
        return render(writer -> writeBudgets(statuses, writer));
    }

    public String allocationCsv(AllocationResult result) {
        return render(writer -> writeAllocation(result, writer));
    }

    public void writeAggregation(AggregationResult result, Writer out) throws IOException {
        String currency = result.currency();
        try (CSVPrinter printer = printer(out, AGGREGATION_HEADER)) {
            for (GroupedTotal row : result.rows()) {
                printer.printRecord(
                        result.groupBy(),
                        row.key(),
                        major(row.amountMinorUnits(), currency),
                        currency,
                        row.pctOfTotal(),
                        row.trendMinorUnits() == null ? null : major(row.trendMinorUnits(), currency),
                        row.comparisonAvailable(),
                        row.recordCount(),
                        result.window().start(),
                        result.window().end());
            }
        }
        log.debug("Exported {} aggregation row(s)", result.rows().size());
    }

    public void writeBudgets(List<BudgetStatus> statuses, Writer out) throws IOException {
        try (CSVPrinter printer = printer(out, BUDGET_HEADER)) {
            for (BudgetStatus status : statuses) {
                String currency = status.currency();
                printer.printRecord(
                        status.budgetId(),
                        status.name(),
                        status.scope(),
                        status.periodStart(),
                        status.periodEnd(),
                        status.asOf(),
                        major(status.amountMinorUnits(), currency),
                        major(status.consumedMinorUnits(), currency),
                        currency,
                        status.consumedPct(),
                        status.expectedPct(),
                        status.status(),
                        status.forecastMinorUnits() == null ? null : major(status.forecastMinorUnits(), currency),
                        status.varianceMinorUnits() == null ? null : major(status.varianceMinorUnits(), currency),
                        status.alertTriggered());
            }
        }
    }

    public void writeAllocation(AllocationResult result, Writer out) throws IOException {
        String currency = result.currency();
        try (CSVPrinter printer = printer(out, ALLOCATION_HEADER)) {
            for (AllocationEntry entry : result.entries()) {
                printer.printRecord(
                        result.ruleName(),
                        result.dimension(),
                        result.method(),
                        entry.key(),
                        major(entry.amountMinorUnits(), currency),
                        currency,
                        entry.pctOfTotal(),
                        result.window().start(),
                        result.window().end());
            }
        }
    }

    private static CSVPrinter printer(Writer out, String[] header) throws IOException {
        return new CSVPrinter(out, CSVFormat.DEFAULT.builder()
                .setHeader(header)
                .setRecordSeparator("\n")
                .build());
    }

    private static String major(long minorUnits, String currency) {
        return Money.toMajorUnits(minorUnits, currency).toPlainString();
    }

    private static String render(CsvWriter body) {
        StringWriter writer = new StringWriter();
        try {
            body.write(writer);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render CSV export", e);
        }
        return writer.toString();
    }

    @FunctionalInterface
    private interface CsvWriter {
        void write(Writer writer) throws IOException;
    }
}
