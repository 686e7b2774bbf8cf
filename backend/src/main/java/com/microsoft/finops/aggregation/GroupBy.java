package com.microsoft.finops.aggregation;

import com.microsoft.finops.domain.model.CostRecord;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.Locale;
import java.util.function.Function;

/**
 * Dimensions the aggregation engine can group by.
 *
 * Time groupings produce ISO keys ("2024-03-01", "2024-03") that sort chronologically.
 */
public enum GroupBy {
    ACCOUNT(CostRecord::getAccountId),
    PROJECT(CostRecord::getProjectId),
    TEAM_TAG(r -> r.tag("team")),
    PRODUCT_TAG(r -> r.tag("product")),
    ENVIRONMENT_TAG(r -> r.tag("environment")),
    COST_CENTER_TAG(r -> r.tag("cost_center")),
    SERVICE(CostRecord::getService),
    CLOUD(r -> r.getCloud().name()),
    REGION(CostRecord::getRegion),
    DAY(r -> day(r).toString()),
    MONTH(r -> YearMonth.from(day(r)).toString());

    public static final String UNASSIGNED = "Unassigned";

    private final Function<CostRecord, String> extractor;

    GroupBy(Function<CostRecord, String> extractor) {
        this.extractor = extractor;
    }

    /**
     * Group key of a record, "Unassigned" when the dimension has no value.
     */
    public String keyOf(CostRecord record) {
        String key = extractor.apply(record);
        return key == null || key.isBlank() ? UNASSIGNED : key;
    }

    public boolean isTimeBucket() {
        return this == DAY || this == MONTH;
    }

    /**
     * Key of the bucket immediately before a time bucket key.
     */
    public String previousBucket(String key) {
        return switch (this) {
            case DAY -> LocalDate.parse(key).minusDays(1).toString();
            case MONTH -> YearMonth.parse(key).minusMonths(1).toString();
            default -> throw new IllegalStateException(this + " is not a time grouping");
        };
    }

    /**
     * Start date of the bucket before the one containing the date.
     */
    public LocalDate previousBucketStart(LocalDate date) {
        return switch (this) {
            case DAY -> date.minusDays(1);
            case MONTH -> YearMonth.from(date).minusMonths(1).atDay(1);
            default -> throw new IllegalStateException(this + " is not a time grouping");
        };
    }

    /**
     * Accepts "team-tag", "team_tag", "TEAM_TAG", "service", ...
     */
    public static GroupBy fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Grouping must not be null");
        }
        try {
            return valueOf(code.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown grouping: " + code);
        }
    }

    private static LocalDate day(CostRecord record) {
        return record.getPeriodStart().atOffset(ZoneOffset.UTC).toLocalDate();
    }
}
