package com.microsoft.finops.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Half-open UTC interval [start, end).
 */
public record TimeWindow(Instant start, Instant end) {

    public TimeWindow {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("Window start " + start + " must be before end " + end);
        }
    }

    /**
     * Whole UTC days [from, toExclusive).
     */
    public static TimeWindow ofDays(LocalDate from, LocalDate toExclusive) {
        return new TimeWindow(startOfDay(from), startOfDay(toExclusive));
    }

    public static TimeWindow ofDay(LocalDate day) {
        return ofDays(day, day.plusDays(1));
    }

    public static Instant startOfDay(LocalDate day) {
        return day.atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    public Duration length() {
        return Duration.between(start, end);
    }

    /**
     * Window of equal length ending where this one starts.
     */
    public TimeWindow preceding() {
        return new TimeWindow(start.minus(length()), start);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }

    public LocalDate startDate() {
        return start.atOffset(ZoneOffset.UTC).toLocalDate();
    }

    public LocalDate endDate() {
        return end.atOffset(ZoneOffset.UTC).toLocalDate();
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
