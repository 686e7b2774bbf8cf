package com.microsoft.finops.adapters.csv;

import com.microsoft.finops.adapters.CloudCostAdapter;
import com.microsoft.finops.adapters.RawCostFact;
import com.microsoft.finops.domain.model.CloudProvider;
import com.microsoft.finops.domain.model.TimeWindow;
import com.microsoft.finops.exception.PartialDataException;
import com.microsoft.finops.exception.SourceAuthenticationException;
import com.microsoft.finops.exception.SourceUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.Reader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Reads billing export files dropped into a directory, one directory per cloud.
 *
 * EXPECTED COLUMNS (header row, case-insensitive):
 * account_id, project_id, service, resource_id, region, usage_start, usage_end,
 * cost, currency, line_item_type, tags
 *
 * usage_start/usage_end accept an ISO instant or an ISO date (UTC midnight).
 * tags is "key=value;key=value". Every *.csv file in the directory is read in
 * file-name order, so the same directory content always yields the same facts.
 *
 * Rows that cannot be parsed are skipped and reported through PartialDataException
 * together with the rows that could.
 */
@Slf4j
public class CsvBillingExportAdapter implements CloudCostAdapter {

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreHeaderCase(true)
            .setIgnoreEmptyLines(true)
            .setTrim(true)
            .build();

    private final CloudProvider provider;
    private final Path directory;

    public CsvBillingExportAdapter(CloudProvider provider, Path directory) {
        this.provider = provider;
        this.directory = directory;
    }

    @Override
    public CloudProvider getProvider() {
        return provider;
    }

    @Override
    public List<RawCostFact> fetch(TimeWindow window) {
        List<Path> files = listExportFiles();
        log.info("Reading {} billing export file(s) for {} from {} in window {}",
                files.size(), provider, directory, window);

        List<RawCostFact> facts = new ArrayList<>();
        List<String> rejectedRows = new ArrayList<>();

        for (Path file : files) {
            try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
                 CSVParser parser = new CSVParser(reader, FORMAT)) {
                for (CSVRecord row : parser) {
                    try {
                        RawCostFact fact = toFact(row);
                        if (window.contains(fact.usageStart())) {
                            facts.add(fact);
                        }
                    } catch (IllegalArgumentException | DateTimeParseException e) {
                        log.warn("Skipping row {} of {}: {}", row.getRecordNumber(), file.getFileName(), e.getMessage());
                        rejectedRows.add(file.getFileName() + "#" + row.getRecordNumber());
                    }
                }
            } catch (AccessDeniedException e) {
                throw new SourceAuthenticationException(provider, "No read access to billing export " + file, e);
            } catch (IOException e) {
                throw new SourceUnavailableException(provider, "Cannot read billing export " + file, e);
            }
        }

        if (!rejectedRows.isEmpty()) {
            throw new PartialDataException(provider,
                    rejectedRows.size() + " unreadable row(s) in billing export: " + rejectedRows, facts);
        }
        return facts;
    }

    @Override
    public boolean validateCredentials() {
        return Files.isDirectory(directory) && Files.isReadable(directory);
    }

    private List<Path> listExportFiles() {
        if (!Files.isDirectory(directory)) {
            throw new SourceUnavailableException(provider, "Billing export directory does not exist: " + directory);
        }
        if (!Files.isReadable(directory)) {
            throw new SourceAuthenticationException(provider, "No read access to billing export directory " + directory);
        }
        try (Stream<Path> entries = Files.list(directory)) {
            return entries
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".csv"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new SourceUnavailableException(provider, "Cannot list billing export directory " + directory, e);
        }
    }

    private RawCostFact toFact(CSVRecord row) {
        return new RawCostFact(
                provider,
                required(row, "account_id"),
                optional(row, "project_id"),
                required(row, "service"),
                optional(row, "resource_id"),
                optional(row, "region"),
                parseTags(optional(row, "tags")),
                parseInstant(required(row, "usage_start")),
                parseInstant(required(row, "usage_end")),
                new BigDecimal(required(row, "cost")),
                required(row, "currency").toUpperCase(Locale.ROOT),
                optional(row, "line_item_type")
        );
    }

    private static String required(CSVRecord row, String column) {
        String value = optional(row, column);
        if (value == null) {
            throw new IllegalArgumentException("missing " + column);
        }
        return value;
    }

    private static String optional(CSVRecord row, String column) {
        if (!row.isMapped(column) || !row.isSet(column)) {
            return null;
        }
        String value = row.get(column);
        return value == null || value.isBlank() ? null : value;
    }

    static Instant parseInstant(String value) {
        if (value.length() == 10) {
            return TimeWindow.startOfDay(LocalDate.parse(value));
        }
        return Instant.parse(value);
    }

    static Map<String, String> parseTags(String value) {
        Map<String, String> tags = new LinkedHashMap<>();
        if (value == null) {
            return tags;
        }
        for (String pair : value.split(";")) {
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            tags.put(pair.substring(0, eq).trim(), pair.substring(eq + 1).trim());
        }
        return tags;
    }
}
