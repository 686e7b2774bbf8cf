package com.microsoft.finops.normalization;

import com.microsoft.finops.adapters.RawCostFact;
import com.microsoft.finops.domain.model.CloudProvider;
import com.microsoft.finops.domain.model.CostRecord;
import com.microsoft.finops.domain.model.CostRecordKey;
import com.microsoft.finops.domain.model.Money;
import com.microsoft.finops.domain.model.RecordType;
import com.microsoft.finops.normalization.DataQualityIssue.IssueType;
import com.microsoft.finops.normalization.NormalizationResult.HeldFact;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Converts raw provider facts into canonical cost records.
 *
 * NORMALIZATION STEPS (per fact):
 * 1. Validate cloud, interval and amount sign; invalid facts are rejected with an issue
 * 2. Map the provider service code through the catalog, falling back to "Other"
 * 3. Resolve tags with the tag policy (lower-cased keys, aliases renamed)
 * 4. Convert to the organization currency at the rate in effect on period start;
 *    without a rate the fact is held, never dropped
 * 5. Deduplicate on the natural key within the batch, last write wins
 *
 * The normalizer is a pure function of (facts, config, batch id, ingestion time),
 * so normalizing the same facts twice yields equal record sets.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CostNormalizer {

    private final RegionNormalizer regionNormalizer;

    public NormalizationResult normalize(
            CloudProvider cloud,
            List<RawCostFact> facts,
            NormalizationConfig config,
            String batchId,
            Instant ingestedAt
    ) {
        Map<CostRecordKey, CostRecord> records = new LinkedHashMap<>();
        List<HeldFact> held = new ArrayList<>();
        List<DataQualityIssue> issues = new ArrayList<>();
        int replaced = 0;

        for (RawCostFact fact : facts) {
            Optional<DataQualityIssue> rejection = validate(cloud, fact);
            if (rejection.isPresent()) {
                log.warn("Rejected {} fact for account {}: {}", cloud, fact.accountId(), rejection.get().detail());
                issues.add(rejection.get());
                continue;
            }

            String currency = fact.currency().trim().toUpperCase(Locale.ROOT);
            LocalDate rateDate = fact.usageStart().atOffset(ZoneOffset.UTC).toLocalDate();
            Optional<Long> converted = Money.isKnownCurrency(currency)
                    ? config.currencyRates().toOrganizationMinorUnits(fact.amount(), currency, rateDate)
                    : Optional.empty();
            if (converted.isEmpty()) {
                String reason = "No " + currency + "->" + config.organizationCurrency() + " rate in effect on " + rateDate;
                log.warn("Holding {} fact for account {}: {}", cloud, fact.accountId(), reason);
                held.add(new HeldFact(fact, reason));
                issues.add(issue(IssueType.CURRENCY_RATE_MISSING, cloud, fact, reason));
                continue;
            }

            Optional<String> service = config.serviceCatalog().resolve(cloud, fact.serviceCode());
            if (service.isEmpty()) {
                log.warn("Unmapped {} service '{}', recording as {}", cloud, fact.serviceCode(), ServiceCatalog.OTHER);
                issues.add(issue(IssueType.UNMAPPED_SERVICE, cloud, fact, "Service '" + fact.serviceCode() + "' not in catalog"));
            }

            CostRecord record = CostRecord.builder()
                    .cloud(cloud)
                    .accountId(config.canonicalAccount(fact.accountId()))
                    .projectId(blankToNull(fact.projectId()))
                    .service(service.orElse(ServiceCatalog.OTHER))
                    .serviceMapped(service.isPresent())
                    .resourceId(blankToNull(fact.resourceId()))
                    .region(regionNormalizer.toCanonicalRegion(cloud, fact.region()))
                    .tags(config.tagPolicy().resolve(fact.tags()))
                    .periodStart(fact.usageStart())
                    .periodEnd(fact.usageEnd())
                    .recordType(recordTypeOf(fact))
                    .amountMinorUnits(converted.get())
                    .currency(config.organizationCurrency())
                    .originalAmountMinorUnits(Money.toMinorUnits(fact.amount(), currency))
                    .originalCurrency(currency)
                    .ingestedAt(ingestedAt)
                    .sourceBatchId(batchId)
                    .build();

            if (records.remove(record.naturalKey()) != null) {
                replaced++;
                log.debug("Fact for {} replaces an earlier fact in batch {}", record.naturalKey(), batchId);
            }
            records.put(record.naturalKey(), record);
        }

        log.info("Normalized {} {} fact(s) in batch {}: {} record(s), {} held, {} issue(s), {} replaced (config {})",
                facts.size(), cloud, batchId, records.size(), held.size(), issues.size(), replaced, config.version());
        return new NormalizationResult(new ArrayList<>(records.values()), held, issues);
    }

    private Optional<DataQualityIssue> validate(CloudProvider cloud, RawCostFact fact) {
        if (fact.cloud() != null && fact.cloud() != cloud) {
            return Optional.of(issue(IssueType.CLOUD_MISMATCH, cloud, fact,
                    "Fact reported for " + fact.cloud() + " by the " + cloud + " source"));
        }
        if (isBlank(fact.accountId()) || isBlank(fact.serviceCode()) || fact.amount() == null || isBlank(fact.currency())) {
            return Optional.of(issue(IssueType.MISSING_FIELD, cloud, fact, "Account, service, amount and currency are required"));
        }
        if (fact.usageStart() == null || fact.usageEnd() == null || !fact.usageStart().isBefore(fact.usageEnd())) {
            return Optional.of(issue(IssueType.INVALID_INTERVAL, cloud, fact,
                    "Interval [" + fact.usageStart() + ", " + fact.usageEnd() + ") is empty or inverted"));
        }
        RecordType type = recordTypeOf(fact);
        if (!type.permits(fact.amount().signum())) {
            return Optional.of(issue(IssueType.INVALID_AMOUNT_SIGN, cloud, fact,
                    type + " line with amount " + fact.amount()));
        }
        return Optional.empty();
    }

    /**
     * Credits, refunds and discounts become CREDIT records; anything else is usage.
     */
    static RecordType recordTypeOf(RawCostFact fact) {
        if (fact.lineItemType() == null) {
            return RecordType.USAGE;
        }
        String type = fact.lineItemType().toLowerCase(Locale.ROOT);
        if (type.contains("credit") || type.contains("refund") || type.contains("discount")) {
            return RecordType.CREDIT;
        }
        return RecordType.USAGE;
    }

    private static DataQualityIssue issue(IssueType type, CloudProvider cloud, RawCostFact fact, String detail) {
        return new DataQualityIssue(type, cloud, fact.accountId(), fact.resourceId(), detail);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String blankToNull(String value) {
        return isBlank(value) ? null : value.trim();
    }
}
