package com.microsoft.finops.config;

import com.microsoft.finops.domain.model.CloudProvider;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Engine configuration bound from the "finops" prefix.
 *
 * The normalization-related parts (catalog, tag policy, rates, account aliases)
 * are not read directly by the engines; NormalizationConfigProvider freezes them
 * into a versioned snapshot first.
 */
@Data
@Component
@ConfigurationProperties(prefix = "finops")
public class FinOpsProperties {

    /**
     * ISO code every record is converted to.
     */
    private String organizationCurrency = "USD";

    /**
     * Per cloud: normalized provider service code to canonical service name.
     */
    private Map<CloudProvider, Map<String, String>> serviceCatalog = new EnumMap<>(CloudProvider.class);

    /**
     * Canonical tag key to the provider tag keys that mean the same thing.
     */
    private Map<String, List<String>> tagPolicy = new HashMap<>();

    /**
     * Currency code to dated rates into the organization currency.
     */
    private Map<String, List<RateEntry>> currencyRates = new HashMap<>();

    /**
     * Provider account identifier to the canonical account id.
     */
    private Map<String, String> accountAliases = new HashMap<>();

    private Budget budget = new Budget();

    private Governance governance = new Governance();

    private Ingestion ingestion = new Ingestion();

    private Sync sync = new Sync();

    @Data
    public static class RateEntry {
        /**
         * ISO date the rate applies from (inclusive).
         */
        private String effectiveFrom;

        /**
         * Organization-currency units per unit of the foreign currency.
         */
        private BigDecimal rate;
    }

    @Data
    public static class Budget {
        /**
         * Percentage points a budget may run ahead of elapsed time and still be on track.
         */
        private BigDecimal tolerancePct = BigDecimal.TEN;
    }

    @Data
    public static class Governance {
        /**
         * Length of the evaluation window ending at the evaluation time.
         */
        private int windowDays = 30;

        /**
         * Seed the default policies when no policy exists.
         */
        private boolean seedDefaultPolicies = true;
    }

    @Data
    public static class Ingestion {
        /**
         * Adapters fetched concurrently during a sync.
         */
        private int parallelism = 4;

        /**
         * Per cloud: directory holding billing export CSV files.
         */
        private Map<CloudProvider, String> csvDirectories = new EnumMap<>(CloudProvider.class);
    }

    @Data
    public static class Sync {
        private boolean enabled = true;

        private String cron = "0 0 3 * * *";

        /**
         * Days before today that the scheduled sync re-fetches, to pick up late corrections.
         */
        private int lookbackDays = 3;
    }
}
