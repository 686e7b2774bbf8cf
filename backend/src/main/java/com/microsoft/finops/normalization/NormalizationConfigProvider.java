package com.microsoft.finops.normalization;

import com.microsoft.finops.config.FinOpsProperties;
import com.microsoft.finops.domain.model.Money;
import com.microsoft.finops.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Freezes the "finops" properties into a versioned NormalizationConfig.
 *
 * The version is a content hash, so two deployments with the same catalog,
 * tag policy, rates and aliases report the same version on their batches.
 * Invalid rates or an unknown organization currency fail startup.
 */
@Component
@Slf4j
public class NormalizationConfigProvider {

    private final NormalizationConfig current;

    public NormalizationConfigProvider(FinOpsProperties properties) {
        this.current = build(properties);
        log.info("Normalization config {} loaded: currency={}, {} catalog cloud(s), {} tag alias(es), {} rate currencies",
                current.version(), current.organizationCurrency(),
                current.serviceCatalog().entries().size(),
                current.tagPolicy().aliases().size(),
                current.currencyRates().rates().size());
    }

    public NormalizationConfig current() {
        return current;
    }

    static NormalizationConfig build(FinOpsProperties properties) {
        String orgCurrency = properties.getOrganizationCurrency();
        if (!Money.isKnownCurrency(orgCurrency)) {
            throw new ConfigurationException("Unknown organization currency: " + orgCurrency);
        }

        Map<String, Map<LocalDate, BigDecimal>> rates = new HashMap<>();
        properties.getCurrencyRates().forEach((currency, entries) -> {
            if (!Money.isKnownCurrency(currency)) {
                throw new ConfigurationException("Unknown currency in rate table: " + currency);
            }
            Map<LocalDate, BigDecimal> dated = new TreeMap<>();
            for (FinOpsProperties.RateEntry entry : entries) {
                if (entry.getRate() == null || entry.getRate().signum() <= 0) {
                    throw new ConfigurationException("Rate for " + currency + " must be positive");
                }
                if (entry.getEffectiveFrom() == null) {
                    throw new ConfigurationException("Rate for " + currency + " has no effectiveFrom");
                }
                try {
                    dated.put(LocalDate.parse(entry.getEffectiveFrom()), entry.getRate());
                } catch (DateTimeParseException e) {
                    throw new ConfigurationException("Invalid effectiveFrom for " + currency + ": "
                            + entry.getEffectiveFrom(), e);
                }
            }
            rates.put(currency, dated);
        });

        ServiceCatalog catalog = new ServiceCatalog(properties.getServiceCatalog());
        TagResolutionPolicy tagPolicy = new TagResolutionPolicy(properties.getTagPolicy());
        CurrencyRateTable rateTable = new CurrencyRateTable(orgCurrency, rates);
        Map<String, String> aliases = new TreeMap<>(properties.getAccountAliases());

        String fingerprint = orgCurrency
                + "|" + new TreeMap<>(catalog.entries())
                + "|" + tagPolicy.aliases()
                + "|" + new TreeMap<>(rateTable.rates())
                + "|" + aliases;
        String version = DigestUtils.md5DigestAsHex(fingerprint.getBytes(StandardCharsets.UTF_8)).substring(0, 12);

        return new NormalizationConfig(version, orgCurrency, catalog, tagPolicy, rateTable, aliases);
    }
}
