package com.microsoft.finops.normalization;

import java.util.Map;

/**
 * Immutable snapshot of everything the normalizer depends on.
 *
 * Passed explicitly into each normalization run and recorded on the batch, so a
 * (store, config version) pair reproduces the same records.
 */
public record NormalizationConfig(
        String version,
        String organizationCurrency,
        ServiceCatalog serviceCatalog,
        TagResolutionPolicy tagPolicy,
        CurrencyRateTable currencyRates,
        Map<String, String> accountAliases
) {
    public NormalizationConfig {
        accountAliases = accountAliases == null ? Map.of() : Map.copyOf(accountAliases);
    }

    public String canonicalAccount(String accountId) {
        String trimmed = accountId.trim();
        return accountAliases.getOrDefault(trimmed, trimmed);
    }
}
