package com.microsoft.finops.normalization;

import com.microsoft.finops.domain.model.Money;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Dated exchange rates into the organization currency.
 *
 * The rate in effect on a date is the entry with the latest effective date on or
 * before it. The organization currency always converts at 1.
 */
public final class CurrencyRateTable {

    private final String organizationCurrency;
    private final Map<String, NavigableMap<LocalDate, BigDecimal>> rates;

    public CurrencyRateTable(String organizationCurrency, Map<String, ? extends Map<LocalDate, BigDecimal>> rates) {
        this.organizationCurrency = organizationCurrency;
        Map<String, NavigableMap<LocalDate, BigDecimal>> copy = new HashMap<>();
        rates.forEach((currency, dated) ->
                copy.put(currency, Collections.unmodifiableNavigableMap(new TreeMap<>(dated))));
        this.rates = Collections.unmodifiableMap(copy);
    }

    public String organizationCurrency() {
        return organizationCurrency;
    }

    public Optional<BigDecimal> rateOn(String currency, LocalDate date) {
        if (organizationCurrency.equals(currency)) {
            return Optional.of(BigDecimal.ONE);
        }
        NavigableMap<LocalDate, BigDecimal> dated = rates.get(currency);
        if (dated == null) {
            return Optional.empty();
        }
        Map.Entry<LocalDate, BigDecimal> entry = dated.floorEntry(date);
        return entry == null ? Optional.empty() : Optional.of(entry.getValue());
    }

    /**
     * Convert a major-unit amount into organization-currency minor units.
     * Empty when no rate is in effect on the date.
     */
    public Optional<Long> toOrganizationMinorUnits(BigDecimal amount, String currency, LocalDate date) {
        return rateOn(currency, date)
                .map(rate -> amount.multiply(rate, MathContext.DECIMAL128))
                .map(converted -> Money.toMinorUnits(converted, organizationCurrency));
    }

    public Map<String, NavigableMap<LocalDate, BigDecimal>> rates() {
        return rates;
    }
}
