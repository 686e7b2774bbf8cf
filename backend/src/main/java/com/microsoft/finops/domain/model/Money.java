package com.microsoft.finops.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Currency;

/**
 * Conversions between major-unit decimals and integer minor units.
 */
public final class Money {

    private Money() {
        // Utility class
    }

    /**
     * Number of minor-unit digits for an ISO currency (2 for USD, 0 for JPY).
     */
    public static int fractionDigits(String currencyCode) {
        int digits = Currency.getInstance(currencyCode).getDefaultFractionDigits();
        return Math.max(digits, 0);
    }

    public static long toMinorUnits(BigDecimal majorUnits, String currencyCode) {
        return majorUnits
                .setScale(fractionDigits(currencyCode), RoundingMode.HALF_EVEN)
                .unscaledValue()
                .longValueExact();
    }

    public static BigDecimal toMajorUnits(long minorUnits, String currencyCode) {
        return BigDecimal.valueOf(minorUnits, fractionDigits(currencyCode));
    }

    public static boolean isKnownCurrency(String currencyCode) {
        if (currencyCode == null || currencyCode.length() != 3) {
            return false;
        }
        try {
            Currency.getInstance(currencyCode);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
