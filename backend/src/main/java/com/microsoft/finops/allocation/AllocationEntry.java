package com.microsoft.finops.allocation;

import java.math.BigDecimal;

public record AllocationEntry(String key, long amountMinorUnits, BigDecimal pctOfTotal) {
}
