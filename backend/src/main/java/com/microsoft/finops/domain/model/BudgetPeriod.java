package com.microsoft.finops.domain.model;

/**
 * Budget period length, anchored to the budget's start date.
 */
public enum BudgetPeriod {
    MONTHLY(1),
    QUARTERLY(3);

    private final int months;

    BudgetPeriod(int months) {
        this.months = months;
    }

    public int getMonths() {
        return months;
    }
}
