package com.jay.forecast.model;

import lombok.Builder;
import lombok.Value;

/** Year-end balance sheet. Totals are derived from the lines, never stored. */
@Value
@Builder
public class BalanceSheetPeriod {
    int year;

    // ── Assets ────────────────────────────────────────────────────────────────
    double cash;
    double shortTermInvestments;
    double accountsReceivable;
    double inventory;
    double otherCurrentAssets;
    double grossPpe;
    double accumulatedDepreciation;
    double netPpe;
    double goodwill;
    double intangibles;
    double otherNonCurrentAssets;

    // ── Liabilities ───────────────────────────────────────────────────────────
    double accountsPayable;
    double shortTermDebt;
    double otherCurrentLiabilities;
    double longTermDebt;
    double otherNonCurrentLiabilities;

    // ── Equity ────────────────────────────────────────────────────────────────
    double retainedEarnings;
    double otherEquity;
    double minorityInterest;

    public double getCurrentAssets() {
        return cash + shortTermInvestments + accountsReceivable + inventory + otherCurrentAssets;
    }

    public double getNonCurrentAssets() {
        return netPpe + goodwill + intangibles + otherNonCurrentAssets;
    }

    public double getTotalAssets() {
        return getCurrentAssets() + getNonCurrentAssets();
    }

    public double getCurrentLiabilities() {
        return accountsPayable + shortTermDebt + otherCurrentLiabilities;
    }

    public double getTotalLiabilities() {
        return getCurrentLiabilities() + longTermDebt + otherNonCurrentLiabilities;
    }

    public double getStockholdersEquity() {
        return retainedEarnings + otherEquity;
    }

    public double getTotalLiabilitiesAndEquity() {
        return getTotalLiabilities() + getStockholdersEquity() + minorityInterest;
    }
}
