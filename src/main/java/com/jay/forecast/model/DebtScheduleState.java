package com.jay.forecast.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Short- and long-term debt for one year. Interest expense is computed on the
 * beginning balances only.
 */
@Value
@Builder
public class DebtScheduleState {
    int year;

    double shortTermBeginning;
    double shortTermDraw;
    double shortTermRepayment;
    double shortTermEnding;

    double longTermBeginning;
    double longTermDraw;
    double longTermAmortization;
    double longTermEnding;

    double costOfDebt;
    double interestExpense;

    @Singular("tranche") List<LoanTranche> tranches;
    @Singular("anomaly") List<String> anomalies;

    public double totalDebt() {
        return shortTermEnding + longTermEnding;
    }
}
