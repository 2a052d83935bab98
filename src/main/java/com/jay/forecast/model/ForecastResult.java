package com.jay.forecast.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Immutable output of one forecast run. Per-period anomalies (balance residuals,
 * clamped debt repayments) are reported here instead of aborting the run.
 */
@Value
@Builder
public class ForecastResult {
    String companyKey;
    String companyName;
    int baseYear;
    int forecastYears;
    boolean backtest;

    ForecastAssumptions assumptions;
    BaseYearSnapshot base;

    @Singular List<ForecastPeriod> periods;
    @Singular List<BalanceCheckFailure> balanceCheckFailures;
    @Singular("debtAnomaly") List<String> debtAnomalies;
    @Singular("backtestResult") List<BacktestResult> backtestResults;

    public List<IncomeStatementPeriod> incomeStatements() {
        return periods.stream().map(ForecastPeriod::incomeStatement).toList();
    }

    public List<CashBudgetPeriod> cashBudgets() {
        return periods.stream().map(ForecastPeriod::cashBudget).toList();
    }

    public List<DebtScheduleState> debtSchedules() {
        return periods.stream().map(ForecastPeriod::debtSchedule).toList();
    }

    public List<BalanceSheetPeriod> balanceSheets() {
        return periods.stream().map(ForecastPeriod::balanceSheet).toList();
    }

    public List<BalanceCheckResult> balanceChecks() {
        return periods.stream().map(ForecastPeriod::balanceCheck).toList();
    }

    public boolean isBalanced() {
        return balanceCheckFailures.isEmpty();
    }
}
