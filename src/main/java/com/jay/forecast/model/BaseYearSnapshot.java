package com.jay.forecast.model;

/**
 * Period 0 rebuilt from reported history. {@code reportedResidual} is the imbalance
 * in the reported balance sheet itself, carried unchanged into every forecast year and
 * excluded from each period's balance check.
 */
public record BaseYearSnapshot(int year, IncomeStatementPeriod incomeStatement,
                               BalanceSheetPeriod balanceSheet, DebtScheduleState debtSchedule,
                               double reportedResidual) {
}
