package com.jay.forecast.model;

/** Every statement of one forecast year, published together once all are consistent. */
public record ForecastPeriod(int year,
                             IncomeStatementPeriod incomeStatement,
                             CashBudgetPeriod cashBudget,
                             DebtScheduleState debtSchedule,
                             BalanceSheetPeriod balanceSheet,
                             BalanceCheckResult balanceCheck) {
}
