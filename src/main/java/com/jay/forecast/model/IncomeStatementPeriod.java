package com.jay.forecast.model;

import lombok.Builder;
import lombok.Value;

/** One year of the income statement. Expense lines are positive magnitudes. */
@Value
@Builder
public class IncomeStatementPeriod {
    int year;

    double revenue;
    double revenueGrowth;         // applied growth, 0 for the base year
    double costOfRevenue;
    double grossProfit;
    double sga;
    double depreciation;
    double operatingIncome;       // EBIT

    double interestExpense;       // on beginning debt balances
    double interestIncome;        // on beginning cash
    double investmentIncome;      // on beginning short-term investments
    double pretaxIncome;
    double taxProvision;
    double netIncome;
}
