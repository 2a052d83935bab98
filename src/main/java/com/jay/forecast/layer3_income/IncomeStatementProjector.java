package com.jay.forecast.layer3_income;

import com.jay.forecast.model.BalanceSheetPeriod;
import com.jay.forecast.model.ForecastAssumptions;
import com.jay.forecast.model.IncomeStatementPeriod;
import com.jay.forecast.model.enums.AssumptionKey;
import org.springframework.stereotype.Component;

/**
 * Layer 3 — Income Statement Projector.
 * Projects one year top-down: revenue, cost lines, operating income, then the
 * interest figures handed in by the caller (already fixed from beginning balances),
 * tax and net income. Each line only reads lines computed above it.
 */
@Component
public class IncomeStatementProjector {

    /**
     * @param prior           last year's income statement (forecast or base year)
     * @param priorBalance    last year's closing balance sheet; supplies the PPE depreciated this year
     * @param periodIndex     1 for the first forecast year
     * @param interestExpense interest on beginning debt, from the debt schedule
     * @param interestIncome  return on beginning cash
     * @param investmentIncome return on the short-term investments redeemed this year
     */
    public IncomeStatementPeriod project(IncomeStatementPeriod prior, BalanceSheetPeriod priorBalance,
                                         ForecastAssumptions a, int periodIndex, double growthDecay,
                                         double interestExpense, double interestIncome,
                                         double investmentIncome) {
        double growth = growthFor(a.get(AssumptionKey.REVENUE_GROWTH), growthDecay, periodIndex);
        double revenue = prior.getRevenue() * (1 + growth);
        double cogs = revenue * a.get(AssumptionKey.COGS_PCT_REVENUE);
        double grossProfit = revenue - cogs;
        double sga = revenue * a.get(AssumptionKey.SGA_PCT_REVENUE);
        double depreciation = priorBalance.getNetPpe() * a.get(AssumptionKey.DEPRECIATION_RATE);
        double operatingIncome = grossProfit - sga - depreciation;

        double pretax = operatingIncome - interestExpense + interestIncome + investmentIncome;
        // losses carry no tax credit
        double tax = Math.max(0.0, pretax * a.get(AssumptionKey.TAX_RATE));
        double netIncome = pretax - tax;

        return IncomeStatementPeriod.builder()
            .year(prior.getYear() + 1)
            .revenue(revenue)
            .revenueGrowth(growth)
            .costOfRevenue(cogs)
            .grossProfit(grossProfit)
            .sga(sga)
            .depreciation(depreciation)
            .operatingIncome(operatingIncome)
            .interestExpense(interestExpense)
            .interestIncome(interestIncome)
            .investmentIncome(investmentIncome)
            .pretaxIncome(pretax)
            .taxProvision(tax)
            .netIncome(netIncome)
            .build();
    }

    /** Base growth faded linearly: {@code g × (1 − decay × (t − 1))}. */
    public static double growthFor(double baseGrowth, double decay, int periodIndex) {
        return baseGrowth * (1 - decay * (periodIndex - 1));
    }
}
