package com.jay.forecast.layer7_backtest;

import com.jay.forecast.model.BacktestResult;
import com.jay.forecast.model.BalanceSheetPeriod;
import com.jay.forecast.model.FinancialYear;
import com.jay.forecast.model.ForecastPeriod;
import com.jay.forecast.model.HistoricalFinancials;
import com.jay.forecast.model.IncomeStatementPeriod;
import com.jay.forecast.model.LineItemVariance;
import com.jay.forecast.model.enums.LineItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.function.ToDoubleFunction;

/**
 * Layer 7 — Backtest Comparator.
 * Compares forecast years against reported actuals when the base year is historical.
 * Read-only: nothing here feeds back into the forecast.
 */
@Slf4j
@Component
public class BacktestComparator {

    private static final Map<LineItem, ToDoubleFunction<ForecastPeriod>> COMPARED = new LinkedHashMap<>();

    static {
        // Income statement
        income(LineItem.TOTAL_REVENUE, IncomeStatementPeriod::getRevenue);
        income(LineItem.COST_OF_REVENUE, IncomeStatementPeriod::getCostOfRevenue);
        income(LineItem.GROSS_PROFIT, IncomeStatementPeriod::getGrossProfit);
        income(LineItem.SGA, IncomeStatementPeriod::getSga);
        income(LineItem.OPERATING_INCOME, IncomeStatementPeriod::getOperatingIncome);
        income(LineItem.INTEREST_EXPENSE, IncomeStatementPeriod::getInterestExpense);
        income(LineItem.PRETAX_INCOME, IncomeStatementPeriod::getPretaxIncome);
        income(LineItem.TAX_PROVISION, IncomeStatementPeriod::getTaxProvision);
        income(LineItem.NET_INCOME, IncomeStatementPeriod::getNetIncome);
        // Balance sheet
        balance(LineItem.CASH, BalanceSheetPeriod::getCash);
        balance(LineItem.ACCOUNTS_RECEIVABLE, BalanceSheetPeriod::getAccountsReceivable);
        balance(LineItem.INVENTORY, BalanceSheetPeriod::getInventory);
        balance(LineItem.NET_PPE, BalanceSheetPeriod::getNetPpe);
        balance(LineItem.TOTAL_ASSETS, BalanceSheetPeriod::getTotalAssets);
        balance(LineItem.ACCOUNTS_PAYABLE, BalanceSheetPeriod::getAccountsPayable);
        balance(LineItem.TOTAL_LIABILITIES, BalanceSheetPeriod::getTotalLiabilities);
        balance(LineItem.STOCKHOLDERS_EQUITY, BalanceSheetPeriod::getStockholdersEquity);
    }

    private static void income(LineItem item, ToDoubleFunction<IncomeStatementPeriod> getter) {
        COMPARED.put(item, p -> getter.applyAsDouble(p.incomeStatement()));
    }

    private static void balance(LineItem item, ToDoubleFunction<BalanceSheetPeriod> getter) {
        COMPARED.put(item, p -> getter.applyAsDouble(p.balanceSheet()));
    }

    /** One result per forecast year that has reported actuals; empty when none do. */
    public List<BacktestResult> compare(List<ForecastPeriod> periods, HistoricalFinancials actuals) {
        List<BacktestResult> results = new ArrayList<>();
        for (ForecastPeriod period : periods) {
            if (!actuals.contains(period.year())) continue;
            FinancialYear actual = actuals.year(period.year());

            List<LineItemVariance> variances = new ArrayList<>();
            COMPARED.forEach((item, forecast) -> {
                OptionalDouble reported = actual.get(item);
                if (reported.isEmpty()) return;
                // exports sign expenses inconsistently; forecast expenses are magnitudes
                double actualValue = item.isExpense() ? Math.abs(reported.getAsDouble()) : reported.getAsDouble();
                variances.add(LineItemVariance.of(item, forecast.applyAsDouble(period), actualValue));
            });
            BacktestResult result = new BacktestResult(period.year(), variances);
            log.info("Backtest {}: {} lines compared, mean |variance| {}%",
                period.year(), variances.size(), String.format("%.2f", result.meanAbsolutePercentVariance()));
            results.add(result);
        }
        return results;
    }
}
