package com.jay.forecast.layer8_report;

import com.jay.forecast.model.BacktestResult;
import com.jay.forecast.model.BalanceCheckResult;
import com.jay.forecast.model.BalanceSheetPeriod;
import com.jay.forecast.model.CashBudgetPeriod;
import com.jay.forecast.model.DebtScheduleState;
import com.jay.forecast.model.ForecastPeriod;
import com.jay.forecast.model.ForecastResult;
import com.jay.forecast.model.IncomeStatementPeriod;
import com.jay.forecast.model.LineItemVariance;
import com.jay.forecast.model.ResolvedAssumption;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Function;
import java.util.function.ToDoubleFunction;

/**
 * Layer 8 — Forecast Report Generator.
 * Renders a finished {@link ForecastResult} as a fixed-width text report, one column per
 * forecast year. Reads the result only.
 */
@Component
public class ForecastReportGenerator {

    private static final String DIVIDER =
        "══════════════════════════════════════════════════════════════════════════";
    private static final String RULE =
        "──────────────────────────────────────────────────────────────────────────";
    private static final String LABEL = "%-30s";
    private static final String CELL = "%14s";

    public String generate(ForecastResult result) {
        List<ForecastPeriod> periods = result.getPeriods();
        StringBuilder sb = new StringBuilder();

        sb.append(String.format("FORECAST REPORT  —  %s (%s)%n", result.getCompanyName(), result.getCompanyKey()));
        sb.append(DIVIDER).append("\n");
        sb.append(String.format("BASE YEAR         :  %d%n", result.getBaseYear()));
        sb.append(String.format("FORECAST YEARS    :  %d%n", result.getForecastYears()));
        sb.append(String.format("MODE              :  %s%n", result.isBacktest() ? "BACKTEST" : "FORECAST"));
        sb.append(String.format("BALANCED          :  %s%n", result.isBalanced() ? "YES" : "NO"));
        sb.append(DIVIDER).append("\n");

        // ── Assumptions ───────────────────────────────────────────────────────
        sb.append("ASSUMPTIONS\n").append(RULE).append("\n");
        for (ResolvedAssumption ra : result.getAssumptions().all()) {
            sb.append(String.format("%-28s %12.4f  %-10s %s%n",
                ra.key().configName(), ra.value(), ra.provenance(), ra.source()));
        }

        // ── Income statement ──────────────────────────────────────────────────
        section(sb, "INCOME STATEMENT", periods);
        Function<ForecastPeriod, IncomeStatementPeriod> is = ForecastPeriod::incomeStatement;
        row(sb, "Revenue", periods, is, IncomeStatementPeriod::getRevenue);
        row(sb, "Cost of revenue", periods, is, IncomeStatementPeriod::getCostOfRevenue);
        row(sb, "Gross profit", periods, is, IncomeStatementPeriod::getGrossProfit);
        row(sb, "SG&A", periods, is, IncomeStatementPeriod::getSga);
        row(sb, "Depreciation", periods, is, IncomeStatementPeriod::getDepreciation);
        row(sb, "Operating income (EBIT)", periods, is, IncomeStatementPeriod::getOperatingIncome);
        row(sb, "Interest expense", periods, is, IncomeStatementPeriod::getInterestExpense);
        row(sb, "Interest income", periods, is, IncomeStatementPeriod::getInterestIncome);
        row(sb, "ST investment income", periods, is, IncomeStatementPeriod::getInvestmentIncome);
        row(sb, "Pretax income", periods, is, IncomeStatementPeriod::getPretaxIncome);
        row(sb, "Tax", periods, is, IncomeStatementPeriod::getTaxProvision);
        row(sb, "Net income", periods, is, IncomeStatementPeriod::getNetIncome);

        // ── Cash budget ───────────────────────────────────────────────────────
        section(sb, "CASH BUDGET", periods);
        Function<ForecastPeriod, CashBudgetPeriod> cb = ForecastPeriod::cashBudget;
        row(sb, "Beginning cash", periods, cb, CashBudgetPeriod::getBeginningCash);
        row(sb, "Operating cash flow", periods, cb, CashBudgetPeriod::getOperatingCashFlow);
        row(sb, "Investing cash flow", periods, cb, CashBudgetPeriod::getInvestingCashFlow);
        row(sb, "External (owners)", periods, cb, CashBudgetPeriod::getExternalCashFlow);
        row(sb, "Financing (LT debt)", periods, cb, CashBudgetPeriod::getFinancingCashFlow);
        row(sb, "Pre-financing cash", periods, cb, CashBudgetPeriod::getPreFinancingCash);
        row(sb, "Minimum cash", periods, cb, CashBudgetPeriod::getMinimumCash);
        row(sb, "Discretionary (ST debt)", periods, cb, CashBudgetPeriod::getDiscretionaryCashFlow);
        row(sb, "ST investments redeemed", periods, cb, CashBudgetPeriod::getShortTermInvestmentRedemption);
        row(sb, "ST investments placed", periods, cb, CashBudgetPeriod::getShortTermInvestment);
        row(sb, "Ending cash", periods, cb, CashBudgetPeriod::getEndingCash);

        // ── Debt schedule ─────────────────────────────────────────────────────
        section(sb, "DEBT SCHEDULE", periods);
        Function<ForecastPeriod, DebtScheduleState> ds = ForecastPeriod::debtSchedule;
        row(sb, "ST beginning", periods, ds, DebtScheduleState::getShortTermBeginning);
        row(sb, "ST draw", periods, ds, DebtScheduleState::getShortTermDraw);
        row(sb, "ST repayment", periods, ds, DebtScheduleState::getShortTermRepayment);
        row(sb, "ST ending", periods, ds, DebtScheduleState::getShortTermEnding);
        row(sb, "LT beginning", periods, ds, DebtScheduleState::getLongTermBeginning);
        row(sb, "LT draw", periods, ds, DebtScheduleState::getLongTermDraw);
        row(sb, "LT amortisation", periods, ds, DebtScheduleState::getLongTermAmortization);
        row(sb, "LT ending", periods, ds, DebtScheduleState::getLongTermEnding);
        row(sb, "Interest (beginning balances)", periods, ds, DebtScheduleState::getInterestExpense);

        // ── Balance sheet ─────────────────────────────────────────────────────
        section(sb, "BALANCE SHEET", periods);
        Function<ForecastPeriod, BalanceSheetPeriod> bs = ForecastPeriod::balanceSheet;
        row(sb, "Cash", periods, bs, BalanceSheetPeriod::getCash);
        row(sb, "Short-term investments", periods, bs, BalanceSheetPeriod::getShortTermInvestments);
        row(sb, "Accounts receivable", periods, bs, BalanceSheetPeriod::getAccountsReceivable);
        row(sb, "Inventory", periods, bs, BalanceSheetPeriod::getInventory);
        row(sb, "Current assets", periods, bs, BalanceSheetPeriod::getCurrentAssets);
        row(sb, "Net PPE", periods, bs, BalanceSheetPeriod::getNetPpe);
        row(sb, "Total assets", periods, bs, BalanceSheetPeriod::getTotalAssets);
        row(sb, "Accounts payable", periods, bs, BalanceSheetPeriod::getAccountsPayable);
        row(sb, "Short-term debt", periods, bs, BalanceSheetPeriod::getShortTermDebt);
        row(sb, "Long-term debt", periods, bs, BalanceSheetPeriod::getLongTermDebt);
        row(sb, "Total liabilities", periods, bs, BalanceSheetPeriod::getTotalLiabilities);
        row(sb, "Retained earnings", periods, bs, BalanceSheetPeriod::getRetainedEarnings);
        row(sb, "Stockholders' equity", periods, bs, BalanceSheetPeriod::getStockholdersEquity);
        row(sb, "Minority interest", periods, bs, BalanceSheetPeriod::getMinorityInterest);
        row(sb, "Total liabilities & equity", periods, bs, BalanceSheetPeriod::getTotalLiabilitiesAndEquity);

        // ── Checks ────────────────────────────────────────────────────────────
        section(sb, "BALANCE CHECK", periods);
        Function<ForecastPeriod, BalanceCheckResult> chk = ForecastPeriod::balanceCheck;
        row(sb, "Assets − (L + E)", periods, chk, BalanceCheckResult::residual);
        if (!result.getBalanceCheckFailures().isEmpty() || !result.getDebtAnomalies().isEmpty()) {
            sb.append("WARNINGS:\n");
            result.getBalanceCheckFailures().forEach(f -> sb.append("   • ").append(f.message()).append("\n"));
            result.getDebtAnomalies().forEach(a -> sb.append("   • ").append(a).append("\n"));
        }

        if (!result.getBacktestResults().isEmpty()) {
            appendBacktest(sb, result.getBacktestResults());
        }
        sb.append(DIVIDER).append("\n");
        return sb.toString();
    }

    private void appendBacktest(StringBuilder sb, List<BacktestResult> backtests) {
        sb.append(DIVIDER).append("\n");
        sb.append("BACKTEST (forecast vs actual)\n");
        for (BacktestResult bt : backtests) {
            sb.append(RULE).append("\n");
            sb.append(String.format("%d  —  mean |variance| %.2f%%%n", bt.year(), bt.meanAbsolutePercentVariance()));
            sb.append(String.format("%-26s %14s %14s %12s %9s  %s%n",
                "Line item", "Forecast", "Actual", "Variance", "Var %", "Rating"));
            for (LineItemVariance v : bt.variances()) {
                String pct = v.percentVariance() != null ? String.format("%.2f%%", v.percentVariance()) : "N/A";
                sb.append(String.format("%-26s %,14.0f %,14.0f %,12.0f %9s  %s%n",
                    v.lineItem().label(), v.forecast(), v.actual(), v.variance(), pct, v.rating()));
            }
        }
    }

    private void section(StringBuilder sb, String title, List<ForecastPeriod> periods) {
        sb.append(DIVIDER).append("\n");
        sb.append(String.format(LABEL, title));
        periods.forEach(p -> sb.append(String.format(CELL, p.year())));
        sb.append("\n").append(RULE).append("\n");
    }

    private <T> void row(StringBuilder sb, String label, List<ForecastPeriod> periods,
                         Function<ForecastPeriod, T> statement, ToDoubleFunction<T> line) {
        sb.append(String.format(LABEL, label));
        for (ForecastPeriod p : periods) {
            sb.append(String.format(CELL, String.format("%,.0f", line.applyAsDouble(statement.apply(p)))));
        }
        sb.append("\n");
    }
}
