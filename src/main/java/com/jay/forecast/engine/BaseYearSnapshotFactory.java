package com.jay.forecast.engine;

import com.jay.forecast.layer1_data.HistoricalDataValidator;
import com.jay.forecast.model.BalanceSheetPeriod;
import com.jay.forecast.model.BaseYearSnapshot;
import com.jay.forecast.model.DebtScheduleState;
import com.jay.forecast.model.FinancialYear;
import com.jay.forecast.model.ForecastAssumptions;
import com.jay.forecast.model.HistoricalFinancials;
import com.jay.forecast.model.IncomeStatementPeriod;
import com.jay.forecast.model.LoanTranche;
import com.jay.forecast.model.enums.AssumptionKey;
import com.jay.forecast.model.enums.LineItem;
import org.springframework.stereotype.Component;

/**
 * Rebuilds period 0 from the reported base year. Lines the model does not drive
 * ("other" assets, liabilities and equity) are taken as the gap between the reported
 * subtotal and its modelled parts, then held constant through the forecast.
 */
@Component
public class BaseYearSnapshotFactory {

    public BaseYearSnapshot build(HistoricalFinancials history, int baseYear, ForecastAssumptions a) {
        FinancialYear fy = history.year(baseYear);
        IncomeStatementPeriod is = incomeStatement(fy);
        BalanceSheetPeriod bs = balanceSheet(fy);
        DebtScheduleState debt = openingDebt(baseYear, bs, is, a);
        return new BaseYearSnapshot(baseYear, is, bs, debt, HistoricalDataValidator.reportedResidual(fy));
    }

    private IncomeStatementPeriod incomeStatement(FinancialYear fy) {
        double revenue = fy.getOrZero(LineItem.TOTAL_REVENUE);
        double cogs = fy.magnitude(LineItem.COST_OF_REVENUE);
        double grossProfit = valueOr(fy, LineItem.GROSS_PROFIT, revenue - cogs);
        double sga = fy.magnitude(LineItem.SGA);
        double depreciation = fy.magnitude(LineItem.DEPRECIATION);
        double operatingIncome = valueOr(fy, LineItem.OPERATING_INCOME, grossProfit - sga - depreciation);
        double interestExpense = fy.magnitude(LineItem.INTEREST_EXPENSE);
        double interestIncome = fy.getOrZero(LineItem.INTEREST_INCOME);
        double pretax = valueOr(fy, LineItem.PRETAX_INCOME, operatingIncome - interestExpense + interestIncome);

        return IncomeStatementPeriod.builder()
            .year(fy.getYear())
            .revenue(revenue)
            .costOfRevenue(cogs)
            .grossProfit(grossProfit)
            .sga(sga)
            .depreciation(depreciation)
            .operatingIncome(operatingIncome)
            .interestExpense(interestExpense)
            .interestIncome(interestIncome)
            .pretaxIncome(pretax)
            .taxProvision(fy.magnitude(LineItem.TAX_PROVISION))
            .netIncome(fy.getOrZero(LineItem.NET_INCOME))
            .build();
    }

    private BalanceSheetPeriod balanceSheet(FinancialYear fy) {
        double cash = fy.getOrZero(LineItem.CASH);
        double receivables = fy.getOrZero(LineItem.ACCOUNTS_RECEIVABLE);
        double inventory = fy.getOrZero(LineItem.INVENTORY);
        double otherCurrentAssets = fy.has(LineItem.CURRENT_ASSETS)
            ? fy.getOrZero(LineItem.CURRENT_ASSETS) - cash - receivables - inventory
            : 0.0;

        double netPpe = fy.has(LineItem.NET_PPE)
            ? fy.getOrZero(LineItem.NET_PPE)
            : fy.getOrZero(LineItem.GROSS_PPE) - fy.magnitude(LineItem.ACCUMULATED_DEPRECIATION);
        double grossPpe = valueOr(fy, LineItem.GROSS_PPE, netPpe);
        double accumulatedDepreciation = fy.has(LineItem.ACCUMULATED_DEPRECIATION)
            ? fy.magnitude(LineItem.ACCUMULATED_DEPRECIATION)
            : grossPpe - netPpe;
        double goodwill = fy.getOrZero(LineItem.GOODWILL);
        double intangibles = fy.getOrZero(LineItem.OTHER_INTANGIBLES);
        double otherNonCurrentAssets = fy.getOrZero(LineItem.TOTAL_ASSETS)
            - (cash + receivables + inventory + otherCurrentAssets) - netPpe - goodwill - intangibles;

        double payables = fy.getOrZero(LineItem.ACCOUNTS_PAYABLE);
        double shortTermDebt = fy.magnitude(LineItem.CURRENT_DEBT);
        double otherCurrentLiabilities = fy.has(LineItem.CURRENT_LIABILITIES)
            ? fy.getOrZero(LineItem.CURRENT_LIABILITIES) - payables - shortTermDebt
            : 0.0;
        double longTermDebt = fy.magnitude(LineItem.LONG_TERM_DEBT);
        double otherNonCurrentLiabilities = fy.getOrZero(LineItem.TOTAL_LIABILITIES)
            - (payables + shortTermDebt + otherCurrentLiabilities) - longTermDebt;

        double retainedEarnings = fy.getOrZero(LineItem.RETAINED_EARNINGS);

        return BalanceSheetPeriod.builder()
            .year(fy.getYear())
            .cash(cash)
            .accountsReceivable(receivables)
            .inventory(inventory)
            .otherCurrentAssets(otherCurrentAssets)
            .grossPpe(grossPpe)
            .accumulatedDepreciation(accumulatedDepreciation)
            .netPpe(netPpe)
            .goodwill(goodwill)
            .intangibles(intangibles)
            .otherNonCurrentAssets(otherNonCurrentAssets)
            .accountsPayable(payables)
            .shortTermDebt(shortTermDebt)
            .otherCurrentLiabilities(otherCurrentLiabilities)
            .longTermDebt(longTermDebt)
            .otherNonCurrentLiabilities(otherNonCurrentLiabilities)
            .retainedEarnings(retainedEarnings)
            .otherEquity(fy.getOrZero(LineItem.STOCKHOLDERS_EQUITY) - retainedEarnings)
            .minorityInterest(fy.getOrZero(LineItem.MINORITY_INTEREST))
            .build();
    }

    /** Existing long-term debt becomes one tranche amortised over the configured loan term. */
    private DebtScheduleState openingDebt(int baseYear, BalanceSheetPeriod bs, IncomeStatementPeriod is,
                                          ForecastAssumptions a) {
        int loanYears = (int) Math.max(1, Math.round(a.get(AssumptionKey.LT_LOAN_YEARS)));
        DebtScheduleState.DebtScheduleStateBuilder b = DebtScheduleState.builder()
            .year(baseYear)
            .shortTermEnding(bs.getShortTermDebt())
            .longTermEnding(bs.getLongTermDebt())
            .costOfDebt(a.get(AssumptionKey.COST_OF_DEBT))
            .interestExpense(is.getInterestExpense());
        if (bs.getLongTermDebt() > 0) {
            b.tranche(LoanTranche.open(baseYear, bs.getLongTermDebt(), loanYears));
        }
        return b.build();
    }

    private static double valueOr(FinancialYear fy, LineItem item, double fallback) {
        return fy.get(item).orElse(fallback);
    }
}
