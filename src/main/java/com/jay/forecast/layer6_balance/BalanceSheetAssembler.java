package com.jay.forecast.layer6_balance;

import com.jay.forecast.model.BalanceSheetPeriod;
import com.jay.forecast.model.CashBudgetPeriod;
import com.jay.forecast.model.DebtScheduleState;
import com.jay.forecast.model.IncomeStatementPeriod;
import com.jay.forecast.model.WorkingCapitalPosition;
import org.springframework.stereotype.Component;

/**
 * Layer 6 — Balance Sheet Assembler.
 * Rolls the prior balance sheet forward from this period's statements. Cash is the
 * cash budget's ending cash as-is; every other line comes from its own driver, and
 * lines without a driver keep their base-year value. Nothing is solved as a residual.
 */
@Component
public class BalanceSheetAssembler {

    public BalanceSheetPeriod assemble(BalanceSheetPeriod prior, IncomeStatementPeriod is,
                                       CashBudgetPeriod cb, DebtScheduleState debt) {
        WorkingCapitalPosition wc = cb.getWorkingCapital();
        double grossPpe = prior.getGrossPpe() + cb.getCapitalExpenditure();
        double accumulatedDepreciation = prior.getAccumulatedDepreciation() + is.getDepreciation();

        return BalanceSheetPeriod.builder()
            .year(is.getYear())
            // Assets
            .cash(cb.getEndingCash())
            .shortTermInvestments(cb.getShortTermInvestmentEnding())
            .accountsReceivable(wc.accountsReceivable())
            .inventory(wc.inventory())
            .otherCurrentAssets(prior.getOtherCurrentAssets())
            .grossPpe(grossPpe)
            .accumulatedDepreciation(accumulatedDepreciation)
            .netPpe(prior.getNetPpe() + cb.getCapitalExpenditure() - is.getDepreciation())
            .goodwill(prior.getGoodwill())
            .intangibles(prior.getIntangibles())
            .otherNonCurrentAssets(prior.getOtherNonCurrentAssets())
            // Liabilities
            .accountsPayable(wc.accountsPayable())
            .shortTermDebt(debt.getShortTermEnding())
            .otherCurrentLiabilities(prior.getOtherCurrentLiabilities())
            .longTermDebt(debt.getLongTermEnding())
            .otherNonCurrentLiabilities(prior.getOtherNonCurrentLiabilities())
            // Equity
            .retainedEarnings(prior.getRetainedEarnings() + is.getNetIncome() - cb.getDividendsPaid())
            .otherEquity(prior.getOtherEquity() + cb.getEquityIssued() - cb.getStockRepurchase())
            .minorityInterest(prior.getMinorityInterest())
            .build();
    }
}
