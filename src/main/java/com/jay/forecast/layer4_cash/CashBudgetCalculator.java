package com.jay.forecast.layer4_cash;

import com.jay.forecast.layer5_debt.FinancingDecision;
import com.jay.forecast.model.BalanceSheetPeriod;
import com.jay.forecast.model.CashBudgetPeriod;
import com.jay.forecast.model.ForecastAssumptions;
import com.jay.forecast.model.IncomeStatementPeriod;
import com.jay.forecast.model.WorkingCapitalPosition;
import com.jay.forecast.model.enums.AssumptionKey;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Layer 4 — Cash Budget Calculator.
 * Works in two passes per period. {@link #draft} computes operating, investing and
 * external (owner) flows and redeems last year's short-term investments, none of which
 * depend on this period's debt. {@link #close} takes the debt schedule's financing
 * decision, places part of any cash left above the threshold in short-term investments
 * and produces ending cash.
 */
@Component
@RequiredArgsConstructor
public class CashBudgetCalculator {

    private final WorkingCapitalProjector workingCapitalProjector;

    public CashBudgetDraft draft(IncomeStatementPeriod is, IncomeStatementPeriod priorIs,
                                 BalanceSheetPeriod priorBalance, ForecastAssumptions a) {
        // ── Operating ─────────────────────────────────────────────────────────
        WorkingCapitalPosition wc = workingCapitalProjector.project(is, a);
        WorkingCapitalPosition priorWc = new WorkingCapitalPosition(
            priorBalance.getAccountsReceivable(), priorBalance.getInventory(), priorBalance.getAccountsPayable());
        double deltaWc = wc.netWorkingCapital() - priorWc.netWorkingCapital();
        double operating = is.getNetIncome() + is.getDepreciation() - deltaWc;

        // ── Investing ─────────────────────────────────────────────────────────
        double capex = is.getRevenue() * a.get(AssumptionKey.CAPEX_PCT_REVENUE);
        double investing = -capex;

        double beginningCash = priorBalance.getCash();
        double minimumCash = minimumCash(is, a);

        // ── Short-term investments: last year's placement comes back this year ─
        double redemption = priorBalance.getShortTermInvestments();

        // ── External: distributions on last year's profit, equity for investment ─
        double dividends   = Math.max(0.0, priorIs.getNetIncome() * a.get(AssumptionKey.PAYOUT_RATIO));
        double repurchases = Math.max(0.0, priorIs.getNetIncome() * a.get(AssumptionKey.REPURCHASE_PCT_NET_INCOME));

        // capex not covered by operating cash or by liquidity already above the threshold
        double fundingNeed = Math.max(0.0,
            capex - Math.max(0.0, operating) - Math.max(0.0, beginningCash + redemption - minimumCash));
        double debtShare = a.get(AssumptionKey.PCT_FINANCING_WITH_DEBT);
        double equityIssued = fundingNeed * (1 - debtShare);
        double external = equityIssued - dividends - repurchases;

        return CashBudgetDraft.builder()
            .year(is.getYear())
            .beginningCash(beginningCash)
            .minimumCash(minimumCash)
            .netIncome(is.getNetIncome())
            .depreciation(is.getDepreciation())
            .workingCapital(wc)
            .changeInWorkingCapital(deltaWc)
            .operatingCashFlow(operating)
            .capitalExpenditure(capex)
            .investingCashFlow(investing)
            .dividendsPaid(dividends)
            .stockRepurchase(repurchases)
            .equityIssued(equityIssued)
            .externalCashFlow(external)
            .shortTermInvestmentRedemption(redemption)
            .excessCashInvestmentShare(a.get(AssumptionKey.ST_INVESTMENT_PCT_EXCESS))
            .investmentFundingNeed(fundingNeed)
            .longTermFunding(fundingNeed * debtShare)
            .build();
    }

    public CashBudgetPeriod close(CashBudgetDraft draft, FinancingDecision decision) {
        // only a period that needed no outside money invests its excess
        double placement = 0.0;
        boolean externallyFunded = decision.state().getShortTermDraw() > 0 || draft.getInvestmentFundingNeed() > 0;
        double excess = decision.preFinancingCash() + decision.discretionaryCashFlow() - draft.getMinimumCash();
        if (!externallyFunded && excess > 0) {
            placement = excess * draft.getExcessCashInvestmentShare();
        }
        double investmentFlow = draft.getShortTermInvestmentRedemption() - placement;

        double netChange = draft.getOperatingCashFlow() + draft.getInvestingCashFlow()
            + decision.financingCashFlow() + draft.getExternalCashFlow() + decision.discretionaryCashFlow()
            + investmentFlow;

        return CashBudgetPeriod.builder()
            .year(draft.getYear())
            .beginningCash(draft.getBeginningCash())
            .netIncome(draft.getNetIncome())
            .depreciation(draft.getDepreciation())
            .changeInWorkingCapital(draft.getChangeInWorkingCapital())
            .operatingCashFlow(draft.getOperatingCashFlow())
            .workingCapital(draft.getWorkingCapital())
            .capitalExpenditure(draft.getCapitalExpenditure())
            .investingCashFlow(draft.getInvestingCashFlow())
            .dividendsPaid(draft.getDividendsPaid())
            .stockRepurchase(draft.getStockRepurchase())
            .equityIssued(draft.getEquityIssued())
            .externalCashFlow(draft.getExternalCashFlow())
            .investmentFundingNeed(draft.getInvestmentFundingNeed())
            .longTermDraw(decision.state().getLongTermDraw())
            .longTermAmortization(decision.state().getLongTermAmortization())
            .financingCashFlow(decision.financingCashFlow())
            .preFinancingCash(decision.preFinancingCash())
            .minimumCash(draft.getMinimumCash())
            .shortTermDraw(decision.state().getShortTermDraw())
            .shortTermRepayment(decision.state().getShortTermRepayment())
            .discretionaryCashFlow(decision.discretionaryCashFlow())
            .shortTermInvestmentRedemption(draft.getShortTermInvestmentRedemption())
            .shortTermInvestment(placement)
            .shortTermInvestmentCashFlow(investmentFlow)
            .shortTermInvestmentEnding(placement)
            .netCashChange(netChange)
            .endingCash(draft.getBeginningCash() + netChange)
            .build();
    }

    /** The larger of the absolute floor and the revenue-scaled operating cash need. */
    public static double minimumCash(IncomeStatementPeriod is, ForecastAssumptions a) {
        return Math.max(a.get(AssumptionKey.MIN_CASH_FLOOR),
            is.getRevenue() * a.get(AssumptionKey.MIN_CASH_PCT_REVENUE));
    }
}
