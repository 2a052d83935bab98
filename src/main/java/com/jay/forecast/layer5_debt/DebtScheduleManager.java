package com.jay.forecast.layer5_debt;

import com.jay.forecast.exception.NegativeDebtException;
import com.jay.forecast.layer4_cash.CashBudgetDraft;
import com.jay.forecast.model.DebtScheduleState;
import com.jay.forecast.model.ForecastAssumptions;
import com.jay.forecast.model.LoanTranche;
import com.jay.forecast.model.enums.AssumptionKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Layer 5 — Debt Schedule Manager.
 *
 * Financing policy, applied in this order each period:
 *   1. Interest on beginning short- and long-term balances (fixed before the income statement).
 *   2. Scheduled long-term amortisation, one equal instalment per tranche over lt_loan_years.
 *   3. New long-term loan for the debt share of the investment funding need.
 *   4. Discretionary short-term debt against the minimum cash threshold: a shortfall is
 *      drawn exactly; a surplus repays short-term debt up to its balance and the rest stays in cash.
 *
 * Short-term debt absorbs every cash shortfall; long-term debt is only raised for investment
 * that operating cash and surplus cash cannot cover.
 */
@Slf4j
@Component
public class DebtScheduleManager {

    /** Interest for the coming period from the prior period's closing balances. */
    public double interestExpense(DebtScheduleState prior, ForecastAssumptions a) {
        return (prior.getShortTermEnding() + prior.getLongTermEnding()) * a.get(AssumptionKey.COST_OF_DEBT);
    }

    public FinancingDecision decide(DebtScheduleState prior, CashBudgetDraft draft, ForecastAssumptions a) {
        int year = draft.getYear();
        int loanYears = loanYears(a);
        List<String> anomalies = new ArrayList<>();

        // ── Long-term: scheduled amortisation ─────────────────────────────────
        double ltBeginning = prior.getLongTermEnding();
        double amortization = 0.0;
        List<LoanTranche> tranches = new ArrayList<>();
        for (LoanTranche tranche : prior.getTranches()) {
            double payment = tranche.scheduledPayment();
            if (payment <= 0) continue;
            try {
                payment = checkedRepayment("LT tranche " + tranche.originYear(), tranche.outstanding(), payment);
            } catch (NegativeDebtException e) {
                log.warn("{}: {}, clamped to outstanding, {} stays in cash",
                    year, e.getMessage(), String.format("%.2f", e.excess()));
                anomalies.add(year + ": " + e.getMessage() + " (clamped)");
                payment = e.getOutstanding();
            }
            amortization += payment;
            LoanTranche after = tranche.afterPayment(payment);
            if (after.outstanding() > 0) tranches.add(after);
        }

        // ── Long-term: new loan for investment ────────────────────────────────
        double ltDraw = Math.max(0.0, draft.getLongTermFunding());
        if (ltDraw > 0) {
            tranches.add(LoanTranche.open(year, ltDraw, loanYears));
        }
        double ltEnding = Math.max(0.0, ltBeginning + ltDraw - amortization);
        double financing = ltDraw - amortization;

        // ── Short-term: discretionary ─────────────────────────────────────────
        double stBeginning = prior.getShortTermEnding();
        double preFinancingCash = draft.cashBeforeDebt() + financing;
        double threshold = draft.getMinimumCash();
        double stDraw = 0.0;
        double stRepayment = 0.0;
        if (preFinancingCash < threshold) {
            stDraw = threshold - preFinancingCash;
        } else if (stBeginning > 0) {
            stRepayment = Math.min(preFinancingCash - threshold, stBeginning);
        }
        double stEnding = stBeginning + stDraw - stRepayment;
        double discretionary = stDraw - stRepayment;

        DebtScheduleState state = DebtScheduleState.builder()
            .year(year)
            .shortTermBeginning(stBeginning)
            .shortTermDraw(stDraw)
            .shortTermRepayment(stRepayment)
            .shortTermEnding(stEnding)
            .longTermBeginning(ltBeginning)
            .longTermDraw(ltDraw)
            .longTermAmortization(amortization)
            .longTermEnding(ltEnding)
            .costOfDebt(a.get(AssumptionKey.COST_OF_DEBT))
            .interestExpense(interestExpense(prior, a))
            .tranches(tranches)
            .anomalies(anomalies)
            .build();

        log.debug("{} debt: ST {} -> {} (draw {}, repay {}), LT {} -> {} (draw {}, amort {})",
            year, fmt(stBeginning), fmt(stEnding), fmt(stDraw), fmt(stRepayment),
            fmt(ltBeginning), fmt(ltEnding), fmt(ltDraw), fmt(amortization));
        return new FinancingDecision(state, financing, discretionary, preFinancingCash);
    }

    /** Returns {@code requested} unless it would take the balance below zero. */
    static double checkedRepayment(String tranche, double outstanding, double requested) {
        if (requested > outstanding) {
            throw new NegativeDebtException(tranche, outstanding, requested);
        }
        return requested;
    }

    private static int loanYears(ForecastAssumptions a) {
        return (int) Math.max(1, Math.round(a.get(AssumptionKey.LT_LOAN_YEARS)));
    }

    private static String fmt(double v) {
        return String.format("%.2f", v);
    }
}
