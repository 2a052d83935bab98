package com.jay.forecast.layer5_debt;

import com.jay.forecast.model.DebtScheduleState;

/**
 * The debt schedule's answer for one period: the updated balances plus the two cash-flow
 * components it owns. {@code preFinancingCash} is the position the short-term decision was
 * taken against (after long-term flows, before short-term ones).
 */
public record FinancingDecision(DebtScheduleState state,
                                double financingCashFlow,
                                double discretionaryCashFlow,
                                double preFinancingCash) {
}
