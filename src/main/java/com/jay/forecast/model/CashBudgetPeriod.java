package com.jay.forecast.model;

import lombok.Builder;
import lombok.Value;

/**
 * One year of the cash budget. Ending cash is always
 * beginning + operating + investing + financing + external + discretionary
 * + short-term investment flow.
 */
@Value
@Builder
public class CashBudgetPeriod {
    int year;
    double beginningCash;

    // ── Operating ─────────────────────────────────────────────────────────────
    double netIncome;
    double depreciation;
    double changeInWorkingCapital;
    double operatingCashFlow;
    WorkingCapitalPosition workingCapital;

    // ── Investing ─────────────────────────────────────────────────────────────
    double capitalExpenditure;
    double investingCashFlow;

    // ── External (owners) ─────────────────────────────────────────────────────
    double dividendsPaid;
    double stockRepurchase;
    double equityIssued;
    double externalCashFlow;

    // ── Financing (long-term debt) ────────────────────────────────────────────
    double investmentFundingNeed;
    double longTermDraw;
    double longTermAmortization;
    double financingCashFlow;

    // ── Discretionary (short-term debt) ───────────────────────────────────────
    double preFinancingCash;
    double minimumCash;
    double shortTermDraw;
    double shortTermRepayment;
    double discretionaryCashFlow;

    // ── Short-term investments ────────────────────────────────────────────────
    double shortTermInvestmentRedemption;   // last year's placement, returned at par
    double shortTermInvestment;             // placed this year out of excess cash
    double shortTermInvestmentCashFlow;
    double shortTermInvestmentEnding;

    double netCashChange;
    double endingCash;
}
