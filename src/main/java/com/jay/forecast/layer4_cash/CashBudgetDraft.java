package com.jay.forecast.layer4_cash;

import com.jay.forecast.model.WorkingCapitalPosition;
import lombok.Builder;
import lombok.Value;

/**
 * The cash budget before any debt activity: operating, investing and owner flows, the
 * redemption of last year's short-term investments, plus the long-term funding requested
 * for investment. Handed to the debt schedule,
 * which decides the financing that closes the period.
 */
@Value
@Builder
public class CashBudgetDraft {
    int year;
    double beginningCash;
    double minimumCash;

    double netIncome;
    double depreciation;
    WorkingCapitalPosition workingCapital;
    double changeInWorkingCapital;
    double operatingCashFlow;

    double capitalExpenditure;
    double investingCashFlow;

    double dividendsPaid;
    double stockRepurchase;
    double equityIssued;
    double externalCashFlow;

    double shortTermInvestmentRedemption;
    double excessCashInvestmentShare;

    double investmentFundingNeed;
    double longTermFunding;

    /** Cash after operating, investing, owner flows and redemptions, before any debt movement. */
    public double cashBeforeDebt() {
        return beginningCash + operatingCashFlow + investingCashFlow + externalCashFlow
            + shortTermInvestmentRedemption;
    }
}
