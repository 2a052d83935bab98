package com.jay.forecast.exception;

import lombok.Getter;

/**
 * A repayment larger than the outstanding balance. The debt schedule catches this,
 * clamps the repayment to the balance and records the event on the period.
 */
@Getter
public class NegativeDebtException extends ForecastException {

    private final String tranche;
    private final double outstanding;
    private final double requestedRepayment;

    public NegativeDebtException(String tranche, double outstanding, double requestedRepayment) {
        super(String.format("%s repayment %.2f exceeds outstanding balance %.2f",
            tranche, requestedRepayment, outstanding));
        this.tranche = tranche;
        this.outstanding = outstanding;
        this.requestedRepayment = requestedRepayment;
    }

    public double excess() { return requestedRepayment - outstanding; }
}
