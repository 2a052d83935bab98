package com.jay.forecast.model;

/** A long-term loan amortised in equal annual instalments. */
public record LoanTranche(int originYear, double principal, double annualPayment, double outstanding) {

    public static LoanTranche open(int originYear, double principal, int termYears) {
        return new LoanTranche(originYear, principal, principal / termYears, principal);
    }

    /**
     * The next instalment. The last one settles the outstanding balance when the two
     * differ only by floating-point residue of {@code principal / termYears}.
     */
    public double scheduledPayment() {
        if (outstanding <= 0) return 0.0;
        if (annualPayment > outstanding && annualPayment - outstanding <= residue()) {
            return outstanding;
        }
        return annualPayment;
    }

    public LoanTranche afterPayment(double paid) {
        double remaining = outstanding - paid;
        // rounding residue after the last instalment
        if (remaining < residue()) remaining = 0.0;
        return new LoanTranche(originYear, principal, annualPayment, remaining);
    }

    private double residue() {
        return RESIDUE * Math.max(1.0, principal);
    }

    private static final double RESIDUE = 1e-9;
}
