package com.jay.forecast.model;

/**
 * Run-level warning for a period whose residual, net of any imbalance carried from the
 * reported base year, exceeds the tolerance. Reported alongside the forecast, never thrown.
 */
public record BalanceCheckFailure(int year, double residual, double tolerance) {

    public static BalanceCheckFailure of(BalanceCheckResult check) {
        return new BalanceCheckFailure(check.year(), check.modelResidual(), check.tolerance());
    }

    public String message() {
        return String.format("Year %d out of balance by %.4f (tolerance %.4f)", year, residual, tolerance);
    }
}
