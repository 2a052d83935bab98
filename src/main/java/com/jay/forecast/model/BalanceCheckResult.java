package com.jay.forecast.model;

/**
 * Assets − (liabilities + equity) for one period. {@code carriedResidual} is the
 * imbalance already present in the reported base year; only the part of the residual
 * the model added on top of it counts against the tolerance.
 */
public record BalanceCheckResult(int year, double totalAssets, double totalLiabilitiesAndEquity,
                                 double residual, double carriedResidual, double tolerance) {

    public double modelResidual() {
        return residual - carriedResidual;
    }

    public boolean passed() {
        return Math.abs(modelResidual()) <= tolerance;
    }
}
