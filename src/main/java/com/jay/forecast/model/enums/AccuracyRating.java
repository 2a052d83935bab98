package com.jay.forecast.model.enums;

public enum AccuracyRating {
    EXCELLENT,
    GOOD,
    ACCEPTABLE,
    NEEDS_IMPROVEMENT,
    NOT_RATED;

    /** Rates an absolute percentage variance: &lt;1% excellent, &lt;5% good, &lt;10% acceptable. */
    public static AccuracyRating of(Double percentVariance) {
        if (percentVariance == null) return NOT_RATED;
        double abs = Math.abs(percentVariance);
        if (abs < 1)  return EXCELLENT;
        if (abs < 5)  return GOOD;
        if (abs < 10) return ACCEPTABLE;
        return NEEDS_IMPROVEMENT;
    }
}
