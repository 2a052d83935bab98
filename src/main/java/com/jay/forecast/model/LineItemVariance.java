package com.jay.forecast.model;

import com.jay.forecast.model.enums.AccuracyRating;
import com.jay.forecast.model.enums.LineItem;

/**
 * Forecast vs actual for one line item. {@code variance} is forecast − actual;
 * {@code percentVariance} is null when the actual is zero.
 */
public record LineItemVariance(LineItem lineItem, double forecast, double actual,
                               double variance, Double percentVariance, AccuracyRating rating) {

    public static LineItemVariance of(LineItem lineItem, double forecast, double actual) {
        double variance = forecast - actual;
        Double pct = actual != 0 ? variance / Math.abs(actual) * 100.0 : null;
        return new LineItemVariance(lineItem, forecast, actual, variance, pct, AccuracyRating.of(pct));
    }
}
