package com.jay.forecast.engine;

import com.jay.forecast.model.ForecastResult;

/** Result of one company in a batch run: either a forecast or the reason it failed. */
public record ForecastOutcome(String companyKey, ForecastResult result, String errorMessage) {

    public static ForecastOutcome success(String companyKey, ForecastResult result) {
        return new ForecastOutcome(companyKey, result, null);
    }

    public static ForecastOutcome failure(String companyKey, String errorMessage) {
        return new ForecastOutcome(companyKey, null, errorMessage);
    }

    public boolean succeeded() { return result != null; }
}
