package com.jay.forecast.exception;

import com.jay.forecast.model.enums.AssumptionKey;
import lombok.Getter;

/** Fewer historical years are available than a derived assumption needs. */
@Getter
public class InsufficientHistoryException extends ForecastException {

    private final AssumptionKey assumption;
    private final int requiredYears;
    private final int availableYears;

    public InsufficientHistoryException(AssumptionKey assumption, int requiredYears, int availableYears) {
        super(String.format("Cannot derive %s: requires %d historical year(s), only %d available",
            assumption.configName(), requiredYears, availableYears));
        this.assumption = assumption;
        this.requiredYears = requiredYears;
        this.availableYears = availableYears;
    }
}
