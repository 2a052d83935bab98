package com.jay.forecast.exception;

/**
 * Base type for every failure raised by the forecasting pipeline.
 * Subclasses thrown before projection abort the run; {@link NegativeDebtException}
 * is the only one recovered inside a period.
 */
public abstract class ForecastException extends RuntimeException {

    protected ForecastException(String message) {
        super(message);
    }

    protected ForecastException(String message, Throwable cause) {
        super(message, cause);
    }
}
