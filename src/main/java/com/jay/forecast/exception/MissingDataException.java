package com.jay.forecast.exception;

/** A required historical file, year or field is absent. */
public class MissingDataException extends ForecastException {

    public MissingDataException(String message) {
        super(message);
    }

    public MissingDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
