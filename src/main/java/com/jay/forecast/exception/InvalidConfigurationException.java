package com.jay.forecast.exception;

public class InvalidConfigurationException extends ForecastException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
