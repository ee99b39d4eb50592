package com.chicu.forecastguard.common.error;

public class ModelUnavailableException extends ForecastGuardException {

    public ModelUnavailableException(String parameter, String message) {
        super(parameter, message);
    }

    public ModelUnavailableException(String parameter, String message, Throwable cause) {
        super(parameter, message, cause);
    }
}
