package com.chicu.forecastguard.common.error;

public class RecorderUnavailableException extends ForecastGuardException {

    public RecorderUnavailableException(String parameter, String message, Throwable cause) {
        super(parameter, message, cause);
    }
}
