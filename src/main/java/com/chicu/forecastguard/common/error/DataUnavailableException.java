package com.chicu.forecastguard.common.error;

/**
 * Недостаточно наблюдений для бэктеста (или они недоступны).
 */
public class DataUnavailableException extends ForecastGuardException {

    public DataUnavailableException(String parameter, String message) {
        super(parameter, message);
    }

    public DataUnavailableException(String parameter, String message, Throwable cause) {
        super(parameter, message, cause);
    }
}
