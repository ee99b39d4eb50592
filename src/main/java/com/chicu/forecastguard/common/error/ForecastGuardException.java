package com.chicu.forecastguard.common.error;

/**
 * Базовое исключение сервиса. Всегда привязано к конкретному параметру,
 * чтобы в логах цикла было видно, чья модель упала.
 */
public class ForecastGuardException extends RuntimeException {

    private final String parameter;

    public ForecastGuardException(String parameter, String message) {
        super("[" + parameter + "] " + message);
        this.parameter = parameter;
    }

    public ForecastGuardException(String parameter, String message, Throwable cause) {
        super("[" + parameter + "] " + message, cause);
        this.parameter = parameter;
    }

    public String getParameter() {
        return parameter;
    }
}
