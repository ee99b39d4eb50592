package com.chicu.forecastguard.common.error;

/**
 * Транспортная ошибка источника временных рядов.
 */
public class SourceUnavailableException extends DataUnavailableException {

    public SourceUnavailableException(String parameter, String message) {
        super(parameter, message);
    }

    public SourceUnavailableException(String parameter, String message, Throwable cause) {
        super(parameter, message, cause);
    }
}
