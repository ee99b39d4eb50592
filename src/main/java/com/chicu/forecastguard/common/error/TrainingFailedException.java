package com.chicu.forecastguard.common.error;

/**
 * Обучение упало или вернуло мусор (пустые веса, NaN/Inf в метриках).
 * Для цикла ретрейна это просто неудачная попытка.
 */
public class TrainingFailedException extends ForecastGuardException {

    public TrainingFailedException(String parameter, String message) {
        super(parameter, message);
    }

    public TrainingFailedException(String parameter, String message, Throwable cause) {
        super(parameter, message, cause);
    }
}
