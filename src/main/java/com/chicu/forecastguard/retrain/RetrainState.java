package com.chicu.forecastguard.retrain;

/**
 * Состояния автомата ретрейна одного параметра.
 * Терминальные: HEALTHY, SKIPPED_NO_AUTOMATION, SUCCEEDED, EXHAUSTED, FAILED.
 */
public enum RetrainState {
    EVALUATING,
    HEALTHY,
    UNHEALTHY,
    SKIPPED_NO_AUTOMATION,
    RETRAINING,
    SUCCEEDED,
    EXHAUSTED,
    /** цикл параметра оборвался неожиданной ошибкой, исход неизвестен */
    FAILED;

    public boolean terminal() {
        return this != EVALUATING && this != UNHEALTHY && this != RETRAINING;
    }
}
