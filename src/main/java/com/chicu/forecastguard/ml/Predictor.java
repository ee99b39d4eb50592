package com.chicu.forecastguard.ml;

public interface Predictor {

    /**
     * Прогноз на нормализованном окне.
     *
     * @throws com.chicu.forecastguard.common.error.ModelUnavailableException нет весов для параметра
     */
    double[] forecast(String parameter, double[] normalizedWindow);
}
