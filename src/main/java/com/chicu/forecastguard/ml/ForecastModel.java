package com.chicu.forecastguard.ml;

/**
 * Загруженная модель одного параметра. Чистая функция окна.
 */
public interface ForecastModel {

    String parameter();

    String versionId();

    /**
     * @param normalizedWindow нормализованное окно длины T_IN
     * @return нормализованный прогноз длины T_OUT
     */
    double[] forecast(double[] normalizedWindow);
}
