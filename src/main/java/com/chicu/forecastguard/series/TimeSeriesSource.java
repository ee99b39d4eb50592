package com.chicu.forecastguard.series;

import com.chicu.forecastguard.common.error.SourceUnavailableException;

import java.util.List;

public interface TimeSeriesSource {

    /**
     * Последние (до windowLength) очищенных наблюдений по параметру, по возрастанию времени.
     * Пропусков и sentinel-значений в ответе нет. Может вернуть меньше windowLength.
     *
     * @throws SourceUnavailableException транспортная ошибка
     */
    List<Observation> fetch(String parameter, int windowLength);
}
