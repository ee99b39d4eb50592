package com.chicu.forecastguard.record;

import com.chicu.forecastguard.retrain.RetrainDecision;

import java.util.Map;

/**
 * Журнал решений цикла (аудит / трекинг экспериментов). Fire-and-forget.
 */
public interface RunRecorder {

    String name();

    /**
     * @param decision    null, если цикл параметра оборвался до решения
     * @param extraParams ключи из {@link RunParams}
     * @throws com.chicu.forecastguard.common.error.RecorderUnavailableException бэкенд журнала недоступен
     */
    void record(String parameter, RetrainDecision decision, double mae, Map<String, Object> extraParams);
}
