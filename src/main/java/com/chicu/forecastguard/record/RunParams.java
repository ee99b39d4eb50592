package com.chicu.forecastguard.record;

import com.chicu.forecastguard.retrain.RetrainOutcome;
import lombok.experimental.UtilityClass;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ключи extraParams, которые понимают все рекордеры.
 */
@UtilityClass
public class RunParams {

    public static final String STATE = "state";
    public static final String RETRAIN_SUCCESS = "retrain_success";
    public static final String ATTEMPTS_USED = "attempts_used";
    public static final String FINAL_MAE = "final_mae";
    public static final String ERROR = "error";

    public static Map<String, Object> of(RetrainOutcome o) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put(STATE, o.state() != null ? o.state().name() : null);
        m.put(ATTEMPTS_USED, o.attemptsUsed());
        m.put(RETRAIN_SUCCESS, o.succeeded());
        if (Double.isFinite(o.finalMae())) m.put(FINAL_MAE, o.finalMae());
        if (o.error() != null) m.put(ERROR, o.error());
        return m;
    }

    public static String string(Map<String, Object> params, String key) {
        Object v = params != null ? params.get(key) : null;
        return v != null ? v.toString() : null;
    }

    public static Integer integer(Map<String, Object> params, String key) {
        Object v = params != null ? params.get(key) : null;
        if (v instanceof Number n) return n.intValue();
        return v != null ? Integer.valueOf(v.toString()) : null;
    }

    public static Double decimal(Map<String, Object> params, String key) {
        Object v = params != null ? params.get(key) : null;
        if (v instanceof Number n) return n.doubleValue();
        return v != null ? Double.valueOf(v.toString()) : null;
    }

    public static Boolean bool(Map<String, Object> params, String key) {
        Object v = params != null ? params.get(key) : null;
        if (v instanceof Boolean b) return b;
        return v != null ? Boolean.valueOf(v.toString()) : null;
    }
}
