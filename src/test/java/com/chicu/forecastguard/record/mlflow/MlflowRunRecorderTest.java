package com.chicu.forecastguard.record.mlflow;

import com.chicu.forecastguard.record.RunParams;
import com.chicu.forecastguard.retrain.RetrainDecision;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MlflowRunRecorderTest {

    @Test
    void params_includeSuccessFlagOnlyForAttemptedRetrain() {
        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put(RunParams.STATE, "EXHAUSTED");
        extra.put(RunParams.ATTEMPTS_USED, 3);
        extra.put(RunParams.RETRAIN_SUCCESS, false);

        List<Map<String, Object>> attempted = MlflowRunRecorder.params("T2M", RetrainDecision.RETRAIN_ATTEMPTED, extra);
        assertTrue(attempted.contains(Map.of("key", "retrain_decision", "value", "RETRAIN_ATTEMPTED")));
        assertTrue(attempted.contains(Map.of("key", RunParams.RETRAIN_SUCCESS, "value", "false")));
        assertTrue(attempted.contains(Map.of("key", RunParams.ATTEMPTS_USED, "value", "3")));

        List<Map<String, Object>> skipped = MlflowRunRecorder.params("T2M", RetrainDecision.SKIPPED, Map.of());
        assertTrue(skipped.stream().noneMatch(m -> RunParams.RETRAIN_SUCCESS.equals(m.get("key"))));
    }

    @Test
    void params_withoutDecision_areLoggedAsFailed_andLongErrorsAreCut() {
        Map<String, Object> extra = Map.of(RunParams.ERROR, "e".repeat(600));

        List<Map<String, Object>> out = MlflowRunRecorder.params("WS2M", null, extra);

        assertTrue(out.contains(Map.of("key", "retrain_decision", "value", "FAILED")));
        String error = out.stream()
                .filter(m -> RunParams.ERROR.equals(m.get("key")))
                .map(m -> (String) m.get("value"))
                .findFirst().orElseThrow();
        assertEquals(250, error.length());
    }

    @Test
    void metrics_skipNonFiniteValues() {
        assertTrue(MlflowRunRecorder.metrics(Double.NaN, Map.of(), 1L).isEmpty());

        List<Map<String, Object>> out = MlflowRunRecorder.metrics(7.5, Map.of(RunParams.FINAL_MAE, 1.5), 1L);

        assertEquals(2, out.size());
        assertEquals("backtest_mae", out.get(0).get("key"));
        assertEquals(7.5, out.get(0).get("value"));
        assertEquals(RunParams.FINAL_MAE, out.get(1).get("key"));
    }
}
