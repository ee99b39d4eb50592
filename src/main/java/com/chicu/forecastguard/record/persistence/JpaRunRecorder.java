package com.chicu.forecastguard.record.persistence;

import com.chicu.forecastguard.common.error.RecorderUnavailableException;
import com.chicu.forecastguard.record.RunParams;
import com.chicu.forecastguard.record.RunRecorder;
import com.chicu.forecastguard.retrain.RetrainDecision;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

/**
 * Аудит решений в БД: одна строка на параметр на цикл.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaRunRecorder implements RunRecorder {

    private final RetrainRunRepository repo;
    private final ObjectMapper objectMapper;

    @Override
    public String name() {
        return "jpa";
    }

    @Override
    @Transactional
    public void record(String parameter, RetrainDecision decision, double mae, Map<String, Object> extraParams) {
        try {
            RetrainRunEntity e = RetrainRunEntity.builder()
                    .parameter(parameter)
                    .decision(decision)
                    .state(RunParams.string(extraParams, RunParams.STATE))
                    .backtestMae(Double.isFinite(mae) ? mae : null)
                    .finalMae(RunParams.decimal(extraParams, RunParams.FINAL_MAE))
                    .attemptsUsed(RunParams.integer(extraParams, RunParams.ATTEMPTS_USED))
                    .retrainSuccess(RunParams.bool(extraParams, RunParams.RETRAIN_SUCCESS))
                    .extraJson(toJson(extraParams))
                    .build();

            RetrainRunEntity saved = repo.save(e);

            log.debug("🧾 RUN saved id={} param={} decision={} state={}",
                    saved.getId(), parameter, decision, saved.getState());

        } catch (RuntimeException ex) {
            throw new RecorderUnavailableException(parameter, "audit write failed: " + ex.getMessage(), ex);
        }
    }

    private String toJson(Map<String, Object> extraParams) {
        if (extraParams == null || extraParams.isEmpty()) return null;
        try {
            return objectMapper.writeValueAsString(extraParams);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("extra params are not serializable: " + e.getOriginalMessage(), e);
        }
    }
}
