package com.chicu.forecastguard.ml;

import com.chicu.forecastguard.common.util.ParameterCodes;
import com.chicu.forecastguard.weights.WeightArtifact;
import com.chicu.forecastguard.weights.WeightStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Кеш загруженных моделей: одна модель на параметр, грузится один раз из "latest".
 * Сбрасывается, когда "latest" меняется (новые веса или откат).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ModelRegistry {

    private final WeightStore weightStore;
    private final ForecastModelLoader loader;

    private final Map<String, ForecastModel> models = new ConcurrentHashMap<>();

    public ForecastModel get(String parameter) {
        String p = ParameterCodes.normalize(parameter);
        return models.computeIfAbsent(p, this::load);
    }

    public Optional<String> loadedVersion(String parameter) {
        ForecastModel m = models.get(ParameterCodes.normalize(parameter));
        return Optional.ofNullable(m).map(ForecastModel::versionId);
    }

    public void invalidate(String parameter) {
        String p = ParameterCodes.normalize(parameter);
        ForecastModel removed = models.remove(p);
        if (removed != null) {
            log.info("🧠 MODEL EVICT param={} version={}", p, removed.versionId());
        }
    }

    private ForecastModel load(String p) {
        WeightArtifact artifact = weightStore.readLatest(p);
        ForecastModel model = loader.load(artifact);
        log.info("🧠 MODEL LOADED param={} version={} bytes={}", p, artifact.versionId(), artifact.size());
        return model;
    }
}
