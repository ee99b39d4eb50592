package com.chicu.forecastguard.ml;

import com.chicu.forecastguard.common.error.ModelUnavailableException;
import com.chicu.forecastguard.health.HealthProperties;
import com.chicu.forecastguard.ml.sidecar.ForecastSidecarClient;
import com.chicu.forecastguard.ml.sidecar.dto.LoadModelRequestDto;
import com.chicu.forecastguard.ml.sidecar.dto.PredictRequestDto;
import com.chicu.forecastguard.ml.sidecar.dto.PredictResponseDto;
import com.chicu.forecastguard.ml.sidecar.dto.SidecarAckDto;
import com.chicu.forecastguard.weights.WeightArtifact;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Base64;

/**
 * Модель живёт в sidecar: при загрузке отдаём ему веса один раз,
 * дальше прогнозы идут по modelKey.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SidecarForecastModelLoader implements ForecastModelLoader {

    private final ForecastSidecarClient client;
    private final HealthProperties healthProps;

    @Override
    public ForecastModel load(WeightArtifact artifact) {
        String p = artifact.parameter();
        String modelKey = modelKey(p, artifact.versionId());

        SidecarAckDto ack;
        try {
            ack = client.loadModel(LoadModelRequestDto.builder()
                    .modelKey(modelKey)
                    .parameter(p)
                    .modelVersion(artifact.versionId())
                    .weightsBase64(Base64.getEncoder().encodeToString(artifact.payload()))
                    .build());
        } catch (RuntimeException e) {
            throw new ModelUnavailableException(p, "sidecar load failed: " + e.getMessage(), e);
        }

        if (ack == null || !ack.isOk()) {
            throw new ModelUnavailableException(p, "sidecar rejected weights " + artifact.versionId()
                    + ": " + (ack != null ? ack.getMessage() : "null"));
        }

        return new SidecarForecastModel(p, artifact.versionId(), modelKey);
    }

    static String modelKey(String parameter, String versionId) {
        return parameter + "|" + (versionId != null ? versionId : "unknown");
    }

    private final class SidecarForecastModel implements ForecastModel {

        private final String parameter;
        private final String versionId;
        private final String modelKey;

        private SidecarForecastModel(String parameter, String versionId, String modelKey) {
            this.parameter = parameter;
            this.versionId = versionId;
            this.modelKey = modelKey;
        }

        @Override
        public String parameter() {
            return parameter;
        }

        @Override
        public String versionId() {
            return versionId;
        }

        @Override
        public double[] forecast(double[] normalizedWindow) {
            PredictResponseDto resp;
            try {
                resp = client.predict(PredictRequestDto.builder()
                        .modelKey(modelKey)
                        .window(normalizedWindow)
                        .horizon(healthProps.getHorizon())
                        .build());
            } catch (RuntimeException e) {
                log.warn("🧠 PREDICT FAIL modelKey={} err={}", modelKey, e.toString());
                throw new ModelUnavailableException(parameter, "predict exception: " + e.getMessage(), e);
            }

            if (resp == null || !resp.isOk() || resp.getForecast() == null) {
                String msg = resp != null ? resp.getMessage() : "predict resp=null";
                log.warn("🧠 PREDICT not ok modelKey={} msg={}", modelKey, msg);
                throw new ModelUnavailableException(parameter, "predict failed: " + msg);
            }
            return resp.getForecast();
        }
    }
}
