package com.chicu.forecastguard.ml;

import com.chicu.forecastguard.common.error.TrainingFailedException;
import com.chicu.forecastguard.common.util.ParameterCodes;
import com.chicu.forecastguard.health.HealthProperties;
import com.chicu.forecastguard.ml.sidecar.ForecastSidecarClient;
import com.chicu.forecastguard.ml.sidecar.dto.TrainRequestDto;
import com.chicu.forecastguard.ml.sidecar.dto.TrainResponseDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Base64;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class SidecarModelTrainer implements ModelTrainer {

    private final ForecastSidecarClient client;
    private final HealthProperties healthProps;

    @Override
    public TrainedModel train(String parameter) {
        String p = ParameterCodes.normalize(parameter);

        TrainRequestDto req = TrainRequestDto.builder()
                .parameter(p)
                .inputWindow(healthProps.getInputWindow())
                .horizon(healthProps.getHorizon())
                .meta(Map.of("source", "forecast-guard"))
                .build();

        long started = System.currentTimeMillis();
        TrainResponseDto resp;
        try {
            resp = client.train(req);
        } catch (RuntimeException e) {
            throw new TrainingFailedException(p, "sidecar train failed: " + e.getMessage(), e);
        }

        TrainedModel model = toTrainedModel(p, resp);
        log.info("🧠 TRAIN OK param={} bytes={} testMse={} testMae={} tookMs={}",
                p, model.payload().length, model.testMse(), model.testMae(),
                System.currentTimeMillis() - started);
        return model;
    }

    static TrainedModel toTrainedModel(String p, TrainResponseDto resp) {
        if (resp == null) {
            throw new TrainingFailedException(p, "train resp=null");
        }
        if (!resp.isOk()) {
            throw new TrainingFailedException(p, "train not ok: " + ParameterCodes.safe(resp.getMessage()));
        }
        if (resp.getWeightsBase64() == null || resp.getWeightsBase64().isBlank()) {
            throw new TrainingFailedException(p, "train returned empty weights");
        }

        double mse = resp.getTestMse() != null ? resp.getTestMse() : Double.NaN;
        double mae = resp.getTestMae() != null ? resp.getTestMae() : Double.NaN;
        if (!Double.isFinite(mse) || !Double.isFinite(mae)) {
            throw new TrainingFailedException(p, "non-finite training metrics mse=" + mse + " mae=" + mae);
        }

        byte[] payload;
        try {
            payload = Base64.getDecoder().decode(resp.getWeightsBase64().trim());
        } catch (IllegalArgumentException e) {
            throw new TrainingFailedException(p, "weights are not valid base64", e);
        }

        return TrainedModel.builder()
                .parameter(p)
                .payload(payload)
                .testMse(mse)
                .testMae(mae)
                .message(resp.getMessage())
                .build();
    }
}
