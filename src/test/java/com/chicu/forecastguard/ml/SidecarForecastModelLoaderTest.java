package com.chicu.forecastguard.ml;

import com.chicu.forecastguard.common.error.ModelUnavailableException;
import com.chicu.forecastguard.health.HealthProperties;
import com.chicu.forecastguard.ml.sidecar.ForecastSidecarClient;
import com.chicu.forecastguard.ml.sidecar.dto.LoadModelRequestDto;
import com.chicu.forecastguard.ml.sidecar.dto.PredictRequestDto;
import com.chicu.forecastguard.ml.sidecar.dto.PredictResponseDto;
import com.chicu.forecastguard.ml.sidecar.dto.SidecarAckDto;
import com.chicu.forecastguard.weights.WeightArtifact;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SidecarForecastModelLoaderTest {

    @Mock private ForecastSidecarClient client;

    private SidecarForecastModelLoader loader;
    private WeightArtifact artifact;

    @BeforeEach
    void setUp() {
        loader = new SidecarForecastModelLoader(client, new HealthProperties());
        artifact = WeightArtifact.builder()
                .parameter("T2M")
                .versionId("v20261019_060000_000")
                .payload(new byte[]{1, 2})
                .createdAt(Instant.parse("2026-10-19T06:00:00Z"))
                .build();
    }

    @Test
    void load_registersWeights_andForecastUsesModelKey() {
        when(client.loadModel(any())).thenReturn(SidecarAckDto.builder().ok(true).build());
        when(client.predict(any())).thenReturn(PredictResponseDto.builder().ok(true).forecast(new double[10]).build());

        ForecastModel model = loader.load(artifact);
        double[] f = model.forecast(new double[60]);

        ArgumentCaptor<LoadModelRequestDto> load = ArgumentCaptor.forClass(LoadModelRequestDto.class);
        verify(client).loadModel(load.capture());
        assertEquals("T2M|v20261019_060000_000", load.getValue().getModelKey());
        assertEquals("AQI=", load.getValue().getWeightsBase64());

        ArgumentCaptor<PredictRequestDto> predict = ArgumentCaptor.forClass(PredictRequestDto.class);
        verify(client).predict(predict.capture());
        assertEquals("T2M|v20261019_060000_000", predict.getValue().getModelKey());
        assertEquals(10, predict.getValue().getHorizon());

        assertEquals(10, f.length);
        assertEquals("v20261019_060000_000", model.versionId());
    }

    @Test
    void rejectedWeights_areModelUnavailable() {
        when(client.loadModel(any())).thenReturn(SidecarAckDto.builder().ok(false).message("shape mismatch").build());

        ModelUnavailableException ex = assertThrows(ModelUnavailableException.class, () -> loader.load(artifact));
        assertTrue(ex.getMessage().contains("shape mismatch"));
    }

    @Test
    void predictFailure_isModelUnavailable() {
        when(client.loadModel(any())).thenReturn(SidecarAckDto.builder().ok(true).build());
        when(client.predict(any()))
                .thenReturn(PredictResponseDto.fail("model not loaded"))
                .thenThrow(new IllegalStateException("ML sidecar IO error"));

        ForecastModel model = loader.load(artifact);

        assertThrows(ModelUnavailableException.class, () -> model.forecast(new double[60]));
        assertThrows(ModelUnavailableException.class, () -> model.forecast(new double[60]));
    }
}
