package com.chicu.forecastguard.ml.sidecar;

import com.chicu.forecastguard.ml.sidecar.dto.LoadModelRequestDto;
import com.chicu.forecastguard.ml.sidecar.dto.PredictRequestDto;
import com.chicu.forecastguard.ml.sidecar.dto.PredictResponseDto;
import com.chicu.forecastguard.ml.sidecar.dto.SidecarAckDto;
import com.chicu.forecastguard.ml.sidecar.dto.TrainRequestDto;
import com.chicu.forecastguard.ml.sidecar.dto.TrainResponseDto;
import com.chicu.forecastguard.ml.sidecar.props.SidecarProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;

/**
 * HTTP-клиент python sidecar'а (torch-модель живёт там).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ForecastSidecarClient {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient baseClient;
    private final ObjectMapper objectMapper;
    private final SidecarProperties props;

    public TrainResponseDto train(TrainRequestDto req) {
        return post("/train", req, TrainResponseDto.class, props.getTrainTimeoutMs());
    }

    public SidecarAckDto loadModel(LoadModelRequestDto req) {
        return post("/models/load", req, SidecarAckDto.class, props.getReadTimeoutMs());
    }

    public PredictResponseDto predict(PredictRequestDto req) {
        return post("/predict", req, PredictResponseDto.class, props.getReadTimeoutMs());
    }

    public JsonNode health() {
        Request req = new Request.Builder()
                .url(url("/health"))
                .get()
                .build();

        try (Response resp = clientWithTimeouts(props.getReadTimeoutMs()).newCall(req).execute()) {
            if (!resp.isSuccessful()) {
                throw new IllegalStateException("ML sidecar /health HTTP " + resp.code());
            }
            String body = resp.body() != null ? resp.body().string() : "";
            return objectMapper.readTree(body);
        } catch (IOException e) {
            throw new IllegalStateException("ML sidecar /health failed: " + e.getMessage(), e);
        }
    }

    private OkHttpClient clientWithTimeouts(long readTimeoutMs) {
        return baseClient.newBuilder()
                .connectTimeout(Duration.ofMillis(Math.max(200, props.getConnectTimeoutMs())))
                .readTimeout(Duration.ofMillis(Math.max(500, readTimeoutMs)))
                .build();
    }

    private <T> T post(String path, Object body, Class<T> responseType, long readTimeoutMs) {
        String url = url(path);

        try {
            String json = objectMapper.writeValueAsString(body);

            Request.Builder rb = new Request.Builder()
                    .url(url)
                    .post(RequestBody.create(json, JSON));

            if (props.getApiKey() != null && !props.getApiKey().isBlank()) {
                rb.header("X-API-KEY", props.getApiKey().trim());
            }

            try (Response resp = clientWithTimeouts(readTimeoutMs).newCall(rb.build()).execute()) {

                String respBody = resp.body() != null ? resp.body().string() : "";

                if (!resp.isSuccessful()) {
                    log.warn("🧠 ML sidecar error: POST {} -> {} body={}", path, resp.code(), shrink(respBody));
                    throw new IllegalStateException("ML sidecar HTTP " + resp.code() + ": " + shrink(respBody));
                }

                if (respBody.isBlank()) {
                    throw new IllegalStateException("ML sidecar пустой ответ: " + path);
                }

                return objectMapper.readValue(respBody, responseType);
            }

        } catch (IOException e) {
            throw new IllegalStateException("ML sidecar IO error: " + url + " -> " + e.getMessage(), e);
        }
    }

    private String url(String path) {
        return props.getBaseUrl().replaceAll("/+$", "") + path;
    }

    static String shrink(String s) {
        if (s == null) return "null";
        String x = s.trim().replaceAll("\\s+", " ");
        if (x.length() <= 400) return x;
        return x.substring(0, 400) + "...";
    }
}
