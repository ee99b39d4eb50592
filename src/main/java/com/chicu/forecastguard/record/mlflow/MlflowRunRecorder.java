package com.chicu.forecastguard.record.mlflow;

import com.chicu.forecastguard.common.error.RecorderUnavailableException;
import com.chicu.forecastguard.record.RunParams;
import com.chicu.forecastguard.record.RunRecorder;
import com.chicu.forecastguard.retrain.RetrainDecision;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Запись решений цикла в MLflow через REST API 2.0:
 * один run на параметр, run name = T2M_daily_retrain_20261019.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "mlops.mlflow", name = "enabled", havingValue = "true")
public class MlflowRunRecorder implements RunRecorder {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final DateTimeFormatter DAY = DateTimeFormatter.BASIC_ISO_DATE.withZone(ZoneOffset.UTC);

    private final OkHttpClient http;
    private final ObjectMapper om;
    private final MlflowProperties props;
    private final Clock clock;

    private volatile String experimentId;

    public MlflowRunRecorder(OkHttpClient baseClient, ObjectMapper om, MlflowProperties props, Clock clock) {
        this.http = baseClient.newBuilder()
                .callTimeout(Duration.ofMillis(Math.max(500, props.getTimeoutMs())))
                .build();
        this.om = om;
        this.props = props;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "mlflow";
    }

    @Override
    public void record(String parameter, RetrainDecision decision, double mae, Map<String, Object> extraParams) {
        try {
            long now = clock.millis();
            String runName = parameter + "_daily_retrain_" + DAY.format(clock.instant());

            Map<String, Object> create = new LinkedHashMap<>();
            create.put("experiment_id", experimentId());
            create.put("start_time", now);
            create.put("run_name", runName);
            create.put("tags", List.of(Map.of("key", "mlflow.runName", "value", runName)));

            String runId = post("/api/2.0/mlflow/runs/create", create).path("run").path("info").path("run_id").asText();
            if (runId.isBlank()) {
                throw new IllegalStateException("MLflow runs/create без run_id");
            }

            Map<String, Object> batch = new LinkedHashMap<>();
            batch.put("run_id", runId);
            batch.put("params", params(parameter, decision, extraParams));
            batch.put("metrics", metrics(mae, extraParams, now));
            post("/api/2.0/mlflow/runs/log-batch", batch);

            post("/api/2.0/mlflow/runs/update", Map.of(
                    "run_id", runId,
                    "status", "FINISHED",
                    "end_time", clock.millis()
            ));

            log.debug("🧾 MLFLOW run={} param={} decision={}", runId, parameter, decision);

        } catch (RuntimeException e) {
            throw new RecorderUnavailableException(parameter, "mlflow: " + e.getMessage(), e);
        }
    }

    static List<Map<String, Object>> params(String parameter, RetrainDecision decision, Map<String, Object> extra) {
        List<Map<String, Object>> out = new ArrayList<>();
        out.add(param("parameter", parameter));
        out.add(param("retrain_decision", decision != null ? decision.name() : "FAILED"));
        if (decision == RetrainDecision.RETRAIN_ATTEMPTED) {
            out.add(param(RunParams.RETRAIN_SUCCESS, String.valueOf(RunParams.bool(extra, RunParams.RETRAIN_SUCCESS))));
        }
        String state = RunParams.string(extra, RunParams.STATE);
        if (state != null) out.add(param(RunParams.STATE, state));
        Integer attempts = RunParams.integer(extra, RunParams.ATTEMPTS_USED);
        if (attempts != null) out.add(param(RunParams.ATTEMPTS_USED, String.valueOf(attempts)));
        String error = RunParams.string(extra, RunParams.ERROR);
        // у MLflow лимит на длину значения параметра
        if (error != null) out.add(param(RunParams.ERROR, error.length() > 250 ? error.substring(0, 250) : error));
        return out;
    }

    static List<Map<String, Object>> metrics(double mae, Map<String, Object> extra, long ts) {
        List<Map<String, Object>> out = new ArrayList<>();
        if (Double.isFinite(mae)) out.add(metric("backtest_mae", mae, ts));
        Double finalMae = RunParams.decimal(extra, RunParams.FINAL_MAE);
        if (finalMae != null && Double.isFinite(finalMae)) out.add(metric(RunParams.FINAL_MAE, finalMae, ts));
        return out;
    }

    private String experimentId() {
        String id = experimentId;
        if (id != null) return id;

        synchronized (this) {
            if (experimentId != null) return experimentId;

            HttpUrl url = HttpUrl.get(base() + "/api/2.0/mlflow/experiments/get-by-name").newBuilder()
                    .addQueryParameter("experiment_name", props.getExperimentName())
                    .build();

            try (Response resp = http.newCall(new Request.Builder().url(url).get().build()).execute()) {
                String body = resp.body() != null ? resp.body().string() : "";
                if (resp.isSuccessful()) {
                    experimentId = om.readTree(body).path("experiment").path("experiment_id").asText();
                } else if (resp.code() == 404) {
                    experimentId = post("/api/2.0/mlflow/experiments/create",
                            Map.of("name", props.getExperimentName())).path("experiment_id").asText();
                    log.info("🧾 MLFLOW experiment created name={} id={}", props.getExperimentName(), experimentId);
                } else {
                    throw new IllegalStateException("MLflow get-by-name HTTP " + resp.code());
                }
            } catch (IOException e) {
                throw new IllegalStateException("MLflow IO error: " + e.getMessage(), e);
            }
            return experimentId;
        }
    }

    private JsonNode post(String path, Object payload) {
        try {
            RequestBody rb = RequestBody.create(om.writeValueAsString(payload), JSON);
            Request req = new Request.Builder().url(base() + path).post(rb).build();

            try (Response resp = http.newCall(req).execute()) {
                String body = resp.body() != null ? resp.body().string() : "";
                if (!resp.isSuccessful()) {
                    throw new IllegalStateException("MLflow " + path + " HTTP " + resp.code() + " body=" + body);
                }
                return body.isBlank() ? om.createObjectNode() : om.readTree(body);
            }
        } catch (IOException e) {
            throw new IllegalStateException("MLflow POST " + path + " failed: " + e.getMessage(), e);
        }
    }

    private String base() {
        return props.getTrackingUri().replaceAll("/+$", "");
    }

    private static Map<String, Object> param(String key, String value) {
        return Map.of("key", key, "value", value != null ? value : "");
    }

    private static Map<String, Object> metric(String key, double value, long ts) {
        return Map.of("key", key, "value", value, "timestamp", ts, "step", 0);
    }
}
