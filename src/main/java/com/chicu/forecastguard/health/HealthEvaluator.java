package com.chicu.forecastguard.health;

import com.chicu.forecastguard.common.error.DataUnavailableException;
import com.chicu.forecastguard.common.error.ModelUnavailableException;
import com.chicu.forecastguard.common.util.ParameterCodes;
import com.chicu.forecastguard.ml.Predictor;
import com.chicu.forecastguard.series.Observation;
import com.chicu.forecastguard.series.TimeSeriesSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;

/**
 * Бэктест модели на последних T_IN + T_OUT наблюдениях:
 * первые T_IN -> в модель, последние T_OUT -> сравниваем с прогнозом по MAE.
 * <p>
 * Нет данных или нет модели -> не исключение, а заведомо "нездоровый" результат
 * с sentinel MAE. Проверка здоровья не должна молча пропускаться.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HealthEvaluator {

    private final TimeSeriesSource source;
    private final Predictor predictor;
    private final HealthProperties props;
    private final Clock clock;

    public HealthCheckResult evaluate(String parameter) {
        String p = ParameterCodes.normalize(parameter);
        int tIn = props.getInputWindow();
        int tOut = props.getHorizon();
        int total = tIn + tOut;

        log.info("🩺 HEALTH CHECK param={} window={}+{}", p, tIn, tOut);

        try {
            double[] series = lastValues(p, total);
            double[] input = Arrays.copyOfRange(series, 0, tIn);
            double[] actual = Arrays.copyOfRange(series, tIn, total);

            SeriesStats stats = SeriesStats.of(input);
            double[] forecastNorm = predictor.forecast(p, stats.normalize(input));
            if (forecastNorm == null || forecastNorm.length != tOut) {
                throw new ModelUnavailableException(p, "forecast length "
                        + (forecastNorm == null ? "null" : forecastNorm.length) + " != horizon " + tOut);
            }

            double mae = SeriesStats.meanAbsoluteError(stats.denormalize(forecastNorm), actual);
            if (!Double.isFinite(mae)) {
                return unavailable(p, "non-finite forecast error");
            }

            boolean healthy = mae < props.getThreshold();
            log.info("🩺 HEALTH {} param={} mae={} threshold={}",
                    healthy ? "OK" : "FAILED", p, String.format("%.4f", mae), props.getThreshold());

            return HealthCheckResult.builder()
                    .parameter(p)
                    .meanAbsoluteError(mae)
                    .healthy(healthy)
                    .evaluatedAt(clock.instant())
                    .build();

        } catch (DataUnavailableException | ModelUnavailableException e) {
            log.warn("🩺 HEALTH UNAVAILABLE param={} -> assume unhealthy: {}", p, e.getMessage());
            return unavailable(p, e.getMessage());
        }
    }

    private double[] lastValues(String p, int total) {
        List<Observation> obs = source.fetch(p, total);
        int n = obs == null ? 0 : obs.size();
        if (n < total) {
            throw new DataUnavailableException(p, "not enough observations: got " + n + ", need " + total);
        }

        double[] out = new double[total];
        int offset = n - total;
        for (int i = 0; i < total; i++) {
            out[i] = obs.get(offset + i).value();
        }
        return out;
    }

    private HealthCheckResult unavailable(String p, String reason) {
        return HealthCheckResult.builder()
                .parameter(p)
                .meanAbsoluteError(props.getSentinelMae())
                .healthy(false)
                .evaluatedAt(clock.instant())
                .error(reason)
                .build();
    }
}
