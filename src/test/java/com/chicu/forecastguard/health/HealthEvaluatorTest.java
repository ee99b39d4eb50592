package com.chicu.forecastguard.health;

import com.chicu.forecastguard.common.error.ModelUnavailableException;
import com.chicu.forecastguard.common.error.SourceUnavailableException;
import com.chicu.forecastguard.ml.Predictor;
import com.chicu.forecastguard.series.Observation;
import com.chicu.forecastguard.series.TimeSeriesSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HealthEvaluatorTest {

    private static final Instant NOW = Instant.parse("2026-10-19T06:00:00Z");

    @Mock private TimeSeriesSource source;
    @Mock private Predictor predictor;

    private HealthProperties props;
    private HealthEvaluator evaluator;

    @BeforeEach
    void setUp() {
        props = new HealthProperties(); // 60 + 10, threshold 2.0, sentinel 9999
        evaluator = new HealthEvaluator(source, predictor, props, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void constantZeroHistory_withFutureAt100_isUnhealthyWithMae100() {
        List<Double> values = new ArrayList<>();
        for (int i = 0; i < 60; i++) values.add(0.0);
        for (int i = 0; i < 10; i++) values.add(100.0);
        when(source.fetch("T2M", 70)).thenReturn(series(values));
        when(predictor.forecast(eq("T2M"), any())).thenReturn(new double[10]);

        HealthCheckResult res = evaluator.evaluate("T2M");

        assertFalse(res.healthy());
        assertEquals(100.0, res.meanAbsoluteError(), 1e-9);
        assertFalse(res.degraded());
        assertEquals("T2M", res.parameter());
        assertEquals(NOW, res.evaluatedAt());
    }

    @Test
    void zeroStd_isReplacedByOne_soInputIsNotDividedByZero() {
        List<Double> values = new ArrayList<>();
        for (int i = 0; i < 70; i++) values.add(5.0);
        when(source.fetch("T2M", 70)).thenReturn(series(values));
        when(predictor.forecast(eq("T2M"), any())).thenReturn(new double[10]);

        HealthCheckResult res = evaluator.evaluate("T2M");

        ArgumentCaptor<double[]> window = ArgumentCaptor.forClass(double[].class);
        verify(predictor).forecast(eq("T2M"), window.capture());
        assertEquals(60, window.getValue().length);
        for (double v : window.getValue()) assertEquals(0.0, v, 1e-12);

        // прогноз 0 в нормализованных единицах -> mean 5.0 после денормализации
        assertTrue(res.healthy());
        assertEquals(0.0, res.meanAbsoluteError(), 1e-9);
    }

    @Test
    void forecastIsDenormalizedWithInputWindowStats() {
        // вход: чередование 10 / 20 -> mean 15, std 5
        List<Double> values = new ArrayList<>();
        for (int i = 0; i < 60; i++) values.add(i % 2 == 0 ? 10.0 : 20.0);
        for (int i = 0; i < 10; i++) values.add(21.0);
        when(source.fetch("RH2M", 70)).thenReturn(series(values));

        double[] norm = new double[10];
        java.util.Arrays.fill(norm, 1.0); // -> 15 + 5 = 20
        when(predictor.forecast(eq("RH2M"), any())).thenReturn(norm);

        HealthCheckResult res = evaluator.evaluate("rh2m");

        assertEquals(1.0, res.meanAbsoluteError(), 1e-9);
        assertTrue(res.healthy());
    }

    @Test
    void maeEqualToThreshold_isUnhealthy() {
        List<Double> values = new ArrayList<>();
        for (int i = 0; i < 60; i++) values.add(0.0);
        for (int i = 0; i < 10; i++) values.add(2.0);
        when(source.fetch("T2M", 70)).thenReturn(series(values));
        when(predictor.forecast(eq("T2M"), any())).thenReturn(new double[10]);

        HealthCheckResult res = evaluator.evaluate("T2M");

        assertEquals(2.0, res.meanAbsoluteError(), 1e-9);
        assertFalse(res.healthy());
    }

    @Test
    void tooFewObservations_returnsSentinelUnhealthy_withoutCallingPredictor() {
        List<Double> values = new ArrayList<>();
        for (int i = 0; i < 40; i++) values.add(1.0);
        when(source.fetch("T2M", 70)).thenReturn(series(values));

        HealthCheckResult res = assertDoesNotThrow(() -> evaluator.evaluate("T2M"));

        assertFalse(res.healthy());
        assertEquals(9999.0, res.meanAbsoluteError());
        assertTrue(res.degraded());
        verifyNoInteractions(predictor);
    }

    @Test
    void sourceUnavailable_returnsSentinelUnhealthy() {
        when(source.fetch(anyString(), anyInt()))
                .thenThrow(new SourceUnavailableException("WS2M", "NASA POWER HTTP 503"));

        HealthCheckResult res = evaluator.evaluate("WS2M");

        assertFalse(res.healthy());
        assertEquals(9999.0, res.meanAbsoluteError());
        assertTrue(res.error().contains("503"));
    }

    @Test
    void missingModel_returnsSentinelUnhealthy() {
        List<Double> values = new ArrayList<>();
        for (int i = 0; i < 70; i++) values.add(1.0);
        when(source.fetch("T2M", 70)).thenReturn(series(values));
        when(predictor.forecast(eq("T2M"), any()))
                .thenThrow(new ModelUnavailableException("T2M", "no latest weights"));

        HealthCheckResult res = evaluator.evaluate("T2M");

        assertFalse(res.healthy());
        assertEquals(9999.0, res.meanAbsoluteError());
    }

    @Test
    void wrongForecastLength_isTreatedAsModelUnavailable() {
        List<Double> values = new ArrayList<>();
        for (int i = 0; i < 70; i++) values.add(1.0);
        when(source.fetch("T2M", 70)).thenReturn(series(values));
        when(predictor.forecast(eq("T2M"), any())).thenReturn(new double[7]);

        HealthCheckResult res = evaluator.evaluate("T2M");

        assertFalse(res.healthy());
        assertEquals(9999.0, res.meanAbsoluteError());
    }

    @Test
    void nanInForecast_isSentinelNotNan() {
        List<Double> values = new ArrayList<>();
        for (int i = 0; i < 70; i++) values.add(1.0);
        when(source.fetch("T2M", 70)).thenReturn(series(values));
        double[] f = new double[10];
        f[3] = Double.NaN;
        when(predictor.forecast(eq("T2M"), any())).thenReturn(f);

        HealthCheckResult res = evaluator.evaluate("T2M");

        assertFalse(res.healthy());
        assertEquals(9999.0, res.meanAbsoluteError());
    }

    @Test
    void usesOnlyMostRecentWindow_whenSourceReturnsMore() {
        List<Double> values = new ArrayList<>();
        for (int i = 0; i < 5; i++) values.add(1000.0); // старые точки не должны попасть в окно
        for (int i = 0; i < 70; i++) values.add(3.0);
        when(source.fetch("T2M", 70)).thenReturn(series(values));
        when(predictor.forecast(eq("T2M"), any())).thenReturn(new double[10]);

        HealthCheckResult res = evaluator.evaluate("T2M");

        assertEquals(0.0, res.meanAbsoluteError(), 1e-9);
        assertTrue(res.healthy());
    }

    private static List<Observation> series(List<Double> values) {
        Instant start = NOW.minus(values.size(), ChronoUnit.DAYS);
        List<Observation> out = new ArrayList<>();
        for (int i = 0; i < values.size(); i++) {
            out.add(new Observation(start.plus(i, ChronoUnit.DAYS), values.get(i)));
        }
        return out;
    }
}
