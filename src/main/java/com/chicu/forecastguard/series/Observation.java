package com.chicu.forecastguard.series;

import java.time.Instant;

/**
 * Одна точка ряда. До очистки value может быть NaN (пропуск).
 */
public record Observation(Instant timestamp, double value) {

    public boolean missing() {
        return !Double.isFinite(value);
    }

    public Observation withValue(double v) {
        return new Observation(timestamp, v);
    }
}
