package com.chicu.forecastguard.health;

import lombok.Builder;

import java.time.Instant;

/**
 * Результат одной проверки. Не меняется после создания.
 *
 * @param error причина, если оценить модель не удалось (тогда mae = sentinel, healthy = false)
 */
@Builder
public record HealthCheckResult(
        String parameter,
        double meanAbsoluteError,
        boolean healthy,
        Instant evaluatedAt,
        String error
) {

    public boolean degraded() {
        return error != null && !error.isBlank();
    }
}
