package com.chicu.forecastguard.ml;

import lombok.Builder;

/**
 * Результат одного обучения. payload ещё никуда не записан.
 */
@Builder
public record TrainedModel(
        String parameter,
        byte[] payload,
        double testMse,
        double testMae,
        String message
) {}
