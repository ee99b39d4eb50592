package com.chicu.forecastguard.ml;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RegistryPredictor implements Predictor {

    private final ModelRegistry registry;

    @Override
    public double[] forecast(String parameter, double[] normalizedWindow) {
        return registry.get(parameter).forecast(normalizedWindow);
    }
}
