package com.chicu.forecastguard.ml;

import com.chicu.forecastguard.weights.WeightArtifact;

public interface ForecastModelLoader {

    ForecastModel load(WeightArtifact artifact);
}
