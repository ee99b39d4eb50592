package com.chicu.forecastguard.retrain;

public enum RetrainDecision {
    SKIPPED,
    RETRAIN_ATTEMPTED,
    MANUAL_REQUIRED
}
