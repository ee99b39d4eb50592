package com.chicu.forecastguard.record.mlflow;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "mlops.mlflow")
public class MlflowProperties {

    private boolean enabled = false;

    private String trackingUri = "http://mlflow:5005";

    private String experimentName = "llm4ts-drift-monitoring";

    private long timeoutMs = 5000;
}
