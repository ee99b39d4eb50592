package com.chicu.forecastguard.ml.sidecar.props;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "mlops.sidecar")
public class SidecarProperties {

    /**
     * Пример: http://127.0.0.1:8001
     */
    private String baseUrl = "http://127.0.0.1:8001";

    /**
     * Защита sidecar (если включена в python).
     */
    private String apiKey = "";

    private long connectTimeoutMs = 1000;
    private long readTimeoutMs = 8000;

    /**
     * Обучение долгое, отдельный таймаут на /train.
     */
    private long trainTimeoutMs = 1_800_000;
}
