package com.chicu.forecastguard.weights;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "mlops.storage")
public class StorageProperties {

    /**
     * filesystem | memory
     */
    private String backend = "filesystem";

    /**
     * Общий volume с inference-подами.
     */
    private String modelsDir = "./models";
}
