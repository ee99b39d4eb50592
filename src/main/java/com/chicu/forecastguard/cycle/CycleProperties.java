package com.chicu.forecastguard.cycle;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "mlops.cycle")
public class CycleProperties {

    private boolean schedulerEnabled = false;

    private long initialDelayMinutes = 5;

    private long periodHours = 24;

    /**
     * 1 = строго последовательно. Больше 1 — разные параметры параллельно.
     */
    private int parallelism = 1;
}
