package com.chicu.forecastguard.deploy;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "mlops.deploy")
public class DeploymentProperties {

    /**
     * false = рестарты не делаем (локальный запуск без кластера).
     */
    private boolean enabled = false;

    private String kubectl = "kubectl";

    private String namespace = "weather-mlops";

    /**
     * %s = код параметра в нижнем регистре.
     */
    private String deploymentPattern = "inference-%s";

    private long timeoutSeconds = 60;
}
