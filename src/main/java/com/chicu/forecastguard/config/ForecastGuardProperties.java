package com.chicu.forecastguard.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "mlops")
public class ForecastGuardProperties {

    /**
     * Отслеживаемые параметры, в порядке обработки циклом.
     * Пример: T2M, RH2M, WS2M
     */
    private List<String> parameters = new ArrayList<>(List.of("T2M", "RH2M", "WS2M"));
}
