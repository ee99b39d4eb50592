package com.chicu.forecastguard.health;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "mlops.health")
public class HealthProperties {

    /**
     * Порог MAE в физических единицах прогноза. Здорова только при mae < threshold.
     */
    private double threshold = 2.0;

    /** T_IN — окно истории на вход модели */
    private int inputWindow = 60;

    /** T_OUT — горизонт прогноза */
    private int horizon = 10;

    /**
     * MAE, которое ставим, когда оценить модель невозможно (нет данных / нет весов).
     */
    private double sentinelMae = 9999.0;
}
