package com.chicu.forecastguard.series;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "mlops.source")
public class SourceProperties {

    private String baseUrl = "https://power.larc.nasa.gov/api/temporal/daily/point";

    private double latitude = 13.18;
    private double longitude = 77.80;
    private String community = "AG";

    /**
     * Сколько дней докачиваем сверх запрошенного окна (задержка публикации данных).
     */
    private int marginDays = 5;

    /**
     * NASA POWER отдаёт -999 вместо пропуска.
     */
    private double sentinelValue = -999.0;

    private long timeoutMs = 30_000;

    /**
     * Допустимые диапазоны по параметрам, например RH2M: [0, 100].
     */
    private Map<String, ClipRange> clip = new HashMap<>(Map.of(
            "RH2M", new ClipRange(0.0, 100.0),
            "WS2M", new ClipRange(0.0, null)
    ));

    @Data
    public static class ClipRange {
        private Double min;
        private Double max;

        public ClipRange() {
        }

        public ClipRange(Double min, Double max) {
            this.min = min;
            this.max = max;
        }
    }
}
