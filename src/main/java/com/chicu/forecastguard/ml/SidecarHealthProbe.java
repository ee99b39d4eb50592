package com.chicu.forecastguard.ml;

import com.chicu.forecastguard.ml.sidecar.ForecastSidecarClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "mlops.sidecar", name = "probe-on-startup", havingValue = "true", matchIfMissing = true)
public class SidecarHealthProbe implements ApplicationRunner {

    private final ForecastSidecarClient client;

    @Override
    public void run(ApplicationArguments args) {
        try {
            var node = client.health();
            log.info("✅ ML sidecar OK: {}", node);
        } catch (Exception e) {
            // старт не валим: health-check сам уйдёт в sentinel, если sidecar так и не поднимется
            log.warn("⚠️ ML sidecar NOT available: {}", e.getMessage());
        }
    }
}
