package com.chicu.forecastguard.config;

import com.chicu.forecastguard.cycle.CycleProperties;
import com.chicu.forecastguard.deploy.DeploymentProperties;
import com.chicu.forecastguard.health.HealthProperties;
import com.chicu.forecastguard.ml.sidecar.props.SidecarProperties;
import com.chicu.forecastguard.record.mlflow.MlflowProperties;
import com.chicu.forecastguard.retrain.RetrainProperties;
import com.chicu.forecastguard.series.SourceProperties;
import com.chicu.forecastguard.weights.FileSystemWeightStore;
import com.chicu.forecastguard.weights.InMemoryWeightStore;
import com.chicu.forecastguard.weights.StorageProperties;
import com.chicu.forecastguard.weights.VersionIdGenerator;
import com.chicu.forecastguard.weights.WeightStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Locale;

@Slf4j
@Configuration
@EnableConfigurationProperties({
        ForecastGuardProperties.class,
        HealthProperties.class,
        RetrainProperties.class,
        CycleProperties.class,
        StorageProperties.class,
        SourceProperties.class,
        SidecarProperties.class,
        DeploymentProperties.class,
        MlflowProperties.class
})
public class ForecastGuardConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public VersionIdGenerator versionIdGenerator(Clock clock) {
        return new VersionIdGenerator(clock);
    }

    /**
     * Бэкенд хранилища весов: filesystem (общий volume) или memory.
     */
    @Bean
    @ConditionalOnMissingBean
    public WeightStore weightStore(StorageProperties props, VersionIdGenerator versions) {
        String backend = props.getBackend() == null ? "filesystem" : props.getBackend().trim().toLowerCase(Locale.ROOT);

        return switch (backend) {
            case "memory" -> {
                log.warn("💾 WeightStore backend=memory: веса не переживут рестарт процесса");
                yield new InMemoryWeightStore(versions);
            }
            case "filesystem" -> new FileSystemWeightStore(Path.of(props.getModelsDir()), versions);
            default -> throw new IllegalStateException("Unknown mlops.storage.backend: " + props.getBackend());
        };
    }
}
