package com.chicu.forecastguard.deploy;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Заглушка для запуска без кластера: рестарт только пишется в лог.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "mlops.deploy", name = "enabled", havingValue = "false", matchIfMissing = true)
public class NoopDeploymentController implements DeploymentController {

    @Override
    public void restart(String parameter) {
        log.info("🚀 RESTART (noop) param={}: mlops.deploy.enabled=false", parameter);
    }
}
