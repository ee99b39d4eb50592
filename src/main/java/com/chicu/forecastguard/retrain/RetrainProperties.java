package com.chicu.forecastguard.retrain;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "mlops.retrain")
public class RetrainProperties {

    /**
     * Разрешён ли автоматический ретрейн (бывший ENABLE_RETRAINING).
     */
    private boolean enabled = false;

    private AutomationMode mode = AutomationMode.AUTO;

    /**
     * Дедлайн одной попытки (train + re-eval) в мс. 0 или меньше = без дедлайна.
     */
    private long attemptTimeoutMs = 0;

    public boolean isAutomationAuthorized() {
        return enabled && mode == AutomationMode.AUTO;
    }
}
