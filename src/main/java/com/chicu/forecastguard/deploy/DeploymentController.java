package com.chicu.forecastguard.deploy;

/**
 * Рестарт serving-нагрузки параметра, чтобы она перечитала "latest".
 * Best-effort: вызывающая сторона логирует неудачу и идёт дальше.
 */
public interface DeploymentController {

    /**
     * @throws com.chicu.forecastguard.common.error.DeploymentRestartFailedException не удалось подать сигнал
     */
    void restart(String parameter);
}
