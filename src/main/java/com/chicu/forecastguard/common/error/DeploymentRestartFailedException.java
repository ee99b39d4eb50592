package com.chicu.forecastguard.common.error;

public class DeploymentRestartFailedException extends ForecastGuardException {

    public DeploymentRestartFailedException(String parameter, String message) {
        super(parameter, message);
    }

    public DeploymentRestartFailedException(String parameter, String message, Throwable cause) {
        super(parameter, message, cause);
    }
}
