package com.chicu.forecastguard.deploy;

import com.chicu.forecastguard.common.error.DeploymentRestartFailedException;
import com.chicu.forecastguard.common.util.ParameterCodes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * kubectl rollout restart deployment/inference-t2m -n weather-mlops
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "mlops.deploy", name = "enabled", havingValue = "true")
public class KubectlDeploymentController implements DeploymentController {

    private static final long OUTPUT_DRAIN_SECONDS = 5;

    private final DeploymentProperties props;

    @Override
    public void restart(String parameter) {
        String p = ParameterCodes.normalize(parameter);
        List<String> cmd = command(p);

        log.info("🚀 RESTART param={} cmd={}", p, String.join(" ", cmd));

        Process proc;
        try {
            proc = new ProcessBuilder(cmd).redirectErrorStream(true).start();
        } catch (IOException e) {
            throw new DeploymentRestartFailedException(p, "cannot start kubectl: " + e.getMessage(), e);
        }

        // stdout читаем параллельно с ожиданием: иначе большой вывод забьёт pipe и kubectl встанет
        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readOutput(proc));

        try {
            boolean done = proc.waitFor(Math.max(1, props.getTimeoutSeconds()), TimeUnit.SECONDS);
            if (!done) {
                proc.destroyForcibly();
                throw new DeploymentRestartFailedException(p, "kubectl timed out after " + props.getTimeoutSeconds() + "s");
            }

            String out = output.get(OUTPUT_DRAIN_SECONDS, TimeUnit.SECONDS).trim();
            if (proc.exitValue() != 0) {
                throw new DeploymentRestartFailedException(p, "kubectl exit=" + proc.exitValue() + ": " + ParameterCodes.safe(out));
            }

            log.info("🚀 RESTART OK param={} {}", p, ParameterCodes.safe(out));

        } catch (InterruptedException e) {
            proc.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new DeploymentRestartFailedException(p, "interrupted while waiting for kubectl", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new DeploymentRestartFailedException(p, "cannot read kubectl output: " + e.getMessage(), e);
        }
    }

    private static String readOutput(Process proc) {
        try (InputStream in = proc.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    List<String> command(String p) {
        return List.of(
                props.getKubectl(),
                "rollout", "restart",
                "deployment/" + deploymentName(p),
                "-n", props.getNamespace()
        );
    }

    String deploymentName(String p) {
        return String.format(props.getDeploymentPattern(), p.toLowerCase(Locale.ROOT));
    }
}
