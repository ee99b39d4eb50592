package com.chicu.forecastguard.retrain;

import com.chicu.forecastguard.common.error.DeploymentRestartFailedException;
import com.chicu.forecastguard.common.error.TrainingFailedException;
import com.chicu.forecastguard.common.util.ParameterCodes;
import com.chicu.forecastguard.deploy.DeploymentController;
import com.chicu.forecastguard.health.HealthCheckResult;
import com.chicu.forecastguard.health.HealthEvaluator;
import com.chicu.forecastguard.ml.ModelRegistry;
import com.chicu.forecastguard.weights.WeightStore;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Автомат одного параметра за цикл:
 * <pre>
 * EVALUATING -> HEALTHY                       (SKIPPED)
 *            -> UNHEALTHY -> SKIPPED_NO_AUTOMATION (MANUAL_REQUIRED)
 *                         -> RETRAINING -> SUCCEEDED | EXHAUSTED (RETRAIN_ATTEMPTED)
 * </pre>
 * Бэкап "latest" -> "previous" делается один раз перед первой попыткой,
 * откат "previous" -> "latest" — только после последней неудачной.
 * Рестарт serving'а: ровно один на успех, ровно один после отката, ноль на пропусках.
 */
@Slf4j
@Service
public class RetrainOrchestrator {

    public static final int MAX_ATTEMPTS = 3;

    private final HealthEvaluator evaluator;
    private final RetrainExecutor executor;
    private final WeightStore weightStore;
    private final ModelRegistry registry;
    private final DeploymentController deploymentController;
    private final RetrainProperties props;
    private final Clock clock;

    /**
     * Один параметр — один ретрейн одновременно: иначе гонка на слотах latest/previous.
     */
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    private final ExecutorService attemptPool;

    public RetrainOrchestrator(HealthEvaluator evaluator,
                               RetrainExecutor executor,
                               WeightStore weightStore,
                               ModelRegistry registry,
                               DeploymentController deploymentController,
                               RetrainProperties props,
                               Clock clock) {
        this.evaluator = evaluator;
        this.executor = executor;
        this.weightStore = weightStore;
        this.registry = registry;
        this.deploymentController = deploymentController;
        this.props = props;
        this.clock = clock;

        AtomicInteger seq = new AtomicInteger();
        this.attemptPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "retrain-attempt-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public RetrainOutcome run(String parameter) {
        String p = ParameterCodes.normalize(parameter);

        if (!inFlight.add(p)) {
            log.warn("🔁 RETRAIN BUSY param={} (another run in flight)", p);
            return RetrainOutcome.failed(p, "retrain already in flight for " + p, clock.instant());
        }

        try {
            return runGuarded(p);
        } finally {
            inFlight.remove(p);
        }
    }

    public boolean isInFlight(String parameter) {
        return inFlight.contains(ParameterCodes.normalize(parameter));
    }

    private RetrainOutcome runGuarded(String p) {
        log.info("🩺 EVALUATING param={}", p);

        HealthCheckResult initial = evaluator.evaluate(p);
        double backtestMae = initial.meanAbsoluteError();

        if (initial.healthy()) {
            log.info("✅ HEALTHY param={} mae={} -> retraining skipped", p, fmt(backtestMae));
            return outcome(p, RetrainDecision.SKIPPED, RetrainState.HEALTHY, 0, false, backtestMae, backtestMae, null);
        }

        log.warn("⚠️ UNHEALTHY param={} mae={}{}", p, fmt(backtestMae),
                initial.degraded() ? " (evaluation unavailable: " + initial.error() + ")" : "");

        if (!props.isAutomationAuthorized()) {
            log.warn("⚠️ MANUAL REQUIRED param={} enabled={} mode={}. Для авторетрейна: mlops.retrain.enabled=true, mode=AUTO",
                    p, props.isEnabled(), props.getMode());
            return outcome(p, RetrainDecision.MANUAL_REQUIRED, RetrainState.SKIPPED_NO_AUTOMATION,
                    0, false, backtestMae, backtestMae, initial.error());
        }

        // ===== RETRAINING =====
        log.info("🧠 RETRAIN START param={} maxAttempts={}", p, MAX_ATTEMPTS);
        weightStore.snapshotLatestToPrevious(p);

        double lastMae = backtestMae;
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            log.info("🧠 RETRAIN ATTEMPT {}/{} param={}", attempt, MAX_ATTEMPTS, p);

            HealthCheckResult res = runAttempt(p, attempt);
            if (res == null) continue;

            lastMae = res.meanAbsoluteError();
            if (res.healthy()) {
                log.info("✅ RETRAIN SUCCEEDED param={} attempt={} mae={}", p, attempt, fmt(lastMae));
                restart(p);
                return outcome(p, RetrainDecision.RETRAIN_ATTEMPTED, RetrainState.SUCCEEDED,
                        attempt, true, backtestMae, lastMae, null);
            }

            log.warn("⚠️ RETRAIN ATTEMPT {} FAILED param={} mae={} still >= threshold", attempt, p, fmt(lastMae));
        }

        // ===== EXHAUSTED -> откат =====
        log.error("❌ RETRAIN EXHAUSTED param={} after {} attempts, reverting to previous weights", p, MAX_ATTEMPTS);
        weightStore.restorePreviousToLatest(p);
        registry.invalidate(p);
        restart(p);

        return outcome(p, RetrainDecision.RETRAIN_ATTEMPTED, RetrainState.EXHAUSTED,
                MAX_ATTEMPTS, false, backtestMae, lastMae, "model failed to converge after " + MAX_ATTEMPTS + " attempts");
    }

    /**
     * @return результат переоценки или null, если попытка провалилась
     */
    private HealthCheckResult runAttempt(String p, int attempt) {
        long timeoutMs = props.getAttemptTimeoutMs();
        try {
            if (timeoutMs <= 0) {
                return executor.execute(p);
            }

            AtomicBoolean live = new AtomicBoolean(true);
            Future<HealthCheckResult> f = attemptPool.submit(() -> executor.execute(p, live::get));
            try {
                return f.get(timeoutMs, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                // сначала закрываем запись: даже если поток проигнорирует interrupt, "latest" он уже не тронет
                live.set(false);
                f.cancel(true);
                log.warn("⏱️ RETRAIN ATTEMPT {} TIMEOUT param={} after {}ms", attempt, p, timeoutMs);
                return null;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof RuntimeException re) throw re;
                throw new IllegalStateException(cause.getMessage(), cause);
            } catch (InterruptedException e) {
                live.set(false);
                f.cancel(true);
                Thread.currentThread().interrupt();
                log.warn("⏱️ RETRAIN ATTEMPT {} INTERRUPTED param={}", attempt, p);
                return null;
            }

        } catch (TrainingFailedException e) {
            log.warn("🧠 TRAIN FAILED attempt={} param={}: {}", attempt, p, e.getMessage());
            return null;
        } catch (RuntimeException e) {
            // после бэкапа любая ошибка попытки считается неудачной попыткой
            log.error("🧠 RETRAIN ATTEMPT {} ERROR param={}: {}", attempt, p, e.getMessage(), e);
            return null;
        }
    }

    private void restart(String p) {
        try {
            deploymentController.restart(p);
        } catch (DeploymentRestartFailedException e) {
            log.warn("🚀 RESTART FAILED param={}: {}", p, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("🚀 RESTART ERROR param={}: {}", p, e.toString());
        }
    }

    private RetrainOutcome outcome(String p,
                                   RetrainDecision decision,
                                   RetrainState state,
                                   int attempts,
                                   boolean succeeded,
                                   double backtestMae,
                                   double finalMae,
                                   String error) {
        return RetrainOutcome.builder()
                .parameter(p)
                .decision(decision)
                .state(state)
                .attemptsUsed(attempts)
                .succeeded(succeeded)
                .backtestMae(backtestMae)
                .finalMae(finalMae)
                .error(error)
                .finishedAt(clock.instant())
                .build();
    }

    private static String fmt(double v) {
        return String.format("%.4f", v);
    }

    @PreDestroy
    public void shutdown() {
        attemptPool.shutdownNow();
    }
}
