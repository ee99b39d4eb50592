package com.chicu.forecastguard.cycle;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Периодический запуск цикла (ежедневный drift-check) и ручной триггер.
 * Одновременно идёт не больше одного цикла.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetrainCycleRuntime {

    private final CycleRunner cycleRunner;
    private final CycleProperties props;

    private final ScheduledExecutorService scheduler =
            Executors.newSingleThreadScheduledExecutor(r -> new Thread(r, "retrain-cycle-scheduler"));

    private final AtomicBoolean running = new AtomicBoolean(false);

    @PostConstruct
    public void start() {
        if (!props.isSchedulerEnabled()) {
            log.info("🔁 Cycle scheduler disabled (mlops.cycle.scheduler-enabled=false)");
            return;
        }

        long periodMs = Duration.ofHours(Math.max(1, props.getPeriodHours())).toMillis();
        long delayMs = Duration.ofMinutes(Math.max(0, props.getInitialDelayMinutes())).toMillis();

        scheduler.scheduleWithFixedDelay(() -> safeRun("scheduled"), delayMs, periodMs, TimeUnit.MILLISECONDS);
        log.info("🔁 Cycle scheduler started: first in {} min, then every {} h",
                props.getInitialDelayMinutes(), props.getPeriodHours());
    }

    /**
     * Флаг занимается здесь же, до постановки в очередь: второй триггер сразу получает false.
     *
     * @return false, если цикл уже идёт или стоит в очереди
     */
    public boolean triggerAsync(String reason) {
        if (!running.compareAndSet(false, true)) return false;
        try {
            scheduler.submit(() -> runClaimed(reason));
        } catch (RejectedExecutionException e) {
            running.set(false);
            log.warn("🔁 cycle trigger rejected ({}): scheduler is shut down", reason);
            return false;
        }
        return true;
    }

    public boolean isRunning() {
        return running.get();
    }

    void safeRun(String reason) {
        if (!running.compareAndSet(false, true)) {
            log.info("🔁 cycle skip ({}): previous cycle still running", reason);
            return;
        }
        runClaimed(reason);
    }

    private void runClaimed(String reason) {
        try {
            log.info("🔁 cycle trigger: {}", reason);
            cycleRunner.runConfigured();
        } catch (Exception e) {
            log.error("🔁 cycle FAILED ({}): {}", reason, e.getMessage(), e);
        } finally {
            running.set(false);
        }
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
    }
}
