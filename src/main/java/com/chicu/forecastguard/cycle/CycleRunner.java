package com.chicu.forecastguard.cycle;

import com.chicu.forecastguard.common.error.RecorderUnavailableException;
import com.chicu.forecastguard.common.util.ParameterCodes;
import com.chicu.forecastguard.config.ForecastGuardProperties;
import com.chicu.forecastguard.record.RunParams;
import com.chicu.forecastguard.record.RunRecorder;
import com.chicu.forecastguard.retrain.RetrainOrchestrator;
import com.chicu.forecastguard.retrain.RetrainOutcome;
import com.chicu.forecastguard.retrain.RetrainState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Один проход по всем параметрам. Ошибка одного параметра не останавливает остальные,
 * каждое решение уходит во все рекордеры до перехода к следующему параметру.
 */
@Slf4j
@Service
public class CycleRunner {

    private final RetrainOrchestrator orchestrator;
    private final List<RunRecorder> recorders;
    private final ForecastGuardProperties guardProps;
    private final CycleProperties cycleProps;
    private final Clock clock;

    private final AtomicReference<List<RetrainOutcome>> lastCycle = new AtomicReference<>(List.of());

    public CycleRunner(RetrainOrchestrator orchestrator,
                       List<RunRecorder> recorders,
                       ForecastGuardProperties guardProps,
                       CycleProperties cycleProps,
                       Clock clock) {
        this.orchestrator = orchestrator;
        this.recorders = List.copyOf(recorders);
        this.guardProps = guardProps;
        this.cycleProps = cycleProps;
        this.clock = clock;

        log.info("🔁 CycleRunner поднят. Рекордеров: {} {}", this.recorders.size(),
                this.recorders.stream().map(RunRecorder::name).toList());
    }

    /**
     * Цикл по сконфигурированным параметрам.
     */
    public List<RetrainOutcome> runConfigured() {
        return run(guardProps.getParameters());
    }

    /**
     * Коды нормализуются (trim + upper-case); пустые и повторные коды отбрасываются,
     * так что на каждый уникальный параметр приходится ровно один исход,
     * в порядке первого появления. Результатов может быть меньше, чем элементов на входе.
     */
    public List<RetrainOutcome> run(List<String> parameters) {
        List<String> params = ParameterCodes.normalizeAll(parameters);
        int parallelism = Math.max(1, Math.min(cycleProps.getParallelism(), Math.max(1, params.size())));

        log.info("🔁 === RETRAIN CYCLE STARTED === params={} parallelism={}", params, parallelism);
        long started = System.currentTimeMillis();

        List<RetrainOutcome> outcomes = parallelism == 1
                ? runSequential(params)
                : runParallel(params, parallelism);

        lastCycle.set(List.copyOf(outcomes));

        log.info("🔁 === RETRAIN CYCLE FINISHED === tookMs={} summary={}",
                System.currentTimeMillis() - started, summary(outcomes));
        return outcomes;
    }

    public List<RetrainOutcome> lastCycle() {
        return lastCycle.get();
    }

    private List<RetrainOutcome> runSequential(List<String> params) {
        List<RetrainOutcome> out = new ArrayList<>(params.size());
        for (String p : params) {
            out.add(processOne(p));
        }
        return out;
    }

    private List<RetrainOutcome> runParallel(List<String> params, int parallelism) {
        AtomicInteger seq = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(parallelism,
                r -> new Thread(r, "retrain-cycle-" + seq.incrementAndGet()));

        try {
            List<Future<RetrainOutcome>> futures = new ArrayList<>(params.size());
            for (String p : params) {
                futures.add(pool.submit(() -> processOne(p)));
            }

            // порядок результатов = порядок параметров
            List<RetrainOutcome> out = new ArrayList<>(params.size());
            for (int i = 0; i < params.size(); i++) {
                String p = params.get(i);
                try {
                    out.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.error("🔁 [{}] cycle worker crashed: {}", p, cause.toString(), cause);
                    out.add(RetrainOutcome.failed(p, cause.toString(), clock.instant()));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("🔁 [{}] cycle interrupted while waiting", p);
                    out.add(RetrainOutcome.failed(p, "cycle interrupted", clock.instant()));
                }
            }
            return out;
        } finally {
            pool.shutdownNow();
        }
    }

    private RetrainOutcome processOne(String p) {
        RetrainOutcome outcome;
        try {
            outcome = orchestrator.run(p);
        } catch (RuntimeException e) {
            log.error("❌ [{}] ERROR during retraining cycle: {}", p, e.getMessage(), e);
            outcome = RetrainOutcome.failed(p, e.getClass().getSimpleName() + ": " + e.getMessage(), clock.instant());
        }

        recordAll(outcome);
        return outcome;
    }

    private void recordAll(RetrainOutcome o) {
        Map<String, Object> extra = RunParams.of(o);
        for (RunRecorder r : recorders) {
            try {
                r.record(o.parameter(), o.decision(), o.backtestMae(), extra);
            } catch (RecorderUnavailableException e) {
                log.warn("🧾 RECORDER {} unavailable param={}: {}", r.name(), o.parameter(), e.getMessage());
            } catch (RuntimeException e) {
                log.warn("🧾 RECORDER {} error param={}: {}", r.name(), o.parameter(), e.toString());
            }
        }
    }

    private static Map<RetrainState, Integer> summary(List<RetrainOutcome> outcomes) {
        Map<RetrainState, Integer> m = new EnumMap<>(RetrainState.class);
        for (RetrainOutcome o : outcomes) {
            m.merge(o.state(), 1, Integer::sum);
        }
        return m;
    }
}
