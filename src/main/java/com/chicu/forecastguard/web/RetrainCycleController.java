package com.chicu.forecastguard.web;

import com.chicu.forecastguard.config.ForecastGuardProperties;
import com.chicu.forecastguard.common.util.ParameterCodes;
import com.chicu.forecastguard.cycle.CycleRunner;
import com.chicu.forecastguard.cycle.RetrainCycleRuntime;
import com.chicu.forecastguard.retrain.RetrainOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/retrain")
public class RetrainCycleController {

    private final RetrainCycleRuntime runtime;
    private final CycleRunner cycleRunner;
    private final ForecastGuardProperties props;

    /**
     * POST /api/retrain/cycle — запустить один цикл по всем параметрам (асинхронно).
     */
    @PostMapping("/cycle")
    public ResponseEntity<Map<String, Object>> triggerCycle() {
        boolean accepted = runtime.triggerAsync("api");
        log.info("🌐 [API] cycle trigger accepted={}", accepted);

        if (!accepted) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("accepted", false, "message", "Цикл уже выполняется"));
        }
        return ResponseEntity.accepted()
                .body(Map.of("accepted", true, "parameters", ParameterCodes.normalizeAll(props.getParameters())));
    }

    /**
     * GET /api/retrain/cycle/last — итоги последнего завершённого цикла.
     */
    @GetMapping("/cycle/last")
    public Map<String, Object> lastCycle() {
        List<RetrainOutcome> outcomes = cycleRunner.lastCycle();
        return Map.of(
                "running", runtime.isRunning(),
                "outcomes", outcomes
        );
    }

    @GetMapping("/parameters")
    public List<String> parameters() {
        return ParameterCodes.normalizeAll(props.getParameters());
    }
}
