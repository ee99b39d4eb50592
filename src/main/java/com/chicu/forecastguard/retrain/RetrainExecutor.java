package com.chicu.forecastguard.retrain;

import com.chicu.forecastguard.common.error.TrainingFailedException;
import com.chicu.forecastguard.common.util.ParameterCodes;
import com.chicu.forecastguard.health.HealthCheckResult;
import com.chicu.forecastguard.health.HealthEvaluator;
import com.chicu.forecastguard.ml.ModelRegistry;
import com.chicu.forecastguard.ml.ModelTrainer;
import com.chicu.forecastguard.ml.TrainedModel;
import com.chicu.forecastguard.weights.WeightArtifact;
import com.chicu.forecastguard.weights.WeightStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.function.BooleanSupplier;

/**
 * Ровно одна попытка: обучить -> записать в "latest" -> переоценить.
 * Повторов здесь нет, ими управляет оркестратор.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetrainExecutor {

    private final ModelTrainer trainer;
    private final WeightStore weightStore;
    private final ModelRegistry registry;
    private final HealthEvaluator evaluator;

    /**
     * @throws TrainingFailedException обучение не удалось или попытку отменили
     */
    public HealthCheckResult execute(String parameter) {
        return execute(parameter, () -> true);
    }

    /**
     * @param live закрывается оркестратором по дедлайну; проверяется под локом хранилища,
     *             поэтому снятая попытка не может записать "latest" после отката или поверх следующей
     * @throws TrainingFailedException обучение не удалось или попытку сняли
     */
    public HealthCheckResult execute(String parameter, BooleanSupplier live) {
        String p = ParameterCodes.normalize(parameter);

        TrainedModel trained = trainer.train(p);
        if (trained == null || trained.payload() == null || trained.payload().length == 0) {
            throw new TrainingFailedException(p, "trainer returned no weights");
        }

        // попытку сняли по дедлайну, пока шло обучение: "latest" больше не трогаем
        if (Thread.currentThread().isInterrupted()) {
            throw new TrainingFailedException(p, "attempt cancelled before weights were written");
        }

        WeightArtifact artifact = weightStore.writeLatestIf(p, trained.payload(), live)
                .orElseThrow(() -> new TrainingFailedException(p, "attempt retired by deadline, weights discarded"));
        registry.invalidate(p);
        log.info("🧠 RETRAIN WEIGHTS param={} version={} testMae={}", p, artifact.versionId(), trained.testMae());

        return evaluator.evaluate(p);
    }
}
