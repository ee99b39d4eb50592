package com.chicu.forecastguard.retrain;

import com.chicu.forecastguard.common.error.TrainingFailedException;
import com.chicu.forecastguard.health.HealthCheckResult;
import com.chicu.forecastguard.health.HealthEvaluator;
import com.chicu.forecastguard.ml.ModelRegistry;
import com.chicu.forecastguard.ml.ModelTrainer;
import com.chicu.forecastguard.ml.TrainedModel;
import com.chicu.forecastguard.weights.InMemoryWeightStore;
import com.chicu.forecastguard.weights.VersionIdGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RetrainExecutorTest {

    private static final Instant NOW = Instant.parse("2026-10-19T06:00:00Z");

    @Mock private ModelTrainer trainer;
    @Mock private ModelRegistry registry;
    @Mock private HealthEvaluator evaluator;

    private InMemoryWeightStore store;
    private RetrainExecutor executor;

    @BeforeEach
    void setUp() {
        store = new InMemoryWeightStore(new VersionIdGenerator(Clock.fixed(NOW, ZoneOffset.UTC)));
        executor = new RetrainExecutor(trainer, store, registry, evaluator);
    }

    @Test
    void execute_writesLatest_evictsCachedModel_thenReevaluates() {
        when(trainer.train("T2M")).thenReturn(TrainedModel.builder()
                .parameter("T2M").payload(new byte[]{1, 2, 3}).testMse(0.1).testMae(0.2).build());
        HealthCheckResult reeval = HealthCheckResult.builder()
                .parameter("T2M").meanAbsoluteError(1.2).healthy(true).evaluatedAt(NOW).build();
        when(evaluator.evaluate("T2M")).thenReturn(reeval);

        HealthCheckResult res = executor.execute("t2m");

        assertSame(reeval, res);
        assertArrayEquals(new byte[]{1, 2, 3}, store.findLatest("T2M").orElseThrow().payload());
        assertEquals(1, store.listVersions("T2M").size());

        InOrder order = inOrder(trainer, registry, evaluator);
        order.verify(trainer).train("T2M");
        order.verify(registry).invalidate("T2M");
        order.verify(evaluator).evaluate("T2M");
    }

    @Test
    void emptyPayload_isTrainingFailure_andLatestIsNotTouched() {
        when(trainer.train("T2M")).thenReturn(TrainedModel.builder().parameter("T2M").payload(new byte[0]).build());

        assertThrows(TrainingFailedException.class, () -> executor.execute("T2M"));

        assertTrue(store.findLatest("T2M").isEmpty());
        verifyNoInteractions(registry, evaluator);
    }

    @Test
    void trainerFailure_propagatesWithoutWriting() {
        when(trainer.train("RH2M")).thenThrow(new TrainingFailedException("RH2M", "boom"));

        TrainingFailedException ex = assertThrows(TrainingFailedException.class, () -> executor.execute("RH2M"));

        assertEquals("RH2M", ex.getParameter());
        assertTrue(store.listVersions("RH2M").isEmpty());
        verifyNoInteractions(evaluator);
    }

    @Test
    void retiredAttempt_discardsWeights_andSkipsReevaluation() {
        when(trainer.train("T2M")).thenReturn(TrainedModel.builder()
                .parameter("T2M").payload(new byte[]{7}).testMse(0.1).testMae(0.2).build());

        assertThrows(TrainingFailedException.class, () -> executor.execute("T2M", () -> false));

        assertTrue(store.findLatest("T2M").isEmpty());
        assertTrue(store.listVersions("T2M").isEmpty());
        verifyNoInteractions(registry, evaluator);
    }

    @Test
    void interruptedAttempt_doesNotWriteLatest() {
        when(trainer.train("T2M")).thenAnswer(inv -> {
            Thread.currentThread().interrupt();
            return TrainedModel.builder().parameter("T2M").payload(new byte[]{9}).build();
        });

        try {
            assertThrows(TrainingFailedException.class, () -> executor.execute("T2M"));
        } finally {
            // сбрасываем флаг, чтобы не утёк в следующие тесты
            Thread.interrupted();
        }

        assertTrue(store.findLatest("T2M").isEmpty());
    }
}
