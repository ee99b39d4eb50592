package com.chicu.forecastguard.record.persistence;

import com.chicu.forecastguard.record.RunParams;
import com.chicu.forecastguard.retrain.RetrainDecision;
import com.chicu.forecastguard.retrain.RetrainOutcome;
import com.chicu.forecastguard.retrain.RetrainState;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class JpaRunRecorderTest {

    @Autowired
    private RetrainRunRepository repo;

    private JpaRunRecorder recorder;

    @BeforeEach
    void setUp() {
        recorder = new JpaRunRecorder(repo, new ObjectMapper());
    }

    @Test
    void record_persistsDecisionAndOutcomeFields() {
        RetrainOutcome o = RetrainOutcome.builder()
                .parameter("T2M")
                .decision(RetrainDecision.RETRAIN_ATTEMPTED)
                .state(RetrainState.SUCCEEDED)
                .attemptsUsed(2)
                .succeeded(true)
                .backtestMae(7.5)
                .finalMae(1.25)
                .finishedAt(Instant.parse("2026-10-19T06:00:00Z"))
                .build();

        recorder.record("T2M", o.decision(), o.backtestMae(), RunParams.of(o));

        RetrainRunEntity saved = repo.findTopByParameterOrderByCreatedAtDesc("T2M").orElseThrow();
        assertEquals(RetrainDecision.RETRAIN_ATTEMPTED, saved.getDecision());
        assertEquals("SUCCEEDED", saved.getState());
        assertEquals(7.5, saved.getBacktestMae());
        assertEquals(1.25, saved.getFinalMae());
        assertEquals(2, saved.getAttemptsUsed());
        assertTrue(saved.getRetrainSuccess());
        assertNotNull(saved.getCreatedAt());
        assertTrue(saved.getExtraJson().contains("\"retrain_success\":true"));
    }

    @Test
    void failedParameter_isStoredWithoutDecisionAndMae() {
        RetrainOutcome failed = RetrainOutcome.failed("RH2M", "IllegalStateException: disk full",
                Instant.parse("2026-10-19T06:00:00Z"));

        recorder.record("RH2M", null, failed.backtestMae(), RunParams.of(failed));

        RetrainRunEntity saved = repo.findTopByParameterOrderByCreatedAtDesc("RH2M").orElseThrow();
        assertNull(saved.getDecision());
        assertNull(saved.getBacktestMae());
        assertNull(saved.getFinalMae());
        assertEquals("FAILED", saved.getState());
    }

    @Test
    void countsByDecision() {
        recorder.record("WS2M", RetrainDecision.SKIPPED, 0.4, Map.of());
        recorder.record("WS2M", RetrainDecision.SKIPPED, 0.5, Map.of());
        recorder.record("WS2M", RetrainDecision.MANUAL_REQUIRED, 9999.0, Map.of(RunParams.STATE, "SKIPPED_NO_AUTOMATION"));

        assertEquals(2, repo.countByParameterAndDecision("WS2M", RetrainDecision.SKIPPED));
        assertEquals(1, repo.countByParameterAndDecision("WS2M", RetrainDecision.MANUAL_REQUIRED));

        List<RetrainRunEntity> history = repo.findTop50ByParameterOrderByCreatedAtDesc("WS2M");
        assertEquals(3, history.size());
    }
}
