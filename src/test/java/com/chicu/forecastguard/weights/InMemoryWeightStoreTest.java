package com.chicu.forecastguard.weights;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryWeightStoreTest {

    private final InMemoryWeightStore store = new InMemoryWeightStore(
            new VersionIdGenerator(Clock.fixed(Instant.parse("2026-10-19T06:00:00Z"), ZoneOffset.UTC)));

    @Test
    void payloadIsCopied_soCallerCannotMutateStoredWeights() {
        byte[] payload = {1, 2, 3};
        store.writeLatest("T2M", payload);
        payload[0] = 42;

        assertEquals(1, store.readLatest("T2M").payload()[0]);
    }

    @Test
    void backupAndRestore_areExactInverse() {
        WeightArtifact v1 = store.writeLatest("T2M", new byte[]{1});
        store.snapshotLatestToPrevious("T2M");
        store.writeLatest("T2M", new byte[]{2});

        store.restorePreviousToLatest("T2M");

        assertEquals(v1, store.findLatest("T2M").orElseThrow());
        assertEquals(2, store.listVersions("T2M").size());
    }

    @Test
    void parametersAreIsolated() {
        store.writeLatest("T2M", new byte[]{1});

        store.snapshotLatestToPrevious("RH2M");

        assertTrue(store.findPrevious("RH2M").isEmpty());
        assertTrue(store.findPrevious("T2M").isEmpty());
        assertTrue(store.findLatest("T2M").isPresent());
    }

    @Test
    void closedGate_writesNothing() {
        WeightArtifact v1 = store.writeLatest("T2M", new byte[]{1});

        assertTrue(store.writeLatestIf("T2M", new byte[]{2}, () -> false).isEmpty());

        assertEquals(v1, store.findLatest("T2M").orElseThrow());
        assertEquals(1, store.listVersions("T2M").size());
    }

    @Test
    void blankParameter_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> store.writeLatest(" ", new byte[]{1}));
    }
}
