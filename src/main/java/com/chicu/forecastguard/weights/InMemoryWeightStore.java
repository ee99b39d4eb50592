package com.chicu.forecastguard.weights;

import com.chicu.forecastguard.common.util.ParameterCodes;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BooleanSupplier;

/**
 * Хранилище в памяти: тесты и локальный запуск без volume.
 */
@Slf4j
public class InMemoryWeightStore implements WeightStore {

    private final VersionIdGenerator versions;
    private final Map<String, Slots> slots = new ConcurrentHashMap<>();

    public InMemoryWeightStore(VersionIdGenerator versions) {
        this.versions = versions;
    }

    @Override
    public Optional<WeightArtifact> writeLatestIf(String parameter, byte[] payload, BooleanSupplier gate) {
        String p = ParameterCodes.normalize(parameter);
        if (payload == null) throw new IllegalArgumentException("payload=null");

        Slots s = slotsOf(p);
        synchronized (s) {
            if (!gate.getAsBoolean()) {
                log.warn("💾 WRITE REFUSED param={}: gate closed", p);
                return Optional.empty();
            }
            Instant at = versions.nextInstant();
            WeightArtifact a = WeightArtifact.builder()
                    .parameter(p)
                    .versionId(VersionIdGenerator.format(at))
                    .payload(payload.clone())
                    .createdAt(at)
                    .build();
            s.history.add(a);
            s.latest = a;
            log.debug("💾 WRITE LATEST param={} version={} bytes={}", p, a.versionId(), a.size());
            return Optional.of(a);
        }
    }

    @Override
    public Optional<WeightArtifact> findLatest(String parameter) {
        Slots s = slotsOf(ParameterCodes.normalize(parameter));
        synchronized (s) {
            return Optional.ofNullable(s.latest);
        }
    }

    @Override
    public Optional<WeightArtifact> findPrevious(String parameter) {
        Slots s = slotsOf(ParameterCodes.normalize(parameter));
        synchronized (s) {
            return Optional.ofNullable(s.previous);
        }
    }

    @Override
    public void snapshotLatestToPrevious(String parameter) {
        Slots s = slotsOf(ParameterCodes.normalize(parameter));
        synchronized (s) {
            s.previous = s.latest;
        }
    }

    @Override
    public void restorePreviousToLatest(String parameter) {
        Slots s = slotsOf(ParameterCodes.normalize(parameter));
        synchronized (s) {
            s.latest = s.previous;
        }
    }

    @Override
    public List<String> listVersions(String parameter) {
        Slots s = slotsOf(ParameterCodes.normalize(parameter));
        synchronized (s) {
            return s.history.stream().map(WeightArtifact::versionId).toList();
        }
    }

    private Slots slotsOf(String p) {
        return slots.computeIfAbsent(p, k -> new Slots());
    }

    private static final class Slots {
        private final List<WeightArtifact> history = new ArrayList<>();
        private WeightArtifact latest;
        private WeightArtifact previous;
    }
}
