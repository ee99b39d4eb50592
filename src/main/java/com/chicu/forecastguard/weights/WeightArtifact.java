package com.chicu.forecastguard.weights;

import lombok.Builder;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Снимок весов модели для параметра. payload — непрозрачный сериализованный state (state_dict и т.п.).
 */
@Builder
public record WeightArtifact(
        String parameter,
        String versionId,
        byte[] payload,
        Instant createdAt
) {

    public int size() {
        return payload == null ? 0 : payload.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WeightArtifact that)) return false;
        return Objects.equals(parameter, that.parameter)
                && Objects.equals(versionId, that.versionId)
                && Arrays.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(parameter, versionId) + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "WeightArtifact[" + parameter + ", " + versionId + ", " + size() + " bytes]";
    }
}
