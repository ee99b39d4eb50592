package com.chicu.forecastguard.weights;

import com.chicu.forecastguard.common.error.ModelUnavailableException;

import java.util.List;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Версионированное хранилище весов по параметрам.
 * <p>
 * На каждый параметр: история версий (только дозапись), слот "latest" и слот "previous".
 * "previous" — бэкап на одно поколение, не история.
 * Все операции атомарны в пределах слотов одного параметра.
 */
public interface WeightStore {

    /**
     * Пишет новую неизменяемую версию в историю и делает её "latest".
     */
    default WeightArtifact writeLatest(String parameter, byte[] payload) {
        return writeLatestIf(parameter, payload, () -> true)
                .orElseThrow(() -> new IllegalStateException("unconditional write refused for " + parameter));
    }

    /**
     * То же, что {@link #writeLatest}, но gate проверяется внутри критической секции параметра.
     * Если gate закрыт, ничего не пишется (ни история, ни "latest").
     *
     * @return записанный артефакт или empty, если gate закрыт
     */
    Optional<WeightArtifact> writeLatestIf(String parameter, byte[] payload, BooleanSupplier gate);

    Optional<WeightArtifact> findLatest(String parameter);

    Optional<WeightArtifact> findPrevious(String parameter);

    /**
     * "latest" -> "previous" с перезаписью. Если "latest" нет, "previous" очищается.
     */
    void snapshotLatestToPrevious(String parameter);

    /**
     * "previous" -> "latest". Если "previous" пуст, "latest" очищается (точная инверсия бэкапа).
     */
    void restorePreviousToLatest(String parameter);

    /**
     * Версии параметра, от старых к новым.
     */
    List<String> listVersions(String parameter);

    default WeightArtifact readLatest(String parameter) {
        return findLatest(parameter)
                .orElseThrow(() -> new ModelUnavailableException(parameter, "no latest weights"));
    }
}
