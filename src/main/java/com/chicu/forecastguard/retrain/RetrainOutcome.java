package com.chicu.forecastguard.retrain;

import lombok.Builder;

import java.time.Instant;

/**
 * Итог обработки одного параметра за цикл.
 *
 * @param decision   null только для FAILED (решение так и не принято)
 * @param backtestMae MAE исходной проверки (NaN, если до неё не дошли)
 * @param finalMae    MAE последней оценки (после ретрейна, если он был)
 */
@Builder
public record RetrainOutcome(
        String parameter,
        RetrainDecision decision,
        RetrainState state,
        int attemptsUsed,
        boolean succeeded,
        double backtestMae,
        double finalMae,
        String error,
        Instant finishedAt
) {

    public static RetrainOutcome failed(String parameter, String error, Instant at) {
        return RetrainOutcome.builder()
                .parameter(parameter)
                .state(RetrainState.FAILED)
                .attemptsUsed(0)
                .succeeded(false)
                .backtestMae(Double.NaN)
                .finalMae(Double.NaN)
                .error(error)
                .finishedAt(at)
                .build();
    }
}
