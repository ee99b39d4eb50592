package com.chicu.forecastguard.ml;

public interface ModelTrainer {

    /**
     * Одно полное обучение модели параметра на свежих данных.
     *
     * @throws com.chicu.forecastguard.common.error.TrainingFailedException обучение не удалось
     */
    TrainedModel train(String parameter);
}
