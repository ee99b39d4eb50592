package com.chicu.forecastguard.health;

/**
 * mean/std окна и (де)нормализация по ним. std — популяционное; std == 0 заменяется на 1.
 */
public record SeriesStats(double mean, double std) {

    public static SeriesStats of(double[] values) {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("empty window");
        }
        double sum = 0.0;
        for (double v : values) sum += v;
        double mean = sum / values.length;

        double sq = 0.0;
        for (double v : values) {
            double d = v - mean;
            sq += d * d;
        }
        double std = Math.sqrt(sq / values.length);
        return new SeriesStats(mean, std > 0 ? std : 1.0);
    }

    public double[] normalize(double[] values) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = (values[i] - mean) / std;
        }
        return out;
    }

    public double[] denormalize(double[] values) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[i] * std + mean;
        }
        return out;
    }

    public static double meanAbsoluteError(double[] predicted, double[] actual) {
        if (predicted.length != actual.length || predicted.length == 0) {
            throw new IllegalArgumentException("length mismatch: " + predicted.length + " vs " + actual.length);
        }
        double sum = 0.0;
        for (int i = 0; i < predicted.length; i++) {
            sum += Math.abs(predicted[i] - actual[i]);
        }
        return sum / predicted.length;
    }
}
