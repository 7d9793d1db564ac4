package com.verdict.backend.util;

import com.verdict.backend.model.Candle;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Descriptive statistics over daily series. Standard deviations use the sample (n - 1) convention.
 */
public final class SeriesMath {

    private SeriesMath() {}

    public static double[] closes(List<Candle> candles) {
        return candles.stream().mapToDouble(Candle::getClose).toArray();
    }

    /**
     * Simple day-over-day returns; the result is one element shorter than the input.
     */
    public static double[] returns(double[] closes) {
        if (closes.length < 2) {
            return new double[0];
        }
        double[] returns = new double[closes.length - 1];
        for (int i = 1; i < closes.length; i++) {
            returns[i - 1] = closes[i] / closes[i - 1] - 1.0;
        }
        return returns;
    }

    public static double mean(double[] values) {
        return mean(values, 0, values.length);
    }

    public static double mean(double[] values, int from, int to) {
        if (to <= from) {
            return Double.NaN;
        }
        double sum = 0.0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return sum / (to - from);
    }

    public static double sampleStdDev(double[] values) {
        return sampleStdDev(values, 0, values.length);
    }

    public static double sampleStdDev(double[] values, int from, int to) {
        int n = to - from;
        if (n < 2) {
            return Double.NaN;
        }
        double mean = mean(values, from, to);
        double sumSquares = 0.0;
        for (int i = from; i < to; i++) {
            double diff = values[i] - mean;
            sumSquares += diff * diff;
        }
        return Math.sqrt(sumSquares / (n - 1));
    }

    /**
     * Sample standard deviation of every full trailing window.
     */
    public static double[] rollingStdDev(double[] values, int window) {
        if (values.length < window) {
            return new double[0];
        }
        double[] result = new double[values.length - window + 1];
        for (int end = window; end <= values.length; end++) {
            result[end - window] = sampleStdDev(values, end - window, end);
        }
        return result;
    }

    /**
     * Quantile with linear interpolation between the two nearest order statistics.
     */
    public static double quantile(double[] values, double q) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        double position = q * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = Math.min(lower + 1, sorted.length - 1);
        double fraction = position - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }

    /**
     * Exponential moving average seeded with the simple average of the first {@code period} values.
     * Positions before the seed are null.
     */
    public static List<Double> emaSeries(List<Double> values, int period) {
        List<Double> emaSeries = new ArrayList<>();
        for (int i = 0; i < values.size(); i++) {
            emaSeries.add(null);
        }
        if (values.size() < period) {
            return emaSeries;
        }
        double sma = values.subList(0, period).stream().mapToDouble(d -> d).average().orElse(0.0);
        emaSeries.set(period - 1, sma);
        double k = 2.0 / (period + 1);
        double ema = sma;
        for (int i = period; i < values.size(); i++) {
            ema = (values.get(i) * k) + (ema * (1 - k));
            emaSeries.set(i, ema);
        }
        return emaSeries;
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
