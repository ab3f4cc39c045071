package com.trendearly.pipeline.service;

import com.trendearly.pipeline.dto.MomentumScore;
import com.trendearly.pipeline.exception.InsufficientDataException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Maps a weekly series (oldest first, newest last) to the momentum metrics.
 *
 * <pre>
 * lift         = (mean(last7) - mean(prev21)) / (mean(prev21) + 0.01)
 * acceleration = slope(last7) - slope(prev21)
 * novelty      = 1 - percentileRank(mean(last90), all points)
 * noise        = stdev(last7) / (mean(last7) + 0.01)
 * raw          = 0.45*lift + 0.35*acceleration + 0.25*novelty - 0.25*noise
 * score        = round(100 / (1 + e^-raw)), clamped to [1, 100]
 * </pre>
 *
 * No state and no side effects.
 */
@Service
public class MomentumScoringService {

    public static final int MIN_POINTS = 28;

    static final int RECENT_WINDOW = 7;
    static final int PRIOR_WINDOW = 21;
    static final int BASELINE_WINDOW = 90;

    private static final double STABILIZER = 0.01;

    private static final double LIFT_WEIGHT = 0.45;
    private static final double ACCELERATION_WEIGHT = 0.35;
    private static final double NOVELTY_WEIGHT = 0.25;
    private static final double NOISE_WEIGHT = -0.25;

    public MomentumScore score(List<Double> series) throws InsufficientDataException {
        if (series == null || series.size() < MIN_POINTS) {
            int size = series == null ? 0 : series.size();
            throw new InsufficientDataException(
                    "need at least " + MIN_POINTS + " weekly points, got " + size);
        }

        double[] values = toArray(series);
        int n = values.length;

        double[] last7 = slice(values, n - RECENT_WINDOW, n);
        double[] prev21 = slice(values, n - RECENT_WINDOW - PRIOR_WINDOW, n - RECENT_WINDOW);
        // 90주 미만이면 있는 만큼만 사용
        double[] baseline = slice(values, Math.max(0, n - BASELINE_WINDOW), n);

        double lift = lift(last7, prev21);
        double acceleration = slope(last7) - slope(prev21);
        double novelty = 1.0 - percentileRank(mean(baseline), values);
        double noise = noise(last7);

        double raw = LIFT_WEIGHT * lift
                + ACCELERATION_WEIGHT * acceleration
                + NOVELTY_WEIGHT * novelty
                + NOISE_WEIGHT * noise;

        return MomentumScore.builder()
                .lift(lift)
                .acceleration(acceleration)
                .novelty(novelty)
                .noise(noise)
                .rawScore(raw)
                .momentumScore(toMomentumScore(raw))
                .build();
    }

    /**
     * Logistic squash of the raw score. Very negative raw values make {@code exp} overflow to
     * infinity, which yields 0 and clamps to 1.
     */
    static int toMomentumScore(double raw) {
        double squashed = 100.0 / (1.0 + Math.exp(-raw));
        long rounded = Math.round(squashed);
        return (int) Math.max(1, Math.min(100, rounded));
    }

    static double lift(double[] recent, double[] prior) {
        double priorMean = mean(prior);
        return (mean(recent) - priorMean) / (priorMean + STABILIZER);
    }

    static double noise(double[] recent) {
        return stdev(recent) / (mean(recent) + STABILIZER);
    }

    static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /** Sample standard deviation (n - 1). */
    static double stdev(double[] values) {
        if (values.length < 2) {
            return 0.0;
        }
        double mean = mean(values);
        double squares = 0.0;
        for (double v : values) {
            squares += (v - mean) * (v - mean);
        }
        return Math.sqrt(squares / (values.length - 1));
    }

    /** Ordinary least squares slope of value against index 0..n-1. */
    static double slope(double[] values) {
        int n = values.length;
        if (n < 2) {
            return 0.0;
        }
        double sumX = 0, sumY = 0, sumXY = 0, sumXX = 0;
        for (int i = 0; i < n; i++) {
            sumX += i;
            sumY += values[i];
            sumXY += i * values[i];
            sumXX += (double) i * i;
        }
        double denominator = n * sumXX - sumX * sumX;
        if (Math.abs(denominator) < 1e-10) {
            return 0.0;
        }
        return (n * sumXY - sumX * sumY) / denominator;
    }

    /** (count below + 0.5 * count equal) / total */
    static double percentileRank(double value, double[] population) {
        if (population.length == 0) {
            return 0.5;
        }
        int below = 0;
        int equal = 0;
        for (double v : population) {
            if (v < value) {
                below++;
            } else if (v == value) {
                equal++;
            }
        }
        return (below + 0.5 * equal) / population.length;
    }

    private static double[] toArray(List<Double> series) throws InsufficientDataException {
        double[] values = new double[series.size()];
        for (int i = 0; i < values.length; i++) {
            Double v = series.get(i);
            if (v == null || !Double.isFinite(v) || v < 0) {
                throw new InsufficientDataException("invalid point at index " + i + ": " + v);
            }
            values[i] = v;
        }
        return values;
    }

    private static double[] slice(double[] values, int from, int to) {
        double[] out = new double[to - from];
        System.arraycopy(values, from, out, 0, out.length);
        return out;
    }
}
