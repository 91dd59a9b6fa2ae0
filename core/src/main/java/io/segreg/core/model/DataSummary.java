package io.segreg.core.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dataset summary supplied by an external loader. Exposed to the sampler as the data constants
 * {@code MINX}, {@code MAXX} and {@code SDY} that default priors refer to.
 *
 * @param minX minimum observed predictor value
 * @param maxX maximum observed predictor value
 * @param sdY  sample standard deviation of the response (1 when not applicable)
 */
public record DataSummary(double minX, double maxX, double sdY) {

    public static final String MINX = "MINX";
    public static final String MAXX = "MAXX";
    public static final String SDY = "SDY";

    public DataSummary {
        if (!(minX < maxX)) {
            throw new IllegalArgumentException("minX must be below maxX, got: " + minX + " and " + maxX);
        }
        if (!(sdY > 0)) {
            throw new IllegalArgumentException("sdY must be positive, got: " + sdY);
        }
    }

    /**
     * Summarizes raw columns.
     *
     * @param x predictor values (at least two distinct)
     * @param y response values, or {@code null} to use {@code sdY = 1}
     */
    public static DataSummary of(double[] x, double[] y) {
        if (x == null || x.length == 0) {
            throw new IllegalArgumentException("x must not be empty");
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : x) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        double sd = 1;
        if (y != null && y.length > 1) {
            double mean = 0;
            for (double v : y) {
                mean += v;
            }
            mean /= y.length;
            double ss = 0;
            for (double v : y) {
                ss += (v - mean) * (v - mean);
            }
            double sample = Math.sqrt(ss / (y.length - 1));
            if (sample > 0) {
                sd = sample;
            }
        }
        return new DataSummary(min, max, sd);
    }

    /** The data constants by name. */
    public Map<String, Double> constants() {
        Map<String, Double> constants = new LinkedHashMap<>();
        constants.put(MINX, minX);
        constants.put(MAXX, maxX);
        constants.put(SDY, sdY);
        return constants;
    }
}
