package io.segreg.core.engine;

import io.segreg.core.model.DataSummary;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Data columns for one simulation call.
 *
 * @param x       predictor values, in observation order
 * @param groups  grouping columns by name (one label per observation); may be empty
 * @param trials  binomial trials per observation, or {@code null}
 * @param summary data constants for {@code MINX}/{@code MAXX}/{@code SDY}, or {@code null}
 *                to use the range of {@code x}
 */
public record SimulationInput(double[] x, Map<String, String[]> groups, double[] trials, DataSummary summary) {

    public SimulationInput {
        Objects.requireNonNull(x, "x must not be null");
        x = x.clone();
        Map<String, String[]> copy = new LinkedHashMap<>();
        if (groups != null) {
            for (Map.Entry<String, String[]> column : groups.entrySet()) {
                String[] labels = column.getValue();
                if (labels.length != x.length) {
                    throw new IllegalArgumentException("Group column '" + column.getKey() + "' has "
                            + labels.length + " labels for " + x.length + " observations");
                }
                copy.put(column.getKey(), labels.clone());
            }
        }
        groups = Collections.unmodifiableMap(copy);
        if (trials != null) {
            if (trials.length != x.length) {
                throw new IllegalArgumentException(
                        "trials has " + trials.length + " values for " + x.length + " observations");
            }
            trials = trials.clone();
        }
    }

    /** Predictor values only. */
    public static SimulationInput of(double... x) {
        return new SimulationInput(x, Map.of(), null, null);
    }

    /** Returns a copy with one more grouping column. */
    public SimulationInput withGroup(String name, String... labels) {
        Map<String, String[]> more = new LinkedHashMap<>(groups);
        more.put(name, labels);
        return new SimulationInput(x, more, trials, summary);
    }

    /** Returns a copy with binomial trials. */
    public SimulationInput withTrials(double... trials) {
        return new SimulationInput(x, groups, trials, summary);
    }

    /** Returns a copy with explicit data constants. */
    public SimulationInput withSummary(DataSummary summary) {
        return new SimulationInput(x, groups, trials, summary);
    }

    /** Number of observations. */
    public int size() {
        return x.length;
    }

    @Override
    public double[] x() {
        return x.clone();
    }
}
