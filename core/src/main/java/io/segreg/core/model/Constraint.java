package io.segreg.core.model;

import java.util.Map;
import java.util.Objects;

/**
 * A derived relationship between parameters. Constraints feed the prior synthesizer (to
 * truncate default supports) and draw checks; they are not persisted separately.
 *
 * <p>
 * Bounds are symbolic {@link Expr}s over parameter names and the data constants
 * {@code MINX}/{@code MAXX}, so the constraint set does not depend on the dataset.
 *
 * <p>
 * Thread-safe and immutable.
 */
public sealed interface Constraint {

    /** Tolerance for the zero-sum check. */
    double ZERO_SUM_TOLERANCE = 1e-9;

    /** The constrained parameter. */
    String parameter();

    /** Human-readable description, e.g. {@code cp_1 < cp_2 < MAXX}. */
    String description();

    /**
     * Checks the constraint against concrete values.
     *
     * @param values parameter values (varying levels as {@code cp_1_id[level]}) together with
     *               the data constants
     * @return {@code true} if satisfied or if a value needed for the check is absent
     */
    boolean isSatisfied(Map<String, Double> values);

    /**
     * Change point ordering: {@code lower < parameter < upper}.
     *
     * @param parameter the change point
     * @param lower     previous change point or {@code MINX}
     * @param upper     next change point or {@code MAXX}
     */
    record Ordering(String parameter, Expr lower, Expr upper) implements Constraint {
        public Ordering {
            Objects.requireNonNull(parameter, "parameter must not be null");
            Objects.requireNonNull(lower, "lower must not be null");
            Objects.requireNonNull(upper, "upper must not be null");
        }

        @Override
        public String description() {
            return lower.render() + " < " + parameter + " < " + upper.render();
        }

        @Override
        public boolean isSatisfied(Map<String, Double> values) {
            Double value = values.get(parameter);
            if (value == null || !bound(lower, values) || !bound(upper, values)) {
                return true;
            }
            return value > lower.evaluate(values) && value < upper.evaluate(values);
        }
    }

    /**
     * Varying-offset truncation: every level's absolute location {@code base + offset} lies in
     * the open interval {@code (lower, upper)}.
     *
     * @param parameter the offset vector
     * @param base      the population-level change point
     * @param lower     adjacent lower population-level change point or {@code MINX}
     * @param upper     adjacent upper population-level change point or {@code MAXX}
     */
    record Truncation(String parameter, String base, Expr lower, Expr upper) implements Constraint {
        public Truncation {
            Objects.requireNonNull(parameter, "parameter must not be null");
            Objects.requireNonNull(base, "base must not be null");
            Objects.requireNonNull(lower, "lower must not be null");
            Objects.requireNonNull(upper, "upper must not be null");
        }

        @Override
        public String description() {
            return lower.render() + " < " + base + " + " + parameter + "[level] < " + upper.render();
        }

        @Override
        public boolean isSatisfied(Map<String, Double> values) {
            Double location = values.get(base);
            if (location == null || !bound(lower, values) || !bound(upper, values)) {
                return true;
            }
            double lo = lower.evaluate(values);
            double hi = upper.evaluate(values);
            String prefix = parameter + "[";
            for (Map.Entry<String, Double> entry : values.entrySet()) {
                if (entry.getKey().startsWith(prefix)) {
                    double absolute = location + entry.getValue();
                    if (absolute <= lo || absolute >= hi) {
                        return false;
                    }
                }
            }
            return true;
        }
    }

    /**
     * Offsets across all levels of a group sum to exactly zero.
     *
     * @param parameter the offset vector
     * @param group     the grouping variable
     */
    record ZeroSum(String parameter, String group) implements Constraint {
        public ZeroSum {
            Objects.requireNonNull(parameter, "parameter must not be null");
            Objects.requireNonNull(group, "group must not be null");
        }

        @Override
        public String description() {
            return "sum of " + parameter + " over levels of " + group + " = 0";
        }

        @Override
        public boolean isSatisfied(Map<String, Double> values) {
            String prefix = parameter + "[";
            double sum = 0;
            for (Map.Entry<String, Double> entry : values.entrySet()) {
                if (entry.getKey().startsWith(prefix)) {
                    sum += entry.getValue();
                }
            }
            return Math.abs(sum) <= ZERO_SUM_TOLERANCE;
        }
    }

    /**
     * Stationarity hint for AR coefficients: {@code lower < parameter < upper}. Only applied
     * to default priors.
     *
     * @param parameter the AR coefficient
     * @param lower     lower bound (-1)
     * @param upper     upper bound (1)
     */
    record Stationarity(String parameter, double lower, double upper) implements Constraint {
        public Stationarity {
            Objects.requireNonNull(parameter, "parameter must not be null");
        }

        @Override
        public String description() {
            return Expr.formatNumber(lower) + " < " + parameter + " < " + Expr.formatNumber(upper);
        }

        @Override
        public boolean isSatisfied(Map<String, Double> values) {
            Double value = values.get(parameter);
            return value == null || (value > lower && value < upper);
        }
    }

    private static boolean bound(Expr expr, Map<String, Double> values) {
        return values.keySet().containsAll(expr.variables());
    }
}
