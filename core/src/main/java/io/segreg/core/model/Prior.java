package io.segreg.core.model;

import java.util.Objects;

/**
 * A prior distribution as a tagged variant. Arguments are symbolic {@link Expr}s over data
 * constants ({@code MINX}, {@code MAXX}, {@code SDY}) and parameter names. Rendering to
 * sampler text is the job of a {@code SamplerDialect}.
 *
 * <p>
 * Normal-family scales are standard deviations, not precisions.
 *
 * <p>
 * Thread-safe and immutable.
 */
public sealed interface Prior {

    /** Lower truncation/support bound, or {@code null} if unbounded. */
    Expr lower();

    /** Upper truncation/support bound, or {@code null} if unbounded. */
    Expr upper();

    /**
     * Sampler-independent text with the normal scale as a standard deviation, e.g.
     * {@code dnorm(0, 3 * SDY)}, {@code dnorm(0, SDY) T(0, )} or {@code dunif(MINX, MAXX)}.
     */
    String text();

    private static String truncation(Expr lower, Expr upper) {
        if (lower == null && upper == null) {
            return "";
        }
        return " T(" + (lower == null ? "" : lower.render()) + ", " + (upper == null ? "" : upper.render()) + ")";
    }

    /**
     * Uniform distribution on {@code (lower, upper)}.
     *
     * @param lower lower bound
     * @param upper upper bound
     */
    record Uniform(Expr lower, Expr upper) implements Prior {
        public Uniform {
            Objects.requireNonNull(lower, "lower must not be null");
            Objects.requireNonNull(upper, "upper must not be null");
        }

        @Override
        public String text() {
            return "dunif(" + lower.render() + ", " + upper.render() + ")";
        }
    }

    /**
     * Normal distribution, optionally truncated.
     *
     * @param mean  mean
     * @param sd    standard deviation
     * @param lower truncation lower bound, or {@code null}
     * @param upper truncation upper bound, or {@code null}
     */
    record Normal(Expr mean, Expr sd, Expr lower, Expr upper) implements Prior {
        public Normal {
            Objects.requireNonNull(mean, "mean must not be null");
            Objects.requireNonNull(sd, "sd must not be null");
        }

        /** Untruncated normal. */
        public static Normal of(Expr mean, Expr sd) {
            return new Normal(mean, sd, null, null);
        }

        /** Returns {@code true} if either truncation bound is set. */
        public boolean isTruncated() {
            return lower != null || upper != null;
        }

        @Override
        public String text() {
            return "dnorm(" + mean.render() + ", " + sd.render() + ")" + truncation(lower, upper);
        }
    }

    /**
     * Hierarchical normal whose scale is another parameter (the group spread).
     *
     * @param mean     mean (zero for varying change-point offsets)
     * @param spread   name of the spread parameter
     * @param lower    truncation lower bound, or {@code null}
     * @param upper    truncation upper bound, or {@code null}
     */
    record Hierarchical(Expr mean, String spread, Expr lower, Expr upper) implements Prior {
        public Hierarchical {
            Objects.requireNonNull(mean, "mean must not be null");
            Objects.requireNonNull(spread, "spread must not be null");
        }

        @Override
        public String text() {
            return "dnorm(" + mean.render() + ", " + spread + ")" + truncation(lower, upper);
        }
    }

    /**
     * The parameter is pinned to a constant and not sampled.
     *
     * @param value the fixed value
     */
    record Fixed(double value) implements Prior {

        @Override
        public Expr lower() {
            return Expr.num(value);
        }

        @Override
        public Expr upper() {
            return Expr.num(value);
        }

        @Override
        public String text() {
            return Expr.formatNumber(value);
        }
    }

    /**
     * A user-supplied distribution kept verbatim in the sampler's own syntax.
     *
     * @param text distribution text, e.g. {@code dgamma(1, 1)}
     */
    record Custom(String text) implements Prior {
        public Custom {
            Objects.requireNonNull(text, "text must not be null");
        }

        @Override
        public Expr lower() {
            return null;
        }

        @Override
        public Expr upper() {
            return null;
        }
    }
}
