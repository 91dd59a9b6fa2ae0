package io.segreg.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One parsed term of a segment formula. A sealed variant hierarchy; the
 * {@code ParameterTableBuilder} interprets each variant; the parser performs no
 * semantic checks beyond the grammar.
 *
 * <p>
 * Thread-safe and immutable.
 */
public sealed interface Term {

    /** How an intercept-like term is specified. */
    enum InterceptMode {
        /** {@code 1}: a new value, overriding carry-over. */
        ABSOLUTE,
        /** {@code rel(1)}: an offset added to the carried-in value. */
        RELATIVE,
        /** {@code 0}: no intercept of its own; the level joins the previous segment. */
        SUPPRESSED
    }

    /** Character offset of this term within the segment formula. */
    int position();

    /**
     * An intercept term: {@code 1}, {@code 0} or {@code rel(1)}.
     *
     * @param mode     how the intercept is specified
     * @param position offset in the formula text
     */
    record Intercept(InterceptMode mode, int position) implements Term {
        public Intercept {
            Objects.requireNonNull(mode, "mode must not be null");
        }
    }

    /**
     * A slope on the predictor or on a transform of it ({@code x}, {@code x^2},
     * {@code exp(x)}, {@code rel(x)}).
     *
     * @param expression the predictor expression
     * @param relative   {@code true} when written as {@code rel(...)}
     * @param position   offset in the formula text
     */
    record Slope(Expr expression, boolean relative, int position) implements Term {
        public Slope {
            Objects.requireNonNull(expression, "expression must not be null");
        }

        /** Returns {@code true} if the expression is more than the bare predictor. */
        public boolean isTransform() {
            return !(expression instanceof Expr.Var);
        }
    }

    /**
     * An autoregressive sub-model: {@code ar(N)} or {@code ar(N, formula)}.
     *
     * @param order    AR order N (at least 1)
     * @param formula  terms of the coefficient formula; empty means the default {@code 1}
     * @param position offset in the formula text
     */
    record Autoregressive(int order, List<Term> formula, int position) implements Term {
        public Autoregressive {
            if (order < 1) {
                throw new IllegalArgumentException("AR order must be at least 1, got: " + order);
            }
            formula = List.copyOf(formula);
        }
    }

    /**
     * A variance sub-model: {@code sigma(formula)}.
     *
     * @param formula  terms of the standard-deviation formula
     * @param position offset in the formula text
     */
    record Variance(List<Term> formula, int position) implements Term {
        public Variance {
            formula = List.copyOf(formula);
        }
    }

    /**
     * A varying change-point effect {@code (1 | group)}, only valid on the change-point side
     * of segments 2..K.
     *
     * @param group    grouping variable name
     * @param position offset in the formula text
     */
    record VaryingGroup(String group, int position) implements Term {
        public VaryingGroup {
            Objects.requireNonNull(group, "group must not be null");
        }
    }
}
