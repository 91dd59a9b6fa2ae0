package io.segreg.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One parsed formula fragment. Segment {@code k} is preceded by change point
 * {@code cp_(k-1)} for k &gt; 1.
 *
 * @param index         1-based position in the formula list
 * @param formula       the original formula text
 * @param response      response variable name (segment 1 only, otherwise {@code null})
 * @param trials        binomial trials column from {@code y | trials(N)}, or {@code null}
 * @param varyingGroups grouping variables of varying change-point effects on the preceding
 *                      change point, in formula order
 * @param terms         right-hand side terms in formula order
 */
public record Segment(
        int index,
        String formula,
        String response,
        String trials,
        List<Term.VaryingGroup> varyingGroups,
        List<Term> terms) {

    public Segment {
        if (index < 1) {
            throw new IllegalArgumentException("Segment index must be at least 1, got: " + index);
        }
        Objects.requireNonNull(formula, "formula must not be null");
        varyingGroups = List.copyOf(varyingGroups);
        terms = List.copyOf(terms);
    }

    /** Returns the intercept terms ({@code 0}, {@code 1}, {@code rel(1)}) of the mean formula. */
    public List<Term.Intercept> intercepts() {
        return terms.stream()
                .filter(Term.Intercept.class::isInstance)
                .map(Term.Intercept.class::cast)
                .toList();
    }

    /** Returns the slope terms of the mean formula, in formula order. */
    public List<Term.Slope> slopes() {
        return terms.stream()
                .filter(Term.Slope.class::isInstance)
                .map(Term.Slope.class::cast)
                .toList();
    }

    /** Returns the {@code ar()} terms (more than one is a duplicate). */
    public List<Term.Autoregressive> autoregressive() {
        return terms.stream()
                .filter(Term.Autoregressive.class::isInstance)
                .map(Term.Autoregressive.class::cast)
                .toList();
    }

    /** Returns the {@code sigma()} terms (more than one is a duplicate). */
    public List<Term.Variance> variance() {
        return terms.stream()
                .filter(Term.Variance.class::isInstance)
                .map(Term.Variance.class::cast)
                .toList();
    }
}
