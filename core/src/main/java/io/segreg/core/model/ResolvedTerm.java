package io.segreg.core.model;

import java.util.List;

/**
 * The value of one term in one segment after carry-over and relative resolution.
 *
 * @param key        term key ({@code int} for intercepts, otherwise the slope code)
 * @param transform  predictor expression for slopes, {@code null} for intercepts
 * @param summands   parameters whose sum is the term's value (one for absolute terms, more
 *                   when relative offsets were stacked)
 * @param definedIn  the segment that last defined this term
 */
public record ResolvedTerm(String key, Expr transform, List<String> summands, int definedIn) {

    public ResolvedTerm {
        summands = List.copyOf(summands);
    }

    /** Returns {@code true} for the intercept term. */
    public boolean isIntercept() {
        return transform == null;
    }
}
