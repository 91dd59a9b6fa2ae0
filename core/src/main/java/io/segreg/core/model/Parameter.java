package io.segreg.core.model;

import java.util.Objects;

/**
 * A compiled model parameter. Names are a pure function of (segment, term, AR order, grouping).
 *
 * @param name     canonical name, e.g. {@code int_1}, {@code x_2}, {@code ar1_1}, {@code cp_1_id}
 * @param kind     parameter kind
 * @param segment  owning segment (for change points and varying effects: the index {@code k}
 *                 of {@code cp_k})
 * @param term     term code ({@code int}, {@code x}, {@code x_E2}, ...) or {@code null} for
 *                 change-point kinds
 * @param order    AR order for AR kinds, otherwise 0
 * @param relative {@code true} if the value is an offset on the carried-in value
 * @param group    grouping variable for varying kinds, otherwise {@code null}
 */
public record Parameter(
        String name, ParameterKind kind, int segment, String term, int order, boolean relative, String group) {

    public Parameter {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
    }

    /** Returns {@code true} for per-group offsets (indexed by group level). */
    public boolean isVarying() {
        return kind == ParameterKind.VARYING_OFFSET;
    }

    /** Reporting category: {@code varying} or {@code population-level}. */
    public String category() {
        return isVarying() ? "varying" : "population-level";
    }

    /** Name of one level of a varying offset, e.g. {@code cp_1_id[Kate]}. */
    public String levelName(String level) {
        if (!isVarying()) {
            throw new IllegalStateException(name + " is not a varying parameter");
        }
        return name + "[" + level + "]";
    }
}
