package io.segreg.core.model;

/**
 * A varying (hierarchical) offset on a change point.
 *
 * @param changePoint index {@code k} of {@code cp_k}
 * @param group       grouping variable
 * @param offset      name of the offset vector, e.g. {@code cp_1_id}
 * @param spread      name of the spread parameter, e.g. {@code cp_1_sd}
 */
public record VaryingEffect(int changePoint, String group, String offset, String spread) {}
