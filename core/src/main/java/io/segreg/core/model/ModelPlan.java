package io.segreg.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Sampler-independent description of the model body: for every channel and segment the sum
 * of contributions that forms its value. Read by both a {@code SamplerDialect} and the
 * {@code Simulator}.
 *
 * @param modelId        model identifier
 * @param familyLink     response family and link
 * @param response       response column name
 * @param predictor      predictor column name
 * @param trials         binomial trials column, or {@code null}
 * @param formulas       segment formulas in order, for comments
 * @param varying        varying change points in change-point order
 * @param channels       per-segment expressions of every channel, mean first
 * @param coordinates    indices {@code j} of the local coordinates {@code X_j} that are used
 */
public record ModelPlan(
        String modelId,
        FamilyLink familyLink,
        String response,
        String predictor,
        String trials,
        List<String> formulas,
        List<VaryingChangePoint> varying,
        Map<Channel, List<SegmentExpression>> channels,
        SortedSet<Integer> coordinates) {

    public ModelPlan {
        Objects.requireNonNull(familyLink, "familyLink must not be null");
        Objects.requireNonNull(response, "response must not be null");
        Objects.requireNonNull(predictor, "predictor must not be null");
        formulas = List.copyOf(formulas);
        varying = List.copyOf(varying);
        Map<Channel, List<SegmentExpression>> copy = new LinkedHashMap<>();
        channels.forEach((channel, list) -> copy.put(channel, List.copyOf(list)));
        channels = Collections.unmodifiableMap(copy);
        coordinates = Collections.unmodifiableSortedSet(new TreeSet<>(coordinates));
    }

    /**
     * One summand of a channel value: the sum of {@code coefficients}, multiplied by
     * {@code transform} evaluated at local coordinate {@code X_coordinate} for slopes.
     *
     * @param coefficients parameters whose sum is the coefficient
     * @param transform    slope expression over the predictor, or {@code null} for intercepts
     * @param coordinate   local coordinate index for slopes, 0 for intercepts
     */
    public record Contribution(List<String> coefficients, Expr transform, int coordinate) {
        public Contribution {
            coefficients = List.copyOf(coefficients);
        }

        public boolean isIntercept() {
            return transform == null;
        }
    }

    /**
     * Value of a channel within one segment. No contributions means the value is 0.
     *
     * @param segment       1-based segment index
     * @param contributions summands in canonical order
     */
    public record SegmentExpression(int segment, List<Contribution> contributions) {
        public SegmentExpression {
            contributions = List.copyOf(contributions);
        }
    }

    /**
     * A change point with per-group offsets. Each group's location is clamped to
     * {@code [lower, upper]}.
     *
     * @param changePoint index {@code k} of {@code cp_k}
     * @param group       grouping column
     * @param offset      offset vector name
     * @param lower       {@code cp_(k-1)} or {@code MINX}
     * @param upper       {@code cp_(k+1)} or {@code MAXX}
     */
    public record VaryingChangePoint(int changePoint, String group, String offset, Expr lower, Expr upper) {

        /** Data constant holding the number of levels of {@link #group()}. */
        public String levelCount() {
            return "n_unique_" + group;
        }
    }

    /** Number of segments. */
    public int segmentCount() {
        return formulas.size();
    }

    /** Expressions of one channel by segment, or {@code null} if the model lacks the channel. */
    public List<SegmentExpression> channel(Channel channel) {
        return channels.get(channel);
    }

    /** Highest AR order, or 0. */
    public int arOrder() {
        int max = 0;
        for (Channel channel : channels.keySet()) {
            if (channel.type() == Channel.Type.AR) {
                max = Math.max(max, channel.order());
            }
        }
        return max;
    }

    /** The varying effect on change point {@code k}, or {@code null}. */
    public VaryingChangePoint varyingOn(int k) {
        for (VaryingChangePoint candidate : varying) {
            if (candidate.changePoint() == k) {
                return candidate;
            }
        }
        return null;
    }
}
