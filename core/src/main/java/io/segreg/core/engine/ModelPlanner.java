package io.segreg.core.engine;

import io.segreg.core.model.Channel;
import io.segreg.core.model.ChannelResolution;
import io.segreg.core.model.FamilyLink;
import io.segreg.core.model.ModelPlan;
import io.segreg.core.model.ParameterTable;
import io.segreg.core.model.ResolvedTerm;
import io.segreg.core.model.Segment;
import io.segreg.core.model.VaryingEffect;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Turns the resolved parameter table into a {@link ModelPlan}. The value of a channel in
 * segment {@code k} is its intercept plus, for every segment {@code j} from the last level
 * reset up to {@code k}, each slope active in {@code j} applied to {@code X_j}.
 *
 * <p>
 * Thread-safe and stateless; all methods are static.
 */
public final class ModelPlanner {

    private ModelPlanner() {}

    public static ModelPlan plan(
            String modelId, List<Segment> segments, ParameterTable table, FamilyLink familyLink, String predictor) {
        Segment first = segments.get(0);
        SortedSet<Integer> coordinates = new TreeSet<>();
        Map<Channel, List<ModelPlan.SegmentExpression>> channels = new LinkedHashMap<>();
        for (Channel channel : table.channels()) {
            List<ModelPlan.SegmentExpression> expressions = new ArrayList<>();
            for (int k = 1; k <= table.segmentCount(); k++) {
                expressions.add(expression(table, channel, k, coordinates));
            }
            channels.put(channel, expressions);
        }

        List<ModelPlan.VaryingChangePoint> varying = new ArrayList<>();
        for (VaryingEffect effect : table.varyingEffects()) {
            int k = effect.changePoint();
            varying.add(new ModelPlan.VaryingChangePoint(
                    k,
                    effect.group(),
                    effect.offset(),
                    ConstraintDeriver.lowerNeighbour(k),
                    ConstraintDeriver.upperNeighbour(k, table.changePointCount())));
        }

        List<String> formulas = segments.stream().map(Segment::formula).toList();
        return new ModelPlan(
                modelId, familyLink, first.response(), predictor, first.trials(), formulas, varying, channels, coordinates);
    }

    private static ModelPlan.SegmentExpression expression(
            ParameterTable table, Channel channel, int k, SortedSet<Integer> coordinates) {
        ChannelResolution resolution = table.resolution(channel, k);
        List<ModelPlan.Contribution> contributions = new ArrayList<>();
        if (resolution.started()) {
            ResolvedTerm intercept = resolution.intercept();
            if (intercept != null) {
                contributions.add(new ModelPlan.Contribution(intercept.summands(), null, 0));
            }
            for (int j = resolution.anchor(); j <= k; j++) {
                for (ResolvedTerm term : table.resolution(channel, j).terms().values()) {
                    if (!term.isIntercept()) {
                        contributions.add(new ModelPlan.Contribution(term.summands(), term.transform(), j));
                        coordinates.add(j);
                    }
                }
            }
        }
        return new ModelPlan.SegmentExpression(k, contributions);
    }
}
