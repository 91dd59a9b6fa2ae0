package io.segreg.core.engine;

import io.segreg.core.error.PriorSpecException;
import io.segreg.core.model.Constraint;
import io.segreg.core.model.DataSummary;
import io.segreg.core.model.Expr;
import io.segreg.core.model.Family;
import io.segreg.core.model.FamilyLink;
import io.segreg.core.model.Link;
import io.segreg.core.model.Parameter;
import io.segreg.core.model.ParameterTable;
import io.segreg.core.model.Prior;
import io.segreg.core.model.PriorTable;
import io.segreg.core.spec.PriorParser;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assigns a prior to every parameter: a default chosen by parameter kind and family, or the
 * user's override. Overrides replace the default wholesale and are not checked against the
 * derived constraints.
 *
 * <p>
 * Default scales are symbolic in the data constants, so the same model gets the same priors
 * whatever data it is later fitted to.
 */
public final class PriorSynthesizer {

    private static final Logger LOG = LoggerFactory.getLogger(PriorSynthesizer.class);

    private static final Expr ZERO = Expr.num(0);
    private static final Expr MINX = Expr.var(DataSummary.MINX);
    private static final Expr MAXX = Expr.var(DataSummary.MAXX);
    private static final Expr SDY = Expr.var(DataSummary.SDY);
    private static final Expr RANGE = Expr.minus(MAXX, MINX);

    private final String modelId;

    public PriorSynthesizer(String modelId) {
        this.modelId = modelId;
    }

    /**
     * Builds the prior table.
     *
     * @param table       the parameter table
     * @param constraints constraints from {@link ConstraintDeriver}
     * @param familyLink  family/link pair, which sets the default scale
     * @param overrides   parameter name to distribution text; may be empty
     * @return one prior per parameter, in canonical order
     * @throws PriorSpecException if an override names an unknown parameter or cannot be parsed
     */
    public PriorTable synthesize(
            ParameterTable table, List<Constraint> constraints, FamilyLink familyLink, Map<String, String> overrides) {
        Objects.requireNonNull(overrides, "overrides must not be null");
        for (String name : overrides.keySet()) {
            if (!table.contains(name)) {
                throw new PriorSpecException(
                        "Prior given for unknown parameter '" + name + "'; parameters are " + table.names(),
                        modelId,
                        name);
            }
        }

        Map<String, Constraint.Ordering> orderings = new HashMap<>();
        Map<String, Constraint.Truncation> truncations = new HashMap<>();
        for (Constraint constraint : constraints) {
            if (constraint instanceof Constraint.Ordering ordering) {
                orderings.put(ordering.parameter(), ordering);
            } else if (constraint instanceof Constraint.Truncation truncation) {
                truncations.put(truncation.parameter(), truncation);
            }
        }

        Expr scale = scale(familyLink);
        Map<String, Prior> priors = new LinkedHashMap<>();
        Set<String> overridden = new LinkedHashSet<>();
        for (Parameter parameter : table.parameters()) {
            String name = parameter.name();
            String override = overrides.get(name);
            if (override != null) {
                Prior prior = PriorParser.parse(override, name, modelId);
                LOG.debug("prior.override model_id={} parameter={} prior={}", modelId, name, prior.text());
                priors.put(name, prior);
                overridden.add(name);
            } else {
                priors.put(name, defaultPrior(parameter, scale, orderings, truncations));
            }
        }
        return new PriorTable(priors, overridden);
    }

    /**
     * Family-dependent scale {@code S} of intercepts: {@code 3 * SDY} for gaussian identity,
     * {@code 3} on logit/probit/log scales, {@code 10} for poisson counts.
     */
    static Expr scale(FamilyLink familyLink) {
        Family family = familyLink.family();
        if (family == Family.GAUSSIAN) {
            return familyLink.link() == Link.IDENTITY ? Expr.times(Expr.num(3), SDY) : Expr.num(3);
        }
        if (family == Family.POISSON) {
            return Expr.num(10);
        }
        return Expr.num(3);
    }

    private static Prior defaultPrior(
            Parameter parameter,
            Expr scale,
            Map<String, Constraint.Ordering> orderings,
            Map<String, Constraint.Truncation> truncations) {
        switch (parameter.kind()) {
            case CHANGE_POINT:
                return new Prior.Uniform(orderings.get(parameter.name()).lower(), MAXX);
            case INTERCEPT:
                return Prior.Normal.of(ZERO, scale);
            case SLOPE:
                return Prior.Normal.of(ZERO, Expr.div(scale, RANGE));
            case VARIANCE_INTERCEPT:
                return parameter.relative() ? Prior.Normal.of(ZERO, SDY) : new Prior.Normal(ZERO, SDY, ZERO, null);
            case VARIANCE_SLOPE:
                return Prior.Normal.of(ZERO, Expr.div(SDY, RANGE));
            case AR_COEFFICIENT:
                return new Prior.Uniform(Expr.num(-1), Expr.num(1));
            case AR_SLOPE:
                return Prior.Normal.of(ZERO, Expr.div(Expr.num(1), RANGE));
            case CHANGE_POINT_SPREAD:
                return new Prior.Normal(ZERO, Expr.div(RANGE, Expr.num(2)), ZERO, null);
            case VARYING_OFFSET:
                Constraint.Truncation truncation = truncations.get(parameter.name());
                Expr base = Expr.var(truncation.base());
                return new Prior.Hierarchical(
                        ZERO,
                        ParameterTable.changePoint(parameter.segment()) + "_sd",
                        Expr.minus(truncation.lower(), base),
                        Expr.minus(truncation.upper(), base));
            default:
                throw new IllegalStateException("Unhandled parameter kind: " + parameter.kind());
        }
    }
}
