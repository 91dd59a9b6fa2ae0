package io.segreg.core.engine;

import io.segreg.core.error.ConstraintViolationException;
import io.segreg.core.model.Constraint;
import io.segreg.core.model.DataSummary;
import io.segreg.core.model.FamilyLink;
import io.segreg.core.model.ModelPlan;
import io.segreg.core.model.Parameter;
import io.segreg.core.model.ParameterTable;
import io.segreg.core.model.Prior;
import io.segreg.core.model.PriorTable;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Output of {@link ModelCompiler}: model code, priors, parameters, constraints and a
 * simulator for one model. Immutable and thread-safe.
 */
public final class CompiledModel {

    private final String modelId;
    private final FamilyLink familyLink;
    private final ParameterTable table;
    private final List<Constraint> constraints;
    private final PriorTable priors;
    private final ModelPlan plan;
    private final String modelCode;
    private final Simulator simulator;

    CompiledModel(
            String modelId,
            FamilyLink familyLink,
            ParameterTable table,
            List<Constraint> constraints,
            PriorTable priors,
            ModelPlan plan,
            String modelCode,
            Simulator simulator) {
        this.modelId = modelId;
        this.familyLink = Objects.requireNonNull(familyLink, "familyLink must not be null");
        this.table = Objects.requireNonNull(table, "table must not be null");
        this.constraints = List.copyOf(constraints);
        this.priors = Objects.requireNonNull(priors, "priors must not be null");
        this.plan = Objects.requireNonNull(plan, "plan must not be null");
        this.modelCode = Objects.requireNonNull(modelCode, "modelCode must not be null");
        this.simulator = Objects.requireNonNull(simulator, "simulator must not be null");
    }

    public String modelId() {
        return modelId;
    }

    public FamilyLink familyLink() {
        return familyLink;
    }

    /** The sampler model text. */
    public String modelCode() {
        return modelCode;
    }

    /** Prior text by parameter name in canonical order, with normal scales as standard deviations. */
    public Map<String, String> priors() {
        Map<String, String> text = new LinkedHashMap<>();
        for (Map.Entry<String, Prior> entry : priors.asMap().entrySet()) {
            text.put(entry.getKey(), entry.getValue().text());
        }
        return Collections.unmodifiableMap(text);
    }

    /** The structured priors. */
    public PriorTable priorTable() {
        return priors;
    }

    /** Parameter names in the fixed order samples are reported in. */
    public List<String> parameterNames() {
        return table.names();
    }

    /** Parameters with kind, segment and population-level or varying category. */
    public List<Parameter> parameters() {
        return table.parameters();
    }

    public ParameterTable parameterTable() {
        return table;
    }

    public List<Constraint> constraints() {
        return constraints;
    }

    public ModelPlan plan() {
        return plan;
    }

    public Simulator simulator() {
        return simulator;
    }

    /**
     * Data constants for a model without varying change points ({@code MINX}, {@code MAXX},
     * {@code SDY}).
     *
     * @throws IllegalArgumentException if the model has varying change points; use
     *                                  {@link #samplerData(DataSummary, Map)}
     */
    public Map<String, Double> samplerData(DataSummary summary) {
        return samplerData(summary, Map.of());
    }

    /**
     * Data constants the model code refers to: {@code MINX}, {@code MAXX}, {@code SDY} and
     * {@code n_unique_<group>} for every varying change point. The grouping columns
     * themselves go to the sampler as level indices {@code 1..n_unique_<group>}.
     *
     * @param summary dataset summary
     * @param groups  grouping column name to per-observation level labels
     * @throws IllegalArgumentException if a grouping column the model uses is missing
     */
    public Map<String, Double> samplerData(DataSummary summary, Map<String, String[]> groups) {
        Objects.requireNonNull(summary, "summary must not be null");
        Objects.requireNonNull(groups, "groups must not be null");
        Map<String, Double> data = summary.constants();
        for (ModelPlan.VaryingChangePoint varying : plan.varying()) {
            String[] labels = groups.get(varying.group());
            if (labels == null) {
                throw new IllegalArgumentException(
                        "Grouping column '" + varying.group() + "' is required by " + varying.offset());
            }
            data.put(varying.levelCount(), (double) new HashSet<>(Arrays.asList(labels)).size());
        }
        return Collections.unmodifiableMap(data);
    }

    /**
     * Checks one parameter draw against the derived constraints. Stationarity is skipped for
     * AR coefficients whose prior was overridden. Checks whose values are absent from
     * {@code draw} pass.
     *
     * @param draw parameter values, optionally with the data constants
     * @throws ConstraintViolationException on the first violated constraint
     */
    public void checkDraw(Map<String, Double> draw) {
        for (Constraint constraint : constraints) {
            if (constraint instanceof Constraint.Stationarity && priors.isOverridden(constraint.parameter())) {
                continue;
            }
            if (!constraint.isSatisfied(draw)) {
                throw new ConstraintViolationException(constraint.parameter(), constraint.description(), modelId);
            }
        }
    }

    /** As {@link #checkDraw(Map)}, with {@code MINX}/{@code MAXX} taken from {@code summary}. */
    public void checkDraw(Map<String, Double> draw, DataSummary summary) {
        Map<String, Double> values = new HashMap<>(summary.constants());
        values.putAll(draw);
        checkDraw(values);
    }
}
