package io.segreg.core.engine;

import io.segreg.core.error.ConstraintViolationException;
import io.segreg.core.error.LinkDomainException;
import io.segreg.core.error.MissingParameterException;
import io.segreg.core.model.Channel;
import io.segreg.core.model.Constraint;
import io.segreg.core.model.DataSummary;
import io.segreg.core.model.Family;
import io.segreg.core.model.Link;
import io.segreg.core.model.ModelPlan;
import io.segreg.core.model.Prior;
import io.segreg.core.model.PriorTable;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.apache.commons.math3.distribution.BinomialDistribution;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.distribution.PoissonDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Numeric replica of the generated model: maps predictor values and one full parameter
 * assignment to responses.
 *
 * <p>
 * Parameters are looked up only when needed, so a noiseless gaussian simulation does not
 * require {@code sigma_*}. Parameters with a fixed prior fall back to that value. Varying
 * offsets are read as {@code cp_k_group[level]}; levels without a value are 0. No centering
 * is applied: the offsets are used as given.
 *
 * <p>
 * Immutable and thread-safe. Each call runs sequentially in observation order, since the AR
 * correction of observation {@code i} uses the residuals of earlier observations.
 */
public final class Simulator {

    private static final Logger LOG = LoggerFactory.getLogger(Simulator.class);

    private static final double POISSON_EPSILON = 1e-12;
    private static final int POISSON_MAX_ITERATIONS = 10_000_000;

    private final ModelPlan plan;
    private final PriorTable priors;
    private final long defaultSeed;

    public Simulator(ModelPlan plan, PriorTable priors, long defaultSeed) {
        this.plan = Objects.requireNonNull(plan, "plan must not be null");
        this.priors = Objects.requireNonNull(priors, "priors must not be null");
        this.defaultSeed = defaultSeed;
    }

    /** Expected responses, without noise. */
    public SimulationResult simulate(SimulationInput input, Map<String, Double> parameters) {
        return simulate(input, parameters, SimulationOptions.EXPECTED);
    }

    /**
     * Simulates responses.
     *
     * @param input      data columns
     * @param parameters parameter values by name; varying levels as {@code cp_1_id[level]}
     * @param options    noise and seed
     * @return responses and segment assignment
     * @throws MissingParameterException    if a needed parameter has no value
     * @throws ConstraintViolationException if the change points are not strictly increasing
     * @throws LinkDomainException          if a value leaves the domain of its distribution
     */
    public SimulationResult simulate(SimulationInput input, Map<String, Double> parameters, SimulationOptions options) {
        Objects.requireNonNull(input, "input must not be null");
        Objects.requireNonNull(parameters, "parameters must not be null");
        Objects.requireNonNull(options, "options must not be null");

        double[] x = input.x();
        int n = x.length;
        int segments = plan.segmentCount();
        Map<String, Double> env = constants(input);

        double[] changePoints = new double[segments];
        for (int k = 1; k < segments; k++) {
            String name = "cp_" + k;
            changePoints[k] = value(name, parameters, null);
            if (k > 1 && !(changePoints[k] > changePoints[k - 1])) {
                throw new ConstraintViolationException(
                        name, "cp_" + (k - 1) + " < " + name + " (" + changePoints[k - 1] + " vs " + changePoints[k] + ")",
                        plan.modelId());
            }
            env.put(name, changePoints[k]);
        }

        double[][] locations = changePointLocations(input, parameters, changePoints, env);
        Family family = plan.familyLink().family();
        Link link = plan.familyLink().link();
        double[] trials = input.trials();
        if (family == Family.BINOMIAL && trials == null) {
            throw new IllegalArgumentException("The binomial family needs trials for every observation");
        }

        RandomGenerator random = options.addNoise()
                ? new Well19937c(options.seed() != null ? options.seed() : defaultSeed)
                : null;
        int order = plan.arOrder();
        double[] residuals = new double[n];
        double[] y = new double[n];
        int[] assigned = new int[n];

        for (int i = 0; i < n; i++) {
            double[] cp = locations[i];
            int segment = 1;
            for (int j = 1; j < segments; j++) {
                if (x[i] >= cp[j]) {
                    segment = j + 1;
                }
            }
            assigned[i] = segment;
            double[] local = localCoordinates(x[i], cp, segments);

            double eta = evaluate(Channel.MEAN, segment, local, parameters, i);
            double corrected = eta;
            for (int lag = 1; lag <= order; lag++) {
                if (i - lag >= 0) {
                    corrected += evaluate(Channel.ar(lag), segment, local, parameters, i) * residuals[i - lag];
                }
            }

            double mean = link.inverse(corrected);
            double response = respond(family, mean, trials == null ? 0 : trials[i], random, segment, local, parameters, i);
            y[i] = response;

            if (order > 0) {
                if (link == Link.LOG && !(response > 0)) {
                    throw new LinkDomainException(
                            "Response " + response + " is not positive; the log link cannot form an AR residual",
                            plan.modelId(),
                            i,
                            segment);
                }
                residuals[i] = link.apply(response) - eta;
            }
        }

        LOG.debug("simulation.completed model_id={} observations={} noise={}", plan.modelId(), n, options.addNoise());
        return new SimulationResult(y, assigned);
    }

    private double respond(
            Family family,
            double mean,
            double trials,
            RandomGenerator random,
            int segment,
            double[] local,
            Map<String, Double> parameters,
            int i) {
        switch (family) {
            case GAUSSIAN:
                if (random == null) {
                    return mean;
                }
                double sigma = evaluate(Channel.SIGMA, segment, local, parameters, i);
                if (sigma < 0) {
                    throw new LinkDomainException(
                            "Standard deviation " + sigma + " is negative", plan.modelId(), i, segment);
                }
                return sigma == 0 ? mean : new NormalDistribution(random, mean, sigma).sample();
            case BINOMIAL:
            case BERNOULLI:
                if (!(mean >= 0 && mean <= 1)) {
                    throw new LinkDomainException(
                            "Probability " + mean + " is outside [0, 1]", plan.modelId(), i, segment);
                }
                int size = family == Family.BERNOULLI ? 1 : (int) Math.round(trials);
                if (random == null) {
                    return size * mean;
                }
                return new BinomialDistribution(random, size, mean).sample();
            default:
                if (!(mean >= 0)) {
                    throw new LinkDomainException("Rate " + mean + " is negative", plan.modelId(), i, segment);
                }
                if (random == null) {
                    return mean;
                }
                return mean == 0
                        ? 0
                        : new PoissonDistribution(random, mean, POISSON_EPSILON, POISSON_MAX_ITERATIONS).sample();
        }
    }

    /**
     * Per-observation change-point locations, index 1..K-1. Varying locations are clamped to
     * {@code [lower, upper]} exactly as the model code does with {@code min(max(..))}; the open
     * interval is enforced by the truncated prior and {@link CompiledModel#checkDraw}.
     */
    private double[][] changePointLocations(
            SimulationInput input, Map<String, Double> parameters, double[] changePoints, Map<String, Double> env) {
        int n = input.size();
        double[][] locations = new double[n][];
        for (int i = 0; i < n; i++) {
            locations[i] = changePoints.clone();
        }
        for (ModelPlan.VaryingChangePoint varying : plan.varying()) {
            String[] labels = input.groups().get(varying.group());
            if (labels == null) {
                throw new IllegalArgumentException(
                        "Grouping column '" + varying.group() + "' is required by " + varying.offset());
            }
            warnIfNotCentered(varying.offset(), parameters);
            int k = varying.changePoint();
            double lower = varying.lower().evaluate(env);
            double upper = varying.upper().evaluate(env);
            for (int i = 0; i < n; i++) {
                Double offset = parameters.get(varying.offset() + "[" + labels[i] + "]");
                double location = changePoints[k] + (offset == null ? 0 : offset);
                locations[i][k] = Math.min(Math.max(location, lower), upper);
            }
        }
        return locations;
    }

    private void warnIfNotCentered(String offset, Map<String, Double> parameters) {
        String prefix = offset + "[";
        double sum = 0;
        for (Map.Entry<String, Double> entry : parameters.entrySet()) {
            if (entry.getKey().startsWith(prefix)) {
                sum += entry.getValue();
            }
        }
        if (Math.abs(sum) > Constraint.ZERO_SUM_TOLERANCE) {
            LOG.warn("simulation.offsets_not_centered model_id={} parameter={} sum={}", plan.modelId(), offset, sum);
        }
    }

    private static double[] localCoordinates(double x, double[] cp, int segments) {
        double[] local = new double[segments + 1];
        if (segments == 1) {
            local[1] = x;
            return local;
        }
        local[1] = Math.min(x, cp[1]);
        for (int j = 2; j < segments; j++) {
            local[j] = Math.min(x, cp[j]) - cp[j - 1];
        }
        local[segments] = x - cp[segments - 1];
        return local;
    }

    private double evaluate(Channel channel, int segment, double[] local, Map<String, Double> parameters, int i) {
        List<ModelPlan.SegmentExpression> expressions = plan.channel(channel);
        if (expressions == null) {
            return 0;
        }
        double total = 0;
        for (ModelPlan.Contribution contribution : expressions.get(segment - 1).contributions()) {
            double coefficient = 0;
            for (String name : contribution.coefficients()) {
                coefficient += value(name, parameters, i);
            }
            if (contribution.isIntercept()) {
                total += coefficient;
            } else {
                double at = local[contribution.coordinate()];
                total += coefficient * contribution.transform().evaluate(Map.of(plan.predictor(), at));
            }
        }
        return total;
    }

    private double value(String name, Map<String, Double> parameters, Integer observation) {
        Double value = parameters.get(name);
        if (value != null) {
            return value;
        }
        Prior prior = priors.get(name);
        if (prior instanceof Prior.Fixed fixed) {
            return fixed.value();
        }
        throw new MissingParameterException(name, plan.modelId(), observation);
    }

    private static Map<String, Double> constants(SimulationInput input) {
        DataSummary summary = input.summary();
        if (summary == null) {
            double[] x = input.x();
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (double v : x) {
                min = Math.min(min, v);
                max = Math.max(max, v);
            }
            Map<String, Double> env = new HashMap<>();
            env.put(DataSummary.MINX, min);
            env.put(DataSummary.MAXX, max);
            env.put(DataSummary.SDY, 1.0);
            return env;
        }
        return new HashMap<>(summary.constants());
    }
}
