package io.segreg.core.spi;

import io.segreg.core.model.ModelPlan;
import io.segreg.core.model.Prior;
import io.segreg.core.model.PriorTable;

/**
 * Pluggable renderer of model code for one sampling engine. Implementations are registered
 * in a {@code DialectRegistry} and selected by {@link #id()}.
 *
 * <p>
 * Implementations MUST be stateless and thread-safe, and MUST render deterministically: two
 * calls with equal arguments return identical text.
 */
public interface SamplerDialect {

    /**
     * Returns the dialect identifier, e.g. {@code "jags"}.
     *
     * @return a non-null, non-empty identifier (lowercase, no spaces)
     */
    String id();

    /**
     * Renders the complete model text.
     *
     * @param plan            the model body
     * @param priors          one prior per parameter, in canonical order
     * @param segmentComments whether to annotate each segment with its formula
     * @return the model code
     */
    String renderModel(ModelPlan plan, PriorTable priors, boolean segmentComments);

    /**
     * Renders one prior as a distribution in this dialect.
     *
     * @param prior the prior
     * @return distribution text, e.g. {@code dnorm(0, 1 / (3 * SDY)^2)}
     */
    String renderPrior(Prior prior);
}
