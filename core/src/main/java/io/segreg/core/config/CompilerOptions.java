package io.segreg.core.config;

import java.util.Objects;

/**
 * Compiler-wide options.
 *
 * @param dialect         id of the sampler dialect that renders model code
 * @param segmentComments whether model code annotates segments with their formulas
 * @param simulationSeed  seed used by noisy simulations that give none
 */
public record CompilerOptions(String dialect, boolean segmentComments, long simulationSeed) {

    /** {@code jags}, with segment comments, seed 1. */
    public static final CompilerOptions DEFAULT = new CompilerOptions("jags", true, 1L);

    public CompilerOptions {
        Objects.requireNonNull(dialect, "dialect must not be null");
        if (dialect.isBlank()) {
            throw new IllegalArgumentException("dialect must not be blank");
        }
    }

    public CompilerOptions withDialect(String dialect) {
        return new CompilerOptions(dialect, segmentComments, simulationSeed);
    }

    public CompilerOptions withSegmentComments(boolean segmentComments) {
        return new CompilerOptions(dialect, segmentComments, simulationSeed);
    }

    public CompilerOptions withSimulationSeed(long simulationSeed) {
        return new CompilerOptions(dialect, segmentComments, simulationSeed);
    }
}
