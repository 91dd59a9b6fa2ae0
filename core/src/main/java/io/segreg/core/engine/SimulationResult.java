package io.segreg.core.engine;

/**
 * Simulated responses.
 *
 * @param y       response per observation
 * @param segment 1-based segment each observation fell into
 */
public record SimulationResult(double[] y, int[] segment) {

    public SimulationResult {
        y = y.clone();
        segment = segment.clone();
    }

    @Override
    public double[] y() {
        return y.clone();
    }

    @Override
    public int[] segment() {
        return segment.clone();
    }
}
