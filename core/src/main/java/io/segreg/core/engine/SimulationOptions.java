package io.segreg.core.engine;

/**
 * Simulation switches.
 *
 * @param addNoise {@code false} returns the expected response; {@code true} draws from the
 *                 response distribution
 * @param seed     seed of the noise generator, or {@code null} for the compiler default
 */
public record SimulationOptions(boolean addNoise, Long seed) {

    /** Expected values, no noise. */
    public static final SimulationOptions EXPECTED = new SimulationOptions(false, null);

    /** Noisy draws seeded with the compiler's default seed. */
    public static SimulationOptions withNoise() {
        return new SimulationOptions(true, null);
    }

    /** Noisy draws with an explicit seed. */
    public static SimulationOptions withNoise(long seed) {
        return new SimulationOptions(true, seed);
    }
}
