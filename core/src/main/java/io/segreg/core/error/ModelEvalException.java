package io.segreg.core.error;

/**
 * Abstract parent for evaluation errors. Thrown by the simulator or by draw checks when a
 * parameter assignment cannot be evaluated. Carries an additional {@code observation} field with
 * the 0-based observation index, when one is involved.
 */
public abstract class ModelEvalException extends ModelException {

    private static final long serialVersionUID = 1L;

    private final Integer observation;

    protected ModelEvalException(String message, String modelId, Integer observation) {
        super(message, modelId, Phase.EVALUATION);
        this.observation = observation;
    }

    /** The 0-based observation index, or {@code null} if not tied to an observation. */
    public Integer observation() {
        return observation;
    }
}
