package io.segreg.core.error;

/**
 * Thrown when a parameter assignment breaks a derived ordering, truncation, zero-sum or
 * stationarity constraint. Detected at sampling or simulation time, never at compile time.
 */
public final class ConstraintViolationException extends ModelEvalException {

    private static final long serialVersionUID = 1L;

    private final String parameter;
    private final String constraint;

    public ConstraintViolationException(String parameter, String constraint, String modelId) {
        super("Parameter '" + parameter + "' violates constraint: " + constraint, modelId, null);
        this.parameter = parameter;
        this.constraint = constraint;
    }

    /** The offending parameter. */
    public String parameter() {
        return parameter;
    }

    /** Description of the violated constraint. */
    public String constraint() {
        return constraint;
    }
}
