package io.segreg.core.error;

/** Thrown when a simulation needs a parameter value that was not supplied. */
public final class MissingParameterException extends ModelEvalException {

    private static final long serialVersionUID = 1L;

    private final String parameter;

    public MissingParameterException(String parameter, String modelId, Integer observation) {
        super("Missing value for parameter '" + parameter + "'", modelId, observation);
        this.parameter = parameter;
    }

    /** The first unresolved parameter. */
    public String parameter() {
        return parameter;
    }
}
