package io.segreg.core.error;

/** Thrown when a prior override names an unknown parameter or has malformed distribution text. */
public final class PriorSpecException extends ModelCompileException {

    private static final long serialVersionUID = 1L;

    private final String parameter;

    public PriorSpecException(String message, String modelId, String parameter) {
        super(message, modelId, null);
        this.parameter = parameter;
    }

    public PriorSpecException(String message, Throwable cause, String modelId, String parameter) {
        super(message, cause, modelId, null);
        this.parameter = parameter;
    }

    /** The parameter whose override was rejected. */
    public String parameter() {
        return parameter;
    }
}
