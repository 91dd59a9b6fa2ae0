package io.segreg.core.error;

/**
 * Abstract base for all segmented-model exceptions. Never thrown directly; use the concrete
 * subclasses under {@link ModelCompileException} or {@link ModelEvalException}.
 */
public abstract class ModelException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        COMPILE,
        EVALUATION
    }

    private final String modelId;
    private final Phase phase;

    protected ModelException(String message, String modelId, Phase phase) {
        super(message);
        this.modelId = modelId;
        this.phase = phase;
    }

    protected ModelException(String message, Throwable cause, String modelId, Phase phase) {
        super(message, cause);
        this.modelId = modelId;
        this.phase = phase;
    }

    /** The model that triggered the error, or {@code null} if not yet identified. */
    public String modelId() {
        return modelId;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
