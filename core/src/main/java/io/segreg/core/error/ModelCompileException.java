package io.segreg.core.error;

/**
 * Abstract parent for compile-time errors. Thrown during {@code ModelCompiler.compile()} while the
 * formula list, family selection or prior overrides are turned into a compiled model. Carries an
 * additional {@code segment} field identifying the 1-based segment that caused the error.
 */
public abstract class ModelCompileException extends ModelException {

    private static final long serialVersionUID = 1L;

    private final Integer segment;

    protected ModelCompileException(String message, String modelId, Integer segment) {
        super(message, modelId, Phase.COMPILE);
        this.segment = segment;
    }

    protected ModelCompileException(String message, Throwable cause, String modelId, Integer segment) {
        super(message, cause, modelId, Phase.COMPILE);
        this.segment = segment;
    }

    /** The 1-based segment index, or {@code null} if the error is not tied to one segment. */
    public Integer segment() {
        return segment;
    }
}
