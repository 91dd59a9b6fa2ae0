package io.segreg.core.error;

/**
 * Thrown when a model definition YAML file has invalid syntax, violates the definition schema,
 * or is missing required fields. Carries the {@code source} path of the offending file.
 */
public final class ModelDefinitionException extends ModelCompileException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public ModelDefinitionException(String message, String modelId, String source) {
        super(message, modelId, null);
        this.source = source;
    }

    public ModelDefinitionException(String message, Throwable cause, String modelId, String source) {
        super(message, cause, modelId, null);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}
