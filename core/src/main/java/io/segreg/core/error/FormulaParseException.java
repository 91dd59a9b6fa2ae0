package io.segreg.core.error;

/** Thrown when a segment formula cannot be decomposed into the formula grammar. */
public final class FormulaParseException extends ModelCompileException {

    private static final long serialVersionUID = 1L;

    private final int position;

    public FormulaParseException(String message, String modelId, Integer segment, int position) {
        super(message, modelId, segment);
        this.position = position;
    }

    public FormulaParseException(String message, Throwable cause, String modelId, Integer segment, int position) {
        super(message, cause, modelId, segment);
        this.position = position;
    }

    /** 0-based character offset into the formula text, or {@code -1} if unknown. */
    public int position() {
        return position;
    }
}
