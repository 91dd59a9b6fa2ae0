package io.segreg.core.error;

/** Thrown when the same term is specified twice within one segment. */
public final class DuplicateTermException extends ModelCompileException {

    private static final long serialVersionUID = 1L;

    private final String term;

    public DuplicateTermException(String message, String modelId, Integer segment, String term) {
        super(message, modelId, segment);
        this.term = term;
    }

    /** The duplicated term key (e.g. {@code int}, {@code x}, {@code ar}). */
    public String term() {
        return term;
    }
}
