package io.segreg.core.error;

/**
 * Thrown when a parameter assignment produces a value outside the domain of the response
 * distribution (negative standard deviation, probability outside [0, 1], negative rate) or of
 * the link function. Recoverable by narrowing priors; never retried by the compiler.
 */
public final class LinkDomainException extends ModelEvalException {

    private static final long serialVersionUID = 1L;

    private final int segment;

    public LinkDomainException(String message, String modelId, int observation, int segment) {
        super(message, modelId, observation);
        this.segment = segment;
    }

    /** The 1-based segment the observation was assigned to. */
    public int segment() {
        return segment;
    }
}
