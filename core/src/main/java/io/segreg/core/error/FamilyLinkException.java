package io.segreg.core.error;

/**
 * Thrown when a family/link pair is not a recognized combination, or when a sub-model is used
 * with a family that does not support it (e.g. {@code sigma()} on a binomial model).
 */
public final class FamilyLinkException extends ModelCompileException {

    private static final long serialVersionUID = 1L;

    public FamilyLinkException(String message, String modelId, Integer segment) {
        super(message, modelId, segment);
    }
}
