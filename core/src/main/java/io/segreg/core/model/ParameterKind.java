package io.segreg.core.model;

/** Kinds of compiled parameters. */
public enum ParameterKind {
    INTERCEPT,
    SLOPE,
    AR_COEFFICIENT,
    AR_SLOPE,
    VARIANCE_INTERCEPT,
    VARIANCE_SLOPE,
    CHANGE_POINT,
    CHANGE_POINT_SPREAD,
    VARYING_OFFSET;

    /** Intercept kind for the given channel. */
    public static ParameterKind interceptOf(Channel channel) {
        return switch (channel.type()) {
            case MEAN -> INTERCEPT;
            case SIGMA -> VARIANCE_INTERCEPT;
            case AR -> AR_COEFFICIENT;
        };
    }

    /** Slope kind for the given channel. */
    public static ParameterKind slopeOf(Channel channel) {
        return switch (channel.type()) {
            case MEAN -> SLOPE;
            case SIGMA -> VARIANCE_SLOPE;
            case AR -> AR_SLOPE;
        };
    }
}
