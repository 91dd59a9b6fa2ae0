package io.segreg.core.model;

/**
 * A piecewise-linear quantity assembled per segment: the mean (linear predictor), the
 * standard deviation, or the AR coefficient of one order. Each channel has its own
 * intercept/slope terms and carry-over chain.
 *
 * @param type  channel type
 * @param order AR order for {@link Type#AR}, otherwise 0
 */
public record Channel(Type type, int order) implements Comparable<Channel> {

    /** Channel types, in canonical parameter order. */
    public enum Type {
        MEAN,
        SIGMA,
        AR
    }

    public static final Channel MEAN = new Channel(Type.MEAN, 0);
    public static final Channel SIGMA = new Channel(Type.SIGMA, 0);

    public Channel {
        if ((type == Type.AR) != (order > 0)) {
            throw new IllegalArgumentException("AR channels need a positive order, other channels order 0");
        }
    }

    /** The AR channel of the given order. */
    public static Channel ar(int order) {
        return new Channel(Type.AR, order);
    }

    /**
     * Name prefix for this channel's parameters: empty for the mean, {@code sigma} or
     * {@code ar1}, {@code ar2}, ...
     */
    public String prefix() {
        return switch (type) {
            case MEAN -> "";
            case SIGMA -> "sigma";
            case AR -> "ar" + order;
        };
    }

    /** Canonical intercept parameter name for segment {@code k}. */
    public String interceptName(int k) {
        return type == Type.MEAN ? "int_" + k : prefix() + "_" + k;
    }

    /** Canonical slope parameter name for term {@code code} in segment {@code k}. */
    public String slopeName(String code, int k) {
        return type == Type.MEAN ? code + "_" + k : prefix() + "_" + code + "_" + k;
    }

    /** Key used in per-segment term mappings, e.g. {@code int}, {@code x}, {@code sigma:x}. */
    public String termKey(String term) {
        return type == Type.MEAN ? term : prefix() + ":" + term;
    }

    @Override
    public int compareTo(Channel other) {
        int byType = type.compareTo(other.type);
        return byType != 0 ? byType : Integer.compare(order, other.order);
    }

    @Override
    public String toString() {
        return type == Type.MEAN ? "mean" : prefix();
    }
}
