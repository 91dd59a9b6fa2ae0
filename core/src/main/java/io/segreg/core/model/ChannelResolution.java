package io.segreg.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolved state of one channel in one segment.
 *
 * @param channel  the channel
 * @param segment  1-based segment index
 * @param started  {@code false} while no segment up to this one has declared the channel
 * @param anchor   the segment where the current level was last reset (a new or relative
 *                 intercept); slope contributions accumulate from here
 * @param terms    resolved terms keyed by term key, intercept first, then slopes in the order
 *                 they were first defined
 */
public record ChannelResolution(
        Channel channel, int segment, boolean started, int anchor, Map<String, ResolvedTerm> terms) {

    /** Term key of intercepts. */
    public static final String INTERCEPT_KEY = "int";

    public ChannelResolution {
        terms = Collections.unmodifiableMap(new LinkedHashMap<>(terms));
    }

    /** The intercept term, or {@code null} if the channel has none in this segment. */
    public ResolvedTerm intercept() {
        return terms.get(INTERCEPT_KEY);
    }
}
