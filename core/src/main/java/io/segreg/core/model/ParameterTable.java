package io.segreg.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical parameters of a compiled model plus the per-segment resolution of every channel.
 * Created by {@code ParameterTableBuilder}; never mutated afterwards.
 *
 * <p>
 * Carry-over is stored explicitly: each {@link ResolvedTerm} records the segment that last
 * defined it, so looking up what a segment inherits is a map access rather than a search
 * through earlier segments.
 *
 * <p>
 * Thread-safe and immutable.
 */
public final class ParameterTable {

    private final Map<String, Parameter> parameters;
    private final Map<Channel, List<ChannelResolution>> resolutions;
    private final List<VaryingEffect> varyingEffects;
    private final int segmentCount;

    public ParameterTable(
            List<Parameter> parameters,
            Map<Channel, List<ChannelResolution>> resolutions,
            List<VaryingEffect> varyingEffects,
            int segmentCount) {
        Map<String, Parameter> byName = new LinkedHashMap<>();
        for (Parameter parameter : parameters) {
            if (byName.putIfAbsent(parameter.name(), parameter) != null) {
                throw new IllegalArgumentException("Duplicate parameter name: " + parameter.name());
            }
        }
        this.parameters = Collections.unmodifiableMap(byName);
        Map<Channel, List<ChannelResolution>> copy = new LinkedHashMap<>();
        resolutions.forEach((channel, list) -> copy.put(channel, List.copyOf(list)));
        this.resolutions = Collections.unmodifiableMap(copy);
        this.varyingEffects = List.copyOf(varyingEffects);
        this.segmentCount = segmentCount;
    }

    /** Canonical parameter names in the fixed result-interpretation order. */
    public List<String> names() {
        return List.copyOf(parameters.keySet());
    }

    /** All parameters in canonical order. */
    public List<Parameter> parameters() {
        return List.copyOf(parameters.values());
    }

    /** Looks up a parameter by name, or {@code null}. */
    public Parameter get(String name) {
        return parameters.get(name);
    }

    /** Returns {@code true} if a parameter with this name exists. */
    public boolean contains(String name) {
        return parameters.containsKey(name);
    }

    /** All parameters of one kind, in canonical order. */
    public List<Parameter> ofKind(ParameterKind kind) {
        return parameters.values().stream().filter(p -> p.kind() == kind).toList();
    }

    /** Number of segments. */
    public int segmentCount() {
        return segmentCount;
    }

    /** Number of change points ({@code segmentCount - 1}). */
    public int changePointCount() {
        return segmentCount - 1;
    }

    /** Name of change point {@code k} (1-based). */
    public static String changePoint(int k) {
        return "cp_" + k;
    }

    /** Channels present in this model, in canonical order (mean, sigma, ar1, ar2, ...). */
    public List<Channel> channels() {
        return List.copyOf(resolutions.keySet());
    }

    /** Highest AR order used by any segment, or 0. */
    public int arOrder() {
        int max = 0;
        for (Channel channel : resolutions.keySet()) {
            if (channel.type() == Channel.Type.AR) {
                max = Math.max(max, channel.order());
            }
        }
        return max;
    }

    /**
     * Resolution of {@code channel} in segment {@code segment}.
     *
     * @throws IllegalArgumentException if the channel is not part of this model
     */
    public ChannelResolution resolution(Channel channel, int segment) {
        List<ChannelResolution> list = resolutions.get(channel);
        if (list == null) {
            throw new IllegalArgumentException("Channel not present in model: " + channel);
        }
        Objects.checkIndex(segment - 1, list.size());
        return list.get(segment - 1);
    }

    /**
     * Active parameters of a segment: for every resolved term of every channel, the parameters
     * whose sum is its value. Keys are {@link Channel#termKey(String)} values such as
     * {@code int}, {@code x}, {@code sigma:int}, {@code ar1:int}. Omitted terms map to exactly
     * the same list as in the preceding segment.
     */
    public Map<String, List<String>> activeParameters(int segment) {
        Map<String, List<String>> active = new LinkedHashMap<>();
        for (Channel channel : resolutions.keySet()) {
            ChannelResolution resolution = resolution(channel, segment);
            for (ResolvedTerm term : resolution.terms().values()) {
                active.put(channel.termKey(term.key()), term.summands());
            }
        }
        return Collections.unmodifiableMap(active);
    }

    /** Varying change-point effects in change-point order. */
    public List<VaryingEffect> varyingEffects() {
        return varyingEffects;
    }

    /** Varying effects attached to change point {@code k}. */
    public List<VaryingEffect> varyingEffects(int k) {
        List<VaryingEffect> result = new ArrayList<>();
        for (VaryingEffect effect : varyingEffects) {
            if (effect.changePoint() == k) {
                result.add(effect);
            }
        }
        return result;
    }
}
