package io.segreg.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Complete prior assignment: exactly one {@link Prior} per parameter, in canonical parameter
 * order. Tracks which entries came from user overrides.
 *
 * <p>
 * Thread-safe and immutable.
 */
public final class PriorTable {

    private final Map<String, Prior> priors;
    private final Set<String> overridden;

    public PriorTable(Map<String, Prior> priors, Set<String> overridden) {
        Objects.requireNonNull(priors, "priors must not be null");
        this.priors = Collections.unmodifiableMap(new LinkedHashMap<>(priors));
        this.overridden = Set.copyOf(overridden);
    }

    /** Prior of a parameter, or {@code null} if the name is unknown. */
    public Prior get(String parameter) {
        return priors.get(parameter);
    }

    /** All priors in canonical parameter order. */
    public Map<String, Prior> asMap() {
        return priors;
    }

    /** Returns {@code true} if the prior of {@code parameter} came from a user override. */
    public boolean isOverridden(String parameter) {
        return overridden.contains(parameter);
    }

    /** Returns {@code true} if {@code parameter} is pinned to a constant. */
    public boolean isFixed(String parameter) {
        return priors.get(parameter) instanceof Prior.Fixed;
    }

    /** Number of entries. */
    public int size() {
        return priors.size();
    }
}
