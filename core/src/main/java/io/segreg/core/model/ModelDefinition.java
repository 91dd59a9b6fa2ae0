package io.segreg.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Declarative model input: an ordered list of segment formulas plus family/link selection and
 * prior overrides. Immutable; a changed formula list requires a fresh compilation.
 *
 * @param id          model identifier used in logs and errors
 * @param description optional free text
 * @param family      family name, e.g. {@code gaussian}
 * @param link        link name, or {@code null} for the family default
 * @param predictor   predictor variable name, or {@code null} to infer it from slope terms
 * @param segments    segment formulas in order (at least one)
 * @param priors      prior overrides: parameter name to distribution text
 */
public record ModelDefinition(
        String id,
        String description,
        String family,
        String link,
        String predictor,
        List<String> segments,
        Map<String, String> priors) {

    public ModelDefinition {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(segments, "segments must not be null");
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("A model needs at least one segment");
        }
        segments = List.copyOf(segments);
        priors = priors == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(priors));
    }

    /** Gaussian model with default link, inferred predictor and no overrides. */
    public static ModelDefinition of(String id, List<String> segments) {
        return builder().id(id).segments(segments).build();
    }

    /** Returns a new {@link Builder}. */
    public static Builder builder() {
        return new Builder();
    }

    /** Incremental builder; {@code family} defaults to {@code gaussian}. */
    public static final class Builder {
        private String id = "model";
        private String description;
        private String family = "gaussian";
        private String link;
        private String predictor;
        private List<String> segments = List.of();
        private final Map<String, String> priors = new LinkedHashMap<>();

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder family(String family) {
            this.family = family;
            return this;
        }

        public Builder link(String link) {
            this.link = link;
            return this;
        }

        public Builder predictor(String predictor) {
            this.predictor = predictor;
            return this;
        }

        public Builder segments(List<String> segments) {
            this.segments = segments;
            return this;
        }

        public Builder segments(String... segments) {
            this.segments = List.of(segments);
            return this;
        }

        public Builder prior(String parameter, String distribution) {
            this.priors.put(parameter, distribution);
            return this;
        }

        public Builder priors(Map<String, String> priors) {
            this.priors.putAll(priors);
            return this;
        }

        public ModelDefinition build() {
            return new ModelDefinition(id, description, family, link, predictor, segments, priors);
        }
    }
}
