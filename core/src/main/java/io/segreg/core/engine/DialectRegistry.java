package io.segreg.core.engine;

import io.segreg.core.engine.jags.JagsDialect;
import io.segreg.core.spi.SamplerDialect;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of sampler dialects by id. Thread-safe: registration and lookup can happen
 * concurrently.
 */
public final class DialectRegistry {

    private final Map<String, SamplerDialect> dialects = new ConcurrentHashMap<>();

    /** A registry holding the bundled dialects ({@code jags}). */
    public static DialectRegistry withDefaults() {
        DialectRegistry registry = new DialectRegistry();
        registry.register(new JagsDialect());
        return registry;
    }

    /**
     * Registers a dialect. A dialect with the same id is replaced.
     *
     * @param dialect the dialect to register
     * @throws NullPointerException     if dialect is null
     * @throws IllegalArgumentException if dialect.id() is null or empty
     */
    public void register(SamplerDialect dialect) {
        if (dialect == null) {
            throw new NullPointerException("dialect must not be null");
        }
        String id = dialect.id();
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("dialect id must not be null or empty");
        }
        dialects.put(id, dialect);
    }

    /** Looks up a dialect by id. */
    public Optional<SamplerDialect> getDialect(String id) {
        return Optional.ofNullable(dialects.get(id));
    }

    /**
     * Looks up a dialect by id, throwing if not found.
     *
     * @throws IllegalArgumentException if no dialect is registered with the given id
     */
    public SamplerDialect requireDialect(String id) {
        return getDialect(id)
                .orElseThrow(() -> new IllegalArgumentException("No sampler dialect registered for id: '" + id + "'"));
    }

    /** Returns the number of registered dialects. */
    public int size() {
        return dialects.size();
    }

    /** Returns {@code true} if a dialect with the given id is registered. */
    public boolean hasDialect(String id) {
        return dialects.containsKey(id);
    }
}
