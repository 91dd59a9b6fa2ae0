package io.segreg.core.spi;

/**
 * Observability hook for model compilation.
 *
 * <p>
 * All methods receive immutable event objects. Implementations MUST be thread-safe and
 * non-blocking. Exceptions thrown by listeners are caught by the compiler and logged; they
 * do not affect the compilation result.
 */
public interface CompilationListener {

    /**
     * Called after a model compiled successfully.
     *
     * @param event contains modelId, family, segment and parameter counts, duration
     */
    void onModelCompiled(ModelCompiledEvent event);

    /**
     * Called when a model is rejected at compile time.
     *
     * @param event contains modelId, exception type and detail
     */
    void onModelRejected(ModelRejectedEvent event);

    // --- Event records ---

    /** Event emitted when a model compiled successfully. */
    record ModelCompiledEvent(String modelId, String family, int segments, int parameters, long durationMs) {}

    /** Event emitted when a model is rejected. */
    record ModelRejectedEvent(String modelId, String errorType, String errorDetail) {}
}
