package io.quyaml.core.spi;

import io.quyaml.core.error.QuyamlException;

/**
 * Observability hook for the compiler. Integrations bridge these events to
 * metrics or tracing; the core itself carries no telemetry dependency.
 *
 * <p>
 * Implementations must be thread-safe and non-blocking. Exceptions thrown by
 * a listener are caught and logged by the compiler and never change the
 * outcome of a compile.
 */
public interface CompileListener {

    /** Called after a document compiled successfully. */
    void onCircuitCompiled(CircuitCompiledEvent event);

    /** Called when a document is rejected. */
    void onDocumentRejected(DocumentRejectedEvent event);

    // --- Event records ---

    /**
     * @param circuitName compiled circuit name
     * @param version     negotiated document version
     * @param qubits      quantum register width
     * @param clbits      classical register width
     * @param operations  number of top-level operations
     * @param variants    number of circuit variants (1 for plain circuits)
     * @param durationMs  wall-clock compile time
     */
    record CircuitCompiledEvent(
            String circuitName, String version, int qubits, int clbits, int operations, int variants, long durationMs) {}

    /**
     * @param category    error category
     * @param location    offending line or field, may be {@code null}
     * @param errorDetail error message
     */
    record DocumentRejectedEvent(QuyamlException.Category category, String location, String errorDetail) {}
}
