package io.quyaml.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Execution request for a job. Credentials never appear here; they are
 * resolved by the execution collaborator.
 *
 * @param backend backend request, {@code null} when the document names none
 * @param shots   shot count, positive (default: 1024)
 * @param sweep   parameter sweep, {@code null} when none is configured
 */
public record ExecutionOptions(BackendSpec backend, int shots, SweepConfig sweep) {

    public static final int DEFAULT_SHOTS = 1024;

    /** No backend, default shots, no sweep. */
    public static final ExecutionOptions DEFAULT = new ExecutionOptions(null, DEFAULT_SHOTS, null);

    public ExecutionOptions {
        if (shots <= 0) {
            throw new IllegalArgumentException("shots must be positive, got: " + shots);
        }
    }

    public Optional<BackendSpec> backendSpec() {
        return Optional.ofNullable(backend);
    }

    public Optional<SweepConfig> sweepConfig() {
        return Optional.ofNullable(sweep);
    }

    public ExecutionOptions withSweep(SweepConfig newSweep) {
        return new ExecutionOptions(backend, shots, Objects.requireNonNull(newSweep, "newSweep must not be null"));
    }
}
