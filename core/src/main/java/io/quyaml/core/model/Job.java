package io.quyaml.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.util.List;
import java.util.Objects;

/**
 * A compiled job manifest, handed as a whole to the execution collaborator.
 *
 * <p>
 * {@code metadata} and {@code postProcessing} are opaque to the compiler and
 * are defensively copied on the way in and out, so a {@code Job} stays
 * immutable even though Jackson trees are not.
 */
public final class Job {

    private final CircuitSpec circuit;
    private final JsonNode metadata;
    private final ExecutionOptions execution;
    private final JsonNode postProcessing;
    private final List<CircuitSpec> circuitVariants;

    /**
     * @param circuit         the compiled circuit, possibly with symbolic
     *                        sweep parameters
     * @param metadata        metadata mapping, or {@code null} for none
     * @param execution       execution options
     * @param postProcessing  post-processing directive list, or {@code null}
     *                        for none
     * @param circuitVariants circuits to execute, one per sweep value, or just
     *                        {@code circuit} without a sweep
     */
    public Job(
            CircuitSpec circuit,
            JsonNode metadata,
            ExecutionOptions execution,
            JsonNode postProcessing,
            List<CircuitSpec> circuitVariants) {
        this.circuit = Objects.requireNonNull(circuit, "circuit must not be null");
        this.execution = Objects.requireNonNull(execution, "execution must not be null");
        this.metadata = metadata == null ? JsonNodeFactory.instance.objectNode() : metadata.deepCopy();
        this.postProcessing = postProcessing == null ? JsonNodeFactory.instance.arrayNode() : postProcessing.deepCopy();
        this.circuitVariants = List.copyOf(circuitVariants);
        if (this.circuitVariants.isEmpty()) {
            throw new IllegalArgumentException("a job must carry at least one circuit variant");
        }
    }

    public CircuitSpec circuit() {
        return circuit;
    }

    /** Metadata mapping; a fresh copy on every call. */
    public JsonNode metadata() {
        return metadata.deepCopy();
    }

    public ExecutionOptions execution() {
        return execution;
    }

    /** Post-processing directives; a fresh copy on every call. */
    public JsonNode postProcessing() {
        return postProcessing.deepCopy();
    }

    public List<CircuitSpec> circuitVariants() {
        return circuitVariants;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Job other)) {
            return false;
        }
        return circuit.equals(other.circuit)
                && metadata.equals(other.metadata)
                && execution.equals(other.execution)
                && postProcessing.equals(other.postProcessing)
                && circuitVariants.equals(other.circuitVariants);
    }

    @Override
    public int hashCode() {
        return Objects.hash(circuit, metadata, execution, postProcessing, circuitVariants);
    }

    @Override
    public String toString() {
        return "Job[circuit=" + circuit.name() + ", variants=" + circuitVariants.size() + ", execution=" + execution
                + "]";
    }
}
