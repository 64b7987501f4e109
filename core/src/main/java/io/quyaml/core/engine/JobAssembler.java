package io.quyaml.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.quyaml.core.error.SchemaViolationException;
import io.quyaml.core.model.CircuitSpec;
import io.quyaml.core.model.ExecutionOptions;
import io.quyaml.core.model.Job;
import io.quyaml.core.model.SweepConfig;
import io.quyaml.core.spec.CredentialScrubber;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Combines a compiled circuit with the manifest's metadata, execution options
 * and post-processing directives, and expands a configured sweep into the
 * list of circuit variants to run.
 *
 * <p>
 * Sweep expansion: one bound variant per sweep value. If the swept parameter
 * is not a free symbolic parameter of the circuit, a warning is logged and
 * the unbound circuit is repeated once per value.
 */
public final class JobAssembler {

    private static final Logger LOG = LoggerFactory.getLogger(JobAssembler.class);

    /**
     * Assembles a job.
     *
     * @param circuit        compiled circuit; sweep parameters are still
     *                       symbolic
     * @param metadata       {@code metadata} node, or {@code null}
     * @param execution      parsed execution options
     * @param postProcessing {@code post_processing} node, or {@code null}
     * @return the immutable job
     * @throws SchemaViolationException if metadata is not a mapping or
     *                                  post-processing is not a list
     */
    public Job assemble(CircuitSpec circuit, JsonNode metadata, ExecutionOptions execution, JsonNode postProcessing) {
        Objects.requireNonNull(circuit, "circuit must not be null");
        Objects.requireNonNull(execution, "execution must not be null");

        JsonNode meta = present(metadata);
        if (meta != null && !meta.isObject()) {
            throw new SchemaViolationException(
                    "Field 'metadata' must be a mapping, got: " + meta.getNodeType(), "metadata");
        }
        JsonNode post = present(postProcessing);
        if (post != null && !post.isArray()) {
            throw new SchemaViolationException(
                    "Field 'post_processing' must be a list, got: " + post.getNodeType(), "post_processing");
        }
        JsonNode scrubbedMeta = meta == null ? null : CredentialScrubber.scrub((ObjectNode) meta, "metadata");

        List<CircuitSpec> variants = execution.sweepConfig()
                .map(sweep -> expand(circuit, sweep))
                .orElseGet(() -> List.of(circuit));
        return new Job(circuit, scrubbedMeta, execution, post, variants);
    }

    private static List<CircuitSpec> expand(CircuitSpec circuit, SweepConfig sweep) {
        String parameter = sweep.parameter();
        List<CircuitSpec> variants = new ArrayList<>(sweep.values().size());
        if (!circuit.freeParameters().contains(parameter)) {
            LOG.warn(
                    "job.sweep_parameter_unused circuit={} parameter={} values={}: Parameter '{}' defined in sweep "
                            + "but not found in circuit parameters. Running base circuit repeatedly.",
                    circuit.name(),
                    parameter,
                    sweep.values().size(),
                    parameter);
            for (int i = 0; i < sweep.values().size(); i++) {
                variants.add(circuit);
            }
            return variants;
        }
        for (Double value : sweep.values()) {
            variants.add(circuit.bind(Map.of(parameter, value)));
        }
        LOG.debug("job.sweep_expanded circuit={} parameter={} variants={}", circuit.name(), parameter, variants.size());
        return variants;
    }

    private static JsonNode present(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode() ? null : node;
    }
}
