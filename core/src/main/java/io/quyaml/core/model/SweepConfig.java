package io.quyaml.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Single-parameter sweep: the circuit is run once per value.
 *
 * @param parameter swept parameter name
 * @param values    values in document order, never empty
 */
public record SweepConfig(String parameter, List<Double> values) {

    public SweepConfig {
        Objects.requireNonNull(parameter, "parameter must not be null");
        values = List.copyOf(values);
        if (values.isEmpty()) {
            throw new IllegalArgumentException("sweep values must not be empty");
        }
    }
}
