package io.quyaml.core.model;

import io.quyaml.core.expr.ParamValue;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A compiled circuit: registers, parameter table and the lowered operation
 * list.
 *
 * <p>
 * Every qubit index and classical bit or register value referenced by
 * {@link #operations()} lies within the declared register widths; the compiler
 * rejects documents that would violate this before constructing an instance.
 *
 * <p>
 * Immutable and thread-safe.
 *
 * @param name              circuit name
 * @param quantumRegister   quantum register, width at least 1
 * @param classicalRegister classical register, width zero or more
 * @param parameters        parameter table in declaration order; sweep
 *                          placeholders are {@link ParamValue.Symbolic}
 * @param operations        lowered operations in program order
 */
public record CircuitSpec(
        String name,
        Register quantumRegister,
        Register classicalRegister,
        Map<String, ParamValue> parameters,
        List<Operation> operations) {

    public CircuitSpec {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(quantumRegister, "quantumRegister must not be null");
        Objects.requireNonNull(classicalRegister, "classicalRegister must not be null");
        if (quantumRegister.size() < 1) {
            throw new IllegalArgumentException("quantum register must have at least one qubit");
        }
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        operations = List.copyOf(operations);
    }

    public int numQubits() {
        return quantumRegister.size();
    }

    public int numClbits() {
        return classicalRegister.size();
    }

    /** Parameters the operations still depend on symbolically, sorted. */
    public Set<String> freeParameters() {
        return Collections.unmodifiableSet(Operation.freeParameters(operations));
    }

    public boolean isBound() {
        return freeParameters().isEmpty();
    }

    /**
     * Returns a copy with the given parameter values substituted in both the
     * operations and the parameter table.
     */
    public CircuitSpec bind(Map<String, Double> values) {
        Objects.requireNonNull(values, "values must not be null");
        Map<String, ParamValue> table = new LinkedHashMap<>();
        parameters.forEach((key, value) -> table.put(key, value.bind(values)));
        return new CircuitSpec(name, quantumRegister, classicalRegister, table, Operation.bind(operations, values));
    }

    /** One-line summary: {@code circuit 'name', qubits=Q, cbits=C, ops=N}. */
    public String summary() {
        return String.format(
                "circuit '%s', qubits=%d, cbits=%d, ops=%d", name, numQubits(), numClbits(), operations.size());
    }
}
