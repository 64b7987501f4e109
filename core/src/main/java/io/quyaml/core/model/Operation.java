package io.quyaml.core.model;

import io.quyaml.core.expr.ParamValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * A compiled circuit operation. Control-flow blocks hold their bodies as
 * immutable lists; the same body list may be shared between blocks.
 *
 * <p>
 * Immutable and thread-safe.
 */
public sealed interface Operation {

    /** Symbolic parameters this operation (and any nested body) depends on. */
    Set<String> freeParameters();

    /** Returns this operation with the given parameter values substituted. */
    Operation bind(Map<String, Double> values);

    /**
     * A unitary gate on explicit qubits.
     *
     * @param angle rotation or phase angle for parameterized kinds, otherwise
     *              {@code null}
     */
    record Gate(GateKind kind, List<Integer> qubits, ParamValue angle) implements Operation {
        public Gate {
            Objects.requireNonNull(kind, "kind must not be null");
            qubits = List.copyOf(qubits);
            if (qubits.size() != kind.targets()) {
                throw new IllegalArgumentException(
                        "Gate '" + kind.mnemonic() + "' acts on " + kind.targets() + " qubit(s), got: " + qubits);
            }
            if (kind.parameterized() != (angle != null)) {
                throw new IllegalArgumentException("Angle presence does not match gate '" + kind.mnemonic() + "'");
            }
        }

        @Override
        public Set<String> freeParameters() {
            return angle == null ? Set.of() : angle.freeParameters();
        }

        @Override
        public Operation bind(Map<String, Double> values) {
            if (angle == null || !angle.isSymbolic()) {
                return this;
            }
            return new Gate(kind, qubits, angle.bind(values));
        }
    }

    /** Barrier across the whole quantum register. */
    record Barrier() implements Operation {
        @Override
        public Set<String> freeParameters() {
            return Set.of();
        }

        @Override
        public Operation bind(Map<String, Double> values) {
            return this;
        }
    }

    /** Measures every qubit into a dedicated measurement register. */
    record MeasureAll() implements Operation {
        @Override
        public Set<String> freeParameters() {
            return Set.of();
        }

        @Override
        public Operation bind(Map<String, Double> values) {
            return this;
        }
    }

    record Measure(int qubit, int clbit) implements Operation {
        @Override
        public Set<String> freeParameters() {
            return Set.of();
        }

        @Override
        public Operation bind(Map<String, Double> values) {
            return this;
        }
    }

    record Reset(int qubit) implements Operation {
        @Override
        public Set<String> freeParameters() {
            return Set.of();
        }

        @Override
        public Operation bind(Map<String, Double> values) {
            return this;
        }
    }

    /** Two-branch block conditioned on a classical register test. */
    record IfElse(ConditionExpr.Atom test, List<Operation> trueBody, List<Operation> falseBody)
            implements Operation {
        public IfElse {
            Objects.requireNonNull(test, "test must not be null");
            trueBody = List.copyOf(trueBody);
            falseBody = List.copyOf(falseBody);
        }

        @Override
        public Set<String> freeParameters() {
            Set<String> names = Operation.freeParameters(trueBody);
            names.addAll(Operation.freeParameters(falseBody));
            return names;
        }

        @Override
        public Operation bind(Map<String, Double> values) {
            return new IfElse(test, Operation.bind(trueBody, values), Operation.bind(falseBody, values));
        }
    }

    /** Native conditional loop, bounded by {@code maxIter} iterations. */
    record WhileLoop(ConditionExpr.Atom test, List<Operation> body, int maxIter) implements Operation {
        public WhileLoop {
            Objects.requireNonNull(test, "test must not be null");
            body = List.copyOf(body);
            if (maxIter <= 0) {
                throw new IllegalArgumentException("maxIter must be positive, got: " + maxIter);
            }
        }

        @Override
        public Set<String> freeParameters() {
            return Operation.freeParameters(body);
        }

        @Override
        public Operation bind(Map<String, Double> values) {
            return new WhileLoop(test, Operation.bind(body, values), maxIter);
        }
    }

    /** Native counted loop over {@code [start, end)}. */
    record ForLoop(int start, int end, List<Operation> body) implements Operation {
        public ForLoop {
            body = List.copyOf(body);
        }

        @Override
        public Set<String> freeParameters() {
            return Operation.freeParameters(body);
        }

        @Override
        public Operation bind(Map<String, Double> values) {
            return new ForLoop(start, end, Operation.bind(body, values));
        }
    }

    /** Union of free parameters across a list, as a mutable sorted set. */
    static Set<String> freeParameters(List<Operation> operations) {
        Set<String> names = new TreeSet<>();
        for (Operation op : operations) {
            names.addAll(op.freeParameters());
        }
        return names;
    }

    static List<Operation> bind(List<Operation> operations, Map<String, Double> values) {
        List<Operation> bound = new ArrayList<>(operations.size());
        for (Operation op : operations) {
            bound.add(op.bind(values));
        }
        return List.copyOf(bound);
    }
}
