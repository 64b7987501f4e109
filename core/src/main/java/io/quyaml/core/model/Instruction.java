package io.quyaml.core.model;

import io.quyaml.core.expr.ParamExpr;
import java.util.List;
import java.util.Objects;

/**
 * One entry of a circuit's instruction list, after parsing and before
 * lowering. Control-flow bodies may only hold {@link Primitive} entries, so
 * nesting an {@code if}, {@code while} or {@code for} inside another is not
 * representable.
 *
 * <p>
 * {@code line} is the 1-based position of the entry in the instruction list
 * and is carried into error messages.
 */
public sealed interface Instruction {

    int line();

    /** Entries allowed inside control-flow bodies. */
    sealed interface Primitive extends Instruction {}

    /**
     * A gate call line such as {@code ry(2*$theta) 0}.
     *
     * @param kind       gate from the closed table
     * @param expression parameter expression, {@code null} for unparameterized
     *                   gates
     * @param targets    qubit indices, validated against the register width
     */
    record GateCall(GateKind kind, ParamExpr expression, List<Integer> targets, int line) implements Primitive {
        public GateCall {
            Objects.requireNonNull(kind, "kind must not be null");
            targets = List.copyOf(targets);
            if (kind.parameterized() != (expression != null)) {
                throw new IllegalArgumentException(
                        "Gate '" + kind.mnemonic() + "' "
                                + (kind.parameterized() ? "requires" : "does not take") + " a parameter");
            }
        }
    }

    record Measure(int qubit, int clbit, int line) implements Primitive {}

    record Reset(int qubit, int line) implements Primitive {}

    record If(ConditionExpr condition, List<Primitive> thenBody, List<Primitive> elseBody, int line)
            implements Instruction {
        public If {
            Objects.requireNonNull(condition, "condition must not be null");
            thenBody = List.copyOf(thenBody);
            elseBody = List.copyOf(elseBody);
        }
    }

    record While(ConditionExpr condition, List<Primitive> body, int maxIter, int line) implements Instruction {
        public While {
            Objects.requireNonNull(condition, "condition must not be null");
            body = List.copyOf(body);
            if (maxIter <= 0) {
                throw new IllegalArgumentException("maxIter must be positive, got: " + maxIter);
            }
        }
    }

    /** Counted loop over {@code [start, end)}. */
    record For(int start, int end, List<Primitive> body, int line) implements Instruction {
        public For {
            body = List.copyOf(body);
        }

        /** Iteration count, zero for an empty or reversed range; never overflows. */
        public long iterations() {
            return Math.max(0L, (long) end - start);
        }
    }
}
