package io.quyaml.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.quyaml.core.error.ExpressionEvalException;
import io.quyaml.core.error.SchemaViolationException;
import io.quyaml.core.expr.ParamValue;
import io.quyaml.core.model.CircuitSpec;
import io.quyaml.core.model.ConditionExpr;
import io.quyaml.core.model.GateKind;
import io.quyaml.core.model.Operation;
import io.quyaml.core.spec.DocumentLoader;
import io.quyaml.core.spec.SpecNormalizer;
import java.math.BigInteger;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ControlFlowLowering")
class ControlFlowLoweringTest {

    private static final ConditionExpr.Atom C1 = new ConditionExpr.Atom("c", BigInteger.ONE);
    private static final ConditionExpr.Atom C2 = new ConditionExpr.Atom("c", BigInteger.TWO);
    private static final ConditionExpr.Atom C3 = new ConditionExpr.Atom("c", BigInteger.valueOf(3));

    private static final Operation X0 = new Operation.Gate(GateKind.X, List.of(0), null);
    private static final Operation H0 = new Operation.Gate(GateKind.H, List.of(0), null);

    private final DocumentLoader loader = new DocumentLoader();
    private final SpecNormalizer normalizer = new SpecNormalizer();

    private CircuitSpec lower(ControlFlowMode mode, String yaml) {
        return new ControlFlowLowering(mode).lower(normalizer.normalize(loader.load(yaml), List.of()));
    }

    @Nested
    @DisplayName("Primitive ops")
    class Primitives {

        @Test
        @DisplayName("Gate calls, whole-register measure, barrier and reset")
        void primitives() {
            CircuitSpec circuit = lower(ControlFlowMode.NATIVE, """
                    qubits: q[2]
                    bits: c[2]
                    params: {theta: 0.5}
                    ops:
                      - h 0
                      - ry(2*$theta) 1
                      - barrier
                      - reset 1
                      - measure
                      - measure: {q: 1, c: 0}
                    """);

            assertThat(circuit.operations())
                    .containsExactly(
                            H0,
                            new Operation.Gate(GateKind.RY, List.of(1), ParamValue.of(1.0)),
                            new Operation.Barrier(),
                            new Operation.Reset(1),
                            new Operation.MeasureAll(),
                            new Operation.Measure(1, 0));
        }

        @Test
        @DisplayName("Evaluation error names the gate and line")
        void evaluationError() {
            assertThatThrownBy(() -> lower(ControlFlowMode.NATIVE, """
                            qubits: q[1]
                            params: {theta: 0}
                            ops: [h 0, "rx(1/$theta) 0"]
                            """))
                    .isInstanceOfSatisfying(ExpressionEvalException.class, e -> {
                        assertThat(e.getMessage())
                                .contains("Division by zero")
                                .contains("(gate 'rx' on line 2)");
                        assertThat(e.location()).isEqualTo("line 2");
                    });
        }
    }

    @Nested
    @DisplayName("Conditions")
    class Conditions {

        @Test
        @DisplayName("Atom → one if/else block")
        void atom() {
            Operation op = ControlFlowLowering.lowerCondition(C1, List.of(X0), List.of(H0));

            assertThat(op).isEqualTo(new Operation.IfElse(C1, List.of(X0), List.of(H0)));
        }

        @Test
        @DisplayName("l && r → if l { if r {T} else {E} } else {E}")
        void and() {
            Operation op = ControlFlowLowering.lowerCondition(
                    new ConditionExpr.And(C1, C2), List.of(X0), List.of(H0));

            Operation inner = new Operation.IfElse(C2, List.of(X0), List.of(H0));
            assertThat(op).isEqualTo(new Operation.IfElse(C1, List.of(inner), List.of(H0)));
        }

        @Test
        @DisplayName("l || r → if l {T} else { if r {T} else {E} }")
        void or() {
            Operation op = ControlFlowLowering.lowerCondition(
                    new ConditionExpr.Or(C1, C2), List.of(X0), List.of(H0));

            Operation inner = new Operation.IfElse(C2, List.of(X0), List.of(H0));
            assertThat(op).isEqualTo(new Operation.IfElse(C1, List.of(X0), List.of(inner)));
        }

        @Test
        @DisplayName("a || b && c nests the conjunction in the else branch")
        void mixed() {
            Operation op = ControlFlowLowering.lowerCondition(
                    new ConditionExpr.Or(C1, new ConditionExpr.And(C2, C3)), List.of(X0), List.of());

            Operation andBlock = new Operation.IfElse(
                    C2, List.of(new Operation.IfElse(C3, List.of(X0), List.of())), List.of());
            assertThat(op).isEqualTo(new Operation.IfElse(C1, List.of(X0), List.of(andBlock)));
        }

        @Test
        @DisplayName("Composite if from a document honors every atom")
        void compositeFromDocument() {
            CircuitSpec circuit = lower(ControlFlowMode.NATIVE, """
                    qubits: q[1]
                    bits: c[2]
                    ops:
                      - if:
                          cond: c == 1 && c[1] == 1
                          then: [x 0]
                    """);

            Operation expected = new Operation.IfElse(
                    C1, List.of(new Operation.IfElse(C2, List.of(X0), List.of())), List.of());
            assertThat(circuit.operations()).containsExactly(expected);
        }
    }

    @Nested
    @DisplayName("Native loops")
    class NativeLoops {

        @Test
        @DisplayName("while on an atom → native while loop")
        void whileAtom() {
            CircuitSpec circuit = lower(ControlFlowMode.NATIVE, """
                    qubits: q[1]
                    bits: c[1]
                    ops:
                      - while: {cond: c == 1, body: [x 0], max_iter: 3}
                    """);

            assertThat(circuit.operations()).containsExactly(new Operation.WhileLoop(C1, List.of(X0), 3));
        }

        @Test
        @DisplayName("while on a composite condition → max_iter guarded copies")
        void whileComposite() {
            CircuitSpec circuit = lower(ControlFlowMode.NATIVE, """
                    qubits: q[1]
                    bits: c[2]
                    ops:
                      - while: {cond: c == 1 || c == 2, body: [x 0], max_iter: 2}
                    """);

            Operation guarded = new Operation.IfElse(
                    C1, List.of(X0), List.of(new Operation.IfElse(C2, List.of(X0), List.of())));
            assertThat(circuit.operations()).containsExactly(guarded, guarded);
        }

        @Test
        @DisplayName("for → native counted loop")
        void forLoop() {
            CircuitSpec circuit = lower(ControlFlowMode.NATIVE, """
                    qubits: q[1]
                    ops:
                      - for: {range: [0, 3], body: [h 0]}
                    """);

            assertThat(circuit.operations()).containsExactly(new Operation.ForLoop(0, 3, List.of(H0)));
        }

        @Test
        @DisplayName("Empty and reversed ranges emit nothing")
        void emptyRange() {
            CircuitSpec circuit = lower(ControlFlowMode.NATIVE, """
                    qubits: q[1]
                    ops:
                      - for: {range: [2, 2], body: [h 0]}
                      - for: {range: [3, 1], body: [h 0]}
                      - x 0
                    """);

            assertThat(circuit.operations()).containsExactly(X0);
        }
    }

    @Nested
    @DisplayName("Unrolled loops")
    class UnrolledLoops {

        @Test
        @DisplayName("while → exactly max_iter guarded blocks")
        void whileUnrolled() {
            CircuitSpec circuit = lower(ControlFlowMode.UNROLLED, """
                    qubits: q[1]
                    bits: c[1]
                    ops:
                      - while: {cond: c == 1, body: [x 0], max_iter: 2}
                    """);

            Operation guarded = new Operation.IfElse(C1, List.of(X0), List.of());
            assertThat(circuit.operations()).containsExactly(guarded, guarded);
        }

        @Test
        @DisplayName("for → body repeated once per iteration")
        void forUnrolled() {
            CircuitSpec circuit = lower(ControlFlowMode.UNROLLED, """
                    qubits: q[1]
                    ops:
                      - for: {range: [1, 3], body: [h 0, x 0]}
                    """);

            assertThat(circuit.operations()).containsExactly(H0, X0, H0, X0);
        }

        @Test
        @DisplayName("if stays conditional")
        void ifStays() {
            CircuitSpec circuit = lower(ControlFlowMode.UNROLLED, """
                    qubits: q[1]
                    bits: c[1]
                    ops:
                      - if: {cond: c == 1, then: [x 0], else: [h 0]}
                    """);

            assertThat(circuit.operations()).containsExactly(new Operation.IfElse(C1, List.of(X0), List.of(H0)));
        }
    }

    @Nested
    @DisplayName("Unroll budget")
    class UnrollBudget {

        private static final String FULL_INT_RANGE = """
                qubits: q[1]
                ops:
                  - for: {range: [-2147483648, 2147483647], body: [x 0]}
                """;

        @Test
        @DisplayName("Full int range → native loop over the whole range")
        void fullIntRangeNative() {
            CircuitSpec circuit = lower(ControlFlowMode.NATIVE, FULL_INT_RANGE);

            assertThat(circuit.operations())
                    .containsExactly(new Operation.ForLoop(Integer.MIN_VALUE, Integer.MAX_VALUE, List.of(X0)));
        }

        @Test
        @DisplayName("Full int range unrolled → schema error naming the range and line")
        void fullIntRangeUnrolled() {
            assertThatThrownBy(() -> lower(ControlFlowMode.UNROLLED, FULL_INT_RANGE))
                    .isInstanceOfSatisfying(SchemaViolationException.class, e -> {
                        assertThat(e.getMessage())
                                .contains("Unrolled 'for' on line 1 needs 4294967295 copies")
                                .contains("range=[-2147483648, 2147483647]");
                        assertThat(e.location()).isEqualTo("line 1");
                    });
        }

        @Test
        @DisplayName("Composite while with huge max_iter → schema error even in native mode")
        void hugeMaxIter() {
            assertThatThrownBy(() -> lower(ControlFlowMode.NATIVE, """
                            qubits: q[1]
                            bits: c[1]
                            ops:
                              - h 0
                              - while: {cond: c == 1 && c == 1, body: [x 0], max_iter: 2000000000}
                            """))
                    .isInstanceOf(SchemaViolationException.class)
                    .hasMessageContaining("Unrolled 'while' on line 2")
                    .hasMessageContaining("max_iter=2000000000")
                    .hasMessageContaining("limit of 100000");
        }

        @Test
        @DisplayName("Atom while with huge max_iter stays a native loop")
        void hugeMaxIterNativeAtom() {
            CircuitSpec circuit = lower(ControlFlowMode.NATIVE, """
                    qubits: q[1]
                    bits: c[1]
                    ops:
                      - while: {cond: c == 1, body: [x 0], max_iter: 2000000000}
                    """);

            assertThat(circuit.operations()).containsExactly(new Operation.WhileLoop(C1, List.of(X0), 2_000_000_000));
        }

        @Test
        @DisplayName("Budget is shared by all loops of a circuit")
        void budgetIsCumulative() {
            ControlFlowLowering lowering = new ControlFlowLowering(ControlFlowMode.UNROLLED, 5);
            String fits = """
                    qubits: q[1]
                    ops:
                      - for: {range: [0, 2], body: [h 0]}
                      - for: {range: [0, 3], body: [x 0]}
                    """;
            String exceeds = fits + "  - for: {range: [0, 1], body: [h 0]}\n";

            assertThat(lowering.lower(normalizer.normalize(loader.load(fits), List.of())).operations())
                    .containsExactly(H0, H0, X0, X0, X0);
            assertThatThrownBy(() -> lowering.lower(normalizer.normalize(loader.load(exceeds), List.of())))
                    .isInstanceOf(SchemaViolationException.class)
                    .hasMessageContaining("on line 3")
                    .hasMessageContaining("limit of 5");
        }

        @Test
        @DisplayName("Non-positive budget → rejected")
        void nonPositiveBudget() {
            assertThatThrownBy(() -> new ControlFlowLowering(ControlFlowMode.UNROLLED, 0))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("Mode names parse case-insensitively")
    void modeFromString() {
        assertThat(ControlFlowMode.fromString("Unrolled")).isEqualTo(ControlFlowMode.UNROLLED);
        assertThat(ControlFlowMode.fromString(" native ")).isEqualTo(ControlFlowMode.NATIVE);
        assertThatThrownBy(() -> ControlFlowMode.fromString("dynamic"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("expected one of: native, unrolled");
    }
}
