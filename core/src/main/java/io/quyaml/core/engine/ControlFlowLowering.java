package io.quyaml.core.engine;

import io.quyaml.core.error.ExpressionEvalException;
import io.quyaml.core.error.SchemaViolationException;
import io.quyaml.core.expr.ExpressionEvaluator;
import io.quyaml.core.expr.ParamValue;
import io.quyaml.core.guard.GuardrailLimits;
import io.quyaml.core.model.CircuitSpec;
import io.quyaml.core.model.ConditionExpr;
import io.quyaml.core.model.GateKind;
import io.quyaml.core.model.Instruction;
import io.quyaml.core.model.Operation;
import io.quyaml.core.spec.NormalizedCircuit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lowers parsed instructions onto the circuit operation model.
 *
 * <p>
 * Conditions: an atom becomes one {@link Operation.IfElse}. Composite
 * conditions nest so that each branch runs exactly when the boolean
 * expression holds:
 *
 * <pre>
 * lower(l &amp;&amp; r, T, E) = lower(l, [lower(r, T, E)], E)
 * lower(l || r, T, E) = lower(l, T, [lower(r, T, E)])
 * </pre>
 *
 * Loops follow the {@link ControlFlowMode} given at construction. Bodies are
 * built once into immutable lists and shared between the blocks that use them.
 * Unrolled loops draw on a per-circuit budget of body copies
 * ({@link GuardrailLimits#maxUnrolledCopies()}); a loop that would exceed it
 * is rejected before anything is emitted.
 *
 * <p>
 * Thread-safe: immutable after construction.
 */
public final class ControlFlowLowering {

    private static final Logger LOG = LoggerFactory.getLogger(ControlFlowLowering.class);

    private final ControlFlowMode mode;
    private final int maxUnrolledCopies;

    public ControlFlowLowering(ControlFlowMode mode) {
        this(mode, GuardrailLimits.DEFAULT.maxUnrolledCopies());
    }

    /**
     * @param mode              loop lowering strategy
     * @param maxUnrolledCopies unrolled body copies allowed per circuit
     */
    public ControlFlowLowering(ControlFlowMode mode, int maxUnrolledCopies) {
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
        if (maxUnrolledCopies <= 0) {
            throw new IllegalArgumentException("maxUnrolledCopies must be positive, got: " + maxUnrolledCopies);
        }
        this.maxUnrolledCopies = maxUnrolledCopies;
    }

    public ControlFlowMode mode() {
        return mode;
    }

    /**
     * Lowers a normalized circuit.
     *
     * @return the compiled circuit
     * @throws ExpressionEvalException  if a gate parameter has no finite value
     * @throws SchemaViolationException if unrolling would exceed the copy budget
     */
    public CircuitSpec lower(NormalizedCircuit circuit) {
        Objects.requireNonNull(circuit, "circuit must not be null");
        Map<String, ParamValue> parameters = circuit.parameters();
        List<Operation> operations = new ArrayList<>();
        UnrollBudget budget = new UnrollBudget(maxUnrolledCopies);
        for (Instruction instruction : circuit.instructions()) {
            lowerInstruction(instruction, parameters, budget, operations);
        }
        return new CircuitSpec(
                circuit.name(), circuit.quantumRegister(), circuit.classicalRegister(), parameters, operations);
    }

    private void lowerInstruction(
            Instruction instruction, Map<String, ParamValue> parameters, UnrollBudget budget, List<Operation> out) {
        if (instruction instanceof Instruction.Primitive primitive) {
            out.add(lowerPrimitive(primitive, parameters));
        } else if (instruction instanceof Instruction.If ifBlock) {
            List<Operation> thenBody = lowerBody(ifBlock.thenBody(), parameters);
            List<Operation> elseBody = lowerBody(ifBlock.elseBody(), parameters);
            out.add(lowerCondition(ifBlock.condition(), thenBody, elseBody));
        } else if (instruction instanceof Instruction.While whileBlock) {
            lowerWhile(whileBlock, parameters, budget, out);
        } else if (instruction instanceof Instruction.For forBlock) {
            lowerFor(forBlock, parameters, budget, out);
        } else {
            throw new IllegalStateException("Unhandled instruction: " + instruction);
        }
    }

    private void lowerWhile(
            Instruction.While whileBlock, Map<String, ParamValue> parameters, UnrollBudget budget, List<Operation> out) {
        List<Operation> body = lowerBody(whileBlock.body(), parameters);
        if (mode == ControlFlowMode.NATIVE && whileBlock.condition() instanceof ConditionExpr.Atom atom) {
            out.add(new Operation.WhileLoop(atom, body, whileBlock.maxIter()));
            return;
        }
        LOG.debug(
                "lowering.while_unrolled line={} mode={} max_iter={}",
                whileBlock.line(),
                mode,
                whileBlock.maxIter());
        budget.spend(whileBlock.maxIter(), "while", "max_iter=" + whileBlock.maxIter(), whileBlock.line());
        Operation guarded = lowerCondition(whileBlock.condition(), body, List.of());
        out.addAll(Collections.nCopies(whileBlock.maxIter(), guarded));
    }

    private void lowerFor(
            Instruction.For forBlock, Map<String, ParamValue> parameters, UnrollBudget budget, List<Operation> out) {
        long iterations = forBlock.iterations();
        if (iterations == 0) {
            LOG.debug(
                    "lowering.for_empty line={} range=[{}, {}]", forBlock.line(), forBlock.start(), forBlock.end());
            return;
        }
        List<Operation> body = lowerBody(forBlock.body(), parameters);
        if (mode == ControlFlowMode.NATIVE) {
            out.add(new Operation.ForLoop(forBlock.start(), forBlock.end(), body));
            return;
        }
        budget.spend(
                iterations,
                "for",
                "range=[" + forBlock.start() + ", " + forBlock.end() + "]",
                forBlock.line());
        for (long i = 0; i < iterations; i++) {
            out.addAll(body);
        }
    }

    /** Builds the nested block structure for a condition. */
    static Operation lowerCondition(ConditionExpr condition, List<Operation> thenBody, List<Operation> elseBody) {
        if (condition instanceof ConditionExpr.Atom atom) {
            return new Operation.IfElse(atom, thenBody, elseBody);
        }
        if (condition instanceof ConditionExpr.And and) {
            Operation inner = lowerCondition(and.right(), thenBody, elseBody);
            return lowerCondition(and.left(), List.of(inner), elseBody);
        }
        ConditionExpr.Or or = (ConditionExpr.Or) condition;
        Operation inner = lowerCondition(or.right(), thenBody, elseBody);
        return lowerCondition(or.left(), thenBody, List.of(inner));
    }

    private static List<Operation> lowerBody(List<Instruction.Primitive> body, Map<String, ParamValue> parameters) {
        List<Operation> lowered = new ArrayList<>(body.size());
        for (Instruction.Primitive primitive : body) {
            lowered.add(lowerPrimitive(primitive, parameters));
        }
        return List.copyOf(lowered);
    }

    private static Operation lowerPrimitive(Instruction.Primitive primitive, Map<String, ParamValue> parameters) {
        if (primitive instanceof Instruction.Measure measure) {
            return new Operation.Measure(measure.qubit(), measure.clbit());
        }
        if (primitive instanceof Instruction.Reset reset) {
            return new Operation.Reset(reset.qubit());
        }
        Instruction.GateCall call = (Instruction.GateCall) primitive;
        switch (call.kind()) {
            case BARRIER:
                return new Operation.Barrier();
            case MEASURE:
                return new Operation.MeasureAll();
            case RESET:
                return new Operation.Reset(call.targets().get(0));
            default:
                return new Operation.Gate(call.kind(), call.targets(), angle(call, parameters));
        }
    }

    private static ParamValue angle(Instruction.GateCall call, Map<String, ParamValue> parameters) {
        if (call.expression() == null) {
            return null;
        }
        try {
            return ExpressionEvaluator.evaluate(call.expression(), parameters::get);
        } catch (ExpressionEvalException e) {
            GateKind kind = call.kind();
            throw new ExpressionEvalException(
                    e.getMessage() + " (gate '" + kind.mnemonic() + "' on line " + call.line() + ")",
                    e,
                    "line " + call.line());
        }
    }

    /** Body copies still available to unrolled loops of one circuit. Not thread-safe; one per lower call. */
    private static final class UnrollBudget {
        private final int limit;
        private long spent;

        UnrollBudget(int limit) {
            this.limit = limit;
        }

        void spend(long copies, String block, String bound, int line) {
            if (copies > limit - spent) {
                throw new SchemaViolationException(
                        String.format(
                                "Unrolled '%s' on line %d needs %d copies (%s), exceeding the limit of %d"
                                        + " unrolled copies per circuit.",
                                block, line, copies, bound, limit),
                        "line " + line);
            }
            spent += copies;
        }
    }
}
