package io.quyaml.core.bridge;

import io.quyaml.core.expr.ParamValue;
import io.quyaml.core.model.CircuitSpec;
import io.quyaml.core.model.Operation;
import java.util.List;
import java.util.Objects;

/**
 * Structural comparison of compiled circuits: register widths, then the
 * operation sequence including nested bodies. Numeric angles are equal within
 * an absolute tolerance; symbolic angles must render identically. Circuit
 * names and parameter tables are not compared.
 */
public final class CircuitComparator {

    /** Default absolute tolerance for angles. */
    public static final double DEFAULT_TOLERANCE = 1e-9;

    private final double tolerance;

    public CircuitComparator() {
        this(DEFAULT_TOLERANCE);
    }

    public CircuitComparator(double tolerance) {
        if (!(tolerance >= 0.0) || Double.isInfinite(tolerance)) {
            throw new IllegalArgumentException("tolerance must be a finite non-negative number, got: " + tolerance);
        }
        this.tolerance = tolerance;
    }

    public boolean structurallyEqual(CircuitSpec left, CircuitSpec right) {
        return diff(left, right).equal();
    }

    /** Returns the first difference found, or {@link CircuitDiff#EQUAL}. */
    public CircuitDiff diff(CircuitSpec left, CircuitSpec right) {
        Objects.requireNonNull(left, "left must not be null");
        Objects.requireNonNull(right, "right must not be null");
        if (left.numQubits() != right.numQubits() || left.numClbits() != right.numClbits()) {
            return CircuitDiff.mismatch(
                    CircuitDiff.REGISTER_MISMATCH,
                    null,
                    "(" + left.numQubits() + "," + left.numClbits() + ")",
                    "(" + right.numQubits() + "," + right.numClbits() + ")");
        }
        return diffOps("ops", left.operations(), right.operations());
    }

    private CircuitDiff diffOps(String path, List<Operation> left, List<Operation> right) {
        if (left.size() != right.size()) {
            return CircuitDiff.mismatch(CircuitDiff.OP_COUNT_MISMATCH, path, left.size(), right.size());
        }
        for (int i = 0; i < left.size(); i++) {
            CircuitDiff diff = diffOp(path + "[" + i + "]", left.get(i), right.get(i));
            if (!diff.equal()) {
                return diff;
            }
        }
        return CircuitDiff.EQUAL;
    }

    private CircuitDiff diffOp(String path, Operation left, Operation right) {
        if (left.getClass() != right.getClass()) {
            return CircuitDiff.mismatch(CircuitDiff.OP_MISMATCH, path, label(left), label(right));
        }
        if (left instanceof Operation.Gate l) {
            Operation.Gate r = (Operation.Gate) right;
            if (l.kind() != r.kind() || !l.qubits().equals(r.qubits())) {
                return CircuitDiff.mismatch(CircuitDiff.OP_MISMATCH, path, label(l), label(r));
            }
            if (l.angle() != null && !anglesEqual(l.angle(), r.angle())) {
                return CircuitDiff.mismatch(CircuitDiff.PARAM_MISMATCH, path, l.angle(), r.angle());
            }
            return CircuitDiff.EQUAL;
        }
        if (left instanceof Operation.IfElse l) {
            Operation.IfElse r = (Operation.IfElse) right;
            if (!l.test().equals(r.test())) {
                return CircuitDiff.mismatch(CircuitDiff.OP_MISMATCH, path, label(l), label(r));
            }
            CircuitDiff trueDiff = diffOps(path + ".trueBody", l.trueBody(), r.trueBody());
            return trueDiff.equal() ? diffOps(path + ".falseBody", l.falseBody(), r.falseBody()) : trueDiff;
        }
        if (left instanceof Operation.WhileLoop l) {
            Operation.WhileLoop r = (Operation.WhileLoop) right;
            if (!l.test().equals(r.test()) || l.maxIter() != r.maxIter()) {
                return CircuitDiff.mismatch(CircuitDiff.OP_MISMATCH, path, label(l), label(r));
            }
            return diffOps(path + ".body", l.body(), r.body());
        }
        if (left instanceof Operation.ForLoop l) {
            Operation.ForLoop r = (Operation.ForLoop) right;
            if (l.start() != r.start() || l.end() != r.end()) {
                return CircuitDiff.mismatch(CircuitDiff.OP_MISMATCH, path, label(l), label(r));
            }
            return diffOps(path + ".body", l.body(), r.body());
        }
        // Barrier, MeasureAll, Measure, Reset: records without angles
        return left.equals(right) ? CircuitDiff.EQUAL : CircuitDiff.mismatch(CircuitDiff.OP_MISMATCH, path, left, right);
    }

    private boolean anglesEqual(ParamValue left, ParamValue right) {
        if (left instanceof ParamValue.Numeric l && right instanceof ParamValue.Numeric r) {
            return Math.abs(l.value() - r.value()) <= tolerance;
        }
        return left.toString().equals(right.toString());
    }

    private static String label(Operation op) {
        if (op instanceof Operation.Gate gate) {
            return gate.kind().mnemonic() + gate.qubits();
        }
        if (op instanceof Operation.IfElse ifElse) {
            return "if(" + ifElse.test() + ")";
        }
        if (op instanceof Operation.WhileLoop loop) {
            return "while(" + loop.test() + ", max_iter=" + loop.maxIter() + ")";
        }
        if (op instanceof Operation.ForLoop loop) {
            return "for[" + loop.start() + ", " + loop.end() + ")";
        }
        return op.toString();
    }
}
