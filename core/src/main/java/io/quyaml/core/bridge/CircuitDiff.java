package io.quyaml.core.bridge;

import java.util.Objects;

/**
 * First structural difference between two circuits, or {@link #EQUAL}.
 *
 * @param equal  whether the circuits matched
 * @param reason short reason code, {@code equal} when they matched
 * @param path   where the difference is, e.g. {@code ops[2].trueBody[0]};
 *               {@code null} for register mismatches and equal circuits
 * @param left   left-hand value at {@code path}
 * @param right  right-hand value at {@code path}
 */
public record CircuitDiff(boolean equal, String reason, String path, String left, String right) {

    public static final String REGISTER_MISMATCH = "qubits/cbits mismatch";
    public static final String OP_COUNT_MISMATCH = "op count mismatch";
    public static final String OP_MISMATCH = "op mismatch";
    public static final String PARAM_MISMATCH = "param mismatch";

    public static final CircuitDiff EQUAL = new CircuitDiff(true, "equal", null, null, null);

    public CircuitDiff {
        Objects.requireNonNull(reason, "reason must not be null");
    }

    static CircuitDiff mismatch(String reason, String path, Object left, Object right) {
        return new CircuitDiff(false, reason, path, String.valueOf(left), String.valueOf(right));
    }

    /** One-line description, e.g. {@code op mismatch at ops[1]: cx[0, 1] vs cx[1, 0]}. */
    public String describe() {
        if (equal) {
            return reason;
        }
        return reason + (path != null ? " at " + path : "") + ": " + left + " vs " + right;
    }
}
