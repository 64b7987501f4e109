package io.quyaml.core.engine;

import io.quyaml.core.guard.GuardrailLimits;
import java.util.Objects;

/**
 * Per-compiler settings, fixed at construction.
 *
 * <p>
 * Immutable and thread-safe.
 *
 * @param limits          guardrail limits applied to every document
 * @param controlFlowMode loop lowering strategy (default: {@link ControlFlowMode#NATIVE})
 */
public record CompilerOptions(GuardrailLimits limits, ControlFlowMode controlFlowMode) {

    /** Default guardrail limits, native control flow. */
    public static final CompilerOptions DEFAULT = new CompilerOptions(GuardrailLimits.DEFAULT, ControlFlowMode.NATIVE);

    public CompilerOptions {
        Objects.requireNonNull(limits, "limits must not be null");
        Objects.requireNonNull(controlFlowMode, "controlFlowMode must not be null");
    }

    public CompilerOptions withControlFlowMode(ControlFlowMode mode) {
        return new CompilerOptions(limits, mode);
    }

    public CompilerOptions withLimits(GuardrailLimits newLimits) {
        return new CompilerOptions(newLimits, controlFlowMode);
    }
}
