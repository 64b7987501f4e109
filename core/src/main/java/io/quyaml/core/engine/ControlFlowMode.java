package io.quyaml.core.engine;

import java.util.Locale;

/**
 * How {@code while} and {@code for} blocks are lowered. Selected once per
 * compiler through {@link CompilerOptions}.
 */
public enum ControlFlowMode {

    /**
     * Emit native loop blocks: a {@code while} on a single condition atom
     * becomes a bounded conditional loop and a {@code for} becomes a counted
     * loop. Composite {@code while} conditions are still unrolled.
     */
    NATIVE,

    /**
     * Unroll every loop: {@code while} into {@code max_iter} guarded blocks,
     * {@code for} into repeated bodies. {@code if} blocks stay conditional.
     */
    UNROLLED;

    /**
     * Parses a mode name, ignoring case.
     *
     * @throws IllegalArgumentException if the name is not a mode
     */
    public static ControlFlowMode fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("control-flow mode must not be null");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (ControlFlowMode mode : values()) {
            if (mode.name().equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException(
                "Unknown control-flow mode '" + value + "'; expected one of: native, unrolled");
    }
}
