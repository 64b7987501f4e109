package io.quyaml.core.guard;

/**
 * Structural limits enforced on a document. Size and nesting are checked on
 * raw text before it is parsed; register width and unrolled loop iterations
 * are checked while the circuit is built.
 *
 * <p>
 * Immutable and thread-safe.
 *
 * @param maxBytes          maximum UTF-8 encoded document size in bytes (default: 1 000 000)
 * @param maxNesting        maximum indentation depth, counted in two-space levels
 *                          (default: 50)
 * @param maxRegisterWidth  maximum width of a quantum or classical register
 *                          (default: 65 536)
 * @param maxUnrolledCopies maximum number of loop-body copies emitted by
 *                          unrolling, summed over the whole circuit
 *                          (default: 100 000)
 */
public record GuardrailLimits(int maxBytes, int maxNesting, int maxRegisterWidth, int maxUnrolledCopies) {

    static final int DEFAULT_MAX_REGISTER_WIDTH = 65_536;
    static final int DEFAULT_MAX_UNROLLED_COPIES = 100_000;

    /** Default limits: 1 000 000 bytes, nesting depth 50, width 65 536, 100 000 unrolled copies. */
    public static final GuardrailLimits DEFAULT =
            new GuardrailLimits(1_000_000, 50, DEFAULT_MAX_REGISTER_WIDTH, DEFAULT_MAX_UNROLLED_COPIES);

    public GuardrailLimits {
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be positive, got: " + maxBytes);
        }
        if (maxNesting <= 0) {
            throw new IllegalArgumentException("maxNesting must be positive, got: " + maxNesting);
        }
        if (maxRegisterWidth <= 0) {
            throw new IllegalArgumentException("maxRegisterWidth must be positive, got: " + maxRegisterWidth);
        }
        if (maxUnrolledCopies <= 0) {
            throw new IllegalArgumentException("maxUnrolledCopies must be positive, got: " + maxUnrolledCopies);
        }
    }

    /** Text limits only; register width and unrolling keep their defaults. */
    public GuardrailLimits(int maxBytes, int maxNesting) {
        this(maxBytes, maxNesting, DEFAULT_MAX_REGISTER_WIDTH, DEFAULT_MAX_UNROLLED_COPIES);
    }
}
