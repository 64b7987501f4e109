package io.quyaml.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * The closed gate table. Each kind fixes how many target qubits a call names
 * and whether it takes a parameter expression.
 *
 * <p>
 * {@link #BARRIER} and {@link #MEASURE} take no targets and act on the whole
 * quantum register.
 */
public enum GateKind {
    H("h", 1, false),
    X("x", 1, false),
    Z("z", 1, false),
    CX("cx", 2, false),
    SWAP("swap", 2, false),
    BARRIER("barrier", 0, false),
    MEASURE("measure", 0, false),
    RESET("reset", 1, false),
    RX("rx", 1, true),
    RY("ry", 1, true),
    CPHASE("cphase", 2, true);

    private final String mnemonic;
    private final int targets;
    private final boolean parameterized;

    GateKind(String mnemonic, int targets, boolean parameterized) {
        this.mnemonic = mnemonic;
        this.targets = targets;
        this.parameterized = parameterized;
    }

    /** Lower-case source spelling. */
    public String mnemonic() {
        return mnemonic;
    }

    /** Exact number of target qubits a call must name. */
    public int targets() {
        return targets;
    }

    public boolean parameterized() {
        return parameterized;
    }

    /**
     * Looks up a gate by mnemonic, ignoring case.
     *
     * @return the gate kind, or empty if the mnemonic is not in the table
     */
    public static Optional<GateKind> fromMnemonic(String mnemonic) {
        if (mnemonic == null) {
            return Optional.empty();
        }
        String key = mnemonic.toLowerCase(Locale.ROOT);
        for (GateKind kind : values()) {
            if (kind.mnemonic.equals(key)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
