package io.quyaml.core.model;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Classical condition tree. Both surface atom forms ({@code c[i] == 0|1} and
 * {@code c == literal}) normalize to an {@link Atom} that compares the whole
 * classical register against an integer.
 *
 * <p>
 * Immutable.
 */
public sealed interface ConditionExpr {

    /**
     * Register-equality test.
     *
     * @param register classical register name
     * @param value    non-negative value the register must equal
     */
    record Atom(String register, BigInteger value) implements ConditionExpr {
        public Atom {
            Objects.requireNonNull(register, "register must not be null");
            Objects.requireNonNull(value, "value must not be null");
            if (value.signum() < 0) {
                throw new IllegalArgumentException("Condition value must not be negative, got: " + value);
            }
        }

        @Override
        public String toString() {
            return register + " == " + value;
        }
    }

    record And(ConditionExpr left, ConditionExpr right) implements ConditionExpr {
        public And {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public String toString() {
            return left + " && " + right;
        }
    }

    record Or(ConditionExpr left, ConditionExpr right) implements ConditionExpr {
        public Or {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public String toString() {
            return left + " || " + right;
        }
    }
}
