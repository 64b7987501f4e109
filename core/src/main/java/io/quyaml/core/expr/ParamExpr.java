package io.quyaml.core.expr;

import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Arithmetic expression tree for gate parameters. The set of node kinds and
 * operators is closed: anything the parser cannot express with these four
 * records is rejected before evaluation.
 *
 * <p>
 * Immutable and thread-safe.
 */
public sealed interface ParamExpr {

    /** Binary operators, in source spelling. */
    enum BinaryOperator {
        ADD("+"),
        SUB("-"),
        MUL("*"),
        DIV("/"),
        POW("**"),
        MOD("%");

        private final String symbol;

        BinaryOperator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    /** Unary operators, in source spelling. */
    enum UnaryOperator {
        PLUS("+"),
        MINUS("-");

        private final String symbol;

        UnaryOperator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    /** Renders this tree back to expression source, fully parenthesized. */
    String render();

    /** Names of all parameter symbols referenced in this tree, sorted. */
    default Set<String> symbols() {
        Set<String> names = new TreeSet<>();
        collectSymbols(this, names);
        return names;
    }

    private static void collectSymbols(ParamExpr expr, Set<String> names) {
        if (expr instanceof Symbol symbol) {
            names.add(symbol.name());
        } else if (expr instanceof UnaryOp unary) {
            collectSymbols(unary.operand(), names);
        } else if (expr instanceof BinaryOp binary) {
            collectSymbols(binary.left(), names);
            collectSymbols(binary.right(), names);
        }
    }

    /** A numeric literal, or one of the named constants {@code pi} and {@code e}. */
    record Constant(double value) implements ParamExpr {
        public Constant {
            if (!Double.isFinite(value)) {
                throw new IllegalArgumentException("constant must be finite, got: " + value);
            }
        }

        @Override
        public String render() {
            return Double.toString(value);
        }
    }

    /** A reference to a declared parameter, written {@code $name} in source. */
    record Symbol(String name) implements ParamExpr {
        public Symbol {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public String render() {
            return "$" + name;
        }
    }

    record UnaryOp(UnaryOperator operator, ParamExpr operand) implements ParamExpr {
        public UnaryOp {
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(operand, "operand must not be null");
        }

        @Override
        public String render() {
            return operator.symbol() + "(" + operand.render() + ")";
        }
    }

    record BinaryOp(BinaryOperator operator, ParamExpr left, ParamExpr right) implements ParamExpr {
        public BinaryOp {
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public String render() {
            return "(" + left.render() + " " + operator.symbol() + " " + right.render() + ")";
        }
    }
}
