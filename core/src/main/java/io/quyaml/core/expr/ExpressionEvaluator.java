package io.quyaml.core.expr;

import io.quyaml.core.error.ExpressionEvalException;
import io.quyaml.core.error.UnresolvedReferenceException;
import io.quyaml.core.expr.ParamExpr.BinaryOp;
import io.quyaml.core.expr.ParamExpr.BinaryOperator;
import io.quyaml.core.expr.ParamExpr.Constant;
import io.quyaml.core.expr.ParamExpr.Symbol;
import io.quyaml.core.expr.ParamExpr.UnaryOp;
import io.quyaml.core.expr.ParamExpr.UnaryOperator;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Tree walker over {@link ParamExpr}. Numeric subtrees are folded to a single
 * finite {@code double}. A subtree that touches a symbolic parameter is kept
 * as a tree with its numeric parts folded, and returned as
 * {@link ParamValue.Symbolic}.
 *
 * <p>
 * Evaluation order is fixed (left operand first) and powers use
 * {@link StrictMath}, so the same input always yields the same bits.
 */
public final class ExpressionEvaluator {

    private ExpressionEvaluator() {
        // utility class
    }

    /**
     * Parses and evaluates an expression against a parameter table.
     *
     * @param source     expression text
     * @param parameters parameter table; sweep placeholders are symbolic entries
     * @return the folded value
     * @throws ExpressionEvalException      on grammar violations or non-finite
     *                                      results
     * @throws UnresolvedReferenceException if a {@code $name} is not in the table
     */
    public static ParamValue evaluate(String source, Map<String, ParamValue> parameters) {
        Objects.requireNonNull(parameters, "parameters must not be null");
        return evaluate(ExpressionParser.parse(source), parameters::get);
    }

    /**
     * Evaluates a tree. The lookup returns {@code null} for undefined names.
     */
    public static ParamValue evaluate(ParamExpr expr, Function<String, ParamValue> lookup) {
        Objects.requireNonNull(expr, "expr must not be null");
        Objects.requireNonNull(lookup, "lookup must not be null");
        return walk(expr, lookup);
    }

    private static ParamValue walk(ParamExpr expr, Function<String, ParamValue> lookup) {
        if (expr instanceof Constant constant) {
            return ParamValue.of(constant.value());
        }
        if (expr instanceof Symbol symbol) {
            ParamValue value = lookup.apply(symbol.name());
            if (value == null) {
                throw new UnresolvedReferenceException(
                        "Parameter '" + symbol.name() + "' not defined in parameters block.", null);
            }
            return value;
        }
        if (expr instanceof UnaryOp unary) {
            ParamValue operand = walk(unary.operand(), lookup);
            if (unary.operator() == UnaryOperator.PLUS) {
                return operand;
            }
            if (operand instanceof ParamValue.Numeric numeric) {
                return ParamValue.of(-numeric.value());
            }
            return new ParamValue.Symbolic(new UnaryOp(UnaryOperator.MINUS, operand.asExpression()));
        }
        BinaryOp binary = (BinaryOp) expr;
        ParamValue left = walk(binary.left(), lookup);
        ParamValue right = walk(binary.right(), lookup);
        if (left instanceof ParamValue.Numeric l && right instanceof ParamValue.Numeric r) {
            return ParamValue.of(apply(binary.operator(), l.value(), r.value()));
        }
        return new ParamValue.Symbolic(new BinaryOp(binary.operator(), left.asExpression(), right.asExpression()));
    }

    static double apply(BinaryOperator operator, double a, double b) {
        double result;
        switch (operator) {
            case ADD -> result = a + b;
            case SUB -> result = a - b;
            case MUL -> result = a * b;
            case DIV -> {
                if (b == 0.0) {
                    throw new ExpressionEvalException("Division by zero in parameter expression", null);
                }
                result = a / b;
            }
            case MOD -> {
                if (b == 0.0) {
                    throw new ExpressionEvalException("Modulo by zero in parameter expression", null);
                }
                result = floorMod(a, b);
            }
            case POW -> {
                if (a == 0.0 && b < 0.0) {
                    throw new ExpressionEvalException(
                            "Zero raised to a negative power in parameter expression", null);
                }
                if (a < 0.0 && b != Math.rint(b)) {
                    throw new ExpressionEvalException(
                            String.format("Non-real result: %s ** %s in parameter expression", a, b), null);
                }
                result = StrictMath.pow(a, b);
            }
            default -> throw new IllegalStateException("Unhandled operator: " + operator);
        }
        if (!Double.isFinite(result)) {
            throw new ExpressionEvalException(
                    String.format("Overflow: %s %s %s is not a finite number", a, operator.symbol(), b), null);
        }
        return result;
    }

    /** Modulo whose result takes the sign of the divisor. */
    private static double floorMod(double a, double b) {
        double r = a % b;
        if (r != 0.0 && (r < 0.0) != (b < 0.0)) {
            r += b;
        }
        return r == 0.0 ? Math.copySign(0.0, b) : r;
    }
}
