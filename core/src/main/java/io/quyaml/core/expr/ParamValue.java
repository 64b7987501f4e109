package io.quyaml.core.expr;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Result of evaluating a parameter expression: either a finite number, or a
 * deferred symbolic value when an unbound sweep parameter took part.
 *
 * <p>
 * Also used as the entry type of the circuit parameter table, where a
 * constant is {@link Numeric} and a sweep placeholder is a {@link Symbolic}
 * wrapping a single {@link ParamExpr.Symbol}.
 */
public sealed interface ParamValue {

    static ParamValue of(double value) {
        return new Numeric(value);
    }

    static ParamValue placeholder(String name) {
        return new Symbolic(new ParamExpr.Symbol(name));
    }

    /** Parameter names this value still depends on; empty for numbers. */
    Set<String> freeParameters();

    /** The value as an expression tree. */
    ParamExpr asExpression();

    /**
     * Substitutes the given parameter values. Parameters not in the map stay
     * symbolic.
     *
     * @throws io.quyaml.core.error.ExpressionEvalException if the bound
     *                                                      expression has no
     *                                                      finite value
     */
    ParamValue bind(Map<String, Double> values);

    default boolean isSymbolic() {
        return this instanceof Symbolic;
    }

    record Numeric(double value) implements ParamValue {
        public Numeric {
            if (!Double.isFinite(value)) {
                throw new IllegalArgumentException("value must be finite, got: " + value);
            }
        }

        @Override
        public Set<String> freeParameters() {
            return Set.of();
        }

        @Override
        public ParamExpr asExpression() {
            return new ParamExpr.Constant(value);
        }

        @Override
        public ParamValue bind(Map<String, Double> values) {
            return this;
        }

        @Override
        public String toString() {
            return Double.toString(value);
        }
    }

    record Symbolic(ParamExpr expression) implements ParamValue {
        public Symbolic {
            Objects.requireNonNull(expression, "expression must not be null");
        }

        @Override
        public Set<String> freeParameters() {
            return expression.symbols();
        }

        @Override
        public ParamExpr asExpression() {
            return expression;
        }

        @Override
        public ParamValue bind(Map<String, Double> values) {
            return ExpressionEvaluator.evaluate(expression, name -> {
                Double bound = values.get(name);
                return bound != null ? ParamValue.of(bound) : ParamValue.placeholder(name);
            });
        }

        @Override
        public String toString() {
            return expression.render();
        }
    }
}
