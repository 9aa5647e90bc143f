package com.formulagrid.app.formula;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsed formula expression. The set of node types below is closed: the parser can
 * only build these, and they can only do what is listed here.
 */
abstract class Expression {

    Expression() {
    }

    abstract Object evaluate();

    enum ArithmeticOperator {
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*"),
        DIVIDE("/"),
        FLOOR_DIVIDE("//"),
        MODULO("%"),
        POWER("**");

        private final String symbol;

        ArithmeticOperator(String symbol) {
            this.symbol = symbol;
        }

        String symbol() {
            return symbol;
        }
    }

    enum ComparisonOperator {
        EQUAL("="),
        NOT_EQUAL("<>"),
        LESS("<"),
        LESS_OR_EQUAL("<="),
        GREATER(">"),
        GREATER_OR_EQUAL(">=");

        private final String symbol;

        ComparisonOperator(String symbol) {
            this.symbol = symbol;
        }

        String symbol() {
            return symbol;
        }

        static ComparisonOperator fromSymbol(String symbol) {
            for (ComparisonOperator op : values()) {
                if (op.symbol.equals(symbol)) {
                    return op;
                }
            }
            return null;
        }

        boolean test(int comparison) {
            switch (this) {
                case EQUAL:
                    return comparison == 0;
                case NOT_EQUAL:
                    return comparison != 0;
                case LESS:
                    return comparison < 0;
                case LESS_OR_EQUAL:
                    return comparison <= 0;
                case GREATER:
                    return comparison > 0;
                default:
                    return comparison >= 0;
            }
        }
    }

    static final class Literal extends Expression {
        private final Object value;

        Literal(Object value) {
            this.value = value;
        }

        @Override
        Object evaluate() {
            return value;
        }
    }

    static final class Negate extends Expression {
        private final Expression operand;

        Negate(Expression operand) {
            this.operand = operand;
        }

        @Override
        Object evaluate() {
            return Arithmetic.negate(operand.evaluate());
        }
    }

    static final class Plus extends Expression {
        private final Expression operand;

        Plus(Expression operand) {
            this.operand = operand;
        }

        @Override
        Object evaluate() {
            return Arithmetic.toNumber("+", operand.evaluate());
        }
    }

    static final class Binary extends Expression {
        private final ArithmeticOperator operator;
        private final Expression left;
        private final Expression right;

        Binary(ArithmeticOperator operator, Expression left, Expression right) {
            this.operator = operator;
            this.left = left;
            this.right = right;
        }

        @Override
        Object evaluate() {
            return Arithmetic.apply(operator, left.evaluate(), right.evaluate());
        }
    }

    static final class Comparison extends Expression {
        private final ComparisonOperator operator;
        private final Expression left;
        private final Expression right;

        Comparison(ComparisonOperator operator, Expression left, Expression right) {
            this.operator = operator;
            this.left = left;
            this.right = right;
        }

        @Override
        Object evaluate() {
            return Arithmetic.compare(operator, left.evaluate(), right.evaluate());
        }
    }

    /** IF(condition, then, else); only the chosen branch is evaluated. */
    static final class Conditional extends Expression {
        private final Expression condition;
        private final Expression whenTrue;
        private final Expression whenFalse;

        Conditional(Expression condition, Expression whenTrue, Expression whenFalse) {
            this.condition = condition;
            this.whenTrue = whenTrue;
            this.whenFalse = whenFalse;
        }

        @Override
        Object evaluate() {
            return Functions.isTrue(condition.evaluate()) ? whenTrue.evaluate() : whenFalse.evaluate();
        }
    }

    static final class Call extends Expression {
        private final Functions.Function function;
        private final List<Expression> arguments;

        Call(Functions.Function function, List<Expression> arguments) {
            this.function = function;
            this.arguments = arguments;
        }

        @Override
        Object evaluate() {
            function.checkArity(arguments.size());
            List<Object> values = new ArrayList<>(arguments.size());
            for (Expression argument : arguments) {
                values.add(argument.evaluate());
            }
            return function.apply(values);
        }
    }
}
