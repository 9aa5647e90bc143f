package com.formulagrid.app.formula;

import com.formulagrid.app.exceptions.ExpressionException;

import java.math.BigDecimal;

/**
 * Operator semantics for the interpreter.
 * Blank text counts as 0, booleans as 1/0, numeric text as its number;
 * any other text in arithmetic is an error.
 */
final class Arithmetic {

    private Arithmetic() {
    }

    static Number toNumber(String operator, Object value) {
        if (value instanceof Number) {
            return (Number) value;
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? 1L : 0L;
        }
        if (value == null) {
            return 0L;
        }
        String text = value.toString();
        if (text.isBlank()) {
            return 0L;
        }
        Number parsed = Numbers.parseLiteral(text);
        if (parsed == null) {
            throw ExpressionException.failed("Operator '" + operator + "' cannot be applied to text \"" + text + "\"");
        }
        return parsed;
    }

    static Number negate(Object value) {
        Number n = toNumber("-", value);
        if (Numbers.isIntegral(n) && n.longValue() != Long.MIN_VALUE) {
            return -n.longValue();
        }
        if (n instanceof BigDecimal) {
            return ((BigDecimal) n).negate();
        }
        return -n.doubleValue();
    }

    static Number apply(Expression.ArithmeticOperator operator, Object leftValue, Object rightValue) {
        String symbol = operator.symbol();
        Number left = toNumber(symbol, leftValue);
        Number right = toNumber(symbol, rightValue);
        boolean integral = Numbers.isIntegral(left) && Numbers.isIntegral(right);
        switch (operator) {
            case ADD:
                if (integral) {
                    try {
                        return Math.addExact(left.longValue(), right.longValue());
                    } catch (ArithmeticException overflow) {
                        // fall through to double
                    }
                }
                return finite(symbol, left.doubleValue() + right.doubleValue());
            case SUBTRACT:
                if (integral) {
                    try {
                        return Math.subtractExact(left.longValue(), right.longValue());
                    } catch (ArithmeticException overflow) {
                        // fall through to double
                    }
                }
                return finite(symbol, left.doubleValue() - right.doubleValue());
            case MULTIPLY:
                if (integral) {
                    try {
                        return Math.multiplyExact(left.longValue(), right.longValue());
                    } catch (ArithmeticException overflow) {
                        // fall through to double
                    }
                }
                return finite(symbol, left.doubleValue() * right.doubleValue());
            case DIVIDE:
                requireNonZero(symbol, right);
                return finite(symbol, left.doubleValue() / right.doubleValue());
            case FLOOR_DIVIDE:
                requireNonZero(symbol, right);
                // Long.MIN_VALUE // -1 has no long result
                if (integral && !(left.longValue() == Long.MIN_VALUE && right.longValue() == -1)) {
                    return Math.floorDiv(left.longValue(), right.longValue());
                }
                return finite(symbol, Math.floor(left.doubleValue() / right.doubleValue()));
            case MODULO:
                requireNonZero(symbol, right);
                if (integral) {
                    return Math.floorMod(left.longValue(), right.longValue());
                }
                double a = left.doubleValue();
                double b = right.doubleValue();
                return finite(symbol, a - b * Math.floor(a / b));
            case POWER:
                return power(symbol, left, right);
            default:
                throw ExpressionException.unsupported("Unknown operator " + symbol);
        }
    }

    static Number power(String name, Number base, Number exponent) {
        if (Numbers.isIntegral(base) && Numbers.isIntegral(exponent) && exponent.longValue() >= 0) {
            try {
                long result = 1;
                long b = base.longValue();
                long e = exponent.longValue();
                while (e > 0) {
                    if ((e & 1) == 1) {
                        result = Math.multiplyExact(result, b);
                    }
                    e >>= 1;
                    if (e > 0) {
                        b = Math.multiplyExact(b, b);
                    }
                }
                return result;
            } catch (ArithmeticException overflow) {
                // fall through to double
            }
        }
        if (base.doubleValue() == 0 && exponent.doubleValue() < 0) {
            throw ExpressionException.failed(name + ": division by zero");
        }
        return finite(name, Math.pow(base.doubleValue(), exponent.doubleValue()));
    }

    static Boolean compare(Expression.ComparisonOperator operator, Object left, Object right) {
        if (left instanceof String && right instanceof String) {
            return operator.test(((String) left).compareToIgnoreCase((String) right));
        }
        boolean leftText = left instanceof String && Numbers.parseLiteral((String) left) == null;
        boolean rightText = right instanceof String && Numbers.parseLiteral((String) right) == null;
        if (leftText || rightText) {
            switch (operator) {
                case EQUAL:
                    return false;
                case NOT_EQUAL:
                    return true;
                default:
                    throw ExpressionException.failed("Operator '" + operator.symbol()
                            + "' cannot compare text with a number");
            }
        }
        Number a = toNumber(operator.symbol(), left);
        Number b = toNumber(operator.symbol(), right);
        int comparison = Numbers.isIntegral(a) && Numbers.isIntegral(b)
                ? Long.compare(a.longValue(), b.longValue())
                : Numbers.toBigDecimal(a).compareTo(Numbers.toBigDecimal(b));
        return operator.test(comparison);
    }

    static double finite(String name, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw ExpressionException.failed(name + ": result is not a finite number");
        }
        return value;
    }

    private static void requireNonZero(String symbol, Number divisor) {
        if (divisor.doubleValue() == 0) {
            throw ExpressionException.failed("Operator '" + symbol + "': division by zero");
        }
    }
}
