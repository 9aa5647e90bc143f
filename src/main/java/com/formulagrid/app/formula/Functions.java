package com.formulagrid.app.formula;

import com.formulagrid.app.exceptions.ExpressionException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;

/**
 * The allow-list of callable functions. Nothing outside this enum can be called from a formula.
 */
final class Functions {

    private Functions() {
    }

    enum Function {
        SUM(0, Integer.MAX_VALUE),
        AVERAGE(1, Integer.MAX_VALUE),
        MIN(0, Integer.MAX_VALUE),
        MAX(0, Integer.MAX_VALUE),
        COUNT(0, Integer.MAX_VALUE),
        COUNTA(0, Integer.MAX_VALUE),
        ABS(1, 1),
        ROUND(1, 2),
        SQRT(1, 1),
        POWER(2, 2),
        EXP(1, 1),
        LN(1, 1),
        LOG(1, 2),
        LOG10(1, 1),
        SIN(1, 1),
        COS(1, 1),
        TAN(1, 1),
        ASIN(1, 1),
        ACOS(1, 1),
        ATAN(1, 1),
        PI(0, 0),
        E(0, 0),
        IF(3, 3);

        private final int minArgs;
        private final int maxArgs;

        Function(int minArgs, int maxArgs) {
            this.minArgs = minArgs;
            this.maxArgs = maxArgs;
        }

        /**
         * Finds a function by (case-insensitive) name, including the AVG and POW aliases.
         * Returns null for names outside the allow-list.
         */
        static Function lookup(String name) {
            String upper = name.toUpperCase(Locale.ROOT);
            if ("AVG".equals(upper)) {
                return AVERAGE;
            }
            if ("POW".equals(upper)) {
                return POWER;
            }
            for (Function function : values()) {
                if (function.name().equals(upper)) {
                    return function;
                }
            }
            return null;
        }

        void checkArity(int count) {
            if (count < minArgs || count > maxArgs) {
                String expected;
                if (minArgs == maxArgs) {
                    expected = String.valueOf(minArgs);
                } else if (maxArgs == Integer.MAX_VALUE) {
                    expected = "at least " + minArgs;
                } else {
                    expected = minArgs + " to " + maxArgs;
                }
                throw ExpressionException.failed(name() + " expects " + expected
                        + " argument(s), got " + count);
            }
        }

        Object apply(List<Object> args) {
            switch (this) {
                case SUM:
                    return sum(args);
                case AVERAGE:
                    return average(args);
                case MIN:
                    return extreme(args, -1);
                case MAX:
                    return extreme(args, 1);
                case COUNT:
                    return args.stream().filter(a -> a instanceof Number).count();
                case COUNTA:
                    return args.stream().filter(a -> a != null && !"".equals(a)).count();
                case ABS:
                    return abs(number(args, 0));
                case ROUND:
                    return round(number(args, 0), args.size() > 1 ? integer(args, 1) : 0);
                case SQRT:
                    return sqrt(number(args, 0));
                case POWER:
                    return Arithmetic.power(name(), number(args, 0), number(args, 1));
                case EXP:
                    return real(Math.exp(number(args, 0).doubleValue()));
                case LN:
                    return real(Math.log(positive(number(args, 0))));
                case LOG:
                    return log(args);
                case LOG10:
                    return real(Math.log10(positive(number(args, 0))));
                case SIN:
                    return real(Math.sin(number(args, 0).doubleValue()));
                case COS:
                    return real(Math.cos(number(args, 0).doubleValue()));
                case TAN:
                    return real(Math.tan(number(args, 0).doubleValue()));
                case ASIN:
                    return real(Math.asin(unitInterval(number(args, 0))));
                case ACOS:
                    return real(Math.acos(unitInterval(number(args, 0))));
                case ATAN:
                    return real(Math.atan(number(args, 0).doubleValue()));
                case PI:
                    return Math.PI;
                case E:
                    return Math.E;
                default:
                    // IF never reaches here: the parser builds a Conditional node for it
                    throw ExpressionException.unsupported(name() + " cannot be called directly");
            }
        }

        private Number number(List<Object> args, int index) {
            Object value = args.get(index);
            if (value instanceof String && Numbers.parseLiteral((String) value) == null
                    && !((String) value).isBlank()) {
                throw ExpressionException.failed(name() + ": argument " + (index + 1)
                        + " must be a number, got text \"" + value + "\"");
            }
            return Arithmetic.toNumber(name(), value);
        }

        private int integer(List<Object> args, int index) {
            Number n = number(args, index);
            double d = n.doubleValue();
            if (d != Math.rint(d) || Math.abs(d) > 1000) {
                throw ExpressionException.failed(name() + ": argument " + (index + 1)
                        + " must be a whole number of digits, got " + Numbers.toPlainString(n));
            }
            return (int) d;
        }

        private double positive(Number n) {
            if (n.doubleValue() <= 0) {
                throw ExpressionException.failed(name() + ": argument must be positive, got "
                        + Numbers.toPlainString(n));
            }
            return n.doubleValue();
        }

        private double unitInterval(Number n) {
            double d = n.doubleValue();
            if (d < -1 || d > 1) {
                throw ExpressionException.failed(name() + ": argument must be between -1 and 1, got "
                        + Numbers.toPlainString(n));
            }
            return d;
        }

        private double real(double value) {
            return Arithmetic.finite(name(), value);
        }

        private Number sum(List<Object> args) {
            Number total = 0L;
            for (Object arg : args) {
                if (arg instanceof Number) {
                    total = Numbers.add(total, (Number) arg);
                }
            }
            return total;
        }

        private Object average(List<Object> args) {
            long count = args.stream().filter(a -> a instanceof Number).count();
            if (count == 0) {
                throw ExpressionException.failed(name() + ": no numeric arguments");
            }
            return real(sum(args).doubleValue() / count);
        }

        private Number extreme(List<Object> args, int direction) {
            Number best = null;
            for (Object arg : args) {
                if (arg instanceof Number) {
                    Number n = (Number) arg;
                    if (best == null || Numbers.toBigDecimal(n).compareTo(Numbers.toBigDecimal(best)) * direction > 0) {
                        best = n;
                    }
                }
            }
            return best == null ? 0L : best;
        }

        private Number abs(Number n) {
            if (Numbers.isIntegral(n) && n.longValue() != Long.MIN_VALUE) {
                return Math.abs(n.longValue());
            }
            if (n instanceof BigDecimal) {
                return ((BigDecimal) n).abs();
            }
            return Math.abs(n.doubleValue());
        }

        private Number round(Number n, int digits) {
            if (Numbers.isIntegral(n) && digits >= 0) {
                return n;
            }
            Arithmetic.finite(name(), n.doubleValue());
            BigDecimal rounded = Numbers.toBigDecimal(n).setScale(digits, RoundingMode.HALF_UP);
            if (digits <= 0) {
                return Numbers.narrow(rounded.doubleValue());
            }
            return rounded.doubleValue();
        }

        private Number sqrt(Number n) {
            if (n.doubleValue() < 0) {
                throw ExpressionException.failed(name() + ": argument must not be negative, got "
                        + Numbers.toPlainString(n));
            }
            return Math.sqrt(n.doubleValue());
        }

        private Number log(List<Object> args) {
            double x = positive(number(args, 0));
            if (args.size() == 1) {
                return real(Math.log10(x));
            }
            double base = positive(number(args, 1));
            if (base == 1) {
                throw ExpressionException.failed(name() + ": base must not be 1");
            }
            return real(Math.log(x) / Math.log(base));
        }
    }

    /**
     * Truthiness of an IF condition: booleans as-is, numbers when non-zero, blank text is false.
     */
    static boolean isTrue(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return Numbers.signum((Number) value) != 0;
        }
        if (value == null || value.toString().isBlank()) {
            return false;
        }
        Number parsed = Numbers.parseLiteral(value.toString());
        if (parsed == null) {
            throw ExpressionException.failed("IF: condition must be logical or numeric, got text \"" + value + "\"");
        }
        return Numbers.signum(parsed) != 0;
    }
}
