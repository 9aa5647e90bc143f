package com.formulagrid.app.formula;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.regex.Pattern;

/**
 * Small numeric tower used by the interpreter and by range sums:
 * integral values stay {@code Long} while they fit, anything else becomes {@code Double},
 * and {@code BigDecimal} is kept exact when it shows up (percentage and currency cells).
 */
public final class Numbers {

    private static final Pattern NUMERIC_LITERAL =
            Pattern.compile("[+-]?(?:[0-9]+(?:\\.[0-9]*)?|\\.[0-9]+)(?:[eE][+-]?[0-9]+)?");

    private static final Pattern INTEGER_LITERAL = Pattern.compile("[+-]?[0-9]+");

    private Numbers() {
    }

    /**
     * Parses a bare numeric literal ("42", "-1.5", "2e3"). Returns null for anything else.
     */
    public static Number parseLiteral(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        if (!NUMERIC_LITERAL.matcher(trimmed).matches()) {
            return null;
        }
        if (INTEGER_LITERAL.matcher(trimmed).matches()) {
            try {
                return Long.parseLong(trimmed);
            } catch (NumberFormatException e) {
                return Double.parseDouble(trimmed);
            }
        }
        return Double.parseDouble(trimmed);
    }

    public static boolean isIntegral(Number n) {
        return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte
                || (n instanceof BigInteger && ((BigInteger) n).bitLength() < 64);
    }

    public static boolean isExact(Number n) {
        return n instanceof BigDecimal;
    }

    /**
     * Adds two numbers keeping the most precise common representation.
     */
    public static Number add(Number a, Number b) {
        if (isExact(a) || isExact(b)) {
            return toBigDecimal(a).add(toBigDecimal(b));
        }
        if (isIntegral(a) && isIntegral(b)) {
            try {
                return Math.addExact(a.longValue(), b.longValue());
            } catch (ArithmeticException overflow) {
                return a.doubleValue() + b.doubleValue();
            }
        }
        return a.doubleValue() + b.doubleValue();
    }

    public static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal) {
            return (BigDecimal) n;
        }
        if (n instanceof BigInteger) {
            return new BigDecimal((BigInteger) n);
        }
        if (isIntegral(n)) {
            return BigDecimal.valueOf(n.longValue());
        }
        // shortest decimal that round-trips the double, so 0.5 -> 0.5 and 0.1 -> 0.1
        return BigDecimal.valueOf(n.doubleValue());
    }

    /**
     * Plain decimal text, never scientific notation: 1500, 0.25, 1.0E20 -> 100000000000000000000.
     */
    public static String toPlainString(Number n) {
        if (isIntegral(n)) {
            return Long.toString(n.longValue());
        }
        if (n instanceof BigDecimal) {
            return ((BigDecimal) n).toPlainString();
        }
        double d = n.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return Double.toString(d);
        }
        String plain = BigDecimal.valueOf(d).toPlainString();
        return plain.contains(".") ? plain : plain + ".0";
    }

    public static int signum(Number n) {
        if (n instanceof BigDecimal) {
            return ((BigDecimal) n).signum();
        }
        if (isIntegral(n)) {
            return Long.signum(n.longValue());
        }
        return (int) Math.signum(n.doubleValue());
    }

    /**
     * Returns an integral double as a Long when it fits, otherwise the double itself.
     */
    static Number narrow(double d) {
        if (d == Math.rint(d) && Math.abs(d) < 0x1p53) {
            return (long) d;
        }
        return d;
    }
}
