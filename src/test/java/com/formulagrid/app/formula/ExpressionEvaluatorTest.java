package com.formulagrid.app.formula;

import com.formulagrid.app.exceptions.ErrorKind;
import com.formulagrid.app.exceptions.ExpressionException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the restricted expression interpreter.
 */
class ExpressionEvaluatorTest {

    private static Object eval(String text) {
        return ExpressionEvaluator.evaluate(text);
    }

    private static ExpressionException failure(String text) {
        return assertThrows(ExpressionException.class, () -> ExpressionEvaluator.evaluate(text));
    }

    @Test
    void testArithmeticAndPrecedence() {
        assertEquals(7L, eval("1+2*3"));
        assertEquals(9L, eval("(1+2)*3"));
        assertEquals(3.5, eval("7/2"));
        assertEquals(3L, eval("7//2"));
        assertEquals(-4L, eval("-7//2"));
        assertEquals(1L, eval("7%3"));
        assertEquals(2L, eval("-7%3"));
        assertEquals(1024L, eval("2**10"));
        assertEquals(0.5, eval("2**-1"));
        assertEquals(512L, eval("2**3**2"));
        assertEquals(-4L, eval("-2**2"));
        assertEquals(9L, eval("(-3)**2"));
        assertEquals(3.0, eval("1.5*2"));
    }

    @Test
    void testLongOverflowFallsBackToDouble() {
        Object result = eval("9223372036854775807+1");
        assertTrue(result instanceof Double);
        assertEquals(9.223372036854775807E18, (Double) result, 1e4);

        Object quotient = eval("(-9223372036854775807-1)//(-1)");
        assertTrue(quotient instanceof Double);
        assertEquals(9.223372036854775808E18, (Double) quotient, 1e4);
    }

    @Test
    void testBareLiterals() {
        assertEquals(42L, eval("42"));
        assertEquals(-1.5, eval("-1.5"));
        assertEquals(1000.0, eval("1e3"));
        assertEquals("hello", eval("\"hello\""));
        assertEquals("say \"hi\"", eval("\"say \"\"hi\"\"\""));
        assertEquals(Boolean.TRUE, eval("TRUE"));
    }

    @Test
    void testComparisons() {
        assertEquals(Boolean.TRUE, eval("3>2"));
        assertEquals(Boolean.TRUE, eval("1=1"));
        assertEquals(Boolean.FALSE, eval("1<>1"));
        assertEquals(Boolean.FALSE, eval("2<=1"));
        assertEquals(Boolean.TRUE, eval("1+1>=2"));
        assertEquals(Boolean.TRUE, eval("\"abc\"=\"ABC\""));
        assertEquals(Boolean.FALSE, eval("\"abc\"=1"));
        assertEquals(Boolean.TRUE, eval("\"abc\"<>1"));
        assertEquals(ErrorKind.EVALUATION_ERROR, failure("\"abc\"<1").getKind());
    }

    @Test
    void testAllowedFunctions() {
        assertEquals(6L, eval("SUM(1,2,3)"));
        assertEquals(3L, eval("sum(1,2)"));
        assertEquals(2.5, eval("AVERAGE(1,2,3,4)"));
        assertEquals(3.0, eval("AVG(2,4)"));
        assertEquals(1L, eval("MIN(3,1,2)"));
        assertEquals(3L, eval("MAX(3,1.5)"));
        assertEquals(0L, eval("MAX(\"a\")"));
        assertEquals(2L, eval("COUNT(1,\"a\",2)"));
        assertEquals(2L, eval("COUNTA(1,\"a\",\"\")"));
        assertEquals(5L, eval("ABS(-5)"));
        assertEquals(3L, eval("ROUND(2.5)"));
        assertEquals(3.14, eval("ROUND(3.14159, 2)"));
        assertEquals(4.0, eval("SQRT(16)"));
        assertEquals(8L, eval("POWER(2,3)"));
        assertEquals(Math.sqrt(2), (Double) eval("POW(2,0.5)"), 1e-12);
        assertEquals(1.0, eval("EXP(0)"));
        assertEquals(0.0, eval("LN(1)"));
        assertEquals(2.0, eval("LOG(100)"));
        assertEquals(3.0, (Double) eval("LOG(8,2)"), 1e-12);
        assertEquals(3.0, eval("LOG10(1000)"));
        assertEquals(0.0, eval("SIN(0)"));
        assertEquals(1.0, eval("COS(0)"));
        assertEquals(Math.PI, eval("PI()"));
        assertEquals(Math.PI, eval("PI"));
        assertEquals(Math.E, eval("E"));
        assertEquals(Math.PI, (Double) eval("ATAN(1)*4"), 1e-12);
    }

    /**
     * IF only evaluates the branch it picks.
     */
    @Test
    void testConditionalIsLazy() {
        assertEquals(20L, eval("IF(1>2, 10, 20)"));
        assertEquals(10L, eval("IF(1<2, 10, 1/0)"));
        assertEquals("no", eval("IF(0, \"yes\", \"no\")"));
    }

    @Test
    void testBlankTextCountsAsZero() {
        assertEquals(1L, eval("\"\"+1"));
        assertEquals(ErrorKind.EVALUATION_ERROR, failure("\"abc\"+1").getKind());
    }

    @Test
    void testTextThatIsNotAnExpressionIsReturnedUnchanged() {
        assertEquals("hello world", eval("hello world"));
        assertEquals("1000:500", eval("1000:500"));
        assertEquals("", eval(""));
        assertEquals("(1+2", eval("(1+2"));
        // a structural failure wins over the unknown function seen before it
        assertEquals("FOO(1", eval("FOO(1"));
    }

    @Test
    void testConstructsOutsideTheGrammarAreRejected() {
        assertEquals(ErrorKind.UNSUPPORTED_EXPRESSION, failure("__import__('os').system('ls')").getKind());
        assertEquals(ErrorKind.UNSUPPORTED_EXPRESSION, failure("FOO(1)").getKind());
        assertEquals(ErrorKind.UNSUPPORTED_EXPRESSION, failure("x + 1").getKind());
        assertEquals(ErrorKind.UNSUPPORTED_EXPRESSION, failure("A1 + 1").getKind());
        assertEquals(ErrorKind.UNSUPPORTED_EXPRESSION, failure("ABS.__class__").getKind());
        assertEquals(ErrorKind.UNSUPPORTED_EXPRESSION, failure("SUM(1)[0]").getKind());
        assertEquals(ErrorKind.UNSUPPORTED_EXPRESSION, failure("'text'").getKind());
    }

    @Test
    void testRuntimeFailuresNameTheCulprit() {
        ExpressionException sqrt = failure("SQRT(-1)");
        assertEquals(ErrorKind.EVALUATION_ERROR, sqrt.getKind());
        assertTrue(sqrt.getMessage().contains("SQRT"));

        ExpressionException arity = failure("ROUND(1,2,3)");
        assertEquals(ErrorKind.EVALUATION_ERROR, arity.getKind());
        assertTrue(arity.getMessage().contains("ROUND"));

        assertTrue(failure("IF(1,2)").getMessage().contains("IF"));
        assertTrue(failure("SQRT(\"abc\")").getMessage().contains("SQRT"));
        assertTrue(failure("LN(0)").getMessage().contains("LN"));
        assertTrue(failure("LOG(8,1)").getMessage().contains("LOG"));
        assertTrue(failure("ASIN(2)").getMessage().contains("ASIN"));
        assertEquals(ErrorKind.EVALUATION_ERROR, failure("1/0").getKind());
        assertEquals(ErrorKind.EVALUATION_ERROR, failure("5//0").getKind());
        assertEquals(ErrorKind.EVALUATION_ERROR, failure("0**-1").getKind());
        assertEquals(ErrorKind.EVALUATION_ERROR, failure("AVERAGE(\"a\")").getKind());
    }
}
