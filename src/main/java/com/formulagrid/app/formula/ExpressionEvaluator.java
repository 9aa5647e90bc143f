package com.formulagrid.app.formula;

import com.formulagrid.app.exceptions.ExpressionException;

/**
 * Evaluates formula text once every reference in it has been replaced by a literal.
 * <p>
 * Only arithmetic, comparisons, text/number/boolean literals and the allow-listed
 * functions are understood. The text is parsed by a dedicated parser into a closed
 * expression tree; there is no path to general-purpose evaluation.
 * <ul>
 *     <li>a bare numeric literal evaluates to its number;</li>
 *     <li>text that is not an expression at all is returned unchanged, as a String;</li>
 *     <li>an expression using anything outside the grammar fails with UNSUPPORTED_EXPRESSION;</li>
 *     <li>a function or operator failing at runtime fails with EVALUATION_ERROR.</li>
 * </ul>
 */
public final class ExpressionEvaluator {

    private ExpressionEvaluator() {
    }

    /**
     * @return a Long, Double, Boolean or String
     * @throws ExpressionException if the expression is unsupported or fails
     */
    public static Object evaluate(String text) {
        if (text == null) {
            return "";
        }
        Number literal = Numbers.parseLiteral(text);
        if (literal != null) {
            return literal;
        }
        Expression expression;
        try {
            expression = ExpressionParser.parse(text);
        } catch (ExpressionParser.ParseFailure notAnExpression) {
            return text;
        }
        return expression.evaluate();
    }
}
