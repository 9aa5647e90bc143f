package com.formulagrid.app.formula;

import com.formulagrid.app.exceptions.ExpressionException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Recursive-descent parser for the formula grammar.
 * <pre>
 * comparison     := additive [ ("=" | "&lt;&gt;" | "&lt;" | "&lt;=" | "&gt;" | "&gt;=") additive ]
 * additive       := multiplicative { ("+" | "-") multiplicative }
 * multiplicative := unary { ("*" | "/" | "//" | "%") unary }
 * unary          := ("+" | "-") unary | power
 * power          := postfix [ "**" unary ]
 * postfix        := primary { "." NAME | "[" comparison "]" | "(" args ")" }
 * primary        := NUMBER | TEXT | NAME [ "(" args ")" ] | "(" comparison ")"
 * </pre>
 * Member access, subscripts, single-quoted strings and names outside the allow-list are
 * parsed so that the shape of the text can be checked, but they are never turned into nodes:
 * the first one is remembered and reported once the whole text has parsed.
 */
final class ExpressionParser {

    /** The text doesn't have the shape of an expression at all. */
    static final class ParseFailure extends RuntimeException {
        ParseFailure(String message) {
            super(message, null, false, false);
        }
    }

    private enum TokenType {
        NUMBER, TEXT, QUOTED, NAME, OPERATOR, LEFT_PAREN, RIGHT_PAREN, LEFT_BRACKET, RIGHT_BRACKET, COMMA, DOT, END
    }

    private static final class Token {
        final TokenType type;
        final String text;
        final int position;

        Token(TokenType type, String text, int position) {
            this.type = type;
            this.text = text;
            this.position = position;
        }
    }

    private static final Expression PLACEHOLDER = new Expression.Literal("");

    private final List<Token> tokens;
    private int index;
    private String unsupported;

    private ExpressionParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parses {@code text} into an expression tree.
     *
     * @throws ParseFailure if the text is not an expression
     * @throws ExpressionException (UNSUPPORTED_EXPRESSION) if it is one, but uses something outside the grammar
     */
    static Expression parse(String text) {
        ExpressionParser parser = new ExpressionParser(tokenize(text));
        Expression expression = parser.comparison();
        if (parser.peek().type != TokenType.END) {
            throw new ParseFailure("Unexpected '" + parser.peek().text + "' at position " + parser.peek().position);
        }
        if (parser.unsupported != null) {
            throw ExpressionException.unsupported(parser.unsupported);
        }
        return expression;
    }

    private Expression comparison() {
        Expression left = additive();
        Token token = peek();
        if (token.type == TokenType.OPERATOR) {
            Expression.ComparisonOperator operator = Expression.ComparisonOperator.fromSymbol(token.text);
            if (operator != null) {
                index++;
                Expression right = additive();
                return new Expression.Comparison(operator, left, right);
            }
        }
        return left;
    }

    private Expression additive() {
        Expression left = multiplicative();
        while (true) {
            if (acceptOperator("+")) {
                left = new Expression.Binary(Expression.ArithmeticOperator.ADD, left, multiplicative());
            } else if (acceptOperator("-")) {
                left = new Expression.Binary(Expression.ArithmeticOperator.SUBTRACT, left, multiplicative());
            } else {
                return left;
            }
        }
    }

    private Expression multiplicative() {
        Expression left = unary();
        while (true) {
            if (acceptOperator("*")) {
                left = new Expression.Binary(Expression.ArithmeticOperator.MULTIPLY, left, unary());
            } else if (acceptOperator("/")) {
                left = new Expression.Binary(Expression.ArithmeticOperator.DIVIDE, left, unary());
            } else if (acceptOperator("//")) {
                left = new Expression.Binary(Expression.ArithmeticOperator.FLOOR_DIVIDE, left, unary());
            } else if (acceptOperator("%")) {
                left = new Expression.Binary(Expression.ArithmeticOperator.MODULO, left, unary());
            } else {
                return left;
            }
        }
    }

    private Expression unary() {
        if (acceptOperator("-")) {
            return new Expression.Negate(unary());
        }
        if (acceptOperator("+")) {
            return new Expression.Plus(unary());
        }
        return power();
    }

    private Expression power() {
        Expression base = postfix();
        if (acceptOperator("**")) {
            return new Expression.Binary(Expression.ArithmeticOperator.POWER, base, unary());
        }
        return base;
    }

    private Expression postfix() {
        Expression expression = primary();
        while (true) {
            Token token = peek();
            if (token.type == TokenType.DOT) {
                index++;
                Token member = expect(TokenType.NAME);
                rejectLater("Member access '." + member.text + "' is not allowed");
                expression = PLACEHOLDER;
            } else if (token.type == TokenType.LEFT_BRACKET) {
                index++;
                comparison();
                expect(TokenType.RIGHT_BRACKET);
                rejectLater("Subscripts are not allowed");
                expression = PLACEHOLDER;
            } else if (token.type == TokenType.LEFT_PAREN) {
                arguments();
                rejectLater("Only named functions can be called");
                expression = PLACEHOLDER;
            } else {
                return expression;
            }
        }
    }

    private Expression primary() {
        Token token = next();
        switch (token.type) {
            case NUMBER:
                Number number = Numbers.parseLiteral(token.text);
                if (number == null) {
                    throw new ParseFailure("Malformed number '" + token.text + "'");
                }
                return new Expression.Literal(number);
            case TEXT:
                return new Expression.Literal(unquote(token.text));
            case QUOTED:
                rejectLater("Single-quoted text " + token.text + " is not allowed");
                return PLACEHOLDER;
            case NAME:
                return name(token);
            case LEFT_PAREN:
                Expression inner = comparison();
                expect(TokenType.RIGHT_PAREN);
                return inner;
            default:
                throw new ParseFailure("Unexpected '" + token.text + "' at position " + token.position);
        }
    }

    private Expression name(Token token) {
        String upper = token.text.toUpperCase(Locale.ROOT);
        if (peek().type == TokenType.LEFT_PAREN) {
            List<Expression> arguments = arguments();
            Functions.Function function = Functions.Function.lookup(token.text);
            if (function == null) {
                rejectLater("Function '" + token.text + "' is not allowed");
                return PLACEHOLDER;
            }
            if (function == Functions.Function.IF && arguments.size() == 3) {
                return new Expression.Conditional(arguments.get(0), arguments.get(1), arguments.get(2));
            }
            return new Expression.Call(function, arguments);
        }
        switch (upper) {
            case "TRUE":
                return new Expression.Literal(Boolean.TRUE);
            case "FALSE":
                return new Expression.Literal(Boolean.FALSE);
            case "PI":
                return new Expression.Literal(Math.PI);
            case "E":
                return new Expression.Literal(Math.E);
            default:
                rejectLater("Name '" + token.text + "' is not allowed");
                return PLACEHOLDER;
        }
    }

    private List<Expression> arguments() {
        expect(TokenType.LEFT_PAREN);
        List<Expression> arguments = new ArrayList<>();
        if (peek().type == TokenType.RIGHT_PAREN) {
            index++;
            return arguments;
        }
        arguments.add(comparison());
        while (peek().type == TokenType.COMMA) {
            index++;
            arguments.add(comparison());
        }
        expect(TokenType.RIGHT_PAREN);
        return arguments;
    }

    private void rejectLater(String message) {
        if (unsupported == null) {
            unsupported = message;
        }
    }

    private boolean acceptOperator(String symbol) {
        Token token = peek();
        if (token.type == TokenType.OPERATOR && token.text.equals(symbol)) {
            index++;
            return true;
        }
        return false;
    }

    private Token expect(TokenType type) {
        Token token = next();
        if (token.type != type) {
            throw new ParseFailure("Expected " + type + " but found '" + token.text + "' at position " + token.position);
        }
        return token;
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token next() {
        Token token = tokens.get(index);
        if (token.type != TokenType.END) {
            index++;
        }
        return token;
    }

    private static String unquote(String literal) {
        return literal.substring(1, literal.length() - 1).replace("\"\"", "\"");
    }

    private static List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int length = text.length();
        while (i < length) {
            char c = text.charAt(i);
            int start = i;
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            if (Character.isDigit(c) || (c == '.' && i + 1 < length && Character.isDigit(text.charAt(i + 1)))) {
                i = scanNumber(text, i);
                tokens.add(new Token(TokenType.NUMBER, text.substring(start, i), start));
            } else if (Character.isLetter(c) || c == '_') {
                while (i < length && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_')) {
                    i++;
                }
                tokens.add(new Token(TokenType.NAME, text.substring(start, i), start));
            } else if (c == '"' || c == '\'') {
                i = scanQuoted(text, i, c);
                tokens.add(new Token(c == '"' ? TokenType.TEXT : TokenType.QUOTED, text.substring(start, i), start));
            } else if (c == '(') {
                tokens.add(new Token(TokenType.LEFT_PAREN, "(", i++));
            } else if (c == ')') {
                tokens.add(new Token(TokenType.RIGHT_PAREN, ")", i++));
            } else if (c == '[') {
                tokens.add(new Token(TokenType.LEFT_BRACKET, "[", i++));
            } else if (c == ']') {
                tokens.add(new Token(TokenType.RIGHT_BRACKET, "]", i++));
            } else if (c == ',') {
                tokens.add(new Token(TokenType.COMMA, ",", i++));
            } else if (c == '.') {
                tokens.add(new Token(TokenType.DOT, ".", i++));
            } else {
                String operator = scanOperator(text, i);
                if (operator == null) {
                    throw new ParseFailure("Unexpected character '" + c + "' at position " + i);
                }
                tokens.add(new Token(TokenType.OPERATOR, operator, i));
                i += operator.length();
            }
        }
        tokens.add(new Token(TokenType.END, "<end>", length));
        return tokens;
    }

    private static int scanNumber(String text, int start) {
        int i = start;
        int length = text.length();
        while (i < length && Character.isDigit(text.charAt(i))) {
            i++;
        }
        if (i < length && text.charAt(i) == '.') {
            i++;
            while (i < length && Character.isDigit(text.charAt(i))) {
                i++;
            }
        }
        if (i < length && (text.charAt(i) == 'e' || text.charAt(i) == 'E')) {
            int exponent = i + 1;
            if (exponent < length && (text.charAt(exponent) == '+' || text.charAt(exponent) == '-')) {
                exponent++;
            }
            if (exponent < length && Character.isDigit(text.charAt(exponent))) {
                i = exponent;
                while (i < length && Character.isDigit(text.charAt(i))) {
                    i++;
                }
            }
        }
        if (i < length && (Character.isLetter(text.charAt(i)) || text.charAt(i) == '_')) {
            throw new ParseFailure("Malformed number at position " + start);
        }
        return i;
    }

    private static int scanQuoted(String text, int start, char quote) {
        int i = start + 1;
        while (i < text.length()) {
            if (text.charAt(i) == quote) {
                if (i + 1 < text.length() && text.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        throw new ParseFailure("Unterminated text literal at position " + start);
    }

    private static String scanOperator(String text, int i) {
        String[] operators = {"**", "//", "<>", "<=", ">=", "+", "-", "*", "/", "%", "=", "<", ">"};
        for (String operator : operators) {
            if (text.startsWith(operator, i)) {
                return operator;
            }
        }
        return null;
    }
}
