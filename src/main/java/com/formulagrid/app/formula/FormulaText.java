package com.formulagrid.app.formula;

import java.util.function.Function;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text helpers shared by the extractor and the formula cell.
 * Double-quoted literals ("..." with "" as an escaped quote) are opaque to both:
 * nothing inside them is a reference and nothing inside them gets substituted.
 */
public final class FormulaText {

    /** One cell reference token: optional $ markers, 1-3 letters, 1-7 digits. */
    static final String ADDRESS_TOKEN = "\\$?[A-Z]{1,3}\\$?[0-9]{1,7}";

    /** Not preceded by anything that would make the token part of a longer word or number. */
    static final String TOKEN_START = "(?<![A-Za-z0-9_$.!'])";

    /** Not followed by word characters, and not a function call such as LOG10(. */
    static final String TOKEN_END = "(?![A-Za-z0-9_])(?!\\s*\\()";

    private FormulaText() {
    }

    /**
     * Replaces every double-quoted literal with blanks of the same length,
     * so offsets stay aligned with the original text.
     */
    public static String maskStrings(String text) {
        StringBuilder masked = new StringBuilder(text.length());
        boolean inString = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"') {
                inString = !inString;
                masked.append(' ');
            } else {
                masked.append(inString ? ' ' : c);
            }
        }
        return masked.toString();
    }

    /**
     * Applies {@code pattern} only to the parts of {@code text} outside double-quoted literals.
     */
    public static String replaceOutsideStrings(String text, Pattern pattern,
                                               Function<MatchResult, String> replacement) {
        StringBuilder result = new StringBuilder(text.length());
        int segmentStart = 0;
        int i = 0;
        while (i < text.length()) {
            if (text.charAt(i) == '"') {
                result.append(replaceAll(text.substring(segmentStart, i), pattern, replacement));
                int end = endOfLiteral(text, i);
                result.append(text, i, end);
                i = end;
                segmentStart = end;
            } else {
                i++;
            }
        }
        result.append(replaceAll(text.substring(segmentStart), pattern, replacement));
        return result.toString();
    }

    /**
     * True if {@code pattern} occurs somewhere outside double-quoted literals.
     */
    public static boolean containsOutsideStrings(String text, Pattern pattern) {
        return pattern.matcher(maskStrings(text)).find();
    }

    /**
     * Renders a cell value as a literal the expression grammar reads back as the same value:
     * numbers in plain decimal form (negatives in parentheses), booleans as TRUE/FALSE,
     * numeric text as its number, other text quoted, null as blank text.
     */
    public static String toLiteral(Object value) {
        if (value == null) {
            return "\"\"";
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? "TRUE" : "FALSE";
        }
        Number number = value instanceof Number ? (Number) value : Numbers.parseLiteral(value.toString());
        if (number != null) {
            String plain = Numbers.toPlainString(number);
            return Numbers.signum(number) < 0 ? "(" + plain + ")" : plain;
        }
        return quote(value.toString());
    }

    /**
     * Pattern matching SUM applied to exactly this range text, e.g. "SUM( B2:B9 )".
     */
    public static Pattern sumOf(String rangeText) {
        return Pattern.compile("(?<![A-Za-z0-9_.])(?i:SUM)\\s*\\(\\s*" + Pattern.quote(rangeText) + "\\s*\\)");
    }

    /**
     * Quotes {@code value} as a text literal of the expression grammar.
     */
    public static String quote(String value) {
        return '"' + value.replace("\"", "\"\"") + '"';
    }

    /**
     * Pattern matching every $-variant of one address: A1, $A1, A$1, $A$1.
     */
    public static Pattern addressVariants(String letters, int row) {
        return Pattern.compile(TOKEN_START + "\\$?" + letters + "\\$?" + row + TOKEN_END);
    }

    /**
     * Pattern matching one raw token exactly, with reference boundaries on both sides.
     */
    public static Pattern exactToken(String raw) {
        return Pattern.compile("(?<![A-Za-z0-9_$.])" + Pattern.quote(raw) + TOKEN_END);
    }

    private static String replaceAll(String segment, Pattern pattern,
                                     Function<MatchResult, String> replacement) {
        Matcher matcher = pattern.matcher(segment);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement.apply(matcher.toMatchResult())));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    // Index just past the literal that opens at 'start'; unterminated literals run to the end
    private static int endOfLiteral(String text, int start) {
        int i = start + 1;
        while (i < text.length()) {
            if (text.charAt(i) == '"') {
                if (i + 1 < text.length() && text.charAt(i + 1) == '"') {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return text.length();
    }
}
