package com.formulagrid.app.formula;

import com.formulagrid.app.exceptions.InvalidAddressException;
import com.formulagrid.app.models.CellAddress;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Static analysis of formula text. Finds the addresses, ranges and external
 * references a formula depends on without evaluating anything.
 * <p>
 * Extraction is pure: the same text always yields equal results, and it never throws.
 * Tokens that look like references but are out of bounds are simply left out.
 */
public final class DependencyExtractor {

    private static final Pattern EXTERNAL_PATTERN = Pattern.compile(
            "(?:'((?:[^']|'')+)'|(?<![A-Za-z0-9_$.])([A-Za-z_][A-Za-z0-9_]*))!"
                    + "(" + FormulaText.ADDRESS_TOKEN + ")"
                    + "(?::(" + FormulaText.ADDRESS_TOKEN + "))?"
                    + FormulaText.TOKEN_END);

    private static final Pattern RANGE_PATTERN = Pattern.compile(
            FormulaText.TOKEN_START
                    + "(" + FormulaText.ADDRESS_TOKEN + "):(" + FormulaText.ADDRESS_TOKEN + ")"
                    + FormulaText.TOKEN_END);

    private static final Pattern ADDRESS_PATTERN = Pattern.compile(
            FormulaText.TOKEN_START + "(" + FormulaText.ADDRESS_TOKEN + ")" + FormulaText.TOKEN_END);

    /** Larger ranges are not expanded; they are dropped like any other unusable token. */
    static final long MAX_RANGE_CELLS = 1L << 20;

    private static final String ALLOWED_SYMBOLS = "+-*/%()<>=,.:!$'\"_ \t\r\n";

    private DependencyExtractor() {
    }

    /**
     * Extracts every dependency of {@code expression} (formula text without the leading '=').
     */
    public static FormulaDependencies extract(String expression) {
        if (expression == null || expression.isBlank()) {
            return FormulaDependencies.NONE;
        }
        StringBuilder remaining = new StringBuilder(FormulaText.maskStrings(expression));

        List<ExternalReference> externals = new ArrayList<>();
        Set<String> seenExternals = new LinkedHashSet<>();
        Matcher external = EXTERNAL_PATTERN.matcher(remaining.toString());
        while (external.find()) {
            String qualifier = external.group(1) != null
                    ? external.group(1).replace("''", "'")
                    : external.group(2);
            CellAddress start = toAddress(external.group(3));
            CellAddress end = external.group(4) == null ? null : toAddress(external.group(4));
            boolean usable = start != null && (external.group(4) == null
                    || end != null && ExternalReference.cellCount(start, end) <= MAX_RANGE_CELLS);
            if (usable && seenExternals.add(external.group())) {
                externals.add(new ExternalReference(external.group(), qualifier, start, end));
            }
            blank(remaining, external.start(), external.end());
        }

        Set<CellAddress> direct = new TreeSet<>();
        Map<String, List<CellAddress>> ranges = new LinkedHashMap<>();
        Matcher range = RANGE_PATTERN.matcher(remaining.toString());
        while (range.find()) {
            CellAddress first = toAddress(range.group(1));
            CellAddress second = toAddress(range.group(2));
            if (first != null && second != null && !ranges.containsKey(range.group())
                    && ExternalReference.cellCount(first, second) <= MAX_RANGE_CELLS) {
                List<CellAddress> expanded = ExternalReference.expand(first, second);
                ranges.put(range.group(), expanded);
                direct.addAll(expanded);
            }
            blank(remaining, range.start(), range.end());
        }

        Map<CellAddress, Set<String>> tokens = new TreeMap<>();
        Matcher address = ADDRESS_PATTERN.matcher(remaining.toString());
        while (address.find()) {
            CellAddress parsed = toAddress(address.group(1));
            if (parsed != null) {
                direct.add(parsed);
                tokens.computeIfAbsent(parsed, k -> new LinkedHashSet<>()).add(address.group(1));
            }
        }

        return new FormulaDependencies(direct, tokens, ranges, externals);
    }

    /**
     * Cheap structural check run when a formula cell is built.
     * Returns a description of the first problem found, or null if the text looks well-formed.
     * Passing this check doesn't mean the expression is supported; that is decided on evaluation.
     */
    public static String checkSyntax(String expression) {
        if (expression == null || expression.isBlank()) {
            return "Empty formula";
        }
        int depth = 0;
        boolean inString = false;
        boolean inQuotedName = false;
        for (int i = 0; i < expression.length(); i++) {
            char c = expression.charAt(i);
            if (inString) {
                if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (inQuotedName) {
                if (c == '\'') {
                    inQuotedName = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '\'') {
                inQuotedName = true;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth < 0) {
                    return "Unbalanced ')' at position " + i;
                }
            } else if (!Character.isLetterOrDigit(c) && ALLOWED_SYMBOLS.indexOf(c) < 0) {
                return "Illegal character '" + c + "' at position " + i;
            }
        }
        if (inString) {
            return "Unterminated text literal";
        }
        if (inQuotedName) {
            return "Unterminated quoted name";
        }
        if (depth != 0) {
            return "Unbalanced parentheses: " + depth + " unclosed";
        }
        return null;
    }

    private static CellAddress toAddress(String token) {
        try {
            return CellAddress.parse(token.replace("$", ""));
        } catch (InvalidAddressException e) {
            // out-of-bounds token: not a dependency
            return null;
        }
    }

    private static void blank(StringBuilder text, int start, int end) {
        for (int i = start; i < end; i++) {
            text.setCharAt(i, ' ');
        }
    }
}
