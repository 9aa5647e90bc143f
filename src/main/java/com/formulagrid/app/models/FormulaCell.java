package com.formulagrid.app.models;

import com.formulagrid.app.exceptions.CellEvaluationException;
import com.formulagrid.app.exceptions.CircularReferenceException;
import com.formulagrid.app.exceptions.ErrorKind;
import com.formulagrid.app.exceptions.ExpressionException;
import com.formulagrid.app.formula.DependencyExtractor;
import com.formulagrid.app.formula.ExpressionEvaluator;
import com.formulagrid.app.formula.ExternalReference;
import com.formulagrid.app.formula.FormulaDependencies;
import com.formulagrid.app.formula.FormulaText;
import com.formulagrid.app.formula.Numbers;
import com.formulagrid.app.services.EvaluationContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * A cell holding a formula such as "=SUM(B2:B3)*2".
 * <p>
 * Dependencies and a syntax check are worked out once, at construction. Evaluation
 * replaces every reference in the text with the referenced cell's value and hands the
 * result to the {@link ExpressionEvaluator}:
 * <ol>
 *     <li>a COMPLETED cell returns its cached value, an ERROR cell re-throws its cached failure
 *         (unless the context forces a recompute);</li>
 *     <li>re-entering a cell already on the context's call stack is a circular dependency;</li>
 *     <li>references into other tables are resolved through the owning table;</li>
 *     <li>each range written as SUM(range) is replaced by the sum of its numeric cells;</li>
 *     <li>each remaining address, in all of its $-variants, is replaced by that cell's value;</li>
 *     <li>currency and percentage results are kept as exact decimals.</li>
 * </ol>
 * Missing cells are dangling references: they count as 0 in a sum and as blank text elsewhere,
 * unless the context asks for strict references.
 */
public final class FormulaCell extends Cell {
    private final String formula;
    private final String expression;
    private final FormatType formatType;
    private final FormulaDependencies dependencies;
    private final String syntaxError;

    private EvaluationState state = EvaluationState.PENDING;
    private Object value;
    private CellEvaluationException failure;

    FormulaCell(Table table, CellAddress address, String id, String formula, FormatType formatType) {
        super(table, address, id);
        String text = formula == null ? "" : formula.trim();
        this.expression = text.startsWith("=") ? text.substring(1).trim() : text;
        this.formula = "=" + expression;
        this.formatType = formatType;
        this.dependencies = DependencyExtractor.extract(expression);
        this.syntaxError = DependencyExtractor.checkSyntax(expression);
    }

    @Override
    public CellKind getKind() {
        return CellKind.FORMULA;
    }

    @Override
    public Object evaluate(EvaluationContext context) {
        CellKey key = getKey();
        if (!context.isStale(key)) {
            if (state == EvaluationState.COMPLETED) {
                return value;
            }
            if (state == EvaluationState.ERROR) {
                throw failure;
            }
        }
        if (context.isOnStack(key)) {
            throw new CircularReferenceException(key.toString(),
                    "Circular dependency at " + key + ": " + context.describeStack() + " -> " + key);
        }
        if (syntaxError != null) {
            context.recordComputed(key);
            return fail(new CellEvaluationException(key.toString(), ErrorKind.SYNTAX_ERROR,
                    "Syntax error in " + key + ": " + syntaxError));
        }

        context.push(key);
        try {
            state = EvaluationState.CALCULATING;
            context.recordComputed(key);
            Object result = compute(context);
            value = result;
            failure = null;
            state = EvaluationState.COMPLETED;
            return result;
        } catch (CellEvaluationException e) {
            return fail(e);
        } catch (ExpressionException e) {
            return fail(new CellEvaluationException(key.toString(), e.getKind(), key + ": " + e.getMessage(), e));
        } catch (RuntimeException e) {
            return fail(new CellEvaluationException(key.toString(), ErrorKind.EVALUATION_ERROR,
                    key + ": " + e.getMessage(), e));
        } finally {
            context.pop(key);
        }
    }

    /**
     * Back to PENDING with no cached value or failure. Cells depending on this one are untouched.
     */
    public void reset() {
        state = EvaluationState.PENDING;
        value = null;
        failure = null;
    }

    // A depth failure belongs to the context that hit it, so it is not cached
    private Object fail(CellEvaluationException e) {
        value = null;
        if (e.getKind() == ErrorKind.DEPTH_LIMIT_EXCEEDED) {
            state = EvaluationState.PENDING;
            failure = null;
        } else {
            state = EvaluationState.ERROR;
            failure = e;
        }
        throw e;
    }

    private Object compute(EvaluationContext context) {
        String text = expression;

        for (ExternalReference reference : dependencies.getExternalReferenceDetails()) {
            Table target = getTable().resolveTable(reference.getQualifier());
            if (reference.isRange()) {
                Pattern sum = FormulaText.sumOf(reference.getRaw());
                if (FormulaText.containsOutsideStrings(text, sum)) {
                    String total = FormulaText.toLiteral(sumRange(target, reference.getAddresses(), context));
                    text = FormulaText.replaceOutsideStrings(text, sum, m -> total);
                }
                continue;
            }
            Pattern token = FormulaText.exactToken(reference.getRaw());
            if (FormulaText.containsOutsideStrings(text, token)) {
                String literal = FormulaText.toLiteral(resolve(target, reference.getStart(), context));
                text = FormulaText.replaceOutsideStrings(text, token, m -> literal);
            }
        }

        for (Map.Entry<String, List<CellAddress>> range : dependencies.getRangeReferences().entrySet()) {
            Pattern sum = FormulaText.sumOf(range.getKey());
            if (FormulaText.containsOutsideStrings(text, sum)) {
                String total = FormulaText.toLiteral(sumRange(getTable(), range.getValue(), context));
                text = FormulaText.replaceOutsideStrings(text, sum, m -> total);
            }
        }

        for (CellAddress address : dependencies.getDirectReferences()) {
            // the spellings seen in the text ("A01", "$A$1"), then every canonical $-variant
            List<Pattern> spellings = new ArrayList<>();
            for (String token : dependencies.getReferenceTokens().getOrDefault(address, Collections.emptySet())) {
                spellings.add(FormulaText.exactToken(token));
            }
            spellings.add(FormulaText.addressVariants(
                    CellAddress.columnToLetters(address.getColumn()), address.getRow()));

            String literal = null;
            for (Pattern spelling : spellings) {
                if (FormulaText.containsOutsideStrings(text, spelling)) {
                    if (literal == null) {
                        literal = FormulaText.toLiteral(resolve(getTable(), address, context));
                    }
                    String replacement = literal;
                    text = FormulaText.replaceOutsideStrings(text, spelling, m -> replacement);
                }
            }
        }

        Object result = ExpressionEvaluator.evaluate(text);
        if (formatType != null && formatType.isExactDecimal() && result instanceof Number) {
            return Numbers.toBigDecimal((Number) result);
        }
        return result;
    }

    private Number sumRange(Table target, List<CellAddress> addresses, EvaluationContext context) {
        Number total = 0L;
        for (CellAddress address : addresses) {
            Object cellValue = resolve(target, address, context);
            if (cellValue instanceof Number) {
                total = Numbers.add(total, (Number) cellValue);
            }
        }
        return total;
    }

    // Value of one referenced cell; null when the table or the cell doesn't exist
    private Object resolve(Table target, CellAddress address, EvaluationContext context) {
        Cell cell = target == null ? null : target.getCell(address);
        if (cell == null) {
            if (context.isStrictReferences()) {
                throw new CellEvaluationException(getKey().toString(), ErrorKind.DANGLING_REFERENCE,
                        getKey() + ": reference to missing cell "
                                + (target == null ? address + " in an unknown table" : target.getId() + "!" + address));
            }
            return null;
        }
        return cell.evaluate(context);
    }

    /** Canonical text: "=" followed by the expression. */
    public String getFormula() {
        return formula;
    }

    /** The formula without its leading "=". */
    public String getExpression() {
        return expression;
    }

    public FormatType getFormatType() {
        return formatType;
    }

    public FormulaDependencies getDependencies() {
        return dependencies;
    }

    /** Problem found by the construction-time syntax check, or null. */
    public String getSyntaxError() {
        return syntaxError;
    }

    public EvaluationState getState() {
        return state;
    }

    @Override
    public Object getValue() {
        return value;
    }

    /** The cached failure of a cell in ERROR state, otherwise null. */
    public CellEvaluationException getFailure() {
        return failure;
    }
}
