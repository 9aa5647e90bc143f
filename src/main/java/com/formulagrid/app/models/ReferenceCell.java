package com.formulagrid.app.models;

import com.formulagrid.app.services.EvaluationContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A link to cells of other tables.
 * Its value is only a display string naming the first target ("LINK:t2!B2");
 * fetching the linked value is up to the caller.
 */
public final class ReferenceCell extends Cell {

    /** Shown when a link cell arrives without any reference. */
    public static final String BROKEN_LINK = "Reference Error";

    static final String LINK_PREFIX = "LINK:";

    private final List<CellReference> references;

    ReferenceCell(Table table, CellAddress address, String id, List<CellReference> references) {
        super(table, address, id);
        this.references = references == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(references));
    }

    @Override
    public CellKind getKind() {
        return CellKind.REFERENCE;
    }

    @Override
    public Object evaluate(EvaluationContext context) {
        return getValue();
    }

    @Override
    public Object getValue() {
        return references.isEmpty() ? BROKEN_LINK : LINK_PREFIX + references.get(0).getTarget();
    }

    public List<CellReference> getReferences() {
        return references;
    }

    /**
     * Fully-qualified target of the first reference, or null without one.
     */
    public String getTarget() {
        return references.isEmpty() ? null : references.get(0).getTarget();
    }

    public Set<String> getReferencedTableIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (CellReference reference : references) {
            ids.add(reference.getTableId());
        }
        return ids;
    }
}
