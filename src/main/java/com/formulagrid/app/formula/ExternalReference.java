package com.formulagrid.app.formula;

import com.formulagrid.app.models.CellAddress;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A reference into another table found in formula text: "t2!B3", "'Sales 2024'!$B$3"
 * or the range form "t2!B3:B9". The qualifier is only a name here; turning it into a
 * table is up to whoever owns the table lookup.
 */
public final class ExternalReference {
    private final String raw;
    private final String qualifier;
    private final CellAddress start;
    private final CellAddress end;

    ExternalReference(String raw, String qualifier, CellAddress start, CellAddress end) {
        this.raw = raw;
        this.qualifier = qualifier;
        this.start = start;
        this.end = end;
    }

    /** The token exactly as written in the formula. */
    public String getRaw() {
        return raw;
    }

    /** Table id or sheet name, quotes removed. */
    public String getQualifier() {
        return qualifier;
    }

    public CellAddress getStart() {
        return start;
    }

    /** Null unless this is a range reference. */
    public CellAddress getEnd() {
        return end;
    }

    public boolean isRange() {
        return end != null;
    }

    /**
     * Addresses covered, row-major; a single address for non-range references.
     */
    public List<CellAddress> getAddresses() {
        if (end == null) {
            return Collections.singletonList(start);
        }
        return expand(start, end);
    }

    /**
     * Number of cells in the rectangle spanned by two corners.
     */
    static long cellCount(CellAddress first, CellAddress second) {
        long rows = Math.abs(first.getRow() - second.getRow()) + 1L;
        long columns = Math.abs(first.getColumn() - second.getColumn()) + 1L;
        return rows * columns;
    }

    /**
     * Expands the rectangle spanned by two corners, in whatever order they were written,
     * row by row from the smallest row and column to the largest, inclusive.
     */
    static List<CellAddress> expand(CellAddress first, CellAddress second) {
        int fromRow = Math.min(first.getRow(), second.getRow());
        int toRow = Math.max(first.getRow(), second.getRow());
        int fromColumn = Math.min(first.getColumn(), second.getColumn());
        int toColumn = Math.max(first.getColumn(), second.getColumn());
        List<CellAddress> addresses = new ArrayList<>((toRow - fromRow + 1) * (toColumn - fromColumn + 1));
        for (int row = fromRow; row <= toRow; row++) {
            for (int column = fromColumn; column <= toColumn; column++) {
                addresses.add(CellAddress.of(row, column));
            }
        }
        return addresses;
    }

    @Override
    public String toString() {
        return raw;
    }
}
