package com.formulagrid.app.models;

import com.formulagrid.app.exceptions.InvalidAddressException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A 1-based (row, column) cell coordinate with Excel bounds.
 * Canonical text form is the column letters followed by the row number, e.g. "B12".
 * Ordered row-major: by row, then by column.
 */
public final class CellAddress implements Comparable<CellAddress> {

    public static final int MAX_ROW = 1_048_576;
    public static final int MAX_COLUMN = 16_384;

    private static final Pattern ADDRESS_PATTERN = Pattern.compile("^([A-Z]+)([0-9]+)$");

    private final int row;
    private final int column;

    private CellAddress(int row, int column) {
        this.row = row;
        this.column = column;
    }

    /**
     * Creates an address, validating both coordinates against the sheet bounds.
     */
    public static CellAddress of(int row, int column) {
        if (row < 1 || row > MAX_ROW) {
            throw new InvalidAddressException("Row out of bounds: " + row);
        }
        if (column < 1 || column > MAX_COLUMN) {
            throw new InvalidAddressException("Column out of bounds: " + column);
        }
        return new CellAddress(row, column);
    }

    /**
     * Parses canonical address text such as "A1" or "XFD1048576".
     * An optional leading qualifier ("Sheet1!A1", "'My sheet'!A1") is ignored.
     */
    public static CellAddress parse(String text) {
        if (text == null) {
            throw new InvalidAddressException("Address is null");
        }
        String local = text.trim();
        int bang = local.lastIndexOf('!');
        if (bang >= 0) {
            local = local.substring(bang + 1);
        }
        Matcher matcher = ADDRESS_PATTERN.matcher(local);
        if (!matcher.matches()) {
            throw new InvalidAddressException("Malformed address: " + text);
        }
        String letters = matcher.group(1);
        String digits = matcher.group(2);
        // Anything longer can't be in bounds and would overflow the conversions below
        if (letters.length() > 3 || digits.length() > 7) {
            throw new InvalidAddressException("Address out of bounds: " + text);
        }
        return of(Integer.parseInt(digits), lettersToColumn(letters));
    }

    /**
     * Converts a 1-based column index to letters: 1 -> "A", 27 -> "AA".
     */
    public static String columnToLetters(int column) {
        if (column < 1) {
            throw new InvalidAddressException("Column out of bounds: " + column);
        }
        StringBuilder letters = new StringBuilder();
        int n = column;
        while (n > 0) {
            int remainder = (n - 1) % 26;
            letters.insert(0, (char) ('A' + remainder));
            n = (n - 1) / 26;
        }
        return letters.toString();
    }

    /**
     * Converts column letters to a 1-based index: "A" -> 1, "AA" -> 27.
     */
    public static int lettersToColumn(String letters) {
        int column = 0;
        for (int i = 0; i < letters.length(); i++) {
            char c = letters.charAt(i);
            if (c < 'A' || c > 'Z') {
                throw new InvalidAddressException("Malformed column letters: " + letters);
            }
            column = column * 26 + (c - 'A' + 1);
        }
        return column;
    }

    /**
     * Returns the address shifted by the given deltas. Bounds are re-checked.
     */
    public CellAddress offset(int rowDelta, int columnDelta) {
        return of(row + rowDelta, column + columnDelta);
    }

    public int getRow() {
        return row;
    }

    public int getColumn() {
        return column;
    }

    public String format() {
        return columnToLetters(column) + row;
    }

    @Override
    public int compareTo(CellAddress other) {
        if (row != other.row) {
            return Integer.compare(row, other.row);
        }
        return Integer.compare(column, other.column);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellAddress)) {
            return false;
        }
        CellAddress that = (CellAddress) o;
        return row == that.row && column == that.column;
    }

    @Override
    public int hashCode() {
        return 31 * row + column;
    }

    @Override
    public String toString() {
        return format();
    }
}
