package com.formulagrid.app.models;

import com.formulagrid.app.exceptions.InvalidAddressException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for address parsing, formatting and bounds.
 */
class CellAddressTest {

    @Test
    void testFormatKnownAddresses() {
        assertEquals("A1", CellAddress.of(1, 1).format());
        assertEquals("Z1", CellAddress.of(1, 26).format());
        assertEquals("AA1", CellAddress.of(1, 27).format());
        assertEquals("ZZ7", CellAddress.of(7, 702).format());
        assertEquals("AAA1", CellAddress.of(1, 703).format());
        assertEquals("XFD1048576", CellAddress.of(1_048_576, 16_384).format());
    }

    /**
     * parse(format(addr)) == addr, around every letter-count boundary and at the bounds.
     */
    @Test
    void testParseFormatRoundTrip() {
        int[] rows = {1, 2, 9, 10, 99, 100, 65_536, 1_048_575, 1_048_576};
        int[] columns = {1, 2, 25, 26, 27, 52, 53, 701, 702, 703, 16_383, 16_384};
        for (int row : rows) {
            for (int column : columns) {
                CellAddress address = CellAddress.of(row, column);
                assertEquals(address, CellAddress.parse(address.format()));
                assertEquals(address.format(), CellAddress.parse(address.format()).toString());
            }
        }
    }

    @Test
    void testBoundsAreEnforced() {
        assertThrows(InvalidAddressException.class, () -> CellAddress.parse("A0"));
        assertThrows(InvalidAddressException.class, () -> CellAddress.parse("A1048577"));
        assertThrows(InvalidAddressException.class, () -> CellAddress.parse("XFE1"));
        assertThrows(InvalidAddressException.class, () -> CellAddress.of(0, 1));
        assertThrows(InvalidAddressException.class, () -> CellAddress.of(1_048_577, 1));
        assertThrows(InvalidAddressException.class, () -> CellAddress.of(1, 0));
        assertThrows(InvalidAddressException.class, () -> CellAddress.of(1, 16_385));
    }

    @Test
    void testMalformedTextIsRejected() {
        assertThrows(InvalidAddressException.class, () -> CellAddress.parse("1A"));
        assertThrows(InvalidAddressException.class, () -> CellAddress.parse("a1"));
        assertThrows(InvalidAddressException.class, () -> CellAddress.parse("A"));
        assertThrows(InvalidAddressException.class, () -> CellAddress.parse(""));
        assertThrows(InvalidAddressException.class, () -> CellAddress.parse("$A$1"));
        assertThrows(InvalidAddressException.class, () -> CellAddress.parse("ABCDEFG123456789012"));
        assertThrows(InvalidAddressException.class, () -> CellAddress.parse(null));
    }

    @Test
    void testSheetQualifierIsIgnored() {
        assertEquals(CellAddress.of(3, 2), CellAddress.parse("Sheet1!B3"));
        assertEquals(CellAddress.of(2, 3), CellAddress.parse("'My sheet'!C2"));
    }

    @Test
    void testOffsetRevalidatesBounds() {
        assertEquals(CellAddress.parse("A1"), CellAddress.parse("B2").offset(-1, -1));
        assertEquals(CellAddress.parse("D7"), CellAddress.parse("B2").offset(5, 2));
        assertThrows(InvalidAddressException.class, () -> CellAddress.parse("A1").offset(-1, 0));
        assertThrows(InvalidAddressException.class, () -> CellAddress.parse("XFD1").offset(0, 1));
    }

    @Test
    void testRowMajorOrder() {
        assertTrue(CellAddress.parse("B1").compareTo(CellAddress.parse("A2")) < 0);
        assertTrue(CellAddress.parse("A2").compareTo(CellAddress.parse("B2")) < 0);
        assertEquals(0, CellAddress.parse("C3").compareTo(CellAddress.of(3, 3)));
    }

    @Test
    void testColumnLetterConversion() {
        assertEquals(1, CellAddress.lettersToColumn("A"));
        assertEquals(28, CellAddress.lettersToColumn("AB"));
        assertEquals(16_384, CellAddress.lettersToColumn("XFD"));
        assertEquals("AB", CellAddress.columnToLetters(28));
    }
}
