package com.formulagrid.app.formula;

import com.formulagrid.app.models.CellAddress;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for static dependency analysis of formula text.
 */
class DependencyExtractorTest {

    private static Set<CellAddress> addresses(String... texts) {
        Set<CellAddress> result = new TreeSet<>();
        for (String text : texts) {
            result.add(CellAddress.parse(text));
        }
        return result;
    }

    @Test
    void testDirectReferences() {
        FormulaDependencies deps = DependencyExtractor.extract("B2+C3*2");
        assertEquals(addresses("B2", "C3"), deps.getDirectReferences());
        assertTrue(deps.getRangeReferences().isEmpty());
        assertTrue(deps.getExternalReferences().isEmpty());
    }

    /**
     * Every $-variant maps to the same address; the original tokens are kept for substitution.
     */
    @Test
    void testAbsoluteMarkersAreStripped() {
        FormulaDependencies deps = DependencyExtractor.extract("$A$1 + A$1 + $A1 + A1");
        assertEquals(addresses("A1"), deps.getDirectReferences());
        assertEquals(Set.of("$A$1", "A$1", "$A1", "A1"),
                deps.getReferenceTokens().get(CellAddress.parse("A1")));
    }

    @Test
    void testRangesAreNormalizedAndExpandedRowMajor() {
        FormulaDependencies deps = DependencyExtractor.extract("SUM(B3:A1)");
        List<CellAddress> expected = Arrays.asList(
                CellAddress.parse("A1"), CellAddress.parse("B1"),
                CellAddress.parse("A2"), CellAddress.parse("B2"),
                CellAddress.parse("A3"), CellAddress.parse("B3"));
        assertEquals(expected, deps.getRangeReferences().get("B3:A1"));
        assertEquals(new TreeSet<>(expected), deps.getDirectReferences());
    }

    @Test
    void testExternalReferences() {
        FormulaDependencies deps = DependencyExtractor.extract("t2!A1 + 'Sales 2024'!$B$2 + SUM(t3!A1:A3) + t2!A1");
        assertEquals(Arrays.asList("t2!A1", "'Sales 2024'!$B$2", "t3!A1:A3"), deps.getExternalReferences());
        assertTrue(deps.getDirectReferences().isEmpty());

        ExternalReference quoted = deps.getExternalReferenceDetails().get(1);
        assertEquals("Sales 2024", quoted.getQualifier());
        assertEquals(CellAddress.parse("B2"), quoted.getStart());
        assertFalse(quoted.isRange());

        ExternalReference range = deps.getExternalReferenceDetails().get(2);
        assertEquals("t3", range.getQualifier());
        assertTrue(range.isRange());
        assertEquals(3, range.getAddresses().size());
    }

    @Test
    void testFunctionNamesAreNotAddresses() {
        FormulaDependencies deps = DependencyExtractor.extract("LOG10(100) + ATAN(1) + B1");
        assertEquals(addresses("B1"), deps.getDirectReferences());
    }

    @Test
    void testStringLiteralsAreIgnored() {
        FormulaDependencies deps = DependencyExtractor.extract("IF(B1>0, \"A1 and t2!C3\", \"\")");
        assertEquals(addresses("B1"), deps.getDirectReferences());
        assertTrue(deps.getExternalReferences().isEmpty());
    }

    @Test
    void testMalformedTokensAreDropped() {
        FormulaDependencies deps = DependencyExtractor.extract("A0 + XFE1 + B2 + ABCD1 + A99999999");
        assertEquals(addresses("B2"), deps.getDirectReferences());
    }

    @Test
    void testExtractionIsPureAndNeverThrows() {
        String text = "SUM(A1:B2) + t2!C3 * $D$4";
        assertEquals(DependencyExtractor.extract(text), DependencyExtractor.extract(text));

        assertDoesNotThrow(() -> DependencyExtractor.extract("SUM(A1:"));
        assertDoesNotThrow(() -> DependencyExtractor.extract(")))B2((("));
        assertDoesNotThrow(() -> DependencyExtractor.extract("'unterminated!A1"));
        assertDoesNotThrow(() -> DependencyExtractor.extract("\"open string A1"));
        assertTrue(DependencyExtractor.extract("").getDirectReferences().isEmpty());
        assertTrue(DependencyExtractor.extract(null).getDirectReferences().isEmpty());
    }

    @Test
    void testCheckSyntax() {
        assertNull(DependencyExtractor.checkSyntax("SUM(A1:B2)*2"));
        assertNull(DependencyExtractor.checkSyntax("\"(\" "));
        assertNull(DependencyExtractor.checkSyntax("'My Sheet'!A1 + 1"));
        assertNotNull(DependencyExtractor.checkSyntax("SUM(A1"));
        assertNotNull(DependencyExtractor.checkSyntax("A1)"));
        assertNotNull(DependencyExtractor.checkSyntax("A1 ; B1"));
        assertNotNull(DependencyExtractor.checkSyntax("\"unterminated"));
        assertEquals("Empty formula", DependencyExtractor.checkSyntax(""));
    }
}
