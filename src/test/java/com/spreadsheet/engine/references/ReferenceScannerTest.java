package com.spreadsheet.engine.references;

import com.spreadsheet.engine.models.CellAddress;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceScannerTest {

    private ReferenceScanner scanner;

    @BeforeEach
    void setUp() {
        scanner = new ReferenceScanner();
    }

    @Test
    void testCellReferencesWithOffsets() {
        List<Reference> refs = scanner.scan("=A1+$B$2*C$3");

        assertEquals(3, refs.size());
        assertEquals("A1", refs.get(0).getText());
        assertEquals(1, refs.get(0).getStart());
        assertEquals(3, refs.get(0).getEnd());
        assertEquals(ReferenceType.RELATIVE, refs.get(0).getType());
        assertEquals(ReferenceType.ABSOLUTE, refs.get(1).getType());
        assertEquals(ReferenceType.MIXED_ROW, refs.get(2).getType());
        assertEquals(CellAddress.fromA1("C3"), refs.get(2).getAddress());
    }

    @Test
    void testRangeAndSheetReferences() {
        List<Reference> refs = scanner.scan("=SUM(A1:B2)+Data!C4");

        assertEquals(2, refs.size());
        Reference range = refs.get(0);
        assertEquals(ReferenceType.RANGE, range.getType());
        assertEquals("A1:B2", range.getText());
        assertEquals(CellAddress.fromA1("B2"), range.getRangeEnd().getAddress());

        Reference sheet = refs.get(1);
        assertEquals(ReferenceType.SHEET, sheet.getType());
        assertEquals("Data", sheet.getSheetName());
        assertEquals(CellAddress.fromA1("C4"), sheet.getInner().getAddress());
        assertEquals("Data!C4", sheet.getText());
    }

    /**
     * Strings, error literals, function names and off-sheet addresses are not references.
     */
    @Test
    void testNonReferencesAreSkipped() {
        assertTrue(scanner.scan("=\"A1\"&LOG10(2)&#REF!").isEmpty());
        assertTrue(scanner.scan("=XFE1").isEmpty());
        assertTrue(scanner.scan("=A1B").isEmpty());
        assertTrue(scanner.scan("A1+B1").isEmpty());
        assertTrue(scanner.scan(null).isEmpty());
    }

    @Test
    void testLowercaseReferences() {
        List<Reference> refs = scanner.scan("=a1+b2");
        assertEquals(2, refs.size());
        assertEquals(CellAddress.fromA1("B2"), refs.get(1).getAddress());
    }

    @Test
    void testFormatKeepsDollarMarkers() {
        Reference ref = scanner.scan("=$C5").get(0);
        assertEquals(ReferenceType.MIXED_COL, ref.getType());
        assertEquals("$C9", ref.format(CellAddress.fromA1("C9")));
    }
}
