package com.spreadsheet.engine.models;

import com.spreadsheet.engine.exceptions.InvalidAddressException;
import com.spreadsheet.engine.exceptions.InvalidReferenceException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CellAddressTest {

    @Test
    void testColumnLabels() {
        assertEquals("A", CellAddress.columnNumberToLabel(0));
        assertEquals("Z", CellAddress.columnNumberToLabel(25));
        assertEquals("AA", CellAddress.columnNumberToLabel(26));
        assertEquals("ZZ", CellAddress.columnNumberToLabel(701));
        assertEquals("AAA", CellAddress.columnNumberToLabel(702));
        assertEquals("XFD", CellAddress.columnNumberToLabel(CellAddress.MAX_COLUMNS - 1));
    }

    /**
     * Label conversion is a bijection over the whole sheet width.
     */
    @Test
    void testColumnLabelRoundTrip() {
        for (int col = 0; col < CellAddress.MAX_COLUMNS; col++) {
            assertEquals(col, CellAddress.columnLabelToNumber(CellAddress.columnNumberToLabel(col)));
        }
    }

    @Test
    void testFromA1() {
        CellAddress address = CellAddress.fromA1("B12");
        assertEquals(1, address.getCol());
        assertEquals(11, address.getRow());
        assertEquals("B12", address.toA1());
        assertEquals(new CellAddress(16383, 1048575), CellAddress.fromA1("XFD1048576"));
    }

    @Test
    void testMalformedAddressesRejected() {
        for (String text : Arrays.asList("", "12", "A", "a1", "A0", "A1B", "$A$1")) {
            assertThrows(InvalidAddressException.class, () -> CellAddress.fromA1(text), text);
        }
        // Arabic-Indic one is not a row number
        assertThrows(InvalidAddressException.class, () -> CellAddress.fromA1("A\u0661"));
        assertThrows(InvalidAddressException.class, () -> new CellAddress(-1, 0));
        assertThrows(InvalidAddressException.class, () -> CellAddress.columnLabelToNumber(""));
        assertThrows(InvalidAddressException.class, () -> CellAddress.columnLabelToNumber("a"));
    }

    /**
     * Addresses past the sheet edge are #REF! conditions, not malformed text.
     */
    @Test
    void testOffSheetAddressesAreReferenceErrors() {
        InvalidReferenceException ex = assertThrows(InvalidReferenceException.class,
                () -> CellAddress.fromA1("XFE1"));
        assertTrue(ex.getMessage().startsWith("#REF!"));
        assertThrows(InvalidReferenceException.class, () -> CellAddress.fromA1("A1048577"));
        assertThrows(InvalidReferenceException.class, () -> CellAddress.fromA1("XYZ999"));
    }

    @Test
    void testOffset() {
        assertEquals(CellAddress.fromA1("C3"), CellAddress.fromA1("B2").offset(1, 1));
        assertEquals(CellAddress.fromA1("A1"), CellAddress.fromA1("B2").offset(-1, -1));
        assertThrows(InvalidAddressException.class, () -> CellAddress.fromA1("A1").offset(-1, 0));
        assertThrows(InvalidAddressException.class, () -> CellAddress.fromA1("A1").offset(0, -1));
    }

    @Test
    void testWithinBounds() {
        CellAddress address = CellAddress.fromA1("C5");
        assertTrue(address.isWithinBounds(4, 2));
        assertFalse(address.isWithinBounds(3, 2));
        assertFalse(address.isWithinBounds(4, 1));
    }

    @Test
    void testRowMajorOrdering() {
        List<CellAddress> addresses = new ArrayList<>(Arrays.asList(
                CellAddress.fromA1("A2"), CellAddress.fromA1("B1"), CellAddress.fromA1("A1")));
        Collections.sort(addresses);
        assertEquals(Arrays.asList(CellAddress.fromA1("A1"), CellAddress.fromA1("B1"), CellAddress.fromA1("A2")),
                addresses);
    }
}
