package com.spreadsheet.engine.evaluator;

import com.spreadsheet.engine.models.CellValue;
import com.spreadsheet.engine.models.ErrorType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FunctionLibraryTest {

    private FunctionLibrary library;

    @BeforeEach
    void setUp() {
        library = new FunctionLibrary();
    }

    private CellValue call(String name, CellValue... args) {
        return library.call(name, Arrays.asList(args));
    }

    private static CellValue range(CellValue... values) {
        return CellValue.array(Arrays.asList(values));
    }

    /**
     * Direct arguments coerce, while text inside a range is skipped.
     */
    @Test
    void testSum() {
        assertEquals(CellValue.number(6), call("SUM", CellValue.number(1), CellValue.TRUE, CellValue.string("4")));
        assertEquals(CellValue.number(3),
                call("SUM", range(CellValue.number(1), CellValue.string("7"), CellValue.number(2))));
        assertEquals(CellValue.number(0), call("SUM"));
    }

    @Test
    void testAggregatesPropagateErrors() {
        CellValue args = range(CellValue.number(1), CellValue.error(ErrorType.DIVIDE_BY_ZERO));
        assertEquals(ErrorType.DIVIDE_BY_ZERO, call("SUM", args).getErrorType());
        assertEquals(ErrorType.DIVIDE_BY_ZERO, call("MAX", args).getErrorType());
        assertEquals(CellValue.number(1), call("COUNT", args));
    }

    @Test
    void testAverageMinMax() {
        CellValue values = range(CellValue.number(2), CellValue.number(8), CellValue.EMPTY);
        assertEquals(CellValue.number(5), call("AVERAGE", values));
        assertEquals(CellValue.number(2), call("MIN", values));
        assertEquals(CellValue.number(8), call("MAX", values));
        assertEquals(ErrorType.DIVIDE_BY_ZERO, call("AVERAGE", range(CellValue.EMPTY)).getErrorType());
    }

    @Test
    void testRoundAbsSqrt() {
        assertEquals(CellValue.number(2.35), call("ROUND", CellValue.number(2.345), CellValue.number(2)));
        assertEquals(CellValue.number(3), call("ABS", CellValue.number(-3)));
        assertEquals(CellValue.number(3), call("SQRT", CellValue.number(9)));
        assertEquals(ErrorType.NUM_ERROR, call("SQRT", CellValue.number(-1)).getErrorType());
        assertEquals(ErrorType.INVALID_ARGUMENTS, call("ROUND", CellValue.number(1)).getErrorType());
    }

    @Test
    void testTextFunctions() {
        assertEquals(CellValue.string("a1TRUE"),
                call("CONCATENATE", CellValue.string("a"), CellValue.number(1), CellValue.TRUE));
        assertEquals(CellValue.number(5), call("LEN", CellValue.string("hello")));
        assertEquals(CellValue.string("ABC"), call("UPPER", CellValue.string("abc")));
        assertEquals(CellValue.string("abc"), call("lower", CellValue.string("ABC")));
        assertEquals(CellValue.string("a b"), call("TRIM", CellValue.string("  a   b ")));
    }

    @Test
    void testLogicalFunctions() {
        assertEquals(CellValue.string("yes"),
                call("IF", CellValue.TRUE, CellValue.string("yes"), CellValue.string("no")));
        assertEquals(CellValue.FALSE, call("IF", CellValue.number(0), CellValue.string("yes")));
        assertEquals(CellValue.TRUE, call("AND", CellValue.TRUE, CellValue.number(1)));
        assertEquals(CellValue.TRUE, call("OR", CellValue.FALSE, CellValue.TRUE));
        assertEquals(CellValue.FALSE, call("NOT", CellValue.TRUE));
        assertEquals(ErrorType.VALUE_ERROR, call("IF", CellValue.string("maybe"), CellValue.TRUE).getErrorType());
    }

    @Test
    void testErrorFunctions() {
        CellValue error = CellValue.error(ErrorType.VALUE_ERROR);
        assertEquals(CellValue.number(0), call("IFERROR", error, CellValue.number(0)));
        assertEquals(CellValue.number(4), call("IFERROR", CellValue.number(4), CellValue.number(0)));
        assertEquals(CellValue.TRUE, call("ISERROR", error));
        assertEquals(CellValue.TRUE, call("ISBLANK", CellValue.EMPTY));
    }

    @Test
    void testUnknownFunction() {
        assertEquals(ErrorType.NAME_ERROR, call("NOSUCH").getErrorType());
        assertFalse(library.contains("NOSUCH"));
    }

    @Test
    void testCustomFunction() {
        library.register("double", args -> CellValue.number(Operators.toNumber(args.get(0)) * 2));

        assertTrue(library.contains("DOUBLE"));
        assertTrue(library.names().contains("DOUBLE"));
        List<CellValue> args = Collections.singletonList(CellValue.number(21));
        assertEquals(CellValue.number(42), library.call("Double", args));
    }
}
