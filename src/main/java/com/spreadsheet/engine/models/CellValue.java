package com.spreadsheet.engine.models;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The computed value of a cell: empty, number, string, boolean, error or array.
 * Instances are immutable.
 */
public final class CellValue {

    public enum Kind {
        EMPTY,
        NUMBER,
        STRING,
        BOOLEAN,
        ERROR,
        ARRAY
    }

    public static final CellValue EMPTY = new CellValue(Kind.EMPTY, 0, null, false, null, null);
    public static final CellValue TRUE = new CellValue(Kind.BOOLEAN, 0, null, true, null, null);
    public static final CellValue FALSE = new CellValue(Kind.BOOLEAN, 0, null, false, null, null);

    private final Kind kind;
    private final double number;
    private final String text;
    private final boolean bool;
    private final CellError error;
    private final List<CellValue> array;

    private CellValue(Kind kind, double number, String text, boolean bool,
                      CellError error, List<CellValue> array) {
        this.kind = kind;
        this.number = number;
        this.text = text;
        this.bool = bool;
        this.error = error;
        this.array = array;
    }

    public static CellValue number(double value) {
        return new CellValue(Kind.NUMBER, value, null, false, null, null);
    }

    public static CellValue string(String value) {
        return new CellValue(Kind.STRING, 0, Objects.requireNonNull(value, "value"), false, null, null);
    }

    public static CellValue bool(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static CellValue error(CellError error) {
        return new CellValue(Kind.ERROR, 0, null, false, Objects.requireNonNull(error, "error"), null);
    }

    public static CellValue error(ErrorType type) {
        return error(CellError.of(type));
    }

    public static CellValue error(ErrorType type, String description) {
        return error(new CellError(type, description));
    }

    public static CellValue array(List<CellValue> values) {
        return new CellValue(Kind.ARRAY, 0, null, false, null,
                Collections.unmodifiableList(new ArrayList<>(values)));
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isEmpty() {
        return kind == Kind.EMPTY;
    }

    public boolean isNumber() {
        return kind == Kind.NUMBER;
    }

    public boolean isString() {
        return kind == Kind.STRING;
    }

    public boolean isBoolean() {
        return kind == Kind.BOOLEAN;
    }

    public boolean isError() {
        return kind == Kind.ERROR;
    }

    public boolean isArray() {
        return kind == Kind.ARRAY;
    }

    public double getNumber() {
        requireKind(Kind.NUMBER);
        return number;
    }

    public String getString() {
        requireKind(Kind.STRING);
        return text;
    }

    public boolean getBoolean() {
        requireKind(Kind.BOOLEAN);
        return bool;
    }

    public CellError getError() {
        requireKind(Kind.ERROR);
        return error;
    }

    public ErrorType getErrorType() {
        return kind == Kind.ERROR ? error.getType() : null;
    }

    public List<CellValue> getArray() {
        requireKind(Kind.ARRAY);
        return array;
    }

    /**
     * Text shown in a cell: integral numbers without a fraction,
     * TRUE/FALSE for booleans, the display code for errors.
     */
    public String toDisplayString() {
        switch (kind) {
            case EMPTY:
                return "";
            case NUMBER:
                return formatNumber(number);
            case STRING:
                return text;
            case BOOLEAN:
                return bool ? "TRUE" : "FALSE";
            case ERROR:
                return error.getCode();
            default:
                StringBuilder sb = new StringBuilder("{");
                for (int i = 0; i < array.size(); i++) {
                    if (i > 0) {
                        sb.append(',');
                    }
                    sb.append(array.get(i).toDisplayString());
                }
                return sb.append('}').toString();
        }
    }

    /**
     * JSON form: numbers, strings and booleans as themselves, empty as null,
     * errors as their display code.
     */
    @JsonValue
    public Object toJson() {
        switch (kind) {
            case EMPTY:
                return null;
            case NUMBER:
                return number;
            case STRING:
                return text;
            case BOOLEAN:
                return bool;
            case ERROR:
                return error.getCode();
            default:
                List<Object> values = new ArrayList<>();
                for (CellValue v : array) {
                    values.add(v.toJson());
                }
                return values;
        }
    }

    public static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }

    private void requireKind(Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Value is " + kind + ", not " + expected);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CellValue)) return false;
        CellValue that = (CellValue) o;
        if (kind != that.kind) return false;
        switch (kind) {
            case NUMBER:
                return Double.compare(number, that.number) == 0;
            case STRING:
                return text.equals(that.text);
            case BOOLEAN:
                return bool == that.bool;
            case ERROR:
                return error.equals(that.error);
            case ARRAY:
                return array.equals(that.array);
            default:
                return true;
        }
    }

    @Override
    public int hashCode() {
        switch (kind) {
            case NUMBER:
                return Double.hashCode(number);
            case STRING:
                return text.hashCode();
            case BOOLEAN:
                return Boolean.hashCode(bool);
            case ERROR:
                return error.hashCode();
            case ARRAY:
                return array.hashCode();
            default:
                return 0;
        }
    }

    @Override
    public String toString() {
        switch (kind) {
            case EMPTY:
                return "Empty";
            case NUMBER:
                return "Number(" + formatNumber(number) + ")";
            case STRING:
                return "String(" + text + ")";
            case BOOLEAN:
                return "Boolean(" + bool + ")";
            case ERROR:
                return "Error(" + error + ")";
            default:
                return "Array" + array;
        }
    }
}
