package com.spreadsheet.engine.models;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An error carried as a cell value.
 * Equality looks at the type and the cells involved; the description is
 * diagnostic text only.
 */
public final class CellError {

    private final ErrorType type;
    private final String description;
    // Only set for circular dependencies
    private final List<CellAddress> cells;

    public CellError(ErrorType type, String description) {
        this(type, description, Collections.emptyList());
    }

    public CellError(ErrorType type, String description, List<CellAddress> cells) {
        this.type = Objects.requireNonNull(type, "type");
        this.description = description == null ? "" : description;
        this.cells = Collections.unmodifiableList(cells);
    }

    public static CellError of(ErrorType type) {
        return new CellError(type, defaultDescription(type));
    }

    public static CellError circular(List<CellAddress> cells) {
        return new CellError(ErrorType.CIRCULAR_DEPENDENCY, "Circular reference involving " + cells, cells);
    }

    public ErrorType getType() {
        return type;
    }

    public String getCode() {
        return type.getCode();
    }

    public String getDescription() {
        return description;
    }

    public List<CellAddress> getCells() {
        return cells;
    }

    private static String defaultDescription(ErrorType type) {
        switch (type) {
            case DIVIDE_BY_ZERO:
                return "Division by zero";
            case INVALID_REF:
                return "Invalid cell reference";
            case NAME_ERROR:
                return "Unknown name";
            case VALUE_ERROR:
                return "Wrong type of argument or operand";
            case CIRCULAR_DEPENDENCY:
                return "Circular reference";
            case NUM_ERROR:
                return "Numeric result out of range";
            case PARSE_ERROR:
                return "Formula could not be parsed";
            case INVALID_RANGE:
                return "Invalid range";
            case INVALID_ARGUMENTS:
                return "Invalid function arguments";
            default:
                return "Invalid operation";
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CellError)) return false;
        CellError that = (CellError) o;
        return type == that.type && cells.equals(that.cells);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, cells);
    }

    @Override
    public String toString() {
        return description.isEmpty() ? type.getCode() : type.getCode() + " " + description;
    }
}
