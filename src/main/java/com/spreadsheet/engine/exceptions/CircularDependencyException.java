package com.spreadsheet.engine.exceptions;

import com.spreadsheet.engine.models.CellAddress;
import com.spreadsheet.engine.models.ErrorType;

import java.util.Collections;
import java.util.List;

/**
 * Thrown when a calculation order is requested for a graph that contains a cycle.
 */
public class CircularDependencyException extends SpreadsheetException {

    private final List<CellAddress> cells;

    public CircularDependencyException(String message, List<CellAddress> cells) {
        super(message);
        this.cells = Collections.unmodifiableList(cells);
    }

    /**
     * Cells that could not be ordered (members of a cycle or downstream of one).
     */
    public List<CellAddress> getCells() {
        return cells;
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.CIRCULAR_DEPENDENCY;
    }
}
