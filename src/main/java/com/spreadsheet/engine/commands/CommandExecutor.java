package com.spreadsheet.engine.commands;

import com.spreadsheet.engine.models.Cell;
import com.spreadsheet.engine.models.CellAddress;
import com.spreadsheet.engine.models.CellRange;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The storage operations commands are allowed to use.
 * None of these record anything on the undo stack; they are the
 * "without command" counterparts of the session's public mutations.
 */
public interface CommandExecutor {

    /**
     * @return the cell that was replaced, or null if the address was empty
     */
    Cell setCellDirect(CellAddress address, String text);

    /**
     * @return the removed cell, or null if there was none
     */
    Cell deleteCellDirect(CellAddress address);

    List<CellAddress> insertRowsDirect(int beforeRow, int count);

    List<CellAddress> deleteRowsDirect(int startRow, int count);

    List<CellAddress> insertColumnsDirect(int beforeCol, int count);

    List<CellAddress> deleteColumnsDirect(int startCol, int count);

    List<CellAddress> moveRangeDirect(CellRange from, CellAddress toTopLeft);

    /**
     * Raw text of every cell, for restoring after a structural edit.
     */
    Map<CellAddress, String> snapshotCells();

    /**
     * Replaces the whole sheet with the given raw texts and recalculates.
     */
    void restoreCells(Map<CellAddress, String> snapshot);

    Optional<Cell> getCell(CellAddress address);
}
