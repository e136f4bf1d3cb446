package com.spreadsheet.engine.commands;

import com.spreadsheet.engine.models.Cell;
import com.spreadsheet.engine.models.CellAddress;

/**
 * Writes a cell. Undo puts back the previous raw text, or clears the cell
 * if it did not exist before.
 */
public class SetCellCommand implements Command {

    private final CellAddress address;
    private final String newText;
    // captured on execute; null when the cell was empty
    private String previousText;

    public SetCellCommand(CellAddress address, String newText) {
        this.address = address;
        this.newText = newText;
    }

    @Override
    public void execute(CommandExecutor executor) {
        Cell previous = executor.setCellDirect(address, newText);
        previousText = previous == null ? null : previous.getRawText();
    }

    @Override
    public void undo(CommandExecutor executor) {
        if (previousText == null) {
            executor.deleteCellDirect(address);
        } else {
            executor.setCellDirect(address, previousText);
        }
    }

    @Override
    public String getDescription() {
        return "Set cell " + address.toA1();
    }

    public CellAddress getAddress() {
        return address;
    }

    public String getNewText() {
        return newText;
    }

    public String getPreviousText() {
        return previousText;
    }
}
