package com.spreadsheet.engine.commands;

import com.spreadsheet.engine.models.Cell;
import com.spreadsheet.engine.models.CellAddress;

public class DeleteCellCommand implements Command {

    private final CellAddress address;
    private String previousText;

    public DeleteCellCommand(CellAddress address) {
        this.address = address;
    }

    @Override
    public void execute(CommandExecutor executor) {
        Cell previous = executor.deleteCellDirect(address);
        previousText = previous == null ? null : previous.getRawText();
    }

    @Override
    public void undo(CommandExecutor executor) {
        if (previousText != null) {
            executor.setCellDirect(address, previousText);
        }
    }

    @Override
    public String getDescription() {
        return "Delete cell " + address.toA1();
    }

    public CellAddress getAddress() {
        return address;
    }
}
