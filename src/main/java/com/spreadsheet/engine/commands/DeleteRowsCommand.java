package com.spreadsheet.engine.commands;

import com.spreadsheet.engine.models.CellAddress;

import java.util.List;

public class DeleteRowsCommand extends StructuralCommand {

    private final int startRow;
    private final int count;

    public DeleteRowsCommand(int startRow, int count) {
        this.startRow = startRow;
        this.count = count;
    }

    @Override
    protected List<CellAddress> perform(CommandExecutor executor) {
        return executor.deleteRowsDirect(startRow, count);
    }

    @Override
    public String getDescription() {
        if (count == 1) {
            return "Delete row " + (startRow + 1);
        }
        return "Delete " + plural(count, "row") + " at " + (startRow + 1);
    }
}
