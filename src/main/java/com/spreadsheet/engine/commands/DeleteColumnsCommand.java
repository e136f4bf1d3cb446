package com.spreadsheet.engine.commands;

import com.spreadsheet.engine.models.CellAddress;

import java.util.List;

public class DeleteColumnsCommand extends StructuralCommand {

    private final int startCol;
    private final int count;

    public DeleteColumnsCommand(int startCol, int count) {
        this.startCol = startCol;
        this.count = count;
    }

    @Override
    protected List<CellAddress> perform(CommandExecutor executor) {
        return executor.deleteColumnsDirect(startCol, count);
    }

    @Override
    public String getDescription() {
        String label = CellAddress.columnNumberToLabel(startCol);
        if (count == 1) {
            return "Delete column " + label;
        }
        return "Delete " + plural(count, "column") + " at " + label;
    }
}
