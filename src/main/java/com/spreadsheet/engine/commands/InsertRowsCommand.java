package com.spreadsheet.engine.commands;

import com.spreadsheet.engine.models.CellAddress;

import java.util.List;

public class InsertRowsCommand extends StructuralCommand {

    private final int beforeRow;
    private final int count;

    public InsertRowsCommand(int beforeRow, int count) {
        this.beforeRow = beforeRow;
        this.count = count;
    }

    @Override
    protected List<CellAddress> perform(CommandExecutor executor) {
        return executor.insertRowsDirect(beforeRow, count);
    }

    @Override
    public String getDescription() {
        if (count == 1) {
            return "Insert row " + (beforeRow + 1);
        }
        return "Insert " + plural(count, "row") + " at " + (beforeRow + 1);
    }
}
