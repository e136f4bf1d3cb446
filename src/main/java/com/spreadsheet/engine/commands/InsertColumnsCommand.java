package com.spreadsheet.engine.commands;

import com.spreadsheet.engine.models.CellAddress;

import java.util.List;

public class InsertColumnsCommand extends StructuralCommand {

    private final int beforeCol;
    private final int count;

    public InsertColumnsCommand(int beforeCol, int count) {
        this.beforeCol = beforeCol;
        this.count = count;
    }

    @Override
    protected List<CellAddress> perform(CommandExecutor executor) {
        return executor.insertColumnsDirect(beforeCol, count);
    }

    @Override
    public String getDescription() {
        String label = CellAddress.columnNumberToLabel(beforeCol);
        if (count == 1) {
            return "Insert column " + label;
        }
        return "Insert " + plural(count, "column") + " at " + label;
    }
}
