package com.spreadsheet.engine.commands;

import com.spreadsheet.engine.models.CellAddress;
import com.spreadsheet.engine.models.CellRange;

import java.util.List;

public class MoveRangeCommand extends StructuralCommand {

    private final CellRange from;
    private final CellAddress toTopLeft;

    public MoveRangeCommand(CellRange from, CellAddress toTopLeft) {
        this.from = from;
        this.toTopLeft = toTopLeft;
    }

    @Override
    protected List<CellAddress> perform(CommandExecutor executor) {
        return executor.moveRangeDirect(from, toTopLeft);
    }

    @Override
    public String getDescription() {
        CellAddress toEnd = toTopLeft.offset(from.rowCount() - 1, from.columnCount() - 1);
        return "Move " + from.toA1() + " to " + new CellRange(toTopLeft, toEnd).toA1();
    }
}
