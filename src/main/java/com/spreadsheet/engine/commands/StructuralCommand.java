package com.spreadsheet.engine.commands;

import com.spreadsheet.engine.models.CellAddress;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Base for row/column/range edits. The whole sheet is captured before the edit,
 * so undo brings back removed cells, moved cells and rewritten formulas exactly.
 */
public abstract class StructuralCommand implements Command {

    private Map<CellAddress, String> snapshot;
    private List<CellAddress> affected = Collections.emptyList();

    @Override
    public final void execute(CommandExecutor executor) {
        snapshot = executor.snapshotCells();
        affected = perform(executor);
    }

    @Override
    public final void undo(CommandExecutor executor) {
        if (snapshot == null) {
            throw new IllegalStateException("Undo before execute: " + getDescription());
        }
        executor.restoreCells(snapshot);
    }

    protected abstract List<CellAddress> perform(CommandExecutor executor);

    /**
     * Addresses reported by the last execution.
     */
    public List<CellAddress> getAffected() {
        return affected;
    }

    protected static String plural(int count, String noun) {
        return count == 1 ? noun : count + " " + noun + "s";
    }
}
