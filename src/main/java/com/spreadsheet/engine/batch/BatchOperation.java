package com.spreadsheet.engine.batch;

import com.spreadsheet.engine.commands.Command;
import com.spreadsheet.engine.commands.DeleteCellCommand;
import com.spreadsheet.engine.commands.SetCellCommand;
import com.spreadsheet.engine.exceptions.InvalidOperationException;
import com.spreadsheet.engine.models.CellAddress;
import com.spreadsheet.engine.models.CellRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One buffered write in a batch. Converted to commands when the batch is committed.
 */
public abstract class BatchOperation {

    private BatchOperation() {
    }

    public static BatchOperation setCell(CellAddress address, String text) {
        return new SetCell(address, text);
    }

    public static BatchOperation deleteCell(CellAddress address) {
        return new DeleteCell(address);
    }

    /**
     * @param values row-major, one row per range row and one entry per range column
     */
    public static BatchOperation setRange(CellAddress start, CellAddress end, String[][] values) {
        return new SetRange(new CellRange(start, end), values);
    }

    public static BatchOperation deleteRange(CellAddress start, CellAddress end) {
        return new DeleteRange(new CellRange(start, end));
    }

    public abstract List<Command> toCommands();

    public static final class SetCell extends BatchOperation {
        private final CellAddress address;
        private final String text;

        SetCell(CellAddress address, String text) {
            this.address = address;
            this.text = text;
        }

        public CellAddress getAddress() {
            return address;
        }

        public String getText() {
            return text;
        }

        @Override
        public List<Command> toCommands() {
            return Collections.singletonList(new SetCellCommand(address, text));
        }
    }

    public static final class DeleteCell extends BatchOperation {
        private final CellAddress address;

        DeleteCell(CellAddress address) {
            this.address = address;
        }

        public CellAddress getAddress() {
            return address;
        }

        @Override
        public List<Command> toCommands() {
            return Collections.singletonList(new DeleteCellCommand(address));
        }
    }

    public static final class SetRange extends BatchOperation {
        private final CellRange range;
        private final String[][] values;

        SetRange(CellRange range, String[][] values) {
            if (values == null || values.length != range.rowCount()) {
                throw new InvalidOperationException("Expected " + range.rowCount() + " rows of values for "
                        + range.toA1());
            }
            for (String[] row : values) {
                if (row == null || row.length != range.columnCount()) {
                    throw new InvalidOperationException("Expected " + range.columnCount()
                            + " values per row for " + range.toA1());
                }
            }
            this.range = range;
            this.values = values;
        }

        public CellRange getRange() {
            return range;
        }

        @Override
        public List<Command> toCommands() {
            List<Command> commands = new ArrayList<>();
            CellAddress start = range.getStart();
            for (CellAddress address : range) {
                String text = values[address.getRow() - start.getRow()][address.getCol() - start.getCol()];
                commands.add(new SetCellCommand(address, text));
            }
            return commands;
        }
    }

    public static final class DeleteRange extends BatchOperation {
        private final CellRange range;

        DeleteRange(CellRange range) {
            this.range = range;
        }

        public CellRange getRange() {
            return range;
        }

        @Override
        public List<Command> toCommands() {
            List<Command> commands = new ArrayList<>();
            for (CellAddress address : range) {
                commands.add(new DeleteCellCommand(address));
            }
            return commands;
        }
    }
}
