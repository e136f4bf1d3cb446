package com.spreadsheet.engine.batch;

import com.spreadsheet.engine.commands.BatchCommand;
import com.spreadsheet.engine.commands.Command;
import com.spreadsheet.engine.commands.CommandExecutor;
import com.spreadsheet.engine.commands.DeleteCellCommand;
import com.spreadsheet.engine.commands.SetCellCommand;
import com.spreadsheet.engine.events.EventDispatcher;
import com.spreadsheet.engine.events.SpreadsheetEvent;
import com.spreadsheet.engine.exceptions.SpreadsheetException;
import com.spreadsheet.engine.models.CellAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Consumer;

/**
 * Runs batches: operations are buffered by the {@link BatchManager} and applied in one go,
 * with a single recalculation at the end.
 */
public class BatchService {

    private static final Logger logger = LoggerFactory.getLogger(BatchService.class);

    private final BatchManager manager;
    private final EventDispatcher events;

    public BatchService(BatchManager manager, EventDispatcher events) {
        this.manager = manager;
        this.events = events;
    }

    public String beginBatch(String batchId) {
        String id = manager.beginBatch(batchId);
        logger.info("Batch {} started", id);
        events.dispatch(SpreadsheetEvent.batchStarted(id));
        return id;
    }

    public void addOperation(String batchId, BatchOperation operation) {
        manager.addOperation(batchId, operation);
    }

    /**
     * Applies the batch's operations in order.
     *
     * @param executor an executor that does not recalculate on each write
     * @param recalc   called once with every address the batch wrote or deleted
     * @return the executed commands, ready to be recorded as one undo step
     * @throws SpreadsheetException if an operation fails; the commands already applied are undone
     */
    public BatchCommand commitBatch(String batchId, CommandExecutor executor, Consumer<Set<CellAddress>> recalc) {
        List<BatchOperation> operations = manager.takeOperations(batchId);
        List<Command> executed = new ArrayList<>();
        Set<CellAddress> affected = new TreeSet<>();
        try {
            for (BatchOperation operation : operations) {
                for (Command command : operation.toCommands()) {
                    command.execute(executor);
                    executed.add(command);
                    affected.add(addressOf(command));
                }
            }
        } catch (SpreadsheetException e) {
            logger.warn("Batch {} failed after {} commands, reverting: {}", batchId, executed.size(), e.getMessage());
            for (int i = executed.size() - 1; i >= 0; i--) {
                executed.get(i).undo(executor);
            }
            recalc.accept(affected);
            throw e;
        }
        recalc.accept(affected);
        logger.info("Batch {} committed: {} operations, {} cells", batchId, operations.size(), affected.size());
        events.dispatch(SpreadsheetEvent.batchCompleted(batchId, operations.size(), new ArrayList<>(affected)));
        return new BatchCommand(executed);
    }

    public void rollbackBatch(String batchId) {
        manager.rollbackBatch(batchId);
        logger.info("Batch {} rolled back", batchId);
    }

    public boolean hasBatch(String batchId) {
        return manager.hasBatch(batchId);
    }

    public Set<String> activeBatchIds() {
        return manager.activeBatchIds();
    }

    private static CellAddress addressOf(Command command) {
        if (command instanceof SetCellCommand) {
            return ((SetCellCommand) command).getAddress();
        }
        return ((DeleteCellCommand) command).getAddress();
    }
}
