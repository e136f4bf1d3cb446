package com.spreadsheet.engine.commands;

import com.spreadsheet.engine.exceptions.InvalidOperationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Bounded undo and redo stacks of executed commands.
 *
 * While a group is open, recorded commands are collected instead of pushed;
 * committing the group pushes them as a single {@link BatchCommand}.
 */
public class UndoRedoManager {

    private static final Logger logger = LoggerFactory.getLogger(UndoRedoManager.class);

    private final Deque<Command> undoStack = new ArrayDeque<>();
    private final Deque<Command> redoStack = new ArrayDeque<>();
    private final int maxUndo;
    private final int maxRedo;

    private List<Command> group;
    private String groupDescription;

    public UndoRedoManager(int maxUndo, int maxRedo) {
        if (maxUndo < 1 || maxRedo < 1) {
            throw new IllegalArgumentException("Undo/redo limits must be positive");
        }
        this.maxUndo = maxUndo;
        this.maxRedo = maxRedo;
    }

    /**
     * Executes a command and records it. Clears the redo stack.
     */
    public void execute(Command command, CommandExecutor executor) {
        command.execute(executor);
        record(command);
    }

    /**
     * Records a command that has already been executed.
     */
    public void record(Command command) {
        if (group != null) {
            group.add(command);
            return;
        }
        push(undoStack, command, maxUndo);
        redoStack.clear();
        logger.debug("Recorded '{}' ({} on undo stack)", command.getDescription(), undoStack.size());
    }

    /**
     * @return the description of the undone command, or empty if there was nothing to undo
     */
    public Optional<String> undo(CommandExecutor executor) {
        if (undoStack.isEmpty()) {
            return Optional.empty();
        }
        // stays on the stack if undo throws
        Command command = undoStack.peek();
        command.undo(executor);
        undoStack.pop();
        push(redoStack, command, maxRedo);
        logger.debug("Undid '{}'", command.getDescription());
        return Optional.of(command.getDescription());
    }

    /**
     * @return the description of the redone command, or empty if there was nothing to redo
     */
    public Optional<String> redo(CommandExecutor executor) {
        if (redoStack.isEmpty()) {
            return Optional.empty();
        }
        Command command = redoStack.peek();
        command.execute(executor);
        redoStack.pop();
        push(undoStack, command, maxUndo);
        logger.debug("Redid '{}'", command.getDescription());
        return Optional.of(command.getDescription());
    }

    public boolean canUndo() {
        return !undoStack.isEmpty();
    }

    public boolean canRedo() {
        return !redoStack.isEmpty();
    }

    public Optional<String> peekUndo() {
        return Optional.ofNullable(undoStack.peek()).map(Command::getDescription);
    }

    public Optional<String> peekRedo() {
        return Optional.ofNullable(redoStack.peek()).map(Command::getDescription);
    }

    /**
     * Descriptions on the undo stack, most recent first.
     */
    public List<String> getUndoHistory() {
        return descriptions(undoStack);
    }

    public List<String> getRedoHistory() {
        return descriptions(redoStack);
    }

    public void clear() {
        undoStack.clear();
        redoStack.clear();
        group = null;
        groupDescription = null;
    }

    // ----------------------------------------------------------------
    // Grouping
    // ----------------------------------------------------------------

    public void beginGroup(String description) {
        if (group != null) {
            throw new InvalidOperationException("A command group is already open: " + groupDescription);
        }
        group = new ArrayList<>();
        groupDescription = description;
    }

    public boolean isGrouping() {
        return group != null;
    }

    /**
     * Closes the open group and records its commands as one undo step.
     * An empty group records nothing.
     */
    public void commitGroup() {
        if (group == null) {
            throw new InvalidOperationException("No command group is open");
        }
        List<Command> commands = group;
        String description = groupDescription;
        group = null;
        groupDescription = null;
        if (!commands.isEmpty()) {
            record(new BatchCommand(commands, description));
        }
    }

    /**
     * Undoes whatever the open group has executed so far and discards it.
     */
    public void cancelGroup(CommandExecutor executor) {
        if (group == null) {
            throw new InvalidOperationException("No command group is open");
        }
        List<Command> commands = group;
        group = null;
        groupDescription = null;
        for (int i = commands.size() - 1; i >= 0; i--) {
            commands.get(i).undo(executor);
        }
    }

    private static void push(Deque<Command> stack, Command command, int limit) {
        stack.push(command);
        while (stack.size() > limit) {
            stack.removeLast();
        }
    }

    private static List<String> descriptions(Deque<Command> stack) {
        List<String> result = new ArrayList<>(stack.size());
        for (Command command : stack) {
            result.add(command.getDescription());
        }
        return result;
    }
}
