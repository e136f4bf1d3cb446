package com.spreadsheet.engine.commands;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Several commands treated as one undo step: executed in order, undone in reverse.
 */
public class BatchCommand implements Command {

    private final List<Command> commands;
    private final String description;

    public BatchCommand(List<Command> commands) {
        this(commands, null);
    }

    public BatchCommand(List<Command> commands, String description) {
        this.commands = Collections.unmodifiableList(new ArrayList<>(commands));
        this.description = description != null ? description
                : "Batch operation (" + commands.size() + " commands)";
    }

    @Override
    public void execute(CommandExecutor executor) {
        for (Command command : commands) {
            command.execute(executor);
        }
    }

    @Override
    public void undo(CommandExecutor executor) {
        for (int i = commands.size() - 1; i >= 0; i--) {
            commands.get(i).undo(executor);
        }
    }

    @Override
    public String getDescription() {
        return description;
    }

    public List<Command> getCommands() {
        return commands;
    }

    public int size() {
        return commands.size();
    }
}
