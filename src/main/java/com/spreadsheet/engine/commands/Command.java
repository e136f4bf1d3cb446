package com.spreadsheet.engine.commands;

/**
 * A reversible change to a sheet.
 */
public interface Command {

    void execute(CommandExecutor executor);

    void undo(CommandExecutor executor);

    String getDescription();
}
