package com.spreadsheet.engine.events;

/**
 * Receives notifications about changes made by an engine session.
 */
@FunctionalInterface
public interface SpreadsheetEventListener {

    void onEvent(SpreadsheetEvent event);
}
