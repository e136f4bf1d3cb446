package com.spreadsheet.engine.events;

public enum EventType {
    CELL_UPDATED,
    CELL_DELETED,
    CALCULATION_COMPLETED,
    STRUCTURE_CHANGED,
    BATCH_STARTED,
    BATCH_COMPLETED
}
