package com.spreadsheet.engine.exceptions;

/**
 * Thrown when a batch id is not (or no longer) active.
 */
public class BatchNotFoundException extends SpreadsheetException {

    private final String batchId;

    public BatchNotFoundException(String batchId) {
        super("Batch not found: " + batchId);
        this.batchId = batchId;
    }

    public String getBatchId() {
        return batchId;
    }
}
