package com.spreadsheet.engine.events;

import com.spreadsheet.engine.models.CellAddress;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * Something that happened in an engine session. Which fields are set depends on the type:
 * cell events carry an address, batch events a batch id and operation count,
 * calculation and structure events the affected cells.
 */
public class SpreadsheetEvent {

    private final EventType type;
    private final Instant timestamp;
    private final CellAddress address;
    private final String batchId;
    private final int operationCount;
    private final List<CellAddress> affectedCells;

    private SpreadsheetEvent(EventType type, CellAddress address, String batchId,
                             int operationCount, List<CellAddress> affectedCells) {
        this.type = type;
        this.timestamp = Instant.now();
        this.address = address;
        this.batchId = batchId;
        this.operationCount = operationCount;
        this.affectedCells = Collections.unmodifiableList(affectedCells);
    }

    public static SpreadsheetEvent cellUpdated(CellAddress address) {
        return new SpreadsheetEvent(EventType.CELL_UPDATED, address, null, 0, Collections.emptyList());
    }

    public static SpreadsheetEvent cellDeleted(CellAddress address) {
        return new SpreadsheetEvent(EventType.CELL_DELETED, address, null, 0, Collections.emptyList());
    }

    public static SpreadsheetEvent calculationCompleted(List<CellAddress> recalculated) {
        return new SpreadsheetEvent(EventType.CALCULATION_COMPLETED, null, null, 0, recalculated);
    }

    public static SpreadsheetEvent structureChanged(List<CellAddress> affected) {
        return new SpreadsheetEvent(EventType.STRUCTURE_CHANGED, null, null, 0, affected);
    }

    public static SpreadsheetEvent batchStarted(String batchId) {
        return new SpreadsheetEvent(EventType.BATCH_STARTED, null, batchId, 0, Collections.emptyList());
    }

    public static SpreadsheetEvent batchCompleted(String batchId, int operationCount, List<CellAddress> affected) {
        return new SpreadsheetEvent(EventType.BATCH_COMPLETED, null, batchId, operationCount, affected);
    }

    public EventType getType() {
        return type;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public CellAddress getAddress() {
        return address;
    }

    public String getBatchId() {
        return batchId;
    }

    public int getOperationCount() {
        return operationCount;
    }

    public List<CellAddress> getAffectedCells() {
        return affectedCells;
    }

    @Override
    public String toString() {
        return "SpreadsheetEvent{" + type
                + (address != null ? ", address=" + address : "")
                + (batchId != null ? ", batchId=" + batchId + ", operations=" + operationCount : "")
                + "}";
    }
}
