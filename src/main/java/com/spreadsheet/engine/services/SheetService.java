package com.spreadsheet.engine.services;

import com.spreadsheet.engine.batch.BatchOperation;
import com.spreadsheet.engine.config.EngineProperties;
import com.spreadsheet.engine.exceptions.InvalidOperationException;
import com.spreadsheet.engine.exceptions.SheetNotFoundException;
import com.spreadsheet.engine.fill.FillOperation;
import com.spreadsheet.engine.fill.FillResult;
import com.spreadsheet.engine.models.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Holds the named sheets and runs every request against a sheet's engine
 * under that sheet's lock: mutations take the write lock, reads the read lock.
 */
@Service
public class SheetService {

    private static final Logger logger = LoggerFactory.getLogger(SheetService.class);

    // All sheets live here in memory; there is no persistence
    private final Map<Long, Sheet> sheets = new ConcurrentHashMap<>();

    private final EngineProperties properties;

    public SheetService() {
        this(new EngineProperties());
    }

    @Autowired
    public SheetService(EngineProperties properties) {
        this.properties = properties;
    }

    /**
     * Creates a new empty Sheet and returns its ID.
     */
    public long createSheet(String name) {
        Sheet sheet = new Sheet(name == null ? properties.getSheetName() : name, properties);
        sheets.put(sheet.getId(), sheet);
        logger.info("Created sheet {} ({})", sheet.getId(), sheet.getName());
        return sheet.getId();
    }

    /**
     * Retrieves a Sheet by ID. Throws if not found.
     */
    public Sheet getSheet(long sheetId) {
        Sheet sheet = sheets.get(sheetId);
        if (sheet == null) {
            throw new SheetNotFoundException(sheetId);
        }
        return sheet;
    }

    /**
     * Sets a cell from raw text. A formula that fails to parse or evaluate
     * leaves the cell as it was and the exception reaches the controller.
     */
    public CellResponse setCell(long sheetId, String address, String rawText) {
        CellAddress cellAddress = parseAddress(address);
        return write(sheetId, engine -> new CellResponse(cellAddress, engine.setCell(cellAddress, rawText)));
    }

    public Optional<CellResponse> getCell(long sheetId, String address) {
        CellAddress cellAddress = parseAddress(address);
        return read(sheetId, engine -> engine.getCell(cellAddress).map(cell -> new CellResponse(cellAddress, cell)));
    }

    public boolean deleteCell(long sheetId, String address) {
        CellAddress cellAddress = parseAddress(address);
        return write(sheetId, engine -> engine.deleteCell(cellAddress));
    }

    /**
     * Returns { "A1": value, ... } for every cell, row-major.
     * Values are the computed results stored at write time.
     */
    public Map<String, Object> getSheetData(long sheetId) {
        return read(sheetId, engine -> {
            Map<String, Object> data = new LinkedHashMap<>();
            for (CellAddress address : engine.getCellAddresses()) {
                data.put(address.toA1(), engine.getValue(address).toJson());
            }
            return data;
        });
    }

    // ----------------------------------------------------------------
    // Structure
    // ----------------------------------------------------------------

    public List<String> insertRows(long sheetId, int index, int count) {
        return write(sheetId, engine -> toA1(engine.insertRows(index, count)));
    }

    public List<String> deleteRows(long sheetId, int index, int count) {
        return write(sheetId, engine -> toA1(engine.deleteRows(index, count)));
    }

    public List<String> insertColumns(long sheetId, int index, int count) {
        return write(sheetId, engine -> toA1(engine.insertColumns(index, count)));
    }

    public List<String> deleteColumns(long sheetId, int index, int count) {
        return write(sheetId, engine -> toA1(engine.deleteColumns(index, count)));
    }

    // ----------------------------------------------------------------
    // Fill, batch, undo
    // ----------------------------------------------------------------

    /**
     * Fills and returns the new value of every target cell.
     */
    public Map<String, Object> fill(long sheetId, FillRequest request) {
        FillOperation operation = toFillOperation(request);
        return write(sheetId, engine -> {
            FillResult result = engine.fill(operation);
            Map<String, Object> values = new LinkedHashMap<>();
            for (CellAddress address : operation.getTargetRange()) {
                if (result.getAffectedCells().containsKey(address) || result.getFormulasAdjusted().containsKey(address)) {
                    values.put(address.toA1(), engine.getValue(address).toJson());
                }
            }
            return values;
        });
    }

    /**
     * What a fill would write: a value, or for formula targets the adjusted formula text.
     */
    public Map<String, Object> previewFill(long sheetId, FillRequest request) {
        FillOperation operation = toFillOperation(request);
        return read(sheetId, engine -> {
            FillResult result = engine.preview(operation);
            Map<String, Object> preview = new TreeMap<>(Comparator.comparing(CellAddress::fromA1));
            for (Map.Entry<CellAddress, CellValue> entry : result.getAffectedCells().entrySet()) {
                preview.put(entry.getKey().toA1(), entry.getValue().toJson());
            }
            for (Map.Entry<CellAddress, String> entry : result.getFormulasAdjusted().entrySet()) {
                preview.put(entry.getKey().toA1(), entry.getValue());
            }
            return preview;
        });
    }

    /**
     * Applies the operations as one batch: a single recalculation and a single undo step.
     * If an operation is malformed nothing is applied.
     */
    public List<String> applyBatch(long sheetId, BatchRequest request) {
        List<BatchOperation> operations = new ArrayList<>();
        for (BatchRequest.Operation op : request.getOperations()) {
            operations.add(toBatchOperation(op));
        }
        return write(sheetId, engine -> {
            String batchId = engine.beginBatch();
            for (BatchOperation operation : operations) {
                engine.addToBatch(batchId, operation);
            }
            return toA1(engine.commitBatch(batchId));
        });
    }

    public Optional<String> undo(long sheetId) {
        return write(sheetId, SpreadsheetEngine::undo);
    }

    public Optional<String> redo(long sheetId) {
        return write(sheetId, SpreadsheetEngine::redo);
    }

    // ----------------------------------------------------------------
    // Dependency views
    // ----------------------------------------------------------------

    public Map<String, Set<String>> getForwardDependencies(long sheetId) {
        return read(sheetId, engine -> toA1(engine.getForwardDependencies()));
    }

    public Map<String, Set<String>> getReverseDependencies(long sheetId) {
        return read(sheetId, engine -> toA1(engine.getReverseDependencies()));
    }

    // ----------------------------------------------------------------
    // Internal Helpers (used within this service only)
    // ----------------------------------------------------------------

    private <T> T write(long sheetId, Function<SpreadsheetEngine, T> action) {
        Sheet sheet = getSheet(sheetId);
        // Prevent race conditions among multiple writers
        sheet.getLock().writeLock().lock();
        try {
            return action.apply(sheet.getEngine());
        } finally {
            sheet.getLock().writeLock().unlock();
        }
    }

    private <T> T read(long sheetId, Function<SpreadsheetEngine, T> action) {
        Sheet sheet = getSheet(sheetId);
        sheet.getLock().readLock().lock();
        try {
            return action.apply(sheet.getEngine());
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    // Paths are case-insensitive ("/cell/b2")
    private static CellAddress parseAddress(String address) {
        return CellAddress.fromA1(address.trim().toUpperCase(Locale.ROOT));
    }

    private static CellRange parseRange(String range) {
        if (range == null) {
            throw new InvalidOperationException("Missing range");
        }
        return CellRange.fromA1(range.trim().toUpperCase(Locale.ROOT));
    }

    private static FillOperation toFillOperation(FillRequest request) {
        return new FillOperation(parseRange(request.getSource()), parseRange(request.getTarget()),
                request.getDirection());
    }

    private static BatchOperation toBatchOperation(BatchRequest.Operation op) {
        if (op.getType() == null || op.getAddress() == null) {
            throw new InvalidOperationException("Batch operations need a type and an address");
        }
        switch (op.getType().toLowerCase(Locale.ROOT)) {
            case "set":
                return BatchOperation.setCell(parseAddress(op.getAddress()), op.getValue());
            case "delete":
                return BatchOperation.deleteCell(parseAddress(op.getAddress()));
            default:
                throw new InvalidOperationException("Unknown batch operation type: " + op.getType());
        }
    }

    private static List<String> toA1(List<CellAddress> addresses) {
        List<String> result = new ArrayList<>(addresses.size());
        for (CellAddress address : addresses) {
            result.add(address.toA1());
        }
        return result;
    }

    private static Map<String, Set<String>> toA1(Map<CellAddress, Set<CellAddress>> graph) {
        Map<String, Set<String>> result = new LinkedHashMap<>();
        for (Map.Entry<CellAddress, Set<CellAddress>> entry : graph.entrySet()) {
            Set<String> targets = new TreeSet<>(Comparator.comparing(CellAddress::fromA1));
            for (CellAddress target : entry.getValue()) {
                targets.add(target.toA1());
            }
            result.put(entry.getKey().toA1(), targets);
        }
        return result;
    }
}
