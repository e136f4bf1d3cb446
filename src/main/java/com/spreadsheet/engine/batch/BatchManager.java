package com.spreadsheet.engine.batch;

import com.spreadsheet.engine.exceptions.BatchNotFoundException;
import com.spreadsheet.engine.exceptions.InvalidOperationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Buffers operations per open batch until it is committed or rolled back.
 */
public class BatchManager {

    private final Map<String, List<BatchOperation>> batches = new LinkedHashMap<>();
    private int nextId = 1;

    /**
     * Opens a batch.
     *
     * @param batchId the id to use, or null to generate one ("batch_N")
     * @return the id of the new batch
     */
    public String beginBatch(String batchId) {
        String id = batchId;
        if (id == null) {
            do {
                id = "batch_" + nextId++;
            } while (batches.containsKey(id));
        } else if (batches.containsKey(id)) {
            throw new InvalidOperationException("Batch already active: " + id);
        }
        batches.put(id, new ArrayList<>());
        return id;
    }

    public void addOperation(String batchId, BatchOperation operation) {
        require(batchId).add(operation);
    }

    /**
     * Closes the batch and hands back its operations in the order they were added.
     */
    public List<BatchOperation> takeOperations(String batchId) {
        List<BatchOperation> operations = require(batchId);
        batches.remove(batchId);
        return operations;
    }

    /**
     * Discards the batch without applying anything.
     */
    public void rollbackBatch(String batchId) {
        require(batchId);
        batches.remove(batchId);
    }

    public boolean hasBatch(String batchId) {
        return batches.containsKey(batchId);
    }

    public int operationCount(String batchId) {
        return require(batchId).size();
    }

    public Set<String> activeBatchIds() {
        return Collections.unmodifiableSet(batches.keySet());
    }

    private List<BatchOperation> require(String batchId) {
        List<BatchOperation> operations = batches.get(batchId);
        if (operations == null) {
            throw new BatchNotFoundException(batchId);
        }
        return operations;
    }
}
