package com.spreadsheet.engine.models;

import com.spreadsheet.engine.config.EngineProperties;
import com.spreadsheet.engine.services.SpreadsheetEngine;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A named spreadsheet held by the HTTP service:
 * - Has a unique ID
 * - Owns one engine session (cells, formulas, dependencies, undo history)
 * - A read/write lock, since the engine itself assumes exclusive access
 */
public class Sheet {

    // Generates unique IDs for newly created sheets
    private static final AtomicLong ID_GENERATOR = new AtomicLong(1);

    private final long id;
    private final String name;
    private final SpreadsheetEngine engine;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Sheet(String name, EngineProperties properties) {
        this.id = ID_GENERATOR.getAndIncrement();
        this.name = name;
        this.engine = new SpreadsheetEngine(properties.forSheet(name));
    }

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public SpreadsheetEngine getEngine() {
        return engine;
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }
}
