package com.spreadsheet.engine.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Delivers events to registered listeners in registration order.
 * A failing listener is logged and skipped; it never aborts the engine operation.
 */
public class EventDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(EventDispatcher.class);

    private final List<SpreadsheetEventListener> listeners = new CopyOnWriteArrayList<>();

    public void addListener(SpreadsheetEventListener listener) {
        listeners.add(listener);
    }

    public void removeListener(SpreadsheetEventListener listener) {
        listeners.remove(listener);
    }

    public void dispatch(SpreadsheetEvent event) {
        logger.debug("Dispatching {}", event);
        for (SpreadsheetEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException ex) {
                logger.warn("Listener {} failed on {}", listener, event, ex);
            }
        }
    }
}
