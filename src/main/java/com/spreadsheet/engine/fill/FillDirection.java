package com.spreadsheet.engine.fill;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.spreadsheet.engine.exceptions.InvalidOperationException;

public enum FillDirection {
    UP,
    DOWN,
    LEFT,
    RIGHT;

    @JsonCreator
    public static FillDirection fromValue(String value) {
        for (FillDirection direction : values()) {
            if (direction.name().equalsIgnoreCase(value)) {
                return direction;
            }
        }
        throw new InvalidOperationException("Invalid fill direction: " + value);
    }

    /**
     * Whether lanes run down columns (UP/DOWN) rather than along rows.
     */
    public boolean isVertical() {
        return this == UP || this == DOWN;
    }

    /**
     * Whether the fill moves towards lower row/column indexes.
     */
    public boolean isReversed() {
        return this == UP || this == LEFT;
    }
}
