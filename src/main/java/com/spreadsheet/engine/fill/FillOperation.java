package com.spreadsheet.engine.fill;

import com.spreadsheet.engine.models.CellRange;

/**
 * Fill request: extend the source range's values into the target range.
 * When no pattern is given, one is detected per lane.
 */
public class FillOperation {

    private final CellRange sourceRange;
    private final CellRange targetRange;
    private final FillDirection direction;
    private final PatternType pattern;

    public FillOperation(CellRange sourceRange, CellRange targetRange, FillDirection direction) {
        this(sourceRange, targetRange, direction, null);
    }

    public FillOperation(CellRange sourceRange, CellRange targetRange, FillDirection direction,
                         PatternType pattern) {
        this.sourceRange = sourceRange;
        this.targetRange = targetRange;
        this.direction = direction;
        this.pattern = pattern;
    }

    public CellRange getSourceRange() {
        return sourceRange;
    }

    public CellRange getTargetRange() {
        return targetRange;
    }

    public FillDirection getDirection() {
        return direction;
    }

    /**
     * @return the forced pattern, or null to detect one
     */
    public PatternType getPattern() {
        return pattern;
    }
}
