package com.spreadsheet.engine.models;

import com.spreadsheet.engine.fill.FillDirection;

/**
 * Body of POST /sheet/{id}/fill, e.g. { "source": "A1:A3", "target": "A4:A6", "direction": "down" }.
 */
public class FillRequest {
    private String source;
    private String target;
    private FillDirection direction;

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public String getTarget() {
        return target;
    }

    public void setTarget(String target) {
        this.target = target;
    }

    public FillDirection getDirection() {
        return direction;
    }

    public void setDirection(FillDirection direction) {
        this.direction = direction;
    }
}
