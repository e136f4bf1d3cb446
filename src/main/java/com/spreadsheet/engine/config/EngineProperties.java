package com.spreadsheet.engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Engine settings, bound from "spreadsheet.engine.*" when running under Spring.
 * A plain instance (new EngineProperties()) carries the defaults.
 */
@ConfigurationProperties(prefix = "spreadsheet.engine")
public class EngineProperties {

    // References qualified with this name resolve to the session's own cells
    private String sheetName = "Sheet1";

    private int maxUndo = 100;

    private int maxRedo = 100;

    public String getSheetName() {
        return sheetName;
    }

    public void setSheetName(String sheetName) {
        this.sheetName = sheetName;
    }

    /**
     * A copy of these settings for one named sheet.
     */
    public EngineProperties forSheet(String name) {
        EngineProperties copy = new EngineProperties();
        copy.setSheetName(name);
        copy.setMaxUndo(maxUndo);
        copy.setMaxRedo(maxRedo);
        return copy;
    }

    public int getMaxUndo() {
        return maxUndo;
    }

    public void setMaxUndo(int maxUndo) {
        this.maxUndo = maxUndo;
    }

    public int getMaxRedo() {
        return maxRedo;
    }

    public void setMaxRedo(int maxRedo) {
        this.maxRedo = maxRedo;
    }
}
