package com.spreadsheet.engine.models;

/**
 * JSON view of one cell: { "address": "B2", "rawText": "=A1*2", "value": 84, "display": "84" }.
 */
public class CellResponse {
    private String address;
    private String rawText;
    private CellValue value;
    private String display;

    public CellResponse() {
    }

    public CellResponse(CellAddress address, Cell cell) {
        this.address = address.toA1();
        this.rawText = cell.getRawText();
        this.value = cell.getComputedValue();
        this.display = cell.getComputedValue().toDisplayString();
    }

    public String getAddress() {
        return address;
    }

    public String getRawText() {
        return rawText;
    }

    public CellValue getValue() {
        return value;
    }

    public String getDisplay() {
        return display;
    }
}
