package com.excelgrid.app.models;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Outcome of writing one cell: where, what was written,
 * and what the cell now evaluates to.
 */
public class CellChange {
    private final CellAddress address;
    private final String rawValue;
    private final CellValue evaluatedValue;

    public CellChange(CellAddress address, String rawValue, CellValue evaluatedValue) {
        this.address = address;
        this.rawValue = rawValue;
        this.evaluatedValue = evaluatedValue;
    }

    public int getRow() {
        return address.getRow();
    }

    public int getCol() {
        return address.getCol();
    }

    // e.g. "B12"
    public String getRef() {
        return address.toLabel();
    }

    public String getRawValue() {
        return rawValue;
    }

    public CellValue getEvaluatedValue() {
        return evaluatedValue;
    }

    // Kept out of JSON; row/col/ref already describe it
    @JsonIgnore
    public CellAddress getAddress() {
        return address;
    }
}
