package com.excelgrid.app.models;

/**
 * Error sentinels a cell can evaluate to, with their display codes.
 */
public enum ErrorKind {
    GENERIC_ERROR("#ERROR"),
    CIRCULAR_REFERENCE("#CIRC");

    private final String code;

    ErrorKind(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
