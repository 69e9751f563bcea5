package com.excelgrid.app.models;

import java.util.List;

/**
 * Point-in-time copy of a grid's raw and evaluated matrices.
 * Independent of the engine's storage; mutating it changes nothing.
 */
public class GridSnapshot {
    private final List<List<String>> raw;
    private final List<List<CellValue>> evaluated;

    public GridSnapshot(List<List<String>> raw, List<List<CellValue>> evaluated) {
        this.raw = raw;
        this.evaluated = evaluated;
    }

    public List<List<String>> getRaw() {
        return raw;
    }

    public List<List<CellValue>> getEvaluated() {
        return evaluated;
    }
}
