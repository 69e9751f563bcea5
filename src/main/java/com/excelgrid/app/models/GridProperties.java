package com.excelgrid.app.models;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Grid sizing settings, bound from "excelgrid.*" properties.
 * Defaults mirror a fresh 10x10 grid.
 */
@ConfigurationProperties(prefix = "excelgrid")
public class GridProperties {

    private int defaultRows = 10;
    private int defaultCols = 10;
    // 702 columns covers "A".."ZZ"
    private int maxRows = 1000;
    private int maxCols = 702;

    public int getDefaultRows() {
        return defaultRows;
    }
    public void setDefaultRows(int defaultRows) {
        this.defaultRows = defaultRows;
    }

    public int getDefaultCols() {
        return defaultCols;
    }
    public void setDefaultCols(int defaultCols) {
        this.defaultCols = defaultCols;
    }

    public int getMaxRows() {
        return maxRows;
    }
    public void setMaxRows(int maxRows) {
        this.maxRows = maxRows;
    }

    public int getMaxCols() {
        return maxCols;
    }
    public void setMaxCols(int maxCols) {
        this.maxCols = maxCols;
    }
}
