package com.excelgrid.app.models;

import java.util.List;

/**
 * Body of POST /grid. Either explicit dimensions or initial row-major data;
 * when data is given, rows/cols are ignored.
 */
public class CreateGridRequest {
    private Integer rows;
    private Integer cols;
    private List<List<String>> data;
    private boolean readOnly;

    // Default constructor needed for JSON deserialization
    public CreateGridRequest() {
    }

    public CreateGridRequest(Integer rows, Integer cols) {
        this.rows = rows;
        this.cols = cols;
    }

    public static CreateGridRequest withData(List<List<String>> data) {
        CreateGridRequest request = new CreateGridRequest();
        request.setData(data);
        return request;
    }

    public Integer getRows() {
        return rows;
    }
    public Integer getCols() {
        return cols;
    }
    public List<List<String>> getData() {
        return data;
    }
    public boolean isReadOnly() {
        return readOnly;
    }

    public void setRows(Integer rows) {
        this.rows = rows;
    }
    public void setCols(Integer cols) {
        this.cols = cols;
    }
    public void setData(List<List<String>> data) {
        this.data = data;
    }
    public void setReadOnly(boolean readOnly) {
        this.readOnly = readOnly;
    }
}
