package com.excelgrid.app.services;

import com.excelgrid.app.models.CellChange;

/**
 * Host callback, invoked after every single-cell write has been
 * fully recalculated.
 */
@FunctionalInterface
public interface CellChangeListener {
    void onChange(CellChange change);
}
