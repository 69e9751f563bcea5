package com.excelgrid.app.controllers;

import com.excelgrid.app.models.CellChange;
import com.excelgrid.app.models.CreateGridRequest;
import com.excelgrid.app.models.GridSnapshot;
import com.excelgrid.app.services.GridService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST endpoints for formula grids.
 * "/grid" is the base path.
 */
@RestController
@RequestMapping("/grid")
public class GridController {

    @Autowired
    private GridService gridService;

    /**
     * POST /grid
     * Body: { "rows": 10, "cols": 10 } or { "data": [["1", "=A1*2"], ...] },
     * optionally "readOnly": true.
     * Creates and evaluates a grid, returns the gridId.
     */
    @PostMapping
    public ResponseEntity<Long> createGrid(@RequestBody CreateGridRequest request) {
        long gridId = gridService.createGrid(request);
        return ResponseEntity.ok(gridId);
    }

    /**
     * GET /grid/{gridId}
     * Returns { "raw": [[...]], "evaluated": [[...]] }.
     */
    @GetMapping("/{gridId}")
    public ResponseEntity<GridSnapshot> getGrid(@PathVariable long gridId) {
        return ResponseEntity.ok(gridService.getData(gridId));
    }

    /**
     * PUT /grid/{gridId}
     * Body: row-major raw cells. Replaces the whole grid.
     */
    @PutMapping("/{gridId}")
    public ResponseEntity<GridSnapshot> setData(@PathVariable long gridId,
                                                @RequestBody List<List<String>> rows) {
        return ResponseEntity.ok(gridService.setData(gridId, rows));
    }

    @DeleteMapping("/{gridId}")
    public ResponseEntity<Void> deleteGrid(@PathVariable long gridId) {
        gridService.deleteGrid(gridId);
        return ResponseEntity.noContent().build();
    }

    /**
     * PUT /grid/{gridId}/cell/{label}
     * Body: raw value as plain text (literal or "=formula"); empty clears the cell.
     * Returns the cell's ref, raw value and evaluated value after recalculation.
     */
    @PutMapping("/{gridId}/cell/{label}")
    public ResponseEntity<CellChange> setCellValue(
            @PathVariable long gridId,
            @PathVariable String label,
            @RequestBody(required = false) String rawValue
    ) {
        return ResponseEntity.ok(gridService.setCellValue(gridId, label, rawValue));
    }

    @GetMapping("/{gridId}/cell/{label}")
    public ResponseEntity<CellChange> getCell(@PathVariable long gridId, @PathVariable String label) {
        return ResponseEntity.ok(gridService.getCell(gridId, label));
    }

    /**
     * GET /grid/{gridId}/forwardDependencies
     * For each cell => the set of cells its formula references.
     */
    @GetMapping("/{gridId}/forwardDependencies")
    public ResponseEntity<Map<String, Set<String>>> getForwardDependencyGraph(@PathVariable long gridId) {
        return ResponseEntity.ok(gridService.getForwardDependencies(gridId));
    }

    /**
     * GET /grid/{gridId}/reverseDependencies
     * For each cell => the set of cells whose formulas reference it.
     */
    @GetMapping("/{gridId}/reverseDependencies")
    public ResponseEntity<Map<String, Set<String>>> getReverseDependencyGraph(@PathVariable long gridId) {
        return ResponseEntity.ok(gridService.getReverseDependencies(gridId));
    }
}
