package com.excelgrid.app.services;

import com.excelgrid.app.exceptions.GridNotFoundException;
import com.excelgrid.app.exceptions.GridReadOnlyException;
import com.excelgrid.app.exceptions.InvalidGridException;
import com.excelgrid.app.formula.CellAddressCodec;
import com.excelgrid.app.models.CellAddress;
import com.excelgrid.app.models.CellChange;
import com.excelgrid.app.models.CreateGridRequest;
import com.excelgrid.app.models.GridProperties;
import com.excelgrid.app.models.GridSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps the in-memory grids of the host and routes every read and
 * write to the grid's RecalculationEngine under that grid's lock.
 */
@Service
public class GridService {

    private static final Logger log = LoggerFactory.getLogger(GridService.class);

    // Generates unique IDs for newly created grids
    private final AtomicLong idGenerator = new AtomicLong(1);

    // All grids live here in memory; nothing is persisted
    private final Map<Long, ManagedGrid> grids = new ConcurrentHashMap<>();

    private final GridProperties properties;

    public GridService(GridProperties properties) {
        this.properties = properties;
    }

    /**
     * Creates a grid from initial data, or from rows/cols (defaults from
     * configuration when absent). Returns the new grid's ID.
     */
    public long createGrid(CreateGridRequest request) {
        RecalculationEngine engine;
        if (request.getData() != null) {
            checkData(request.getData());
            engine = new RecalculationEngine(request.getData());
        } else {
            int rows = request.getRows() != null ? request.getRows() : properties.getDefaultRows();
            int cols = request.getCols() != null ? request.getCols() : properties.getDefaultCols();
            checkDimensions(rows, cols);
            engine = new RecalculationEngine(rows, cols);
        }

        long id = idGenerator.getAndIncrement();
        engine.addChangeListener(change -> log.debug("Grid {}: {} <- '{}' = {}",
                id, change.getRef(), change.getRawValue(), change.getEvaluatedValue()));
        grids.put(id, new ManagedGrid(engine, request.isReadOnly()));

        log.info("Created grid {} ({}x{}{})", id, engine.getRows(), engine.getCols(),
                request.isReadOnly() ? ", read-only" : "");
        return id;
    }

    /**
     * Retrieves a grid's engine by ID. Throws if not found.
     */
    public RecalculationEngine getEngine(long gridId) {
        return getManaged(gridId).engine;
    }

    public void deleteGrid(long gridId) {
        if (grids.remove(gridId) == null) {
            throw new GridNotFoundException("Grid not found: " + gridId);
        }
        log.info("Deleted grid {}", gridId);
    }

    /**
     * Writes one cell (label like "B3") and returns the resulting change.
     */
    public CellChange setCellValue(long gridId, String label, String rawValue) {
        ManagedGrid managed = getWritable(gridId);
        CellAddress address = CellAddressCodec.parse(label);

        managed.engine.getLock().writeLock().lock();
        try {
            return managed.engine.setCellValue(address, rawValue == null ? "" : rawValue);
        } finally {
            managed.engine.getLock().writeLock().unlock();
        }
    }

    public CellChange getCell(long gridId, String label) {
        RecalculationEngine engine = getEngine(gridId);
        CellAddress address = CellAddressCodec.parse(label);

        engine.getLock().readLock().lock();
        try {
            return new CellChange(address, engine.getRaw(address), engine.getEvaluated(address));
        } finally {
            engine.getLock().readLock().unlock();
        }
    }

    public GridSnapshot getData(long gridId) {
        RecalculationEngine engine = getEngine(gridId);

        engine.getLock().readLock().lock();
        try {
            return engine.getData();
        } finally {
            engine.getLock().readLock().unlock();
        }
    }

    /**
     * Replaces every cell of the grid and re-evaluates from scratch.
     */
    public GridSnapshot setData(long gridId, List<List<String>> rows) {
        ManagedGrid managed = getWritable(gridId);
        checkData(rows);

        managed.engine.getLock().writeLock().lock();
        try {
            managed.engine.setData(rows);
            log.info("Replaced data of grid {} ({}x{})", gridId,
                    managed.engine.getRows(), managed.engine.getCols());
            return managed.engine.getData();
        } finally {
            managed.engine.getLock().writeLock().unlock();
        }
    }

    /**
     * Forward graph by label: cell -> cells its formula reads.
     */
    public Map<String, Set<String>> getForwardDependencies(long gridId) {
        RecalculationEngine engine = getEngine(gridId);

        engine.getLock().readLock().lock();
        try {
            return toLabels(engine.getDependencyGraph().getForwardGraph());
        } finally {
            engine.getLock().readLock().unlock();
        }
    }

    /**
     * Reverse graph by label: cell -> cells whose formulas read it.
     */
    public Map<String, Set<String>> getReverseDependencies(long gridId) {
        RecalculationEngine engine = getEngine(gridId);

        engine.getLock().readLock().lock();
        try {
            return toLabels(engine.getDependencyGraph().getReverseGraph());
        } finally {
            engine.getLock().readLock().unlock();
        }
    }

    // ----------------------------------------------------------------
    // Internal Helpers (used within this service only)
    // ----------------------------------------------------------------

    private ManagedGrid getManaged(long gridId) {
        ManagedGrid managed = grids.get(gridId);
        if (managed == null) {
            throw new GridNotFoundException("Grid not found: " + gridId);
        }
        return managed;
    }

    private ManagedGrid getWritable(long gridId) {
        ManagedGrid managed = getManaged(gridId);
        if (managed.readOnly) {
            throw new GridReadOnlyException("Grid " + gridId + " is read-only");
        }
        return managed;
    }

    private void checkDimensions(int rows, int cols) {
        if (rows < 0 || cols < 0) {
            throw new InvalidGridException("Grid dimensions must not be negative: " + rows + "x" + cols);
        }
        if (rows > properties.getMaxRows() || cols > properties.getMaxCols()) {
            throw new InvalidGridException("Grid " + rows + "x" + cols + " exceeds the maximum of "
                    + properties.getMaxRows() + "x" + properties.getMaxCols());
        }
    }

    private void checkData(List<List<String>> rows) {
        if (rows == null) {
            throw new InvalidGridException("Grid data is missing");
        }
        int width = 0;
        for (List<String> row : rows) {
            width = Math.max(width, row == null ? 0 : row.size());
        }
        checkDimensions(rows.size(), width);
    }

    private Map<String, Set<String>> toLabels(Map<CellAddress, Set<CellAddress>> graph) {
        Map<String, Set<String>> labels = new LinkedHashMap<>();
        for (Map.Entry<CellAddress, Set<CellAddress>> entry : graph.entrySet()) {
            Set<String> targets = new LinkedHashSet<>();
            for (CellAddress target : entry.getValue()) {
                targets.add(target.toLabel());
            }
            labels.put(entry.getKey().toLabel(), targets);
        }
        return labels;
    }

    private static final class ManagedGrid {
        private final RecalculationEngine engine;
        private final boolean readOnly;

        private ManagedGrid(RecalculationEngine engine, boolean readOnly) {
            this.engine = engine;
            this.readOnly = readOnly;
        }
    }
}
