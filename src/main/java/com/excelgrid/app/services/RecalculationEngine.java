package com.excelgrid.app.services;

import com.excelgrid.app.exceptions.FormulaException;
import com.excelgrid.app.exceptions.InvalidReferenceException;
import com.excelgrid.app.formula.CellAddressCodec;
import com.excelgrid.app.formula.FormulaEvaluator;
import com.excelgrid.app.models.CellAddress;
import com.excelgrid.app.models.CellChange;
import com.excelgrid.app.models.CellValue;
import com.excelgrid.app.models.DependencyGraph;
import com.excelgrid.app.models.Grid;
import com.excelgrid.app.models.GridSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Owns one grid and its dependency graph and keeps every evaluated
 * value consistent with the raw cells:
 * 1) a write replaces the raw cell and rebuilds the whole graph,
 * 2) the written cell is re-evaluated,
 * 3) every transitive dependent is re-evaluated in dependency order.
 *
 * Not thread-safe; callers serialize access (see getLock()).
 * A failure inside one cell never escapes: it becomes "#ERROR" or "#CIRC".
 */
public class RecalculationEngine {

    private static final Logger log = LoggerFactory.getLogger(RecalculationEngine.class);

    private final FormulaEvaluator formulaEvaluator;
    private final DependencyGraphBuilder graphBuilder;
    private final CycleDetector cycleDetector;
    private final List<CellChangeListener> listeners = new CopyOnWriteArrayList<>();

    // Lock for hosts that share this engine between threads
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private Grid grid;
    private DependencyGraph graph;

    public RecalculationEngine(int rows, int cols) {
        this(new Grid(rows, cols));
    }

    public RecalculationEngine(List<? extends List<String>> initialData) {
        this(Grid.fromRows(initialData));
    }

    public RecalculationEngine(Grid grid) {
        this(grid, new FormulaEvaluator(), new DependencyGraphBuilder(), new CycleDetector());
    }

    public RecalculationEngine(Grid grid, FormulaEvaluator formulaEvaluator,
                               DependencyGraphBuilder graphBuilder, CycleDetector cycleDetector) {
        this.formulaEvaluator = formulaEvaluator;
        this.graphBuilder = graphBuilder;
        this.cycleDetector = cycleDetector;
        this.grid = grid;
        rebuildGraph();
        evaluateAll();
    }

    public void addChangeListener(CellChangeListener listener) {
        listeners.add(listener);
    }

    // ----------------------------------------------------------------
    // Host operations
    // ----------------------------------------------------------------

    public CellChange setCellValue(String label, String rawValue) {
        return setCellValue(CellAddressCodec.parse(label), rawValue);
    }

    /**
     * Writes one raw cell, recalculates it and everything depending on it,
     * then notifies the change listeners.
     */
    public CellChange setCellValue(CellAddress address, String rawValue) {
        checkInGrid(address);
        grid.setRaw(address, rawValue);
        rebuildGraph();
        recalculateCell(address);

        CellChange change = new CellChange(address, grid.getRaw(address), grid.getEvaluated(address));
        for (CellChangeListener listener : listeners) {
            listener.onChange(change);
        }
        return change;
    }

    /**
     * Replaces the whole grid; dimensions follow the new data.
     */
    public void setData(List<? extends List<String>> rows) {
        grid = Grid.fromRows(rows);
        rebuildGraph();
        evaluateAll();
    }

    public GridSnapshot getData() {
        return new GridSnapshot(grid.copyRaw(), grid.copyEvaluated());
    }

    // ----------------------------------------------------------------
    // Evaluation
    // ----------------------------------------------------------------

    /**
     * Re-evaluates every cell, row by row.
     */
    public void evaluateAll() {
        grid.clearEvaluated();
        CyclePass pass = new CyclePass();
        for (CellAddress address : grid.addresses()) {
            ensureEvaluated(address, pass);
        }
    }

    /**
     * Re-evaluates 'address' and then its transitive dependents.
     * Dependents run in topological order of the affected cells; cells
     * caught in a cycle come last, in breadth-first discovery order.
     */
    public void recalculateCell(CellAddress address) {
        checkInGrid(address);
        List<CellAddress> dependents = collectDependents(address);

        grid.setEvaluated(address, null);
        for (CellAddress dependent : dependents) {
            grid.setEvaluated(dependent, null);
        }

        CyclePass pass = new CyclePass();
        ensureEvaluated(address, pass);
        for (CellAddress dependent : topologicalOrder(dependents)) {
            ensureEvaluated(dependent, pass);
        }
    }

    /**
     * Forgets the current value of 'address' and computes it again,
     * pulling in any referenced cell that is not evaluated yet.
     */
    public void evaluateCell(CellAddress address) {
        checkInGrid(address);
        grid.setEvaluated(address, null);
        ensureEvaluated(address, new CyclePass());
    }

    /**
     * Evaluates 'start' if it has no value yet. Referenced cells that have
     * no value either are evaluated first, using an explicit work stack.
     */
    private void ensureEvaluated(CellAddress start, CyclePass pass) {
        Deque<CellAddress> work = new ArrayDeque<>();
        work.push(start);

        while (!work.isEmpty()) {
            CellAddress cell = work.peek();
            if (grid.isEvaluated(cell)) {
                work.pop();
                continue;
            }

            String raw = grid.getRaw(cell);
            if (!FormulaEvaluator.isFormula(raw)) {
                grid.setEvaluated(cell, CellValue.fromLiteral(raw));
                work.pop();
                continue;
            }

            if (cycleDetector.hasCycle(graph, cell, pass.acyclic, pass.cyclic)) {
                log.debug("Circular reference at {}", cell);
                grid.setEvaluated(cell, CellValue.CIRCULAR_REFERENCE);
                work.pop();
                continue;
            }

            boolean waiting = false;
            for (CellAddress dependency : graph.getDependencies(cell)) {
                if (grid.contains(dependency) && !grid.isEvaluated(dependency)) {
                    work.push(dependency);
                    waiting = true;
                }
            }
            if (waiting) {
                continue;
            }

            grid.setEvaluated(cell, computeFormula(cell, raw));
            work.pop();
        }
    }

    private CellValue computeFormula(CellAddress cell, String formula) {
        try {
            double result = formulaEvaluator.evaluate(formula, this::resolve, grid.getRows(), grid.getCols());
            return CellValue.number(result);
        } catch (FormulaException e) {
            log.debug("Error evaluating cell {}: {}", cell, e.getMessage());
            return CellValue.GENERIC_ERROR;
        }
    }

    /**
     * Current value of a referenced cell, or null if the label
     * names no cell of this grid.
     */
    private CellValue resolve(String label) {
        CellAddress target;
        try {
            target = CellAddressCodec.parse(label);
        } catch (InvalidReferenceException e) {
            return null;
        }
        if (!grid.contains(target)) {
            return null;
        }
        if (!grid.isEvaluated(target)) {
            ensureEvaluated(target, new CyclePass());
        }
        return grid.getEvaluated(target);
    }

    // ----------------------------------------------------------------
    // Dependency helpers
    // ----------------------------------------------------------------

    private void rebuildGraph() {
        graph = graphBuilder.build(grid);
    }

    /**
     * Breadth-first walk over "used by" edges; every in-grid cell that
     * directly or indirectly reads 'start', excluding 'start' itself.
     */
    private List<CellAddress> collectDependents(CellAddress start) {
        Set<CellAddress> seen = new LinkedHashSet<>();
        Queue<CellAddress> queue = new ArrayDeque<>();
        queue.add(start);

        while (!queue.isEmpty()) {
            CellAddress current = queue.poll();
            for (CellAddress dependent : graph.getDependents(current)) {
                if (!dependent.equals(start) && grid.contains(dependent) && seen.add(dependent)) {
                    queue.add(dependent);
                }
            }
        }
        return new ArrayList<>(seen);
    }

    /**
     * Kahn's algorithm restricted to 'cells': a cell comes after every
     * other member of 'cells' it reads. Cells on a cycle never reach
     * in-degree zero and are appended in discovery order.
     */
    private List<CellAddress> topologicalOrder(List<CellAddress> cells) {
        Set<CellAddress> members = new HashSet<>(cells);
        Map<CellAddress, Integer> inDegree = new HashMap<>();
        for (CellAddress cell : cells) {
            int degree = 0;
            for (CellAddress dependency : graph.getDependencies(cell)) {
                if (members.contains(dependency)) {
                    degree++;
                }
            }
            inDegree.put(cell, degree);
        }

        Queue<CellAddress> ready = new ArrayDeque<>();
        for (CellAddress cell : cells) {
            if (inDegree.get(cell) == 0) {
                ready.add(cell);
            }
        }

        List<CellAddress> ordered = new ArrayList<>(cells.size());
        Set<CellAddress> placed = new HashSet<>();
        while (!ready.isEmpty()) {
            CellAddress cell = ready.poll();
            ordered.add(cell);
            placed.add(cell);
            for (CellAddress dependent : graph.getDependents(cell)) {
                if (members.contains(dependent) && inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }

        for (CellAddress cell : cells) {
            if (!placed.contains(cell)) {
                ordered.add(cell);
            }
        }
        return ordered;
    }

    /**
     * Cycle knowledge gathered during one evaluation pass over an unchanged graph.
     */
    private static final class CyclePass {
        private final Set<CellAddress> acyclic = new HashSet<>();
        private final Set<CellAddress> cyclic = new HashSet<>();
    }

    private void checkInGrid(CellAddress address) {
        if (!grid.contains(address)) {
            throw new InvalidReferenceException("Cell " + address + " is outside the "
                    + grid.getRows() + "x" + grid.getCols() + " grid");
        }
    }

    // ----------------------------------------------------------------
    // Accessors
    // ----------------------------------------------------------------

    public int getRows() {
        return grid.getRows();
    }

    public int getCols() {
        return grid.getCols();
    }

    public String getRaw(CellAddress address) {
        checkInGrid(address);
        return grid.getRaw(address);
    }

    public CellValue getEvaluated(CellAddress address) {
        checkInGrid(address);
        return grid.getEvaluated(address);
    }

    public DependencyGraph getDependencyGraph() {
        return graph;
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }
}
