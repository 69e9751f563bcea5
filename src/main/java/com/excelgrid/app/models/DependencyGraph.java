package com.excelgrid.app.models;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Forward and reverse reference adjacency between cells.
 * - forward: cell -> cells its formula reads
 * - reverse: cell -> cells whose formulas read it
 * Derived data: rebuilt whole after every grid mutation.
 */
public class DependencyGraph {

    private final Map<CellAddress, Set<CellAddress>> forward = new LinkedHashMap<>();
    private final Map<CellAddress, Set<CellAddress>> reverse = new LinkedHashMap<>();

    /**
     * Makes sure 'cell' has a (possibly empty) entry in both maps.
     */
    public void addCell(CellAddress cell) {
        forward.putIfAbsent(cell, new LinkedHashSet<>());
        reverse.putIfAbsent(cell, new LinkedHashSet<>());
    }

    /**
     * Records that 'source' reads 'target' (forward edge)
     * and that 'target' is used by 'source' (reverse edge).
     */
    public void addDependency(CellAddress source, CellAddress target) {
        forward.computeIfAbsent(source, k -> new LinkedHashSet<>()).add(target);
        forward.putIfAbsent(target, new LinkedHashSet<>());

        reverse.computeIfAbsent(target, k -> new LinkedHashSet<>()).add(source);
        reverse.putIfAbsent(source, new LinkedHashSet<>());
    }

    public Set<CellAddress> getDependencies(CellAddress cell) {
        return Collections.unmodifiableSet(forward.getOrDefault(cell, Collections.emptySet()));
    }

    public Set<CellAddress> getDependents(CellAddress cell) {
        return Collections.unmodifiableSet(reverse.getOrDefault(cell, Collections.emptySet()));
    }

    public boolean contains(CellAddress cell) {
        return forward.containsKey(cell) && reverse.containsKey(cell);
    }

    public Map<CellAddress, Set<CellAddress>> getForwardGraph() {
        return Collections.unmodifiableMap(forward);
    }

    public Map<CellAddress, Set<CellAddress>> getReverseGraph() {
        return Collections.unmodifiableMap(reverse);
    }
}
