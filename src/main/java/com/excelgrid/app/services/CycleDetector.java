package com.excelgrid.app.services;

import com.excelgrid.app.models.CellAddress;
import com.excelgrid.app.models.DependencyGraph;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Set;

/**
 * Depth-first search over forward edges looking for a back edge.
 * Uses an explicit stack, so long reference chains cannot overflow the call stack.
 */
public class CycleDetector {

    /**
     * True if some cycle is reachable from 'start', including one through 'start' itself.
     */
    public boolean hasCycle(DependencyGraph graph, CellAddress start) {
        return hasCycle(graph, start, new HashSet<>(), new HashSet<>());
    }

    /**
     * Same as {@link #hasCycle(DependencyGraph, CellAddress)}, sharing results
     * between calls on an unchanged graph:
     * 'acyclic' holds cells known to reach no cycle, 'cyclic' cells known to reach one.
     * Both sets are extended with what this search learns.
     */
    public boolean hasCycle(DependencyGraph graph, CellAddress start,
                            Set<CellAddress> acyclic, Set<CellAddress> cyclic) {
        if (cyclic.contains(start)) {
            return true;
        }
        if (acyclic.contains(start)) {
            return false;
        }

        Set<CellAddress> visited = new HashSet<>();
        Set<CellAddress> onPath = new HashSet<>();
        Deque<CellAddress> path = new ArrayDeque<>();
        Deque<Iterator<CellAddress>> pending = new ArrayDeque<>();

        visited.add(start);
        onPath.add(start);
        path.push(start);
        pending.push(graph.getDependencies(start).iterator());

        while (!pending.isEmpty()) {
            Iterator<CellAddress> neighbors = pending.peek();
            if (!neighbors.hasNext()) {
                pending.pop();
                onPath.remove(path.pop());
                continue;
            }
            CellAddress next = neighbors.next();
            if (onPath.contains(next) || cyclic.contains(next)) {
                // everything on the current path leads into the cycle
                cyclic.addAll(path);
                return true;
            }
            if (!acyclic.contains(next) && visited.add(next)) {
                onPath.add(next);
                path.push(next);
                pending.push(graph.getDependencies(next).iterator());
            }
        }
        acyclic.addAll(visited);
        return false;
    }
}
