package com.excelgrid.app.services;

import com.excelgrid.app.exceptions.FormulaException;
import com.excelgrid.app.exceptions.InvalidReferenceException;
import com.excelgrid.app.formula.CellAddressCodec;
import com.excelgrid.app.formula.FormulaEvaluator;
import com.excelgrid.app.formula.SumFunction;
import com.excelgrid.app.formula.Token;
import com.excelgrid.app.formula.TokenType;
import com.excelgrid.app.formula.Tokenizer;
import com.excelgrid.app.models.CellAddress;
import com.excelgrid.app.models.CellRange;
import com.excelgrid.app.models.DependencyGraph;
import com.excelgrid.app.models.Grid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Scans every formula cell of a grid and records which cells it reads.
 * A formula that fails to tokenize simply contributes no edges.
 */
public class DependencyGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    private final Tokenizer tokenizer;
    private final SumFunction sumFunction;

    public DependencyGraphBuilder() {
        this(new Tokenizer(), new SumFunction());
    }

    public DependencyGraphBuilder(Tokenizer tokenizer, SumFunction sumFunction) {
        this.tokenizer = tokenizer;
        this.sumFunction = sumFunction;
    }

    public DependencyGraph build(Grid grid) {
        DependencyGraph graph = new DependencyGraph();
        List<CellAddress> addresses = grid.addresses();
        for (CellAddress cell : addresses) {
            graph.addCell(cell);
        }

        for (CellAddress cell : addresses) {
            String raw = grid.getRaw(cell);
            if (!FormulaEvaluator.isFormula(raw)) {
                continue;
            }
            try {
                for (CellAddress target : references(raw.substring(1), grid)) {
                    graph.addDependency(cell, target);
                }
            } catch (FormulaException e) {
                log.trace("No dependencies recorded for {}: {}", cell, e.getMessage());
            }
        }
        return graph;
    }

    /**
     * Cells read by a formula body. A whole-formula SUM reads every
     * in-grid cell of its range; otherwise each in-grid cell reference token counts.
     */
    private List<CellAddress> references(String body, Grid grid) {
        Optional<CellRange> range = sumFunction.matchRange(body);
        if (range.isPresent()) {
            return range.get().addressesWithin(grid.getRows(), grid.getCols());
        }

        List<CellAddress> targets = new ArrayList<>();
        for (Token token : tokenizer.tokenize(body)) {
            if (token.getType() != TokenType.CELL_REF) {
                continue;
            }
            try {
                CellAddress target = CellAddressCodec.parse(token.getText());
                if (grid.contains(target)) {
                    targets.add(target);
                }
            } catch (InvalidReferenceException e) {
                // e.g. "A0": never resolvable, so it cannot take part in a cycle
                log.trace("Ignoring reference {}: {}", token.getText(), e.getMessage());
            }
        }
        return targets;
    }
}
