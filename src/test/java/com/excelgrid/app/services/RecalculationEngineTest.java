package com.excelgrid.app.services;

import com.excelgrid.app.exceptions.InvalidReferenceException;
import com.excelgrid.app.formula.CellAddressCodec;
import com.excelgrid.app.formula.CellResolver;
import com.excelgrid.app.formula.FormulaEvaluator;
import com.excelgrid.app.models.CellAddress;
import com.excelgrid.app.models.CellChange;
import com.excelgrid.app.models.CellValue;
import com.excelgrid.app.models.Grid;
import com.excelgrid.app.models.GridSnapshot;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Recalculation behavior of a single engine, no Spring context.
 */
class RecalculationEngineTest {

    private static CellAddress cell(String label) {
        return CellAddressCodec.parse(label);
    }

    private static CellValue value(RecalculationEngine engine, String label) {
        return engine.getEvaluated(cell(label));
    }

    private static RecalculationEngine singleRow(String... cells) {
        return new RecalculationEngine(List.of(List.of(cells)));
    }

    /**
     * Counts how often formulas reach the evaluator.
     */
    private static class CountingEvaluator extends FormulaEvaluator {
        final List<String> evaluated = new ArrayList<>();

        @Override
        public double evaluate(String formula, CellResolver resolver, int rows, int cols) {
            evaluated.add(formula);
            return super.evaluate(formula, resolver, rows, cols);
        }
    }

    @Test
    void testEmptyGridIsBlank() {
        RecalculationEngine engine = new RecalculationEngine(10, 10);
        assertEquals(10, engine.getRows());
        assertEquals(10, engine.getCols());
        assertEquals(CellValue.BLANK, value(engine, "J10"));
    }

    @Test
    void testArithmeticFormulas() {
        RecalculationEngine engine = singleRow("=2+2", "=10-5", "=3*4", "=15/3", "=15/0");
        assertEquals(CellValue.number(4), value(engine, "A1"));
        assertEquals(CellValue.number(5), value(engine, "B1"));
        assertEquals(CellValue.number(12), value(engine, "C1"));
        assertEquals(CellValue.number(5), value(engine, "D1"));
        assertEquals(CellValue.GENERIC_ERROR, value(engine, "E1"));
    }

    @Test
    void testPrecedenceAndGrouping() {
        RecalculationEngine engine = singleRow("=2+3*4", "=(2+3)*4");
        assertEquals(CellValue.number(14), value(engine, "A1"));
        assertEquals(CellValue.number(20), value(engine, "B1"));
    }

    @Test
    void testLiteralsAreCopiedVerbatim() {
        RecalculationEngine engine = singleRow("7", "hello", "", "#CIRC");
        assertEquals(CellValue.number(7), value(engine, "A1"));
        assertEquals(CellValue.text("hello"), value(engine, "B1"));
        assertEquals(CellValue.BLANK, value(engine, "C1"));
        assertEquals(CellValue.text("#CIRC"), value(engine, "D1"));
    }

    /**
     * B1 reads A1; writing A1 updates B1 without touching B1.
     */
    @Test
    void testReferencePropagation() {
        RecalculationEngine engine = singleRow("2", "=A1*3");
        assertEquals(CellValue.number(6), value(engine, "B1"));

        engine.setCellValue("A1", "5");
        assertEquals(CellValue.number(15), value(engine, "B1"));
        assertEquals("=A1*3", engine.getRaw(cell("B1")));
    }

    /**
     * Formulas that read cells further right or down are evaluated on demand.
     */
    @Test
    void testForwardReferencesOnInitialLoad() {
        RecalculationEngine engine = singleRow("=B1+C1", "=C1*2", "4");
        assertEquals(CellValue.number(12), value(engine, "A1"));
        assertEquals(CellValue.number(8), value(engine, "B1"));
    }

    @Test
    void testTransitivePropagation() {
        RecalculationEngine engine = singleRow("1", "=A1+1", "=B1+1", "=C1+1");
        engine.setCellValue("A1", "10");
        assertEquals(CellValue.number(13), value(engine, "D1"));
    }

    /**
     * A1 feeds B1 and C1, D1 reads both; each cell is evaluated once per change.
     */
    @Test
    void testDiamondEvaluatesEachDependentOnce() {
        CountingEvaluator evaluator = new CountingEvaluator();
        RecalculationEngine engine = new RecalculationEngine(
                Grid.fromRows(List.of(List.of("=B1+C1", "=D1*2", "=D1*3", "1"))),
                evaluator, new DependencyGraphBuilder(), new CycleDetector());
        assertEquals(CellValue.number(5), value(engine, "A1"));

        evaluator.evaluated.clear();
        engine.setCellValue("D1", "2");
        assertEquals(CellValue.number(10), value(engine, "A1"));
        assertEquals(3, evaluator.evaluated.size());
        assertEquals("=B1+C1", evaluator.evaluated.get(2));
    }

    @Test
    void testTwoCellCycleNeverReachesEvaluator() {
        CountingEvaluator evaluator = new CountingEvaluator();
        RecalculationEngine engine = new RecalculationEngine(
                Grid.fromRows(List.of(List.of("=B1", "=A1"))),
                evaluator, new DependencyGraphBuilder(), new CycleDetector());

        assertEquals(CellValue.CIRCULAR_REFERENCE, value(engine, "A1"));
        assertEquals(CellValue.CIRCULAR_REFERENCE, value(engine, "B1"));
        assertTrue(evaluator.evaluated.isEmpty());
    }

    @Test
    void testSelfReferenceIsCircular() {
        RecalculationEngine engine = singleRow("=A1+1");
        assertEquals(CellValue.CIRCULAR_REFERENCE, value(engine, "A1"));
    }

    @Test
    void testBreakingACycleRecovers() {
        RecalculationEngine engine = singleRow("=B1", "=A1", "=A1*2");
        assertEquals(CellValue.CIRCULAR_REFERENCE, value(engine, "C1"));

        engine.setCellValue("B1", "4");
        assertEquals(CellValue.number(4), value(engine, "A1"));
        assertEquals(CellValue.number(8), value(engine, "C1"));
    }

    @Test
    void testErrorContagion() {
        RecalculationEngine engine = singleRow("=1/0", "=A1+1", "=B1*2");
        assertEquals(CellValue.GENERIC_ERROR, value(engine, "A1"));
        assertEquals(CellValue.GENERIC_ERROR, value(engine, "B1"));
        assertEquals(CellValue.GENERIC_ERROR, value(engine, "C1"));

        engine.setCellValue("A1", "1");
        assertEquals(CellValue.number(4), value(engine, "C1"));
    }

    @Test
    void testTextOperandIsAnError() {
        RecalculationEngine engine = singleRow("abc", "=A1+1");
        assertEquals(CellValue.GENERIC_ERROR, value(engine, "B1"));
    }

    @Test
    void testSyntaxErrorsBecomeErrors() {
        RecalculationEngine engine = singleRow("=2+", "=(1+2", "=1 $ 2", "=-5");
        assertEquals(CellValue.GENERIC_ERROR, value(engine, "A1"));
        assertEquals(CellValue.GENERIC_ERROR, value(engine, "B1"));
        assertEquals(CellValue.GENERIC_ERROR, value(engine, "C1"));
        assertEquals(CellValue.GENERIC_ERROR, value(engine, "D1"));
    }

    @Test
    void testSumRange() {
        RecalculationEngine engine = new RecalculationEngine(10, 10);
        engine.setCellValue("D2", "10");
        engine.setCellValue("D3", "20");
        engine.setCellValue("D4", "30");
        CellChange change = engine.setCellValue("D5", "=SUM(D2:D4)");
        assertEquals(CellValue.number(60), change.getEvaluatedValue());

        engine.setCellValue("D3", "text");
        assertEquals(CellValue.number(40), value(engine, "D5"));

        engine.setCellValue("D3", "");
        engine.setCellValue("D4", "=1/0");
        assertEquals(CellValue.number(10), value(engine, "D5"));
    }

    @Test
    void testSumOverItsOwnCellIsCircular() {
        RecalculationEngine engine = new RecalculationEngine(5, 1);
        engine.setCellValue("A1", "1");
        engine.setCellValue("A5", "=SUM(A1:A5)");
        assertEquals(CellValue.CIRCULAR_REFERENCE, value(engine, "A5"));
    }

    @Test
    void testSumOfBlankRangeIsZero() {
        RecalculationEngine engine = new RecalculationEngine(3, 3);
        engine.setCellValue("C3", "=SUM(A1:B2)");
        assertEquals(CellValue.number(0), value(engine, "C3"));
    }

    /**
     * A range reaching far past the grid edge only reads the cells the grid has.
     */
    @Test
    void testHugeSumRangeOnSmallGrid() {
        RecalculationEngine engine = new RecalculationEngine(10, 10);
        engine.setCellValue("B1", "4");
        engine.setCellValue("J10", "6");

        CellChange change = assertTimeoutPreemptively(Duration.ofSeconds(10),
                () -> engine.setCellValue("A1", "=SUM(B1:ZZ200000)"));
        assertEquals(CellValue.number(10), change.getEvaluatedValue());

        engine.setCellValue("C5", "5");
        assertEquals(CellValue.number(15), value(engine, "A1"));
    }

    @Test
    void testOutOfRangeReferenceIsAnError() {
        RecalculationEngine engine = new RecalculationEngine(10, 10);
        CellChange change = engine.setCellValue("A1", "=Z9999");
        assertEquals(CellValue.GENERIC_ERROR, change.getEvaluatedValue());
    }

    @Test
    void testIdempotentWrites() {
        RecalculationEngine engine = singleRow("3", "=A1*A1");
        CellChange first = engine.setCellValue("B1", "=A1*A1+1");
        GridSnapshot afterFirst = engine.getData();
        CellChange second = engine.setCellValue("B1", "=A1*A1+1");

        assertEquals(first.getEvaluatedValue(), second.getEvaluatedValue());
        assertEquals(first.getRawValue(), second.getRawValue());
        assertEquals(afterFirst.getEvaluated(), engine.getData().getEvaluated());
    }

    @Test
    void testListenerReceivesEachChange() {
        RecalculationEngine engine = singleRow("1", "=A1+1");
        List<CellChange> changes = new ArrayList<>();
        engine.addChangeListener(changes::add);

        engine.setCellValue("A1", "=2*3");
        assertEquals(1, changes.size());
        CellChange change = changes.get(0);
        assertEquals("A1", change.getRef());
        assertEquals(0, change.getRow());
        assertEquals(0, change.getCol());
        assertEquals("=2*3", change.getRawValue());
        assertEquals(CellValue.number(6), change.getEvaluatedValue());
        assertEquals(CellValue.number(7), value(engine, "B1"));
    }

    @Test
    void testWritingOutsideGridFails() {
        RecalculationEngine engine = new RecalculationEngine(2, 2);
        assertThrows(InvalidReferenceException.class, () -> engine.setCellValue("C1", "1"));
        assertThrows(InvalidReferenceException.class, () -> engine.setCellValue("c1", "1"));
    }

    @Test
    void testSnapshotIsDefensiveCopy() {
        RecalculationEngine engine = singleRow("1", "=A1+1");
        GridSnapshot snapshot = engine.getData();
        snapshot.getRaw().get(0).set(0, "100");
        snapshot.getEvaluated().get(0).set(1, CellValue.GENERIC_ERROR);

        assertEquals("1", engine.getRaw(cell("A1")));
        assertEquals(CellValue.number(2), value(engine, "B1"));
    }

    @Test
    void testSetDataReplacesGrid() {
        RecalculationEngine engine = new RecalculationEngine(10, 10);
        engine.setCellValue("A1", "99");

        engine.setData(List.of(
                List.of("1", "2"),
                List.of("=A1+B1", "=SUM(A1:B2)")
        ));
        GridSnapshot snapshot = engine.getData();
        assertEquals(2, snapshot.getRaw().size());
        assertEquals(2, snapshot.getEvaluated().get(0).size());
        assertEquals(CellValue.number(3), snapshot.getEvaluated().get(1).get(0));
        // B2 sums a range containing itself
        assertEquals(CellValue.CIRCULAR_REFERENCE, snapshot.getEvaluated().get(1).get(1));
    }

    /**
     * Raw and evaluated matrices keep the same shape after every operation.
     */
    @Test
    void testDimensionsStayInSync() {
        RecalculationEngine engine = new RecalculationEngine(List.of(
                List.of("1"),
                List.of("2", "3", "=A1")
        ));
        GridSnapshot snapshot = engine.getData();
        assertEquals(snapshot.getRaw().size(), snapshot.getEvaluated().size());
        for (int r = 0; r < snapshot.getRaw().size(); r++) {
            assertEquals(3, snapshot.getRaw().get(r).size());
            assertEquals(3, snapshot.getEvaluated().get(r).size());
        }
    }

    @Test
    void testLongChainRecalculates() {
        int rows = 20_000;
        RecalculationEngine engine = new RecalculationEngine(rows, 1);
        List<List<String>> data = new ArrayList<>();
        // each row reads the row below it, so evaluation starts at the deepest end
        for (int r = 0; r < rows - 1; r++) {
            data.add(List.of("=A" + (r + 2) + "+1"));
        }
        data.add(List.of("0"));
        engine.setData(data);
        assertEquals(CellValue.number(rows - 1), value(engine, "A1"));

        engine.setCellValue("A" + rows, "1");
        assertEquals(CellValue.number(rows), value(engine, "A1"));
    }
}
