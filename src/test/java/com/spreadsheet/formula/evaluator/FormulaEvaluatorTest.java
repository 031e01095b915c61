package com.spreadsheet.formula.evaluator;

import com.spreadsheet.formula.exceptions.CircularReferenceException;
import com.spreadsheet.formula.exceptions.DivisionByZeroException;
import com.spreadsheet.formula.exceptions.EvaluationDepthExceededException;
import com.spreadsheet.formula.exceptions.FormulaParseException;
import com.spreadsheet.formula.exceptions.InvalidRangeUsageException;
import com.spreadsheet.formula.exceptions.UnknownFunctionException;
import com.spreadsheet.formula.functions.FunctionRegistry;
import com.spreadsheet.formula.models.Cell;
import com.spreadsheet.formula.models.CellReference;
import com.spreadsheet.formula.models.CellValue;
import com.spreadsheet.formula.models.Sheet;
import com.spreadsheet.formula.parser.FormulaParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Evaluator tests against an in-memory sheet (no Spring context).
 */
class FormulaEvaluatorTest {

    private FormulaEvaluator evaluator;
    private Sheet sheet;

    @BeforeEach
    void setUp() {
        evaluator = new FormulaEvaluator();
        sheet = new Sheet("test");
    }

    private void literal(String id, Object value) {
        sheet.setCell(Cell.literal(CellReference.parse(id), CellValue.of(value)));
    }

    private void formula(String id, String formula) {
        sheet.setCell(Cell.formula(CellReference.parse(id), formula));
    }

    @Test
    void testArithmeticOverReferences() {
        literal("A1", 10);
        literal("A2", 4);
        assertEquals(CellValue.number(14), evaluator.evaluate("B1", "=A1+A2", sheet));
        assertEquals(CellValue.number(20), evaluator.evaluate("B2", "=A1*2", sheet));
        assertEquals(CellValue.number(8), evaluator.evaluate("B3", "=A1-A2/2", sheet));
        assertEquals(CellValue.number(-6), evaluator.evaluate("B4", "=-A1+A2", sheet));
    }

    @Test
    void testFormulaCellsArePulled() {
        literal("A1", 5);
        formula("A2", "=A1*10");
        assertEquals(CellValue.number(51), evaluator.evaluate("A3", "=A2+1", sheet));
    }

    @Test
    void testSelfReferenceIsCircular() {
        formula("A1", "=A1+1");
        CircularReferenceException ex = assertThrows(CircularReferenceException.class,
                () -> evaluator.evaluate("A1", "=A1+1", sheet));
        assertEquals("CIRCULAR_REFERENCE", ex.getErrorCode());
    }

    @Test
    void testMutualReferenceIsCircular() {
        formula("A1", "=B1+1");
        formula("B1", "=A1+1");
        assertThrows(CircularReferenceException.class, () -> evaluator.evaluate("A1", "=B1+1", sheet));
    }

    @Test
    void testCycleThroughRangeIsCircular() {
        formula("A3", "=SUM(A1:A3)");
        assertThrows(CircularReferenceException.class, () -> evaluator.evaluate("A3", "=SUM(A1:A3)", sheet));
    }

    @Test
    void testEvaluatorRecoversAfterCircularReference() {
        formula("A1", "=A1");
        assertThrows(CircularReferenceException.class, () -> evaluator.evaluate("A1", "=A1", sheet));

        formula("A1", "=2+2");
        assertEquals(CellValue.number(4), evaluator.evaluate("A1", "=2+2", sheet));
        assertTrue(evaluator.getReferences("A1").isEmpty());
    }

    @Test
    void testDivisionByZero() {
        literal("A1", 10);
        DivisionByZeroException ex = assertThrows(DivisionByZeroException.class,
                () -> evaluator.evaluate("B1", "=A1/0", sheet));
        assertEquals("Division by zero", ex.getMessage());
        assertEquals("DIVISION_BY_ZERO", ex.getErrorCode());

        assertThrows(DivisionByZeroException.class, () -> evaluator.evaluate("B2", "=0/0", sheet));
        // An empty cell divides like 0
        assertThrows(DivisionByZeroException.class, () -> evaluator.evaluate("B3", "=A1/Z99", sheet));
    }

    @Test
    void testRangesFlattenIntoFunctions() {
        literal("A1", 1);
        formula("A2", "=A1*10");
        literal("A3", 3);
        literal("B1", "text");
        assertEquals(CellValue.number(14), evaluator.evaluate("C1", "=SUM(A1:A3)", sheet));
        assertEquals(CellValue.number(14), evaluator.evaluate("C2", "=SUM(A1:B3)", sheet));
        assertEquals(CellValue.number(4), evaluator.evaluate("C3", "=COUNTA(A1:B3)", sheet));
    }

    @Test
    void testRangeOutsideFunctionIsRejected() {
        literal("A1", 1);
        literal("A2", 2);
        InvalidRangeUsageException standalone = assertThrows(InvalidRangeUsageException.class,
                () -> evaluator.evaluate("B1", "=A1:A2", sheet));
        assertEquals("INVALID_RANGE_USAGE", standalone.getErrorCode());
        assertThrows(InvalidRangeUsageException.class, () -> evaluator.evaluate("B2", "=A1:A2+1", sheet));
    }

    @Test
    void testUnknownFunction() {
        UnknownFunctionException ex = assertThrows(UnknownFunctionException.class,
                () -> evaluator.evaluate("A1", "=FOO(1)", sheet));
        assertEquals("Unknown function: FOO", ex.getMessage());
        assertEquals("UNKNOWN_FUNCTION", ex.getErrorCode());
    }

    @Test
    void testParseErrorPropagates() {
        assertThrows(FormulaParseException.class, () -> evaluator.evaluate("A1", "=1+", sheet));
    }

    @Test
    void testMissingCellIsNull() {
        assertTrue(evaluator.evaluate("A1", "=Z99", sheet).isNull());
        assertEquals(CellValue.number(1), evaluator.evaluate("A2", "=Z99+1", sheet));
    }

    @Test
    void testConcatenationAndText() {
        literal("A1", 30);
        literal("A2", "hero");
        assertEquals(CellValue.text("Level 30"), evaluator.evaluate("B1", "=\"Level \"&A1", sheet));
        assertEquals(CellValue.text("HERO"), evaluator.evaluate("B2", "=UPPER(A2)", sheet));
        // Text without a number adds as 0
        assertEquals(CellValue.number(1), evaluator.evaluate("B3", "=A2+1", sheet));
    }

    @Test
    void testComparisons() {
        literal("A1", 10);
        literal("A2", "10");
        assertEquals(CellValue.TRUE, evaluator.evaluate("B1", "=A1=10", sheet));
        // Equality is strict about types; ordering coerces
        assertEquals(CellValue.FALSE, evaluator.evaluate("B2", "=A2=A1", sheet));
        assertEquals(CellValue.TRUE, evaluator.evaluate("B3", "=A2<>A1", sheet));
        assertEquals(CellValue.TRUE, evaluator.evaluate("B4", "=A2<11", sheet));
        assertEquals(CellValue.TRUE, evaluator.evaluate("B5", "=A1>=10", sheet));
    }

    @Test
    void testIfWithNestedFunctions() {
        literal("A1", 7);
        assertEquals(CellValue.text("big"), evaluator.evaluate("B1", "=IF(A1>5, \"big\", \"small\")", sheet));
        assertEquals(CellValue.FALSE, evaluator.evaluate("B2", "=IF(A1>50, \"big\")", sheet));
        assertEquals(CellValue.number(4743), evaluator.evaluate("B3", "=EXP_CURVE(10, 100, 1.5, 1.5)", sheet));
    }

    @Test
    void testEvaluationIsIdempotent() {
        literal("A1", 2);
        CellValue first = evaluator.evaluate("B1", "=A1^3", sheet);
        Set<String> firstRefs = evaluator.getReferences("B1");
        CellValue second = evaluator.evaluate("B1", "=A1^3", sheet);

        assertEquals(first, second);
        assertEquals(firstRefs, evaluator.getReferences("B1"));
        assertEquals(Set.of("B1"), evaluator.getDependents("A1"));
    }

    @Test
    void testEditingFormulaMovesEdges() {
        literal("A1", 1);
        literal("C1", 3);
        evaluator.evaluate("B1", "=A1", sheet);
        assertEquals(Set.of("B1"), evaluator.getDependents("A1"));

        assertEquals(CellValue.number(3), evaluator.evaluate("B1", "=C1", sheet));
        assertTrue(evaluator.getDependents("A1").isEmpty());
        assertEquals(Set.of("B1"), evaluator.getDependents("C1"));
    }

    @Test
    void testTransitiveDependents() {
        literal("A1", 1);
        formula("B1", "=A1+1");
        formula("C1", "=B1+1");
        evaluator.evaluate("C1", "=B1+1", sheet);

        assertEquals(Set.of("B1", "C1"), evaluator.getTransitiveDependents("A1"));
        assertEquals(Set.of("C1"), evaluator.getReverseGraph().get("B1"));
        assertEquals(Set.of("A1"), evaluator.getForwardGraph().get("B1"));
    }

    @Test
    void testCustomFunctionRegisteredByCaller() {
        FunctionRegistry functions = FunctionRegistry.withBuiltins();
        functions.register("double_it", args -> CellValue.number(2 * args.get(0).asNumber()));
        FormulaEvaluator custom = new FormulaEvaluator(new FormulaParser(), functions, FormulaEvaluator.DEFAULT_MAX_DEPTH);
        literal("A1", 21);
        assertEquals(CellValue.number(42), custom.evaluate("B1", "=DOUBLE_IT(A1)", sheet));
    }

    @Test
    void testDepthLimit() {
        FormulaEvaluator shallow = new FormulaEvaluator(new FormulaParser(), FunctionRegistry.withBuiltins(), 3);
        formula("A1", "=A2+1");
        formula("A2", "=A3+1");
        formula("A3", "=A4+1");
        literal("A4", 1);
        assertEquals(CellValue.number(4), shallow.evaluate("A1", "=A2+1", sheet));

        formula("A4", "=A5+1");
        EvaluationDepthExceededException ex = assertThrows(EvaluationDepthExceededException.class,
                () -> shallow.evaluate("A1", "=A2+1", sheet));
        assertEquals("MAX_DEPTH_EXCEEDED", ex.getErrorCode());

        // The guard unwinds completely
        assertEquals(CellValue.number(1), shallow.evaluate("A5", "=1", sheet));
    }

    @Test
    void testStackExhaustionBecomesDepthError() throws InterruptedException {
        FormulaEvaluator deep = new FormulaEvaluator(new FormulaParser(), FunctionRegistry.withBuiltins(), 1_000_000);
        for (int row = 1; row < 20_000; row++) {
            formula("A" + row, "=A" + (row + 1) + "+1");
        }
        literal("A20000", 1);

        AtomicReference<Throwable> thrown = new AtomicReference<>();
        Thread worker = new Thread(null, () -> {
            try {
                deep.evaluate("A1", "=A2+1", sheet);
            } catch (Throwable t) {
                thrown.set(t);
            }
        }, "small-stack", 256 * 1024);
        worker.start();
        worker.join();

        EvaluationDepthExceededException ex = assertInstanceOf(EvaluationDepthExceededException.class, thrown.get());
        assertEquals("Evaluation of A1 nests too deeply", ex.getMessage());
        assertEquals(CellValue.number(2), deep.evaluate("B1", "=1+1", sheet));
    }

    @Test
    void testRangeLimitAppliesToEvaluation() {
        FormulaEvaluator limited = new FormulaEvaluator(
                new FormulaParser(FormulaParser.DEFAULT_MAX_NESTING, 3), FunctionRegistry.withBuiltins(), 16);
        literal("A1", 1);
        literal("A2", 2);
        literal("A3", 3);
        assertEquals(CellValue.number(6), limited.evaluate("B1", "=SUM(A1:A3)", sheet));
        assertThrows(InvalidRangeUsageException.class, () -> limited.evaluate("B2", "=SUM(A1:A4)", sheet));
    }

    @Test
    void testTextUsesItsLeadingNumber() {
        literal("A1", "12px");
        assertEquals(CellValue.number(13), evaluator.evaluate("B1", "=A1+1", sheet));
        assertEquals(CellValue.number(1), evaluator.evaluate("B2", "=\"px\"+1", sheet));
    }
}
