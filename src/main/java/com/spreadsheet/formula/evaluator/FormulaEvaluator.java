package com.spreadsheet.formula.evaluator;

import com.spreadsheet.formula.dependency.DependencyGraph;
import com.spreadsheet.formula.exceptions.CircularReferenceException;
import com.spreadsheet.formula.exceptions.DivisionByZeroException;
import com.spreadsheet.formula.exceptions.EvaluationDepthExceededException;
import com.spreadsheet.formula.exceptions.FormulaParseException;
import com.spreadsheet.formula.exceptions.InvalidRangeUsageException;
import com.spreadsheet.formula.exceptions.UnknownFunctionException;
import com.spreadsheet.formula.functions.FormulaFunction;
import com.spreadsheet.formula.functions.FunctionRegistry;
import com.spreadsheet.formula.models.Cell;
import com.spreadsheet.formula.models.CellReference;
import com.spreadsheet.formula.models.CellValue;
import com.spreadsheet.formula.models.Sheet;
import com.spreadsheet.formula.models.ValueCoercion;
import com.spreadsheet.formula.models.ValueType;
import com.spreadsheet.formula.parser.FormulaParser;
import com.spreadsheet.formula.parser.ast.BinaryOpNode;
import com.spreadsheet.formula.parser.ast.CellRefNode;
import com.spreadsheet.formula.parser.ast.FormulaNode;
import com.spreadsheet.formula.parser.ast.FormulaNodeVisitor;
import com.spreadsheet.formula.parser.ast.FunctionCallNode;
import com.spreadsheet.formula.parser.ast.LiteralNode;
import com.spreadsheet.formula.parser.ast.RangeRefNode;
import com.spreadsheet.formula.parser.ast.UnaryOpNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Evaluates formulas against a sheet and keeps the dependency graph
 * between formula cells up to date.
 * <p>
 * Two independent checks guard against circular references:
 * - a reentrancy guard over the cells currently being evaluated on
 *   this call stack, and
 * - a depth-first search of the whole dependency graph after each
 *   edge update, which also catches loops the call stack hasn't
 *   reached yet (A1 -> B1 installed, then B1 -> A1).
 * <p>
 * Not thread-safe: one evaluator per sheet, calls serialised by the caller.
 */
public class FormulaEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(FormulaEvaluator.class);

    public static final int DEFAULT_MAX_DEPTH = 256;

    private final FormulaParser parser;
    private final FunctionRegistry functions;
    private final int maxDepth;

    private final DependencyGraph dependencies = new DependencyGraph();
    // Cells whose evaluate() is on the current call stack
    private final Set<String> evaluating = new LinkedHashSet<>();

    public FormulaEvaluator() {
        this(new FormulaParser(), FunctionRegistry.withBuiltins(), DEFAULT_MAX_DEPTH);
    }

    public FormulaEvaluator(FormulaParser parser, FunctionRegistry functions, int maxDepth) {
        this.parser = parser;
        this.functions = functions;
        this.maxDepth = maxDepth;
    }

    /**
     * Evaluates {@code formula} as the content of {@code cellId}:
     * 1) Reject reentry into a cell already being evaluated.
     * 2) Reject nesting deeper than the configured limit.
     * 3) Parse, then rebuild the cell's outgoing dependency edges.
     * 4) Search the whole graph for a cycle through the cell.
     * 5) Walk the AST; referenced formula cells are evaluated recursively.
     * <p>
     * Should the walk still run out of stack, the outermost call reports
     * it as an {@link EvaluationDepthExceededException}.
     *
     * @throws FormulaParseException             on a syntax error
     * @throws CircularReferenceException        if the cell reads itself
     * @throws UnknownFunctionException          for an unregistered function
     * @throws DivisionByZeroException           on division by zero
     * @throws InvalidRangeUsageException        if a range is used outside a function call
     * @throws EvaluationDepthExceededException  if formula cells nest too deeply
     */
    public CellValue evaluate(String cellId, String formula, Sheet sheet) {
        if (evaluating.contains(cellId)) {
            throw new CircularReferenceException("Circular reference detected at " + cellId);
        }
        if (evaluating.size() >= maxDepth) {
            throw new EvaluationDepthExceededException(cellId, maxDepth);
        }

        boolean outermost = evaluating.isEmpty();
        evaluating.add(cellId);
        try {
            FormulaNode ast = parser.parse(formula);

            Set<String> references = parser.extractReferences(ast);
            dependencies.setDependencies(cellId, references);

            if (dependencies.hasCycleFrom(cellId)) {
                throw new CircularReferenceException("Circular reference detected at " + cellId);
            }

            CellValue result = ast.accept(new AstEvaluator(sheet));
            if (result.isArray()) {
                throw new InvalidRangeUsageException("Range cannot be used as a standalone expression");
            }

            logger.debug("Evaluated {} = {}", cellId, result);
            return result;
        } catch (StackOverflowError e) {
            if (!outermost) {
                throw e;
            }
            evaluating.clear();
            logger.warn("Evaluation of {} ran out of stack", cellId);
            throw new EvaluationDepthExceededException("Evaluation of " + cellId + " nests too deeply");
        } finally {
            evaluating.remove(cellId);
        }
    }

    /**
     * Cells whose formulas read {@code cellId} directly.
     */
    public Set<String> getDependents(String cellId) {
        return dependencies.getDependents(cellId);
    }

    /**
     * Every cell that reads {@code cellId} directly or transitively,
     * nearest first.
     */
    public Set<String> getTransitiveDependents(String cellId) {
        return dependencies.getTransitiveDependents(cellId);
    }

    /**
     * Cells that the last evaluation of {@code cellId} read.
     */
    public Set<String> getReferences(String cellId) {
        return dependencies.getDependencies(cellId);
    }

    public Map<String, Set<String>> getForwardGraph() {
        return dependencies.forwardSnapshot();
    }

    public Map<String, Set<String>> getReverseGraph() {
        return dependencies.reverseSnapshot();
    }

    /**
     * Forgets the outgoing edges of a cell that no longer holds a formula.
     */
    public void removeDependencies(String cellId) {
        dependencies.clearDependencies(cellId);
    }

    public void clearDependencies() {
        dependencies.clear();
    }

    // ----------------------------------------------------------------
    // AST walk
    // ----------------------------------------------------------------

    private final class AstEvaluator implements FormulaNodeVisitor<CellValue> {
        private final Sheet sheet;

        AstEvaluator(Sheet sheet) {
            this.sheet = sheet;
        }

        @Override
        public CellValue visitLiteral(LiteralNode node) {
            return node.getValue();
        }

        @Override
        public CellValue visitCellRef(CellRefNode node) {
            return resolve(node.getReference());
        }

        @Override
        public CellValue visitRangeRef(RangeRefNode node) {
            List<CellValue> values = new ArrayList<>();
            for (CellReference reference : parser.expandRange(node.getRange())) {
                values.add(resolve(reference));
            }
            return CellValue.array(values);
        }

        @Override
        public CellValue visitUnaryOp(UnaryOpNode node) {
            double operand = number(node.getOperand().accept(this));
            switch (node.getOperator()) {
                case "-":
                    return CellValue.number(-operand);
                case "+":
                    return CellValue.number(operand);
                default:
                    throw new FormulaParseException("Unknown unary operator: " + node.getOperator());
            }
        }

        @Override
        public CellValue visitBinaryOp(BinaryOpNode node) {
            CellValue left = node.getLeft().accept(this);
            CellValue right = node.getRight().accept(this);

            switch (node.getOperator()) {
                case "+":
                    return CellValue.number(number(left) + number(right));
                case "-":
                    return CellValue.number(number(left) - number(right));
                case "*":
                    return CellValue.number(number(left) * number(right));
                case "/": {
                    double dividend = number(left);
                    double divisor = number(right);
                    if (divisor == 0) {
                        throw new DivisionByZeroException();
                    }
                    return CellValue.number(dividend / divisor);
                }
                case "^":
                    return CellValue.number(Math.pow(number(left), number(right)));
                case "&":
                    return CellValue.text(text(left) + text(right));
                case "=":
                    return CellValue.bool(strictlyEqual(left, right));
                case "<>":
                    return CellValue.bool(!strictlyEqual(left, right));
                case "<":
                    return CellValue.bool(number(left) < number(right));
                case ">":
                    return CellValue.bool(number(left) > number(right));
                case "<=":
                    return CellValue.bool(number(left) <= number(right));
                case ">=":
                    return CellValue.bool(number(left) >= number(right));
                default:
                    throw new FormulaParseException("Unknown operator: " + node.getOperator());
            }
        }

        @Override
        public CellValue visitFunctionCall(FunctionCallNode node) {
            FormulaFunction function = functions.find(node.getName());
            if (function == null) {
                throw new UnknownFunctionException(node.getName());
            }

            // Ranges stay arrays here; functions flatten them themselves
            List<CellValue> args = new ArrayList<>();
            for (FormulaNode argument : node.getArguments()) {
                args.add(argument.accept(this));
            }

            CellValue result = function.apply(args);
            return result == null ? CellValue.NULL : result;
        }

        /**
         * Value of a referenced cell. Formula cells are always evaluated
         * afresh rather than read from any cache.
         */
        private CellValue resolve(CellReference reference) {
            Cell cell = sheet.getCellAt(reference.getColumnIndex(), reference.getRowIndex());
            if (cell == null) {
                return CellValue.NULL;
            }
            if (cell.hasFormula()) {
                return evaluate(cell.getId(), cell.getFormula(), sheet);
            }
            return cell.getValue();
        }
    }

    private static double number(CellValue value) {
        return ValueCoercion.toNumber(scalar(value));
    }

    private static String text(CellValue value) {
        return ValueCoercion.toText(scalar(value));
    }

    private static CellValue scalar(CellValue value) {
        if (value.isArray()) {
            throw new InvalidRangeUsageException("Cannot use range in this context");
        }
        return value;
    }

    // Same type and same payload; numbers compare numerically, text case-sensitively
    private static boolean strictlyEqual(CellValue left, CellValue right) {
        scalar(left);
        scalar(right);
        if (left.getType() != right.getType()) {
            return false;
        }
        if (left.getType() == ValueType.NUMBER) {
            return left.asNumber() == right.asNumber();
        }
        return left.equals(right);
    }
}
