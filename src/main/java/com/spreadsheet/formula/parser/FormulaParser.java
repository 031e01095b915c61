package com.spreadsheet.formula.parser;

import com.spreadsheet.formula.exceptions.FormulaParseException;
import com.spreadsheet.formula.exceptions.InvalidCellReferenceException;
import com.spreadsheet.formula.exceptions.InvalidRangeUsageException;
import com.spreadsheet.formula.models.CellRange;
import com.spreadsheet.formula.models.CellReference;
import com.spreadsheet.formula.models.CellValue;
import com.spreadsheet.formula.parser.ast.BinaryOpNode;
import com.spreadsheet.formula.parser.ast.CellRefNode;
import com.spreadsheet.formula.parser.ast.FormulaNode;
import com.spreadsheet.formula.parser.ast.FormulaNodeVisitor;
import com.spreadsheet.formula.parser.ast.FunctionCallNode;
import com.spreadsheet.formula.parser.ast.LiteralNode;
import com.spreadsheet.formula.parser.ast.RangeRefNode;
import com.spreadsheet.formula.parser.ast.UnaryOpNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for spreadsheet formulas.
 * Precedence, lowest to highest:
 * comparison, concatenation ('&amp;'), additive, multiplicative,
 * power ('^'), unary sign, primary.
 * <p>
 * Nesting (parentheses, signs, function calls and chained operators)
 * and range sizes are capped so a hostile formula fails with a
 * {@link FormulaParseException} instead of exhausting the stack or heap.
 * <p>
 * Instances hold no per-parse state and may be shared.
 */
public class FormulaParser {

    private static final List<String> COMPARISON_OPERATORS = Arrays.asList("=", "<>", "<", ">", "<=", ">=");

    public static final int DEFAULT_MAX_NESTING = 256;
    public static final long DEFAULT_MAX_RANGE_CELLS = 100_000;

    private final FormulaTokenizer tokenizer;
    private final int maxNesting;
    private final long maxRangeCells;

    public FormulaParser() {
        this(DEFAULT_MAX_NESTING, DEFAULT_MAX_RANGE_CELLS);
    }

    public FormulaParser(int maxNesting, long maxRangeCells) {
        this(new FormulaTokenizer(), maxNesting, maxRangeCells);
    }

    public FormulaParser(FormulaTokenizer tokenizer, int maxNesting, long maxRangeCells) {
        this.tokenizer = tokenizer;
        this.maxNesting = maxNesting;
        this.maxRangeCells = maxRangeCells;
    }

    /**
     * Parses a formula (with or without its leading '=') into an AST.
     *
     * @throws FormulaParseException on any syntax error, including a
     *                               {@link com.spreadsheet.formula.exceptions.FormulaLexException}
     */
    public FormulaNode parse(String formula) {
        TokenStream tokens = new TokenStream(tokenizer.tokenize(formula), maxNesting);
        if (tokens.atEnd()) {
            throw new FormulaParseException("Empty formula");
        }

        FormulaNode root = parseComparison(tokens);
        if (!tokens.atEnd()) {
            throw new FormulaParseException("Unexpected token: " + tokens.peek().getText());
        }
        return root;
    }

    /**
     * Collects every cell the AST reads: plain references plus every
     * cell inside each range. Order carries no meaning.
     */
    public Set<String> extractReferences(FormulaNode ast) {
        Set<String> references = new LinkedHashSet<>();
        ast.accept(new ReferenceCollector(references));
        return references;
    }

    /**
     * Every cell of {@code range}, column-major.
     *
     * @throws InvalidRangeUsageException if the range holds more cells than allowed
     */
    public List<CellReference> expandRange(CellRange range) {
        checkRangeSize(range);
        return range.cells();
    }

    // ----------------------------------------------------------------
    // Precedence levels
    // ----------------------------------------------------------------

    private FormulaNode parseComparison(TokenStream tokens) {
        FormulaNode node = parseConcatenation(tokens);
        int chained = 0;
        while (!tokens.atEnd() && tokens.peek().is(TokenType.OPERATOR)
                && COMPARISON_OPERATORS.contains(tokens.peek().getText())) {
            String op = tokens.next().getText();
            tokens.descend();
            chained++;
            node = new BinaryOpNode(op, node, parseConcatenation(tokens));
        }
        tokens.ascend(chained);
        return node;
    }

    private FormulaNode parseConcatenation(TokenStream tokens) {
        FormulaNode node = parseAdditive(tokens);
        int chained = 0;
        while (!tokens.atEnd() && tokens.peek().isOperator("&")) {
            tokens.next();
            tokens.descend();
            chained++;
            node = new BinaryOpNode("&", node, parseAdditive(tokens));
        }
        tokens.ascend(chained);
        return node;
    }

    private FormulaNode parseAdditive(TokenStream tokens) {
        FormulaNode node = parseMultiplicative(tokens);
        int chained = 0;
        while (!tokens.atEnd() && (tokens.peek().isOperator("+") || tokens.peek().isOperator("-"))) {
            String op = tokens.next().getText();
            tokens.descend();
            chained++;
            node = new BinaryOpNode(op, node, parseMultiplicative(tokens));
        }
        tokens.ascend(chained);
        return node;
    }

    private FormulaNode parseMultiplicative(TokenStream tokens) {
        FormulaNode node = parsePower(tokens);
        int chained = 0;
        while (!tokens.atEnd() && (tokens.peek().isOperator("*") || tokens.peek().isOperator("/"))) {
            String op = tokens.next().getText();
            tokens.descend();
            chained++;
            node = new BinaryOpNode(op, node, parsePower(tokens));
        }
        tokens.ascend(chained);
        return node;
    }

    // '^' groups left to right: 2^3^2 = (2^3)^2
    private FormulaNode parsePower(TokenStream tokens) {
        FormulaNode node = parseUnary(tokens);
        int chained = 0;
        while (!tokens.atEnd() && tokens.peek().isOperator("^")) {
            tokens.next();
            tokens.descend();
            chained++;
            node = new BinaryOpNode("^", node, parseUnary(tokens));
        }
        tokens.ascend(chained);
        return node;
    }

    private FormulaNode parseUnary(TokenStream tokens) {
        if (!tokens.atEnd() && (tokens.peek().isOperator("-") || tokens.peek().isOperator("+"))) {
            String op = tokens.next().getText();
            tokens.descend();
            FormulaNode operand = parseUnary(tokens);
            tokens.ascend(1);
            return new UnaryOpNode(op, operand);
        }
        return parsePrimary(tokens);
    }

    private FormulaNode parsePrimary(TokenStream tokens) {
        if (tokens.atEnd()) {
            throw new FormulaParseException("Unexpected end of formula");
        }

        Token token = tokens.next();
        switch (token.getType()) {
            case NUMBER:
                return new LiteralNode(CellValue.number(Double.parseDouble(token.getText())));
            case STRING:
                return new LiteralNode(CellValue.text(token.getText()));
            case BOOLEAN:
                return new LiteralNode(CellValue.bool(token.getText().equals("TRUE")));
            case CELL:
                return new CellRefNode(toReference(token.getText()));
            case RANGE: {
                String[] corners = token.getText().split(":");
                CellRange range = new CellRange(toReference(corners[0]), toReference(corners[1]));
                checkRangeSize(range);
                return new RangeRefNode(range);
            }
            case FUNCTION:
                return parseFunctionCall(token.getText(), tokens);
            case LPAREN: {
                tokens.descend();
                FormulaNode inner = parseComparison(tokens);
                tokens.ascend(1);
                if (tokens.atEnd() || !tokens.peek().is(TokenType.RPAREN)) {
                    throw new FormulaParseException("Expected ')'");
                }
                tokens.next();
                return inner;
            }
            default:
                throw new FormulaParseException("Unexpected token: " + token.getText());
        }
    }

    private FormulaNode parseFunctionCall(String name, TokenStream tokens) {
        if (tokens.atEnd() || !tokens.peek().is(TokenType.LPAREN)) {
            throw new FormulaParseException("Expected '(' after function " + name);
        }
        tokens.next();
        tokens.descend();

        List<FormulaNode> args = new ArrayList<>();
        if (!tokens.atEnd() && !tokens.peek().is(TokenType.RPAREN)) {
            args.add(parseComparison(tokens));
            while (!tokens.atEnd() && tokens.peek().is(TokenType.COMMA)) {
                tokens.next();
                args.add(parseComparison(tokens));
            }
        }

        if (tokens.atEnd() || !tokens.peek().is(TokenType.RPAREN)) {
            throw new FormulaParseException("Expected ')' after arguments of " + name);
        }
        tokens.next();
        tokens.ascend(1);
        return new FunctionCallNode(name, args);
    }

    // ----------------------------------------------------------------
    // Internal helpers
    // ----------------------------------------------------------------

    // "A0" has cell shape for the tokenizer but no such row exists
    private static CellReference toReference(String text) {
        try {
            return CellReference.parse(text);
        } catch (InvalidCellReferenceException e) {
            throw new FormulaParseException(e.getMessage());
        }
    }

    private void checkRangeSize(CellRange range) {
        long size = range.size();
        if (size > maxRangeCells) {
            throw new InvalidRangeUsageException(
                    "Range " + range + " has " + size + " cells; at most " + maxRangeCells + " are allowed");
        }
    }

    private static final class TokenStream {
        private final List<Token> tokens;
        private final int maxNesting;
        private int position;
        // Upper bound on the height of the subtree being built
        private int depth;

        TokenStream(List<Token> tokens, int maxNesting) {
            this.tokens = tokens;
            this.maxNesting = maxNesting;
        }

        void descend() {
            if (++depth > maxNesting) {
                throw new FormulaParseException("Formula nests deeper than " + maxNesting + " levels");
            }
        }

        void ascend(int levels) {
            depth -= levels;
        }

        boolean atEnd() {
            return position >= tokens.size();
        }

        Token peek() {
            return tokens.get(position);
        }

        Token next() {
            return tokens.get(position++);
        }
    }

    private final class ReferenceCollector implements FormulaNodeVisitor<Void> {
        private final Set<String> references;

        ReferenceCollector(Set<String> references) {
            this.references = references;
        }

        @Override
        public Void visitLiteral(LiteralNode node) {
            return null;
        }

        @Override
        public Void visitCellRef(CellRefNode node) {
            references.add(node.getReference().toId());
            return null;
        }

        @Override
        public Void visitRangeRef(RangeRefNode node) {
            for (CellReference cell : expandRange(node.getRange())) {
                references.add(cell.toId());
            }
            return null;
        }

        @Override
        public Void visitUnaryOp(UnaryOpNode node) {
            return node.getOperand().accept(this);
        }

        @Override
        public Void visitBinaryOp(BinaryOpNode node) {
            node.getLeft().accept(this);
            return node.getRight().accept(this);
        }

        @Override
        public Void visitFunctionCall(FunctionCallNode node) {
            for (FormulaNode arg : node.getArguments()) {
                arg.accept(this);
            }
            return null;
        }
    }
}
