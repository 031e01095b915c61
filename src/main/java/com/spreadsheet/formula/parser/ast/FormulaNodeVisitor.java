package com.spreadsheet.formula.parser.ast;

public interface FormulaNodeVisitor<R> {
    R visitLiteral(LiteralNode node);

    R visitCellRef(CellRefNode node);

    R visitRangeRef(RangeRefNode node);

    R visitUnaryOp(UnaryOpNode node);

    R visitBinaryOp(BinaryOpNode node);

    R visitFunctionCall(FunctionCallNode node);
}
