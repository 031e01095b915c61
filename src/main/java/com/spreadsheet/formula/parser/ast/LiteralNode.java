package com.spreadsheet.formula.parser.ast;

import com.spreadsheet.formula.models.CellValue;

public class LiteralNode extends FormulaNode {
    private final CellValue value;

    public LiteralNode(CellValue value) {
        this.value = value;
    }

    public CellValue getValue() {
        return value;
    }

    @Override
    public <R> R accept(FormulaNodeVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public String toString() {
        return String.valueOf(value.toJavaObject());
    }
}
