package com.spreadsheet.formula.parser.ast;

import com.spreadsheet.formula.models.CellReference;

public class CellRefNode extends FormulaNode {
    private final CellReference reference;

    public CellRefNode(CellReference reference) {
        this.reference = reference;
    }

    public CellReference getReference() {
        return reference;
    }

    @Override
    public <R> R accept(FormulaNodeVisitor<R> visitor) {
        return visitor.visitCellRef(this);
    }

    @Override
    public String toString() {
        return reference.toId();
    }
}
