package com.spreadsheet.formula.parser.ast;

import com.spreadsheet.formula.models.CellRange;

public class RangeRefNode extends FormulaNode {
    private final CellRange range;

    public RangeRefNode(CellRange range) {
        this.range = range;
    }

    public CellRange getRange() {
        return range;
    }

    @Override
    public <R> R accept(FormulaNodeVisitor<R> visitor) {
        return visitor.visitRangeRef(this);
    }

    @Override
    public String toString() {
        return range.toString();
    }
}
