package com.spreadsheet.formula.parser.ast;

/**
 * Prefix '-' or '+'.
 */
public class UnaryOpNode extends FormulaNode {
    private final String operator;
    private final FormulaNode operand;

    public UnaryOpNode(String operator, FormulaNode operand) {
        this.operator = operator;
        this.operand = operand;
    }

    public String getOperator() {
        return operator;
    }

    public FormulaNode getOperand() {
        return operand;
    }

    @Override
    public <R> R accept(FormulaNodeVisitor<R> visitor) {
        return visitor.visitUnaryOp(this);
    }

    @Override
    public String toString() {
        return "(" + operator + operand + ")";
    }
}
