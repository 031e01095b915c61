package com.spreadsheet.formula.parser.ast;

public class BinaryOpNode extends FormulaNode {
    private final String operator;
    private final FormulaNode left;
    private final FormulaNode right;

    public BinaryOpNode(String operator, FormulaNode left, FormulaNode right) {
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public String getOperator() {
        return operator;
    }

    public FormulaNode getLeft() {
        return left;
    }

    public FormulaNode getRight() {
        return right;
    }

    @Override
    public <R> R accept(FormulaNodeVisitor<R> visitor) {
        return visitor.visitBinaryOp(this);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator + " " + right + ")";
    }
}
