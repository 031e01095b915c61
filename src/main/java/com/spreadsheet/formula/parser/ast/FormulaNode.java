package com.spreadsheet.formula.parser.ast;

/**
 * Node of a parsed formula. Every concrete node dispatches through
 * {@link FormulaNodeVisitor}, so a new node kind breaks every visitor
 * at compile time until it is handled.
 */
public abstract class FormulaNode {

    public abstract <R> R accept(FormulaNodeVisitor<R> visitor);
}
