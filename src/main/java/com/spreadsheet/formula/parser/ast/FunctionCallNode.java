package com.spreadsheet.formula.parser.ast;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

public class FunctionCallNode extends FormulaNode {
    private final String name;
    private final List<FormulaNode> arguments;

    public FunctionCallNode(String name, List<FormulaNode> arguments) {
        this.name = name;
        this.arguments = Collections.unmodifiableList(arguments);
    }

    /**
     * Uppercase function name, e.g. "SUM".
     */
    public String getName() {
        return name;
    }

    public List<FormulaNode> getArguments() {
        return arguments;
    }

    @Override
    public <R> R accept(FormulaNodeVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }

    @Override
    public String toString() {
        return name + arguments.stream().map(String::valueOf).collect(Collectors.joining(", ", "(", ")"));
    }
}
