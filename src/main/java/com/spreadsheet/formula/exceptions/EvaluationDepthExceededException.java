package com.spreadsheet.formula.exceptions;

/**
 * Thrown when a chain of formula cells referencing formula cells
 * nests deeper than the configured limit, or when evaluation runs out
 * of stack before reaching it.
 */
public class EvaluationDepthExceededException extends FormulaException {
    public EvaluationDepthExceededException(String cellId, int maxDepth) {
        super("Evaluation depth exceeded " + maxDepth + " at " + cellId);
    }

    public EvaluationDepthExceededException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "MAX_DEPTH_EXCEEDED";
    }
}
