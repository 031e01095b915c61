package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.models.CellValue;
import com.spreadsheet.formula.models.ValueCoercion;

import java.util.List;

import static com.spreadsheet.formula.functions.FunctionArgs.arg;
import static com.spreadsheet.formula.functions.FunctionArgs.flatten;

/**
 * IF, AND, OR and NOT.
 */
public final class LogicalFunctions {

    private LogicalFunctions() {
    }

    static void registerAll(FunctionRegistry registry) {
        registry.register("IF", LogicalFunctions::ifFunction);
        registry.register("AND", LogicalFunctions::and);
        registry.register("OR", LogicalFunctions::or);
        registry.register("NOT", LogicalFunctions::not);
    }

    /**
     * IF(condition, then, else=FALSE). Both branches have already been
     * evaluated by the time this runs; formulas have no side effects.
     */
    public static CellValue ifFunction(List<CellValue> args) {
        if (ValueCoercion.toBoolean(arg(args, 0))) {
            return arg(args, 1);
        }
        return args.size() > 2 ? args.get(2) : CellValue.FALSE;
    }

    public static CellValue and(List<CellValue> args) {
        for (CellValue value : flatten(args)) {
            if (!ValueCoercion.toBoolean(value)) {
                return CellValue.FALSE;
            }
        }
        return CellValue.TRUE;
    }

    public static CellValue or(List<CellValue> args) {
        for (CellValue value : flatten(args)) {
            if (ValueCoercion.toBoolean(value)) {
                return CellValue.TRUE;
            }
        }
        return CellValue.FALSE;
    }

    public static CellValue not(List<CellValue> args) {
        return CellValue.bool(!ValueCoercion.toBoolean(arg(args, 0)));
    }
}
