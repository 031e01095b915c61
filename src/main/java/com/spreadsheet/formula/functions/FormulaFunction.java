package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.models.CellValue;

import java.util.List;

/**
 * A spreadsheet function. Arguments arrive already evaluated; a range
 * argument is a single ARRAY value. Implementations never throw for bad
 * input, they return Null or a sentinel text instead.
 */
@FunctionalInterface
public interface FormulaFunction {
    CellValue apply(List<CellValue> args);
}
