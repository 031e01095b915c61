package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.models.CellValue;
import com.spreadsheet.formula.models.ValueCoercion;

import java.util.ArrayList;
import java.util.List;

/**
 * Argument helpers shared by the function families.
 */
final class FunctionArgs {

    private FunctionArgs() {
    }

    /**
     * Positional argument, or Null when the caller left it out.
     */
    static CellValue arg(List<CellValue> args, int index) {
        return index < args.size() ? args.get(index) : CellValue.NULL;
    }

    /**
     * Positional numeric argument, or {@code fallback} when it is
     * missing or has no number.
     */
    static double numberArg(List<CellValue> args, int index, double fallback) {
        Double number = ValueCoercion.toNumberOrNull(arg(args, index));
        return number == null ? fallback : number;
    }

    /**
     * Every scalar in the arguments, with ranges (at any depth) spliced in place.
     */
    static List<CellValue> flatten(List<CellValue> args) {
        List<CellValue> flat = new ArrayList<>();
        for (CellValue value : args) {
            if (value.isArray()) {
                flat.addAll(flatten(value.asArray()));
            } else {
                flat.add(value);
            }
        }
        return flat;
    }

    /**
     * Flattened arguments that have a number, in argument order.
     */
    static List<Double> numbers(List<CellValue> args) {
        List<Double> numbers = new ArrayList<>();
        for (CellValue value : flatten(args)) {
            Double number = ValueCoercion.toNumberOrNull(value);
            if (number != null) {
                numbers.add(number);
            }
        }
        return numbers;
    }

    static CellValue numberOrNull(Double value) {
        return value == null ? CellValue.NULL : CellValue.number(value);
    }

    static double sum(List<Double> numbers) {
        double total = 0;
        for (double n : numbers) {
            total += n;
        }
        return total;
    }

    static double mean(List<Double> numbers) {
        return sum(numbers) / numbers.size();
    }

    static double squaredDeviations(List<Double> numbers) {
        double avg = mean(numbers);
        double total = 0;
        for (double n : numbers) {
            total += (n - avg) * (n - avg);
        }
        return total;
    }
}
