package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.models.CellValue;
import com.spreadsheet.formula.models.ValueCoercion;
import com.spreadsheet.formula.models.ValueType;

import java.util.Collections;
import java.util.List;

import static com.spreadsheet.formula.functions.FunctionArgs.arg;
import static com.spreadsheet.formula.functions.FunctionArgs.flatten;
import static com.spreadsheet.formula.functions.FunctionArgs.numberOrNull;
import static com.spreadsheet.formula.functions.FunctionArgs.numbers;

/**
 * Aggregates (SUM, AVERAGE, MIN, MAX, COUNT, COUNTA) and scalar math
 * (ROUND, CEILING, FLOOR, ABS, SQRT, POWER).
 * <p>
 * Aggregates skip entries without a number and return 0 on empty input.
 * Scalar functions return Null when an input has no number, and SQRT
 * of a negative is Null too.
 */
public final class MathFunctions {

    private MathFunctions() {
    }

    static void registerAll(FunctionRegistry registry) {
        registry.register("SUM", MathFunctions::sum);
        registry.register("AVERAGE", MathFunctions::average);
        registry.register("MIN", MathFunctions::min);
        registry.register("MAX", MathFunctions::max);
        registry.register("COUNT", MathFunctions::count);
        registry.register("COUNTA", MathFunctions::countA);
        registry.register("ROUND", MathFunctions::round);
        registry.register("CEILING", MathFunctions::ceiling);
        registry.register("FLOOR", MathFunctions::floor);
        registry.register("ABS", MathFunctions::abs);
        registry.register("SQRT", MathFunctions::sqrt);
        registry.register("POWER", MathFunctions::power);
    }

    public static CellValue sum(List<CellValue> args) {
        return CellValue.number(FunctionArgs.sum(numbers(args)));
    }

    public static CellValue average(List<CellValue> args) {
        List<Double> numbers = numbers(args);
        if (numbers.isEmpty()) {
            return CellValue.number(0);
        }
        return CellValue.number(FunctionArgs.mean(numbers));
    }

    public static CellValue min(List<CellValue> args) {
        List<Double> numbers = numbers(args);
        return CellValue.number(numbers.isEmpty() ? 0 : Collections.min(numbers));
    }

    public static CellValue max(List<CellValue> args) {
        List<Double> numbers = numbers(args);
        return CellValue.number(numbers.isEmpty() ? 0 : Collections.max(numbers));
    }

    /**
     * Entries that convert to a number, including numeric text and booleans.
     */
    public static CellValue count(List<CellValue> args) {
        return CellValue.number(numbers(args).size());
    }

    /**
     * Entries of any type that are neither Null nor empty text.
     */
    public static CellValue countA(List<CellValue> args) {
        long filled = flatten(args).stream()
                .filter(v -> !v.isNull())
                .filter(v -> !(v.getType() == ValueType.TEXT && v.asText().isEmpty()))
                .count();
        return CellValue.number(filled);
    }

    /**
     * ROUND(value, decimals=0); halves round up, as Math.round does.
     */
    public static CellValue round(List<CellValue> args) {
        Double value = ValueCoercion.toNumberOrNull(arg(args, 0));
        Double decimals = args.size() > 1 ? ValueCoercion.toNumberOrNull(arg(args, 1)) : Double.valueOf(0);
        if (value == null || decimals == null) {
            return CellValue.NULL;
        }
        double factor = Math.pow(10, decimals);
        return CellValue.number(Math.floor(value * factor + 0.5) / factor);
    }

    public static CellValue ceiling(List<CellValue> args) {
        Double value = ValueCoercion.toNumberOrNull(arg(args, 0));
        return value == null ? CellValue.NULL : CellValue.number(Math.ceil(value));
    }

    public static CellValue floor(List<CellValue> args) {
        Double value = ValueCoercion.toNumberOrNull(arg(args, 0));
        return value == null ? CellValue.NULL : CellValue.number(Math.floor(value));
    }

    public static CellValue abs(List<CellValue> args) {
        Double value = ValueCoercion.toNumberOrNull(arg(args, 0));
        return value == null ? CellValue.NULL : CellValue.number(Math.abs(value));
    }

    public static CellValue sqrt(List<CellValue> args) {
        Double value = ValueCoercion.toNumberOrNull(arg(args, 0));
        return numberOrNull(value != null && value >= 0 ? Math.sqrt(value) : null);
    }

    public static CellValue power(List<CellValue> args) {
        Double base = ValueCoercion.toNumberOrNull(arg(args, 0));
        Double exponent = ValueCoercion.toNumberOrNull(arg(args, 1));
        if (base == null || exponent == null) {
            return CellValue.NULL;
        }
        return CellValue.number(Math.pow(base, exponent));
    }
}
