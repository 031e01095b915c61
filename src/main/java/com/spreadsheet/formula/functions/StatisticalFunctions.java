package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.models.CellValue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.spreadsheet.formula.functions.FunctionArgs.numbers;
import static com.spreadsheet.formula.functions.FunctionArgs.squaredDeviations;

/**
 * MEDIAN, MODE, STDEV, STDEVP, VAR and VARP over every number in the
 * (flattened) arguments. Too few values gives Null, never an error:
 * the sample variants need two, the population variants one.
 */
public final class StatisticalFunctions {

    private StatisticalFunctions() {
    }

    static void registerAll(FunctionRegistry registry) {
        registry.register("MEDIAN", StatisticalFunctions::median);
        registry.register("MODE", StatisticalFunctions::mode);
        registry.register("STDEV", StatisticalFunctions::stdev);
        registry.register("STDEVP", StatisticalFunctions::stdevp);
        registry.register("VAR", StatisticalFunctions::var);
        registry.register("VARP", StatisticalFunctions::varp);
    }

    public static CellValue median(List<CellValue> args) {
        List<Double> sorted = new ArrayList<>(numbers(args));
        if (sorted.isEmpty()) {
            return CellValue.NULL;
        }
        sorted.sort(Double::compare);

        int mid = sorted.size() / 2;
        if (sorted.size() % 2 == 0) {
            return CellValue.number((sorted.get(mid - 1) + sorted.get(mid)) / 2);
        }
        return CellValue.number(sorted.get(mid));
    }

    /**
     * The value that first reaches the highest count; Null when no value repeats.
     */
    public static CellValue mode(List<CellValue> args) {
        Map<Double, Integer> frequency = new HashMap<>();
        int maxFrequency = 0;
        Double mode = null;

        for (Double number : numbers(args)) {
            int count = frequency.merge(number, 1, Integer::sum);
            if (count > maxFrequency) {
                maxFrequency = count;
                mode = number;
            }
        }
        return maxFrequency > 1 ? CellValue.number(mode) : CellValue.NULL;
    }

    public static CellValue stdev(List<CellValue> args) {
        List<Double> numbers = numbers(args);
        if (numbers.size() < 2) {
            return CellValue.NULL;
        }
        return CellValue.number(Math.sqrt(squaredDeviations(numbers) / (numbers.size() - 1)));
    }

    public static CellValue stdevp(List<CellValue> args) {
        List<Double> numbers = numbers(args);
        if (numbers.isEmpty()) {
            return CellValue.NULL;
        }
        return CellValue.number(Math.sqrt(squaredDeviations(numbers) / numbers.size()));
    }

    public static CellValue var(List<CellValue> args) {
        List<Double> numbers = numbers(args);
        if (numbers.size() < 2) {
            return CellValue.NULL;
        }
        return CellValue.number(squaredDeviations(numbers) / (numbers.size() - 1));
    }

    public static CellValue varp(List<CellValue> args) {
        List<Double> numbers = numbers(args);
        if (numbers.isEmpty()) {
            return CellValue.NULL;
        }
        return CellValue.number(squaredDeviations(numbers) / numbers.size());
    }
}
