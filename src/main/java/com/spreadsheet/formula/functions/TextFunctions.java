package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.models.CellValue;
import com.spreadsheet.formula.models.ValueCoercion;

import java.util.List;
import java.util.stream.Collectors;

import static com.spreadsheet.formula.functions.FunctionArgs.arg;
import static com.spreadsheet.formula.functions.FunctionArgs.flatten;
import static com.spreadsheet.formula.functions.FunctionArgs.numberArg;

/**
 * CONCATENATE, LEFT, RIGHT, MID, UPPER, LOWER and LEN.
 * Character counts are clamped to the string, so LEFT("abc", 10) is "abc".
 */
public final class TextFunctions {

    private TextFunctions() {
    }

    static void registerAll(FunctionRegistry registry) {
        registry.register("CONCATENATE", TextFunctions::concatenate);
        registry.register("LEFT", TextFunctions::left);
        registry.register("RIGHT", TextFunctions::right);
        registry.register("MID", TextFunctions::mid);
        registry.register("UPPER", TextFunctions::upper);
        registry.register("LOWER", TextFunctions::lower);
        registry.register("LEN", TextFunctions::len);
    }

    public static CellValue concatenate(List<CellValue> args) {
        return CellValue.text(flatten(args).stream()
                .map(ValueCoercion::toText)
                .collect(Collectors.joining()));
    }

    public static CellValue left(List<CellValue> args) {
        String text = textArg(args);
        int count = clamp((int) numberArg(args, 1, 1), text.length());
        return CellValue.text(text.substring(0, count));
    }

    public static CellValue right(List<CellValue> args) {
        String text = textArg(args);
        int count = clamp((int) numberArg(args, 1, 1), text.length());
        return CellValue.text(text.substring(text.length() - count));
    }

    /**
     * MID(text, start, count) with a 1-based start, as in every spreadsheet.
     */
    public static CellValue mid(List<CellValue> args) {
        String text = textArg(args);
        // Both ends derive from the unclamped start: MID("abc",0,2) is "a"
        int from = (int) numberArg(args, 1, 1) - 1;
        int start = clamp(from, text.length());
        int end = clamp(from + (int) numberArg(args, 2, 0), text.length());
        return CellValue.text(end <= start ? "" : text.substring(start, end));
    }

    public static CellValue upper(List<CellValue> args) {
        return CellValue.text(textArg(args).toUpperCase());
    }

    public static CellValue lower(List<CellValue> args) {
        return CellValue.text(textArg(args).toLowerCase());
    }

    public static CellValue len(List<CellValue> args) {
        return CellValue.number(textArg(args).length());
    }

    private static String textArg(List<CellValue> args) {
        return ValueCoercion.toText(arg(args, 0));
    }

    private static int clamp(int value, int max) {
        return Math.max(0, Math.min(value, max));
    }
}
